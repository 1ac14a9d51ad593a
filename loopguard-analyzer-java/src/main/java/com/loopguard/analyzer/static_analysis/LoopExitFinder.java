package com.loopguard.analyzer.static_analysis;

import org.eclipse.jdt.core.dom.*;

/**
 * Looks for a statement inside a loop body that leaves the loop: a {@code return}, an
 * unlabeled {@code break} not captured by a nested loop or switch, a {@code break} targeting
 * the loop's label, or a {@code throw} outside the body of a {@code try} with catch clauses.
 * Lambda bodies and local or anonymous classes are not searched.
 */
class LoopExitFinder extends ASTVisitor {

    private final String loopLabel;
    private int nesting = 0;
    // depth of try blocks with catch clauses enclosing the current node
    private int catching = 0;
    private boolean exitFound = false;

    private LoopExitFinder(String loopLabel) {
        this.loopLabel = loopLabel;
    }

    static boolean hasExit(Statement loop, Statement body) {
        String label = loop.getParent() instanceof LabeledStatement labeled
            ? labeled.getLabel().getIdentifier()
            : null;
        LoopExitFinder finder = new LoopExitFinder(label);
        body.accept(finder);
        return finder.exitFound;
    }

    @Override
    public boolean visit(ReturnStatement node) {
        exitFound = true;
        return false;
    }

    @Override
    public boolean visit(BreakStatement node) {
        if (node.getLabel() != null) {
            if (node.getLabel().getIdentifier().equals(loopLabel)) exitFound = true;
        } else if (nesting == 0) {
            exitFound = true;
        }
        return false;
    }

    @Override
    public boolean visit(ThrowStatement node) {
        if (catching == 0) exitFound = true;
        return false;
    }

    @Override
    public boolean visit(TryStatement node) {
        if (node.catchClauses().isEmpty()) return true;
        for (Object resource : node.resources()) {
            ((ASTNode) resource).accept(this);
        }
        catching++;
        node.getBody().accept(this);
        catching--;
        for (Object clause : node.catchClauses()) {
            ((ASTNode) clause).accept(this);
        }
        if (node.getFinally() != null) node.getFinally().accept(this);
        return false;
    }

    @Override public boolean visit(WhileStatement node)         { nesting++; return true; }
    @Override public void endVisit(WhileStatement node)         { nesting--; }
    @Override public boolean visit(DoStatement node)            { nesting++; return true; }
    @Override public void endVisit(DoStatement node)            { nesting--; }
    @Override public boolean visit(ForStatement node)           { nesting++; return true; }
    @Override public void endVisit(ForStatement node)           { nesting--; }
    @Override public boolean visit(EnhancedForStatement node)   { nesting++; return true; }
    @Override public void endVisit(EnhancedForStatement node)   { nesting--; }
    @Override public boolean visit(SwitchStatement node)        { nesting++; return true; }
    @Override public void endVisit(SwitchStatement node)        { nesting--; }
    @Override public boolean visit(SwitchExpression node)       { nesting++; return true; }
    @Override public void endVisit(SwitchExpression node)       { nesting--; }

    @Override public boolean visit(LambdaExpression node)        { return false; }
    @Override public boolean visit(AnonymousClassDeclaration node) { return false; }
    @Override public boolean visit(TypeDeclarationStatement node)  { return false; }
}
