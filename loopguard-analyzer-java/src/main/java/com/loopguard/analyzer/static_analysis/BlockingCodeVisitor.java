package com.loopguard.analyzer.static_analysis;

import com.loopguard.api.Severity;
import com.loopguard.api.ViolationKind;
import org.eclipse.jdt.core.dom.*;

/**
 * Reports blocking and unsafe calls from the operation table, plus two structural findings:
 * static non-final fields and constant-true loops without an exit.
 */
public class BlockingCodeVisitor extends OperationVisitor {

    public BlockingCodeVisitor(CompilationUnit unit, String context, OperationTable table) {
        super(unit, context, table);
    }

    @Override
    public boolean visit(FieldDeclaration node) {
        int modifiers = node.getModifiers();
        if (!Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || isInterfaceMember(node)) {
            return true;
        }
        String owner = enclosingTypeName(node);
        for (Object o : node.fragments()) {
            VariableDeclarationFragment fragment = (VariableDeclarationFragment) o;
            String field = fragment.getName().getIdentifier();
            String symbol = owner.isEmpty() ? field : owner + "." + field;
            report(ViolationKind.STATIC_MUTABLE_ACCESS, Severity.WARNING, symbol, fragment,
                "Static field '" + symbol + "' keeps its value across requests",
                "Make the field final and immutable, or keep the value in request-scoped state");
        }
        return true;
    }

    @Override
    public boolean visit(WhileStatement node) {
        if (isConstantTrue(node.getExpression()) && !LoopExitFinder.hasExit(node, node.getBody())) {
            reportLoop("while(true)", node);
        }
        return true;
    }

    @Override
    public boolean visit(DoStatement node) {
        if (isConstantTrue(node.getExpression()) && !LoopExitFinder.hasExit(node, node.getBody())) {
            reportLoop("do-while(true)", node);
        }
        return true;
    }

    @Override
    public boolean visit(ForStatement node) {
        Expression condition = node.getExpression();
        if ((condition == null || isConstantTrue(condition)) && !LoopExitFinder.hasExit(node, node.getBody())) {
            reportLoop(condition == null ? "for(;;)" : "for(;true;)", node);
        }
        return true;
    }

    private void reportLoop(String symbol, Statement loop) {
        report(ViolationKind.UNBOUNDED_LOOP, Severity.ERROR, symbol, loop,
            "Loop '" + symbol + "' has no break or return and never yields to the event loop",
            "Add an exit condition, or split the work into scheduled chunks");
    }

    static boolean isConstantTrue(Expression expression) {
        Expression current = expression;
        while (current instanceof ParenthesizedExpression parenthesized) {
            current = parenthesized.getExpression();
        }
        return current instanceof BooleanLiteral literal && literal.booleanValue();
    }

    private static boolean isInterfaceMember(FieldDeclaration node) {
        return node.getParent() instanceof TypeDeclaration type && type.isInterface()
            || node.getParent() instanceof AnnotationTypeDeclaration;
    }
}
