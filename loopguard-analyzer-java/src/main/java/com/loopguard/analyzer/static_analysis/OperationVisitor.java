package com.loopguard.analyzer.static_analysis;

import com.loopguard.api.BlockingViolation;
import com.loopguard.api.Severity;
import com.loopguard.api.SourceLocation;
import com.loopguard.api.ViolationKind;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Base ASTVisitor that reports every method call and constructor call matching an
 * {@link OperationTable}. Subclasses add the structural checks of their analysis.
 */
public abstract class OperationVisitor extends ASTVisitor {

    private final CompilationUnit unit;
    private final String context;
    private final OperationTable table;
    private final StaticImports imports;
    private final List<BlockingViolation> violations = new ArrayList<>();

    protected OperationVisitor(CompilationUnit unit, String context, OperationTable table) {
        this.unit = unit;
        this.context = context;
        this.table = table;
        this.imports = StaticImports.of(unit);
    }

    public List<BlockingViolation> getViolations() { return violations; }

    @Override
    public boolean visit(MethodInvocation node) {
        String receiver = receiverText(node.getExpression());
        table.matchInvocation(receiver, node.getName().getIdentifier(), node.arguments().size(), imports)
             .ifPresent(rule -> report(rule, node));
        return true;
    }

    @Override
    public boolean visit(ClassInstanceCreation node) {
        table.matchConstruction(typeName(node.getType()))
             .ifPresent(rule -> report(rule, node));
        return true;
    }

    protected void report(OperationRule rule, ASTNode node) {
        report(rule.kind(), rule.severity(), rule.symbol(), node, rule.message(), rule.suggestion());
    }

    protected void report(ViolationKind kind, Severity severity, String symbol, ASTNode node,
                          String message, String suggestion) {
        violations.add(new BlockingViolation(kind, severity, symbol,
            SourceLocation.ofSource(context, lineOf(node)), message, suggestion));
    }

    protected int lineOf(ASTNode node) {
        int line = unit.getLineNumber(node.getStartPosition());
        return Math.max(line, 0);
    }

    /**
     * Receiver text used for matching: the dotted name for name receivers, the source text for
     * field accesses, empty for any other expression and null when the call is unqualified.
     */
    static String receiverText(Expression expression) {
        if (expression == null) return null;
        if (expression instanceof Name name) return name.getFullyQualifiedName();
        if (expression instanceof FieldAccess fieldAccess) return fieldAccess.toString();
        return "";
    }

    protected static String typeName(Type type) {
        if (type instanceof ParameterizedType parameterized) return typeName(parameterized.getType());
        if (type instanceof SimpleType simple) return simple.getName().getFullyQualifiedName();
        if (type instanceof QualifiedType qualified) {
            return typeName(qualified.getQualifier()) + "." + qualified.getName().getIdentifier();
        }
        if (type instanceof NameQualifiedType nameQualified) {
            return nameQualified.getQualifier().getFullyQualifiedName() + "."
                + nameQualified.getName().getIdentifier();
        }
        return type.toString();
    }

    /** Name of the type declaring {@code node}, or empty when it is not inside a type. */
    protected static String enclosingTypeName(ASTNode node) {
        ASTNode current = node.getParent();
        while (current != null) {
            if (current instanceof AbstractTypeDeclaration type) return type.getName().getIdentifier();
            current = current.getParent();
        }
        return "";
    }
}
