package com.loopguard.analyzer.policy;

import com.loopguard.analyzer.static_analysis.OperationTable;
import com.loopguard.analyzer.static_analysis.OperationVisitor;
import com.loopguard.api.Severity;
import com.loopguard.api.ViolationKind;
import org.eclipse.jdt.core.dom.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reports global-state calls, writes to static non-final fields declared in the same
 * compilation unit, and static ThreadLocal declarations.
 */
class GlobalStateVisitor extends OperationVisitor {

    private static final Set<String> THREAD_LOCAL_TYPES = Set.of(
        "ThreadLocal", "java.lang.ThreadLocal", "InheritableThreadLocal", "java.lang.InheritableThreadLocal");
    private static final String SLOT_SUGGESTION =
        "Hold the value in a StateSlot tracked by the request context, or pass it as a parameter";

    // field name -> declaring type simple name
    private final Map<String, String> staticMutableFields;

    GlobalStateVisitor(CompilationUnit unit, String context, OperationTable table) {
        super(unit, context, table);
        this.staticMutableFields = collectStaticMutableFields(unit);
    }

    @Override
    public boolean visit(FieldDeclaration node) {
        if (Modifier.isStatic(node.getModifiers())
                && THREAD_LOCAL_TYPES.contains(typeName(node.getType()))) {
            String owner = enclosingTypeName(node);
            for (Object o : node.fragments()) {
                VariableDeclarationFragment fragment = (VariableDeclarationFragment) o;
                String symbol = owner + "." + fragment.getName().getIdentifier();
                report(ViolationKind.STATIC_MUTABLE_ACCESS, Severity.WARNING, symbol, fragment,
                    "ThreadLocal '" + symbol + "' leaks values between requests served on the same thread",
                    SLOT_SUGGESTION);
            }
        }
        return true;
    }

    @Override
    public boolean visit(Assignment node) {
        checkWrite(node.getLeftHandSide(), node);
        return true;
    }

    @Override
    public boolean visit(PrefixExpression node) {
        PrefixExpression.Operator op = node.getOperator();
        if (op == PrefixExpression.Operator.INCREMENT || op == PrefixExpression.Operator.DECREMENT) {
            checkWrite(node.getOperand(), node);
        }
        return true;
    }

    @Override
    public boolean visit(PostfixExpression node) {
        checkWrite(node.getOperand(), node);
        return true;
    }

    private void checkWrite(Expression target, ASTNode node) {
        String field = staticFieldWritten(target);
        if (field == null) return;
        String symbol = staticMutableFields.get(field) + "." + field;
        report(ViolationKind.STATIC_MUTABLE_ACCESS, Severity.WARNING, symbol, node,
            "Write to static field '" + symbol + "' is visible to every later request",
            SLOT_SUGGESTION);
    }

    private String staticFieldWritten(Expression target) {
        if (target instanceof SimpleName simple) {
            String name = simple.getIdentifier();
            return staticMutableFields.containsKey(name) ? name : null;
        }
        if (target instanceof QualifiedName qualified) {
            String name = qualified.getName().getIdentifier();
            String owner = staticMutableFields.get(name);
            Name qualifier = qualified.getQualifier();
            String qualifierText = qualifier.getFullyQualifiedName();
            boolean ownerMatches = owner != null
                && (qualifierText.equals(owner) || qualifierText.endsWith("." + owner));
            return ownerMatches ? name : null;
        }
        if (target instanceof FieldAccess access) {
            String name = access.getName().getIdentifier();
            return staticMutableFields.containsKey(name) ? name : null;
        }
        return null;
    }

    private static Map<String, String> collectStaticMutableFields(CompilationUnit unit) {
        Map<String, String> fields = new HashMap<>();
        unit.accept(new ASTVisitor() {
            @Override
            public boolean visit(FieldDeclaration node) {
                int modifiers = node.getModifiers();
                if (Modifier.isStatic(modifiers) && !Modifier.isFinal(modifiers)) {
                    String owner = enclosingTypeName(node);
                    for (Object o : node.fragments()) {
                        fields.put(((VariableDeclarationFragment) o).getName().getIdentifier(), owner);
                    }
                }
                return false;
            }
        });
        return fields;
    }
}
