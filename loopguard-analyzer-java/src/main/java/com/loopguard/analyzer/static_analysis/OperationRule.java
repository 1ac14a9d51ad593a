package com.loopguard.analyzer.static_analysis;

import com.loopguard.api.Severity;
import com.loopguard.api.ViolationKind;

/**
 * One entry of an operation table: a call shape that is reported when found in source.
 *
 * @param kind          finding category
 * @param severity      finding severity
 * @param qualifiedType declaring type, e.g. {@code java.lang.Thread}; display-only for INSTANCE rules
 * @param method        method name; null for CONSTRUCTOR rules
 * @param shape         how the call is recognised
 * @param arity         required argument count, or -1 for any
 * @param suggestion    remediation hint
 */
public record OperationRule(
    ViolationKind kind,
    Severity severity,
    String qualifiedType,
    String method,
    Shape shape,
    int arity,
    String suggestion
) {

    public static final int ANY_ARITY = -1;

    public enum Shape {
        /** {@code Type.method(..)}, or an unqualified call made available by a static import. */
        STATIC,
        /** {@code receiver.method(..)} on any receiver expression. */
        INSTANCE,
        /** {@code new Type(..)}. */
        CONSTRUCTOR
    }

    public String simpleType() {
        int dot = qualifiedType.lastIndexOf('.');
        return dot < 0 ? qualifiedType : qualifiedType.substring(dot + 1);
    }

    public String symbol() {
        return shape == Shape.CONSTRUCTOR ? "new " + simpleType() : simpleType() + "." + method;
    }

    public boolean acceptsArity(int argumentCount) {
        return arity == ANY_ARITY || arity == argumentCount;
    }

    public String message() {
        return switch (kind) {
            case BLOCKING_CALL -> "Blocking call '" + symbol() + "' will freeze the event loop";
            case UNSAFE_CALL -> "Call '" + symbol() + "' changes state shared by every request";
            case GLOBAL_STATE_ACCESS -> "'" + symbol() + "' reads process-wide state shared by all requests";
            case STATIC_MUTABLE_ACCESS -> "'" + symbol() + "' touches state that persists across requests";
            case UNBOUNDED_LOOP -> "'" + symbol() + "' may never return control to the event loop";
        };
    }

    /**
     * True when the receiver text of a call names this rule's type: the simple or qualified
     * type name itself, or a member reached through it ({@code TimeUnit.SECONDS}).
     */
    boolean receiverMatches(String receiver) {
        String simple = simpleType();
        return receiver.equals(simple) || receiver.equals(qualifiedType)
            || receiver.startsWith(simple + ".") || receiver.startsWith(qualifiedType + ".");
    }
}
