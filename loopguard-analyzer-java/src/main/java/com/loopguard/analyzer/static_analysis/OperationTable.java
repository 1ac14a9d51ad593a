package com.loopguard.analyzer.static_analysis;

import com.loopguard.analyzer.static_analysis.OperationRule.Shape;
import com.loopguard.api.Severity;
import com.loopguard.api.ViolationKind;

import java.util.*;

/**
 * Immutable lookup table of reportable operations, indexed by method name and by
 * constructed type.
 */
public final class OperationTable {

    private final Map<String, List<OperationRule>> staticRules;
    private final Map<String, List<OperationRule>> instanceRules;
    private final Map<String, OperationRule> constructorRules;
    private final int size;

    private OperationTable(List<OperationRule> rules) {
        Map<String, List<OperationRule>> statics = new HashMap<>();
        Map<String, List<OperationRule>> instances = new HashMap<>();
        Map<String, OperationRule> constructors = new HashMap<>();
        for (OperationRule rule : rules) {
            switch (rule.shape()) {
                case STATIC -> statics.computeIfAbsent(rule.method(), k -> new ArrayList<>()).add(rule);
                case INSTANCE -> instances.computeIfAbsent(rule.method(), k -> new ArrayList<>()).add(rule);
                case CONSTRUCTOR -> {
                    constructors.put(rule.simpleType(), rule);
                    constructors.put(rule.qualifiedType(), rule);
                }
            }
        }
        this.staticRules = statics;
        this.instanceRules = instances;
        this.constructorRules = constructors;
        this.size = rules.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() { return size; }

    /**
     * Find the rule for a method call.
     *
     * @param receiver     receiver text when the receiver is a name ({@code Thread},
     *                     {@code TimeUnit.SECONDS}); empty for any other receiver expression;
     *                     null for an unqualified call
     * @param method       invoked method name
     * @param argumentCount number of arguments at the call site
     * @param imports      static imports of the enclosing compilation unit
     */
    public Optional<OperationRule> matchInvocation(String receiver, String method, int argumentCount,
                                                   StaticImports imports) {
        for (OperationRule rule : staticRules.getOrDefault(method, List.of())) {
            if (!rule.acceptsArity(argumentCount)) continue;
            boolean matches = receiver == null
                ? imports.provides(rule.qualifiedType(), method)
                : rule.receiverMatches(receiver);
            if (matches) return Optional.of(rule);
        }
        if (receiver == null) return Optional.empty();
        for (OperationRule rule : instanceRules.getOrDefault(method, List.of())) {
            if (rule.acceptsArity(argumentCount)) return Optional.of(rule);
        }
        return Optional.empty();
    }

    /** Find the rule for {@code new typeName(..)}; generic arguments must already be stripped. */
    public Optional<OperationRule> matchConstruction(String typeName) {
        OperationRule rule = constructorRules.get(typeName);
        if (rule == null) {
            int dot = typeName.lastIndexOf('.');
            if (dot >= 0) rule = constructorRules.get(typeName.substring(dot + 1));
        }
        return Optional.ofNullable(rule);
    }

    public static final class Builder {

        private final List<OperationRule> rules = new ArrayList<>();

        public Builder staticCall(ViolationKind kind, Severity severity, String qualifiedType,
                                  String suggestion, String... methods) {
            for (String method : methods) {
                rules.add(new OperationRule(kind, severity, qualifiedType, method, Shape.STATIC,
                    OperationRule.ANY_ARITY, suggestion));
            }
            return this;
        }

        public Builder instanceCall(ViolationKind kind, Severity severity, String displayType,
                                    String method, int arity, String suggestion) {
            rules.add(new OperationRule(kind, severity, displayType, method, Shape.INSTANCE, arity, suggestion));
            return this;
        }

        public Builder construction(ViolationKind kind, Severity severity, String suggestion,
                                    String... qualifiedTypes) {
            for (String type : qualifiedTypes) {
                rules.add(new OperationRule(kind, severity, type, null, Shape.CONSTRUCTOR,
                    OperationRule.ANY_ARITY, suggestion));
            }
            return this;
        }

        public OperationTable build() {
            return new OperationTable(List.copyOf(rules));
        }
    }
}
