package com.loopguard.analyzer.static_analysis;

import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.ImportDeclaration;

import java.util.*;

/**
 * Static imports of one compilation unit, used to resolve unqualified calls such as
 * {@code sleep(100)} after {@code import static java.lang.Thread.sleep}.
 */
public final class StaticImports {

    public static final StaticImports NONE = new StaticImports(Map.of(), Set.of());

    // member name -> declaring type, for single static imports
    private final Map<String, Set<String>> members;
    // declaring types of on-demand static imports
    private final Set<String> onDemandTypes;

    private StaticImports(Map<String, Set<String>> members, Set<String> onDemandTypes) {
        this.members = members;
        this.onDemandTypes = onDemandTypes;
    }

    public static StaticImports of(CompilationUnit cu) {
        Map<String, Set<String>> members = new HashMap<>();
        Set<String> onDemand = new HashSet<>();
        for (Object o : cu.imports()) {
            ImportDeclaration imp = (ImportDeclaration) o;
            if (!imp.isStatic()) continue;
            String name = imp.getName().getFullyQualifiedName();
            if (imp.isOnDemand()) {
                onDemand.add(name);
            } else {
                int dot = name.lastIndexOf('.');
                if (dot > 0) {
                    members.computeIfAbsent(name.substring(dot + 1), k -> new HashSet<>())
                           .add(name.substring(0, dot));
                }
            }
        }
        return new StaticImports(members, onDemand);
    }

    boolean provides(String qualifiedType, String member) {
        Set<String> owners = members.getOrDefault(member, Set.of());
        return owners.contains(qualifiedType) || onDemandTypes.contains(qualifiedType);
    }
}
