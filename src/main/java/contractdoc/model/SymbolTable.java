// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only lookup of the documented model entities by name.
 * <p>
 * Implementations must be safe to use from multiple threads at once.
 */
public interface SymbolTable {
    @Nullable ClassType findClass(String name);

    @Nullable Enumeration findEnumeration(String name);

    @Nullable ConstrainedPrimitive findConstrainedPrimitive(String name);

    @Nullable GlobalConstant findConstant(String name);

    @Nullable VerificationFunction findVerificationFunction(String name);

    /**
     * Returns all classes, in declaration order.
     */
    List<ClassType> classes();

    /**
     * Returns all enumerations, in declaration order.
     */
    List<Enumeration> enumerations();

    /**
     * Returns all constrained primitives, in declaration order.
     */
    List<ConstrainedPrimitive> constrainedPrimitives();

    /**
     * Returns all global constants, in declaration order.
     */
    List<GlobalConstant> constants();

    /**
     * Returns all verification functions, in declaration order.
     */
    List<VerificationFunction> verificationFunctions();

    /**
     * Returns all ancestors of the given class, nearest first, each exactly once.
     * <p>
     * Parents that are not in this table are skipped.
     */
    default List<ClassType> ancestors(final ClassType classType) {
        return ancestors(classType.parents(), this::findClass, ClassType::parents);
    }

    /**
     * Returns all ancestors of the given constrained primitive, nearest first, each exactly once.
     * <p>
     * Parents that are not in this table are skipped.
     */
    default List<ConstrainedPrimitive> ancestors(final ConstrainedPrimitive primitive) {
        return ancestors(primitive.parents(), this::findConstrainedPrimitive, ConstrainedPrimitive::parents);
    }

    /**
     * Returns all classes that have the given class among their ancestors, in declaration order.
     */
    default List<ClassType> descendants(final ClassType classType) {
        final var result = new ArrayList<ClassType>();
        for (final var candidate : classes()) {
            if (ancestors(candidate).contains(classType)) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * Finds the class that declares the property or method with the given name, looking at the class itself first
     * and then at its ancestors, nearest first.
     *
     * @return The declaring class, or {@code null} if neither the class nor any ancestor declares such a member.
     */
    default @Nullable ClassType findDeclaringClass(final ClassType classType, final String memberName) {
        if (declares(classType, memberName)) {
            return classType;
        }
        for (final var ancestor : ancestors(classType)) {
            if (declares(ancestor, memberName)) {
                return ancestor;
            }
        }
        return null;
    }

    private static <T> List<T> ancestors(
        final List<String> parents,
        final Function<String, @Nullable T> lookup,
        final Function<T, List<String>> parentsOf
    ) {
        final var result = new LinkedHashSet<T>();
        final var queue = new ArrayDeque<>(parents);
        while (!queue.isEmpty()) {
            final var parent = lookup.apply(queue.removeFirst());
            if (parent != null && result.add(parent)) {
                queue.addAll(parentsOf.apply(parent));
            }
        }
        return List.copyOf(result);
    }

    private static boolean declares(final ClassType classType, final String memberName) {
        return classType.findProperty(memberName) != null || classType.findMethod(memberName) != null;
    }
}
