// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A class of the data model.
 *
 * @param name        The identifier of the class.
 * @param description A short user-readable description, possibly empty.
 * @param parents     The names of the classes this class directly inherits from.
 * @param properties  The properties declared in this class, not including inherited ones.
 * @param methods     The methods declared in this class, not including inherited ones.
 * @param invariants  The invariants declared in this class, not including inherited ones.
 */
public record ClassType(
    String name,
    String description,
    List<String> parents,
    List<Property> properties,
    List<Method> methods,
    List<Invariant> invariants
) {
    public ClassType {
        parents = List.copyOf(parents);
        properties = List.copyOf(properties);
        methods = List.copyOf(methods);
        invariants = List.copyOf(invariants);
    }

    /**
     * Retrieves the property declared in this class with the given name, or {@code null} if there is none.
     */
    public @Nullable Property findProperty(final String propertyName) {
        for (final var property : properties) {
            if (property.name().equals(propertyName)) {
                return property;
            }
        }
        return null;
    }

    /**
     * Retrieves the method declared in this class with the given name, or {@code null} if there is none.
     */
    public @Nullable Method findMethod(final String methodName) {
        for (final var method : methods) {
            if (method.name().equals(methodName)) {
                return method;
            }
        }
        return null;
    }
}
