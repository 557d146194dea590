// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An enumeration of the data model.
 */
public record Enumeration(String name, String description, List<EnumerationLiteral> literals) {
    public Enumeration {
        literals = List.copyOf(literals);
    }

    /**
     * Retrieves the literal with the given name, or {@code null} if there is none.
     */
    public @Nullable EnumerationLiteral findLiteral(final String literalName) {
        for (final var literal : literals) {
            if (literal.name().equals(literalName)) {
                return literal;
            }
        }
        return null;
    }
}
