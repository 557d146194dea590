// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.List;

/**
 * A primitive type narrowed by invariants, such as a string that must not be empty.
 *
 * @param name        The identifier of the constrained primitive.
 * @param description A short user-readable description, possibly empty.
 * @param constrainee The primitive whose values are constrained; {@code self} has this type in the invariants.
 * @param parents     The names of the constrained primitives this one directly inherits from.
 * @param invariants  The invariants declared by this constrained primitive, not including inherited ones.
 */
public record ConstrainedPrimitive(
    String name,
    String description,
    TypeAnnotation.PrimitiveKind constrainee,
    List<String> parents,
    List<Invariant> invariants
) {
    public ConstrainedPrimitive {
        parents = List.copyOf(parents);
        invariants = List.copyOf(invariants);
    }
}
