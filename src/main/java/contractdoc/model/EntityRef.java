// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A reference to a documented model entity.
 *
 * @param kind  The kind of the entity.
 * @param owner For members (literals, properties, methods), the name of the enumeration or class declaring them;
 *              {@code null} otherwise.
 * @param name  The identifier of the entity.
 */
public record EntityRef(EntityKind kind, @Nullable String owner, String name) {
    public EntityRef {
        if (kind.isMember() != (owner != null)) {
            throw new IllegalArgumentException("Members, and only members, have owners: " + kind + ' ' + name);
        }
    }

    public static EntityRef ofClass(final String name) {
        return new EntityRef(EntityKind.CLASS, null, name);
    }

    public static EntityRef ofEnumeration(final String name) {
        return new EntityRef(EntityKind.ENUMERATION, null, name);
    }

    public static EntityRef ofConstrainedPrimitive(final String name) {
        return new EntityRef(EntityKind.CONSTRAINED_PRIMITIVE, null, name);
    }

    public static EntityRef ofConstant(final String name) {
        return new EntityRef(EntityKind.CONSTANT, null, name);
    }

    public static EntityRef ofFunction(final String name) {
        return new EntityRef(EntityKind.VERIFICATION_FUNCTION, null, name);
    }

    public static EntityRef ofLiteral(final String enumeration, final String name) {
        return new EntityRef(EntityKind.ENUMERATION_LITERAL, enumeration, name);
    }

    public static EntityRef ofProperty(final String className, final String name) {
        return new EntityRef(EntityKind.PROPERTY, className, name);
    }

    public static EntityRef ofMethod(final String className, final String name) {
        return new EntityRef(EntityKind.METHOD, className, name);
    }

    /**
     * Returns the reference to the page this entity is documented on: itself for top-level entities, the owner for
     * members.
     */
    public EntityRef page() {
        if (owner == null) {
            return this;
        }
        return (kind == EntityKind.ENUMERATION_LITERAL) ? ofEnumeration(owner) : ofClass(owner);
    }
}
