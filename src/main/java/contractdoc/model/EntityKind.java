// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * The kinds of model entities that can be documented and linked to.
 */
public enum EntityKind {
    CLASS(false),
    ENUMERATION(false),
    ENUMERATION_LITERAL(true),
    CONSTRAINED_PRIMITIVE(false),
    PROPERTY(true),
    METHOD(true),
    CONSTANT(false),
    VERIFICATION_FUNCTION(false);

    EntityKind(final boolean member) {
        this.member = member;
    }

    /**
     * Returns {@code true} iff entities of this kind live inside another entity's page.
     */
    public boolean isMember() {
        return member;
    }

    private final boolean member;
}
