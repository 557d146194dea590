// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.naming;

import contractdoc.model.EntityKind;

/**
 * A naming scheme that keeps model identifiers unchanged, so {@code id_short} of {@code Referable} is linked as
 * {@code Referable.html#id_short}.
 */
public final class VerbatimNaming implements NamingScheme {
    private VerbatimNaming() {
    }

    /**
     * Retrieves the sole instance.
     */
    public static VerbatimNaming instance() {
        return instance;
    }

    @Override
    public String displayName(final EntityKind kind, final String identifier) {
        return identifier;
    }

    @Override
    public String variableName(final String identifier) {
        return identifier;
    }

    private static final VerbatimNaming instance = new VerbatimNaming();
}
