// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.naming;

import contractdoc.model.EntityKind;
import contractdoc.model.EntityRef;

/**
 * Maps model entities to display names, page files and anchors.
 * <p>
 * Top-level entities (classes, enumerations, constrained primitives, constants and verification functions) get a
 * page each, named after their display name. Members are documented on their owner's page, under an anchor equal
 * to their display name.
 */
public interface NamingScheme {
    /**
     * Returns the display name of an identifier of the given kind.
     */
    String displayName(EntityKind kind, String identifier);

    /**
     * Returns the display name of a local variable or argument.
     */
    String variableName(String identifier);

    /**
     * Returns the display name of the given entity.
     */
    default String displayName(final EntityRef entity) {
        return displayName(entity.kind(), entity.name());
    }

    /**
     * Returns the file name of the page the given entity is documented on.
     */
    default String pageFile(final EntityRef entity) {
        final var page = entity.page();
        return displayName(page) + ".html";
    }

    /**
     * Returns the anchor of the given entity within its page, or the empty string for top-level entities.
     */
    default String anchor(final EntityRef entity) {
        return entity.kind().isMember() ? displayName(entity) : "";
    }

    /**
     * Returns the relative hyperlink to the given entity.
     */
    default String href(final EntityRef entity) {
        final var anchor = anchor(entity);
        return anchor.isEmpty() ? pageFile(entity) : pageFile(entity) + '#' + anchor;
    }
}
