// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base interface for DOM tree nodes.
 * <p>
 * DOM tree nodes are immutable. Only text and element nodes exist.
 */
public sealed interface Node {
    /**
     * Returns a new element node with the given attributes and no children.
     */
    static Element empty(final Tag tag, final List<Attribute> attributes) {
        return new Element(tag, attributes, List.of());
    }

    /**
     * Returns a new element node with the given children and no attributes.
     */
    static Element simple(final Tag tag, final List<? extends Node> children) {
        return new Element(tag, List.of(), List.copyOf(children));
    }

    /**
     * Returns a new element node with a single child and no attributes.
     */
    static Element simple(final Tag tag, final Node child) {
        return new Element(tag, List.of(), List.of(child));
    }

    /**
     * Returns a new element node with a {@code class} attribute and the given children.
     */
    static Element classed(final Tag tag, final String className, final List<? extends Node> children) {
        return new Element(tag, List.of(Attribute.of("class", className)), List.copyOf(children));
    }

    /**
     * Returns a new element node with a {@code class} attribute and a single text child.
     */
    static Element classed(final Tag tag, final String className, final String text) {
        return classed(tag, className, List.of(new Text(text)));
    }

    /**
     * DOM node representing bare text.
     */
    record Text(String text) implements Node {
    }

    /**
     * DOM node representing an HTML element, with optional attributes and optional children.
     */
    record Element(Tag tag, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        /**
         * Retrieves the attribute with the given name, or {@code null} if there is none.
         */
        public @Nullable Attribute getAttribute(final String name) {
            for (final var attribute : attributes) {
                if (name.equals(attribute.name())) {
                    return attribute;
                }
            }
            return null;
        }
    }
}
