// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import contractdoc.dom.Node;
import contractdoc.dom.Serializer;
import contractdoc.model.EntityRef;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * A rendered piece of code: an immutable sequence of DOM nodes to be placed inside a {@code <pre>} element, together
 * with the model entities it links to.
 * <p>
 * Line breaks are plain {@code '\n'} characters in text nodes. Fragments never start or end with incidental
 * whitespace; layout decisions are made on the visible text, ignoring markup.
 */
public final class Fragment {
    private Fragment(final List<Node> nodes, final Set<EntityRef> references) {
        this.nodes = nodes;
        this.references = references;
        plainText = plainTextOf(nodes);
    }

    /**
     * Returns the empty fragment.
     */
    public static Fragment empty() {
        return empty;
    }

    /**
     * Returns a fragment consisting of unstyled text.
     */
    public static Fragment text(final String text) {
        return builder().text(text).build();
    }

    /**
     * Returns a fragment consisting of a single node.
     */
    public static Fragment of(final Node node) {
        return builder().node(node).build();
    }

    /**
     * Returns a new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retrieves the DOM nodes of this fragment.
     */
    public List<Node> nodes() {
        return nodes;
    }

    /**
     * Retrieves the entities this fragment links to, in the order they first appear.
     */
    public Set<EntityRef> references() {
        return references;
    }

    /**
     * Retrieves the visible text of this fragment, without any markup.
     */
    public String plainText() {
        return plainText;
    }

    /**
     * Retrieves the length of the visible text.
     */
    public int length() {
        return plainText.length();
    }

    /**
     * Returns {@code true} iff the visible text contains a line break.
     */
    public boolean isMultiLine() {
        return plainText.indexOf('\n') >= 0;
    }

    /**
     * Returns a copy of this fragment whose every line but the first is prefixed with the given indentation.
     */
    @CheckReturnValue
    public Fragment indentButFirstLine(final String indent) {
        if (!isMultiLine()) {
            return this;
        }
        final var indented = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            indented.add(indentNode(node, indent));
        }
        return new Fragment(Collections.unmodifiableList(indented), references);
    }

    /**
     * Serializes the nodes of this fragment to HTML.
     */
    public String toHtml() {
        final var builder = new StringBuilder();
        for (final var node : nodes) {
            builder.append(Serializer.serializeToString(node));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return plainText;
    }

    private static Node indentNode(final Node node, final String indent) {
        if (node instanceof Node.Text text) {
            return new Node.Text(text.text().replace("\n", "\n" + indent));
        }
        final var element = (Node.Element) node;
        final var children = new ArrayList<Node>(element.children().size());
        for (final var child : element.children()) {
            children.add(indentNode(child, indent));
        }
        return new Node.Element(element.tag(), element.attributes(), children);
    }

    private static String plainTextOf(final List<Node> nodes) {
        final var builder = new StringBuilder();
        appendPlainText(builder, nodes);
        return builder.toString();
    }

    private static void appendPlainText(final StringBuilder builder, final List<Node> nodes) {
        for (final var node : nodes) {
            if (node instanceof Node.Text text) {
                builder.append(text.text());
            } else if (node instanceof Node.Element element) {
                appendPlainText(builder, element.children());
            }
        }
    }

    private static final Fragment empty = new Fragment(List.of(), Set.of());

    private final List<Node> nodes;
    private final Set<EntityRef> references;
    private final String plainText;

    /**
     * Accumulates the nodes and references of a fragment. Adjacent text is merged into a single text node.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Appends all nodes and references of the given fragment.
         */
        public Builder append(final Fragment fragment) {
            for (final var node : fragment.nodes) {
                node(node);
            }
            references.addAll(fragment.references);
            return this;
        }

        /**
         * Appends a single node.
         */
        public Builder node(final Node node) {
            if (node instanceof Node.Text text) {
                return text(text.text());
            }
            flushText();
            nodes.add(node);
            return this;
        }

        /**
         * Appends unstyled text.
         */
        public Builder text(final String text) {
            pendingText.append(text);
            return this;
        }

        /**
         * Records a reference to a linked entity.
         */
        public Builder reference(final EntityRef reference) {
            references.add(reference);
            return this;
        }

        public Fragment build() {
            flushText();
            return new Fragment(
                Collections.unmodifiableList(new ArrayList<>(nodes)),
                Collections.unmodifiableSet(new LinkedHashSet<>(references))
            );
        }

        private void flushText() {
            if (pendingText.length() > 0) {
                nodes.add(new Node.Text(pendingText.toString()));
                pendingText.setLength(0);
            }
        }

        private final List<Node> nodes = new ArrayList<>();
        private final Set<EntityRef> references = new LinkedHashSet<>();
        private final StringBuilder pendingText = new StringBuilder();
    }
}
