// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import contractdoc.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The DOM-to-HTML serializer.
 * <p>
 * Text is written verbatim except for {@code <}, {@code >} and {@code &}, which are escaped; attribute values
 * additionally escape {@code "}. No whitespace is added between nodes, so text inside {@code <pre>} survives exactly.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the DOM tree rooted at {@code rootNode} to HTML, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final Writer writer, final Node rootNode) throws IOException {
        new Serializer(writer).serializeNode(rootNode);
    }

    /**
     * Serializes the DOM tree rooted at {@code rootNode} to an HTML string.
     */
    public static String serializeToString(final Node rootNode) {
        final var writer = new StringWriter();
        try {
            serialize(writer, rootNode);
        } catch (final IOException e) {
            // StringWriter never throws.
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    void serializePseudoElement(
        final String elementName,
        final List<Attribute> attributes,
        final List<Node> children,
        final boolean omitClosingTag
    ) throws IOException {
        writer.write('<');
        writer.write(elementName);
        serializeAttributes(attributes);
        writer.write('>');
        for (final var child : children) {
            serializeNode(child);
        }
        if (!omitClosingTag) {
            writer.write("</");
            writer.write(elementName);
            writer.write('>');
        }
    }

    private void serializeNode(final Node node) throws IOException {
        if (node instanceof Node.Text text) {
            serializeString(text.text(), TextEscaper.instance);
        } else if (node instanceof Node.Element element) {
            final var tagSerializer = element.tag().elementSerializer();
            if (tagSerializer == null) {
                serializeDefault(element);
            } else {
                tagSerializer.serialize(this, element);
            }
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeDefault(final Node.Element element) throws IOException {
        final var tag = element.tag();
        serializePseudoElement(tag.htmlName(), element.attributes(), element.children(), tag.omitClosingTag());
    }

    private void serializeAttributes(final List<Attribute> attributes) throws IOException {
        for (final var attribute : attributes) {
            writer.write(' ');
            writer.write(attribute.name());
            writer.write("=\"");
            serializeString(attribute.value(), AttributeEscaper.instance);
            writer.write('"');
        }
    }

    private void serializeString(final String string, final Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static int findCharacterToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private final Writer writer;

    @FunctionalInterface
    interface ForElement {
        void serialize(Serializer serializer, Node.Element element) throws IOException;
    }

    private sealed interface Escaper permits TextEscaper, AttributeEscaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : TextEscaper.instance.escape(character);
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
