// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.List;
import contractdoc.dom.Attribute;
import contractdoc.dom.Node;
import contractdoc.dom.Tag;
import contractdoc.model.EntityRef;

/**
 * Highlighted tokens of the rendered code.
 * <p>
 * Token classes follow the short names used by Pygments style sheets, so any Pygments theme styles the output.
 */
public final class Tokens {
    private Tokens() {
    }

    public static Fragment punctuation(final String text) {
        return styled("p", text);
    }

    public static Fragment operator(final String text) {
        return styled("o", text);
    }

    public static Fragment operatorWord(final String text) {
        return styled("ow", text);
    }

    public static Fragment builtin(final String text) {
        return styled("nb", text);
    }

    public static Fragment variable(final String text) {
        return styled("nv", text);
    }

    public static Fragment pseudoName(final String text) {
        return styled("bp", text);
    }

    public static Fragment keyword(final String text) {
        return styled("k", text);
    }

    public static Fragment keywordConstant(final String text) {
        return styled("kc", text);
    }

    public static Fragment string(final String text) {
        return styled("sc", text);
    }

    public static Fragment comment(final String text) {
        return styled("c", text);
    }

    /**
     * Returns a token of the given class whose text links to the given entity.
     */
    public static Fragment link(final String tokenClass, final String text, final String href, final EntityRef entity) {
        final var anchor = new Node.Element(Tag.A, List.of(Attribute.of("href", href)), List.of(new Node.Text(text)));
        return Fragment.builder()
            .node(Node.classed(Tag.SPAN, tokenClass, List.of(anchor)))
            .reference(entity)
            .build();
    }

    /**
     * Returns an unstyled token whose text links to the given entity, as used for members.
     */
    public static Fragment memberLink(final String text, final String href, final EntityRef entity) {
        return Fragment.builder()
            .node(new Node.Element(Tag.A, List.of(Attribute.of("href", href)), List.of(new Node.Text(text))))
            .reference(entity)
            .build();
    }

    /**
     * Returns a token of the given class.
     */
    public static Fragment styled(final String tokenClass, final String text) {
        return Fragment.of(Node.classed(Tag.SPAN, tokenClass, text));
    }

    static final String constantClass = "no";
    static final String functionClass = "nf";
    static final String typeClass = "nc";
    static final String stringAffixClass = "sa";
    static final String singleQuoteClass = "s1";
    static final String doubleQuoteClass = "s2";
    static final String interpolationClass = "si";
}
