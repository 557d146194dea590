// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.ArrayList;
import java.util.List;
import contractdoc.model.Expression;
import contractdoc.model.NodeKind;

/**
 * The layout engine: parenthesization and line wrapping.
 * <p>
 * Layout is purely cosmetic. Nothing here ever changes what the rendered code means, only how it is broken into
 * lines.
 */
public final class Layout {
    /**
     * Initializes a new layout engine with the given settings.
     */
    public Layout(final LayoutSettings settings) {
        this.settings = settings;
        indent = settings.indentUnit();
    }

    /**
     * Returns {@code true} iff a node of the given kind must be parenthesized in the given position.
     */
    public static boolean needsParentheses(final NodeKind childKind, final Slot slot) {
        return !slot.allowsBare(childKind);
    }

    /**
     * Returns the rendered child as it should appear in the given position: unchanged if its kind is allowed bare
     * there, parenthesized otherwise.
     * <p>
     * A conjunction or disjunction of several values already renders as its own parenthesized block, so it is not
     * parenthesized a second time.
     */
    public Fragment inSlot(final Expression child, final Slot slot, final Fragment rendered) {
        if (!needsParentheses(child.kind(), slot) || rendersOwnBlock(child)) {
            return rendered;
        }
        return parenthesize(rendered);
    }

    /**
     * Encloses the fragment in parentheses. A multi-line fragment becomes an indented block with the parentheses on
     * lines of their own.
     */
    public Fragment parenthesize(final Fragment content) {
        if (content.isMultiLine()) {
            return block(Fragment.empty(), List.of(content));
        }
        return Fragment.builder()
            .append(Tokens.punctuation("("))
            .append(content)
            .append(Tokens.punctuation(")"))
            .build();
    }

    /**
     * Returns {@code true} iff the fragment is on a single line that is longer than the line budget.
     */
    public boolean exceedsBudget(final Fragment fragment) {
        return !fragment.isMultiLine() && fragment.length() > settings.lineBudget();
    }

    /**
     * Returns the fragment unchanged if it fits the line budget, or as a parenthesized block otherwise.
     */
    public Fragment wrapIfLong(final Fragment fragment) {
        return exceedsBudget(fragment) ? block(Fragment.empty(), List.of(fragment)) : fragment;
    }

    /**
     * Lays out a parenthesized block: the head immediately followed by an opening parenthesis, each line indented
     * by one unit, and the closing parenthesis on a line of its own.
     */
    public Fragment block(final Fragment head, final List<Fragment> lines) {
        final var builder = Fragment.builder()
            .append(head)
            .append(Tokens.punctuation("("))
            .text("\n");
        for (final var line : lines) {
            builder.text(indent).append(line.indentButFirstLine(indent)).text("\n");
        }
        return builder.append(Tokens.punctuation(")")).build();
    }

    /**
     * Lays out a list of items, such as call arguments, after the head: on one line if the joined items fit the
     * line budget, one item per line otherwise.
     *
     * @param forceBlock If {@code true}, one item per line is used regardless of length.
     */
    public Fragment delimitedList(final Fragment head, final List<Fragment> items, final boolean forceBlock) {
        final var joined = join(items, ", ");
        if (!forceBlock && !joined.isMultiLine() && joined.length() <= settings.lineBudget()) {
            return Fragment.builder()
                .append(head)
                .append(Tokens.punctuation("("))
                .append(joined)
                .append(Tokens.punctuation(")"))
                .build();
        }
        final var lines = new ArrayList<Fragment>(items.size());
        for (int i = 0; i < items.size(); i += 1) {
            final var item = items.get(i);
            lines.add((i + 1 < items.size()) ? Fragment.builder().append(item).text(",").build() : item);
        }
        return block(head, lines);
    }

    /**
     * Joins the fragments with the given unstyled separator.
     */
    public static Fragment join(final List<Fragment> fragments, final String separator) {
        final var builder = Fragment.builder();
        var first = true;
        for (final var fragment : fragments) {
            if (!first) {
                builder.text(separator);
            }
            builder.append(fragment);
            first = false;
        }
        return builder.build();
    }

    private static boolean rendersOwnBlock(final Expression node) {
        if (node instanceof Expression.And and) {
            return and.values().size() > 1;
        }
        if (node instanceof Expression.Or or) {
            return or.values().size() > 1;
        }
        return false;
    }

    private final LayoutSettings settings;
    private final String indent;
}
