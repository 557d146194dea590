// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.List;
import contractdoc.model.Expression;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A failure to render a node, with the failures of its children that caused it.
 *
 * @param node    The node that failed to render, or {@code null} for failures concerning a contract as a whole.
 * @param kind    The kind of failure.
 * @param message A user-readable description of the failure.
 * @param causes  The errors of the children, in the order the children were rendered.
 */
public record RenderError(@Nullable Expression node, Kind kind, String message, List<RenderError> causes) {
    public RenderError {
        causes = List.copyOf(causes);
    }

    /**
     * Returns a new error without causes.
     */
    public static RenderError of(final @Nullable Expression node, final Kind kind, final String message) {
        return new RenderError(node, kind, message, List.of());
    }

    /**
     * Returns a new error naming a larger construct whose children failed.
     */
    public static RenderError aggregate(
        final @Nullable Expression node,
        final String message,
        final List<RenderError> causes
    ) {
        return new RenderError(node, Kind.AGGREGATE, message, causes);
    }

    /**
     * Formats the error and all its causes as an indented, user-readable report.
     */
    public String format() {
        final var builder = new StringBuilder();
        format(builder, 0);
        return builder.toString();
    }

    private void format(final StringBuilder builder, final int level) {
        builder.append("  ".repeat(level)).append(message);
        for (final var cause : causes) {
            builder.append('\n');
            cause.format(builder, level + 1);
        }
    }

    /**
     * The kinds of rendering failures.
     */
    public enum Kind {
        UNRESOLVED_IDENTIFIER,
        UNRESOLVABLE_MEMBER,
        DUPLICATE_BINDING,
        UNSUPPORTED_BUILTIN,
        NOT_A_FUNCTION,
        TYPE_INFERENCE,
        /**
         * An interpolated value of a formatted string would not fit on a single line.
         */
        MULTI_LINE_INTERPOLATION,
        /**
         * A construct failed because some of its children did.
         */
        AGGREGATE
    }
}
