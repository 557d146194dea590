// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A named, independently documented contract helper.
 *
 * @param name        The identifier of the function.
 * @param description A short user-readable description, possibly empty.
 * @param kind        How the body of the function is available.
 * @param arguments   The declared arguments.
 * @param returns     The declared return type, or {@code null} if the function returns nothing.
 * @param body        The parsed statements of the body; always empty for implementation-specific functions.
 */
public record VerificationFunction(
    String name,
    String description,
    Kind kind,
    List<Argument> arguments,
    @Nullable TypeAnnotation returns,
    List<Expression> body
) {
    public VerificationFunction {
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
        if (kind == Kind.IMPLEMENTATION_SPECIFIC && !body.isEmpty()) {
            throw new IllegalArgumentException("Implementation-specific function " + name + " cannot have a body");
        }
    }

    /**
     * How the body of a verification function is available.
     */
    public enum Kind {
        /**
         * The body is an ordinary sequence of statements.
         */
        TRANSPILABLE,
        /**
         * The body matches its argument against a regular expression.
         */
        PATTERN,
        /**
         * The body is left to each implementation and is not part of the model.
         */
        IMPLEMENTATION_SPECIFIC
    }
}
