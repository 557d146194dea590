// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.naming;

import java.util.Locale;
import contractdoc.model.EntityKind;

/**
 * A naming scheme that converts snake-case model identifiers to camel case.
 * <p>
 * Types, literals, methods, functions and constants are capitalized ({@code URL_to_something} becomes
 * {@code UrlToSomething}); properties, arguments and variables are not ({@code something_to_URL} becomes
 * {@code somethingToUrl}).
 */
public final class CamelCaseNaming implements NamingScheme {
    private CamelCaseNaming() {
    }

    /**
     * Retrieves the sole instance.
     */
    public static CamelCaseNaming instance() {
        return instance;
    }

    @Override
    public String displayName(final EntityKind kind, final String identifier) {
        return (kind == EntityKind.PROPERTY) ? lowerCamelCase(identifier) : capitalizedCamelCase(identifier);
    }

    @Override
    public String variableName(final String identifier) {
        return lowerCamelCase(identifier);
    }

    /**
     * Converts a snake-case identifier to camel case with the first letter capitalized.
     */
    public static String capitalizedCamelCase(final String identifier) {
        final var builder = new StringBuilder(identifier.length());
        for (final var part : identifier.split("_")) {
            appendCapitalized(builder, part);
        }
        return builder.toString();
    }

    /**
     * Converts a snake-case identifier to camel case with the first letter in lower case.
     */
    public static String lowerCamelCase(final String identifier) {
        final var parts = identifier.split("_");
        final var builder = new StringBuilder(identifier.length());
        var first = true;
        for (final var part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (first) {
                builder.append(part.toLowerCase(Locale.ROOT));
                first = false;
            } else {
                appendCapitalized(builder, part);
            }
        }
        return builder.toString();
    }

    private static void appendCapitalized(final StringBuilder builder, final String part) {
        if (part.isEmpty()) {
            return;
        }
        builder.append(part.substring(0, 1).toUpperCase(Locale.ROOT));
        builder.append(part.substring(1).toLowerCase(Locale.ROOT));
    }

    private static final CamelCaseNaming instance = new CamelCaseNaming();
}
