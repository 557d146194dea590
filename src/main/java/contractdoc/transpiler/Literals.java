// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import contractdoc.model.Expression;

/**
 * Source text of literal values, in the notation of the rendered language.
 */
final class Literals {
    private Literals() {
    }

    static String booleanLiteral(final boolean value) {
        return value ? "True" : "False";
    }

    /**
     * Formats a float the way the rendered language prints it: the shortest round-tripping digits, positional
     * notation for decimal exponents from -4 to 15, and scientific notation with a signed, two-digit exponent
     * otherwise.
     */
    static String floatLiteral(final double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return (value > 0) ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1.0 / value < 0) ? "-0.0" : "0.0";
        }
        final var sign = (value < 0) ? "-" : "";
        final var decimal = shortestDecimal(Math.abs(value));
        final var digits = decimal.unscaledValue().toString();
        final var exponent = digits.length() - 1 - decimal.scale();
        if (exponent < -4 || exponent >= 16) {
            final var mantissa = (digits.length() == 1) ? digits : digits.charAt(0) + "." + digits.substring(1);
            final var exponentSign = (exponent < 0) ? '-' : '+';
            return sign + mantissa + 'e' + exponentSign + String.format(Locale.ROOT, "%02d", Math.abs(exponent));
        }
        final var plain = decimal.toPlainString();
        return sign + ((plain.indexOf('.') < 0) ? plain + ".0" : plain);
    }

    private static BigDecimal shortestDecimal(final double value) {
        final var exact = new BigDecimal(value);
        for (int precision = 1; precision < maxSignificantDigits; precision += 1) {
            final var candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (Double.parseDouble(candidate.toString()) == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(maxSignificantDigits, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /**
     * Returns a complete string literal, enclosed in double quotes.
     */
    static String stringLiteral(final String value) {
        return '"' + escape(value, '"', false) + '"';
    }

    /**
     * Escapes the text of a string literal enclosed in the given quote.
     * <p>
     * Backslashes, the enclosing quote, common control characters and any other character below U+0020 or equal
     * to U+007F are escaped. Inside interpolated strings, curly braces are doubled.
     */
    static String escape(final String value, final char quote, final boolean doubleCurlyBraces) {
        final var builder = new StringBuilder(value.length() + 2);
        for (int i = 0; i < value.length(); i += 1) {
            final var character = value.charAt(i);
            if (character == '\\') {
                builder.append("\\\\");
            } else if (character == quote) {
                builder.append('\\').append(character);
            } else if (character == '\n') {
                builder.append("\\n");
            } else if (character == '\r') {
                builder.append("\\r");
            } else if (character == '\t') {
                builder.append("\\t");
            } else if (character < 0x20 || character == 0x7f) {
                builder.append(String.format(Locale.ROOT, "\\x%02x", (int) character));
            } else if (doubleCurlyBraces && (character == '{' || character == '}')) {
                builder.append(character).append(character);
            } else {
                builder.append(character);
            }
        }
        return builder.toString();
    }

    /**
     * Returns the lines of a byte-string literal, every byte escaped in hexadecimal and at most
     * {@value #bytesPerLine} bytes per line. Each line is a complete literal; adjacent literals concatenate.
     */
    static List<String> bytesLiteralLines(final Expression.Constant.BytesValue value) {
        final var lines = new ArrayList<String>();
        final var length = value.length();
        var start = 0;
        do {
            final var end = Math.min(length, start + bytesPerLine);
            final var builder = new StringBuilder("b\"");
            for (int i = start; i < end; i += 1) {
                builder.append(String.format(Locale.ROOT, "\\x%02x", value.get(i) & 0xff));
            }
            lines.add(builder.append('"').toString());
            start = end;
        } while (start < length);
        return lines;
    }

    /**
     * Picks the quote enclosing an interpolated string: the one that needs fewer escapes in the literal segments,
     * the single quote on ties.
     */
    static char chooseQuote(final List<Expression.JoinedString.Segment> segments) {
        var singleQuotes = 0;
        var doubleQuotes = 0;
        for (final var segment : segments) {
            if (segment instanceof Expression.JoinedString.Literal literal) {
                singleQuotes += count(literal.text(), '\'');
                doubleQuotes += count(literal.text(), '"');
            }
        }
        return (singleQuotes <= doubleQuotes) ? '\'' : '"';
    }

    private static int count(final String text, final char character) {
        var result = 0;
        for (int i = 0; i < text.length(); i += 1) {
            if (text.charAt(i) == character) {
                result += 1;
            }
        }
        return result;
    }

    static final int bytesPerLine = 16;

    // Seventeen significant digits identify every double.
    private static final int maxSignificantDigits = 17;
}
