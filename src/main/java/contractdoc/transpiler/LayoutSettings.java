// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

/**
 * Line-wrapping parameters.
 *
 * @param lineBudget The maximum visible length of a single-line fragment before it is laid out as a block.
 * @param indentUnit The indentation of one block level.
 */
public record LayoutSettings(int lineBudget, String indentUnit) {
    public LayoutSettings {
        if (lineBudget <= 0) {
            throw new IllegalArgumentException("The line budget must be positive, got " + lineBudget);
        }
        if (!indentUnit.isBlank() || indentUnit.isEmpty()) {
            throw new IllegalArgumentException("The indentation unit must be non-empty whitespace");
        }
    }

    /**
     * Fifty characters per line, four spaces per indentation level.
     */
    public static final LayoutSettings defaultSettings = new LayoutSettings(50, "    ");
}
