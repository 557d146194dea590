// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * Comparison operators, with their source symbols.
 */
public enum ComparisonOperator {
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    ComparisonOperator(final String symbol) {
        this.symbol = symbol;
    }

    /**
     * Retrieves the symbol of this operator as written in contract expressions.
     */
    public String symbol() {
        return symbol;
    }

    private final String symbol;
}
