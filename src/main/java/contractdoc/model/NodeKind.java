// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * The kinds of expression nodes.
 */
public enum NodeKind {
    NAME,
    MEMBER,
    INDEX,
    COMPARISON,
    IS_IN,
    IMPLICATION,
    NOT,
    AND,
    OR,
    ADD,
    SUBTRACT,
    FUNCTION_CALL,
    METHOD_CALL,
    CONSTANT,
    JOINED_STRING,
    IS_NONE,
    IS_NOT_NONE,
    ASSIGNMENT,
    RETURN,
    QUANTIFIER
}
