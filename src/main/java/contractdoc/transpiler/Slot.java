// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.EnumSet;
import contractdoc.model.NodeKind;

/**
 * Operand positions, each with the node kinds that render correctly there without parentheses.
 * <p>
 * The whitelists are the precedence rules of the rendered language; they are deliberately not derived from
 * precedence numbers, since implication and quantifiers are not ordinary infix operators.
 */
public enum Slot {
    MEMBER_INSTANCE(primaries()),
    INDEX_COLLECTION(primariesAnd(NodeKind.CONSTANT)),
    COMPARISON_OPERAND(primariesAnd(NodeKind.CONSTANT)),
    MEMBERSHIP_OPERAND(primariesAnd(NodeKind.CONSTANT)),
    IMPLICATION_OPERAND(primaries()),
    NOT_OPERAND(primaries()),
    NONE_TEST_VALUE(primaries()),
    AND_OR_OPERAND(primariesAnd(NodeKind.COMPARISON)),
    ADD_SUBTRACT_OPERAND(primariesAnd(NodeKind.CONSTANT)),
    QUANTIFIER_SOURCE(primaries());

    Slot(final EnumSet<NodeKind> bare) {
        this.bare = bare;
    }

    /**
     * Returns {@code true} iff a node of the given kind renders without parentheses in this position.
     */
    public boolean allowsBare(final NodeKind kind) {
        return bare.contains(kind);
    }

    private static EnumSet<NodeKind> primaries() {
        return EnumSet.of(
            NodeKind.NAME,
            NodeKind.MEMBER,
            NodeKind.FUNCTION_CALL,
            NodeKind.METHOD_CALL,
            NodeKind.INDEX
        );
    }

    private static EnumSet<NodeKind> primariesAnd(final NodeKind extra) {
        final var result = primaries();
        result.add(extra);
        return result;
    }

    private final EnumSet<NodeKind> bare;
}
