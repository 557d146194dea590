// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, conditions are delivered to handlers before the stack is unwound, so a handler can choose among
 * restart points that were established after the handler itself.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full, detailed, user-readable message representing this condition.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
