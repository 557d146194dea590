// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * Thrown when a condition is signaled with {@link ConditionContext#error(Condition)} and no handler transferred
 * control elsewhere.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the condition that nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
