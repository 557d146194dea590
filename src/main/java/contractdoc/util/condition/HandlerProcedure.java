// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * The procedure of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * A handler declines by returning normally, or handles the condition by a non-local transfer of control, usually
     * {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition);

    /**
     * A handler procedure that may run on threads other than the one that established it.
     * <p>
     * Only thread-safe handlers are inherited by worker threads.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
