// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * The callback executed by {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    @SuppressWarnings("RedundantThrows")
    T call(Restart restart) throws Unwind;
}
