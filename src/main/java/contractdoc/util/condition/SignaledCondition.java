// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * The condition being signaled, bundled with auxiliary information.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff the condition was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(Condition condition, boolean isFatal) {
}
