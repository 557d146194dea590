// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import java.util.Queue;
import contractdoc.util.condition.ConditionContext;
import contractdoc.util.condition.HandlerProcedure;
import contractdoc.util.condition.SignaledCondition;

/**
 * Applies a {@link FailurePolicy} to signaled {@link TranspilationErrorCondition}s: records the failure, then unwinds
 * to the restart the policy names. Other conditions are declined.
 */
final class FailurePolicyHandler implements HandlerProcedure.ThreadSafe {
    FailurePolicyHandler(final FailurePolicy policy, final Queue<TranspilationErrorCondition> failures) {
        this.policy = policy;
        this.failures = failures;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!(condition.condition() instanceof TranspilationErrorCondition failure)) {
            return;
        }
        final var restartName = switch (policy) {
            case ABORT -> SiteGenerator.abortRestartName;
            case SKIP -> SiteGenerator.skipRestartName;
        };
        final var restart = ConditionContext.findRestart(restartName);
        if (restart != null) {
            failures.add(failure);
            restart.unwindTo();
        }
    }

    private final FailurePolicy policy;
    private final Queue<TranspilationErrorCondition> failures;
}
