// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import contractdoc.util.CollectionExecutorService;
import contractdoc.util.condition.Condition;
import contractdoc.util.condition.ConditionContext;
import contractdoc.util.condition.Handler;
import contractdoc.util.condition.HandlerProcedure;
import contractdoc.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturns() {
        final var seen = new ArrayList<String>();
        ConditionContext.signal(new TestCondition("nobody listens"));
        try (final var handler = new Handler(condition -> seen.add(condition.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("declined"));
        }
        assertThat(seen).containsExactly("declined");
    }

    @Test
    void declinedErrorIsFatal() {
        final var condition = new TestCondition("fatal");
        final var fatality = new ArrayList<Boolean>();
        try (final var handler = new Handler(signaled -> fatality.add(signaled.isFatal()))) {
            handler.use();
            assertThatExceptionOfType(UnhandledErrorError.class)
                .isThrownBy(() -> {
                    throw ConditionContext.error(condition);
                })
                .satisfies(e -> assertThat(e.condition()).isSameAs(condition));
        }
        assertThat(fatality).containsExactly(true);
    }

    @Test
    void handlerUnwindsToRestart() {
        final var result = ConditionContext.withRestart("outer", outer -> {
            final var inner = ConditionContext.withRestart("inner", restart -> {
                try (final var handler = new Handler(signaled -> unwindTo("inner"))) {
                    handler.use();
                    throw ConditionContext.error(new TestCondition("unwind me"));
                }
            });
            assertThat(inner).isNull();
            return "finished";
        });
        assertThat(result).isEqualTo("finished");
        assertThat(ConditionContext.findRestart("inner")).isNull();
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void newestHandlerRunsFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("both"));
            }
        }
        assertThat(order).containsExactly("inner", "outer");
    }

    @Test
    void findRestartPicksNewestWithName() {
        ConditionContext.withRestart("retry", first -> ConditionContext.withRestart("retry", second -> {
            assertThat(ConditionContext.findRestart("retry")).isSameAs(second);
            final var names = new ArrayList<String>();
            for (final var restart : ConditionContext.restarts()) {
                names.add(restart.name());
            }
            assertThat(names).containsExactly("retry", "retry");
            return null;
        }));
    }

    @Test
    void mapKeepsIterationOrder() {
        final var executorService = Executors.newFixedThreadPool(3);
        try {
            final var executor = new CollectionExecutorService(executorService);
            final var result = executor.map(List.of(5, 3, 8, 1), value -> value * 10);
            assertThat(result).containsExactly(50, 30, 80, 10);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void workersUnwindToCallerRestart() {
        final var executorService = Executors.newFixedThreadPool(2);
        final var seen = new ConcurrentLinkedQueue<String>();
        try {
            final var executor = new CollectionExecutorService(executorService);
            final HandlerProcedure.ThreadSafe procedure = signaled -> {
                seen.add(signaled.condition().message());
                unwindTo("stop");
            };
            final var result = ConditionContext.withRestart("stop", restart -> {
                try (final var handler = new Handler(procedure)) {
                    handler.use();
                    return executor.map(List.of(1, 2, 3), value -> {
                        if (value == 2) {
                            throw ConditionContext.error(new TestCondition("bad value " + value));
                        }
                        return value;
                    });
                }
            });
            assertThat(result).isNull();
            assertThat(seen).containsExactly("bad value 2");
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void threadConfinedHandlersAreNotInherited() {
        final var executorService = Executors.newFixedThreadPool(1);
        try {
            final var executor = new CollectionExecutorService(executorService);
            try (final var handler = new Handler(signaled -> unwindTo("never"))) {
                handler.use();
                assertThatExceptionOfType(UnhandledErrorError.class).isThrownBy(() -> executor.forEach(
                    List.of("only"),
                    value -> {
                        throw ConditionContext.error(new TestCondition(value));
                    }
                ));
            }
        } finally {
            executorService.shutdownNow();
        }
    }

    private static void unwindTo(final String restartName) {
        final var restart = ConditionContext.findRestart(restartName);
        assertThat(restart).isNotNull();
        assert restart != null : "@AssumeAssertion(nullness)";
        restart.unwindTo();
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
