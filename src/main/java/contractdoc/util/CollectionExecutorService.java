// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import contractdoc.util.condition.ConditionContext;
import contractdoc.util.condition.Unwind;

/**
 * A wrapper around {@link ExecutorService} for processing collections concurrently.
 * <p>
 * Tasks inherit the {@link ConditionContext} state of the submitting thread, so restarts established by the caller
 * can be unwound to from a worker. Such unwinds are propagated back to the calling thread.
 */
public final class CollectionExecutorService {
    /**
     * Initializes a new collection executor service that will submit tasks to the given executor service.
     */
    public CollectionExecutorService(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Returns an unmodifiable list of the results of applying the function to each element, in iteration order.
     * <p>
     * Waits for all submitted tasks to finish before returning.
     */
    public <T, R> List<R> map(final Iterable<? extends T> iterable, final Function<? super T, ? extends R> function) {
        final var results = new ArrayList<R>();
        new AwaitImpl<R>(submitTasks(iterable, function).iterator(), results::add).awaitAll();
        return Collections.unmodifiableList(results);
    }

    /**
     * Applies the consumer to each element concurrently, waiting for all of them to finish.
     */
    public <T> void forEach(final Iterable<? extends T> iterable, final Consumer<? super T> consumer) {
        final var futures = submitTasks(iterable, value -> {
            consumer.accept(value);
            return null;
        });
        new AwaitImpl<>(futures.iterator(), value -> {
        }).awaitAll();
    }

    private <T, R> List<Future<R>> submitTasks(
        final Iterable<? extends T> iterable,
        final Function<? super T, ? extends R> function
    ) {
        final var inheritedState = ConditionContext.saveInheritableState();
        final var futures = new ArrayList<Future<R>>();
        for (final T item : iterable) {
            futures.add(executorService.submit(() -> {
                final var previousState = ConditionContext.inheritState(inheritedState);
                final MessageSupplier message = () -> "Executing a task in thread " + Thread.currentThread().getName();
                try (final var trace = new Trace(message)) {
                    trace.use();
                    return function.apply(item);
                } finally {
                    ConditionContext.restoreState(previousState);
                }
            }));
        }
        return futures;
    }

    private final ExecutorService executorService;

    private static final class AwaitImpl<T> {
        private AwaitImpl(final Iterator<? extends Future<? extends T>> iterator, final Consumer<? super T> consumer) {
            this.iterator = iterator;
            this.consumer = consumer;
        }

        private void awaitAll() {
            try {
                while (iterator.hasNext()) {
                    awaitOne(iterator.next());
                }
                if (foundInterrupt) {
                    throw new AssertionError("A task was interrupted, but no other task threw anything concrete");
                }
            } finally {
                if (needsCancellation) {
                    while (iterator.hasNext()) {
                        iterator.next().cancel(true);
                    }
                }
            }
        }

        private void awaitOne(final Future<? extends T> future) {
            try {
                consumer.accept(future.get());
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            } catch (final ExecutionException e) {
                recover(e);
            }
        }

        private void recover(final ExecutionException executionException) {
            needsCancellation = true;
            final var cause = executionException.getCause();
            if (cause instanceof Unwind) {
                // Cross-thread unwind, keep unwinding in the calling thread.
                throw SneakyThrow.doThrow(cause);
            } else if (cause instanceof InterruptedException) {
                // Some other future will likely have a more concrete throwable.
                foundInterrupt = true;
            } else if (cause instanceof Error error) {
                throw error;
            } else {
                throw new AssertionError("An exception escaped from a worker through a future", cause);
            }
        }

        private final Iterator<? extends Future<? extends T>> iterator;
        private final Consumer<? super T> consumer;
        private boolean foundInterrupt = false;
        private boolean needsCancellation = false;
    }
}
