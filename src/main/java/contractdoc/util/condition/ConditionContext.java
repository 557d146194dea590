// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import contractdoc.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Keeps track of the handlers and restart points registered in a thread.
 * <p>
 * Every thread has its own context. Instances are never exposed; static methods operate on the calling thread's
 * context instead.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition.
     * <p>
     * Registered handlers are invoked from the newest to the oldest, stopping at the first one that transfers
     * control. If every handler declines, this method returns normally.
     * <p>
     * Since handlers may unwind to a restart point, this method may throw {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that {@link UnhandledErrorError} is thrown if every handler
     * declines. The return type exists so that call sites can write {@code throw ConditionContext.error(...)} to help
     * the compiler's control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given callback with a named restart point around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points, newest first.
     */
    public static Iterable<Restart> restarts() {
        final var first = localContext().firstRestart;
        return () -> new RestartIterator(first);
    }

    /**
     * Finds the newest active restart with the given name.
     *
     * @return The restart, or {@code null} if there is none with that name.
     */
    public static @Nullable Restart findRestart(final String name) {
        for (final var restart : restarts()) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        return null;
    }

    /**
     * Saves the restarts and thread-safe handlers of the calling thread, so that a worker thread can use them.
     *
     * @see #inheritState(InheritedState)
     */
    public static InheritedState saveInheritableState() {
        final var context = localContext();
        // signal() skips handlers that are not usable in the signaling thread, so the chain can be shared as-is.
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Installs inherited state into the calling thread, whose context must be empty.
     *
     * @return A token to pass to {@link #restoreState(PreviousState)}.
     */
    public static PreviousState inheritState(final InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Attempted to inherit state into a thread that already has handlers";
        assert context.firstRestart == null : "Attempted to inherit state into a thread that already has restarts";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Empties the calling thread's context again after {@link #inheritState(InheritedState)}.
     */
    public static void restoreState(@SuppressWarnings("unused") final PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from within a handler only reaches the handlers outside of it.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Opaque saved inheritable state of a condition context.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token representing the state of a condition context before inheritance.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }

    private static final class RestartIterator implements Iterator<Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
