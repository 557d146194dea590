// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces are user-readable descriptions of the operation in progress, such as "Rendering the page of class
 * Referable". They are shown alongside fatal conditions to explain where a problem occurred; they are <em>not</em>
 * a machine stack trace.
 * <p>
 * Trace objects must never be used outside the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message, and registers it as the innermost
     * active trace of the calling thread.
     * <p>
     * The supplier is called at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Initializes a new trace with the given message, and registers it as the innermost active trace of the calling
     * thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext();
        next = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return () -> new TraceIterator(localContext().innermost);
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread. Use try-with-resources instead of calling this directly.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never produces null.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // A String once evaluated, a MessageSupplier before that.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }

    private static final class TraceIterator implements Iterator<String> {
        private TraceIterator(final @Nullable Trace first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
