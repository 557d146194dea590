// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * When a condition is signaled, the procedures of the installed handlers run from the most recently installed one
 * outwards, until one of them transfers control.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler with the given procedure in the current thread's condition context.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls the handler.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final SignaledCondition condition) {
        procedure.handle(condition);
    }

    boolean usableIn(final ConditionContext context) {
        return ownerContext == context || procedure instanceof HandlerProcedure.ThreadSafe;
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext ownerContext;
}
