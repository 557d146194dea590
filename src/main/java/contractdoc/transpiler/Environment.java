// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import contractdoc.model.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A lexical environment: a scope mapping identifiers to their types, chained to its parent scope.
 * <p>
 * Definitions are made with {@link #define(String, TypeAnnotation)}, which returns a {@link Binding} to be closed
 * when the identifier goes out of scope, typically in try-with-resources:
 * <pre>{@code
 * final var inner = environment.pushChild();
 * try (final var binding = inner.define("x", type)) {
 *     binding.use();
 *     ...
 * }
 * }</pre>
 * Environments are not thread-safe; each contract rendering uses its own chain.
 */
public final class Environment {
    private Environment(final @Nullable Environment parent) {
        this.parent = parent;
        depth = (parent == null) ? 1 : parent.depth + 1;
    }

    /**
     * Returns a new, empty top-level environment.
     */
    public static Environment root() {
        return new Environment(null);
    }

    /**
     * Returns a new, empty scope whose parent is this one.
     */
    public Environment pushChild() {
        return new Environment(this);
    }

    /**
     * Retrieves the parent scope, or {@code null} for a top-level environment.
     */
    public @Nullable Environment parent() {
        return parent;
    }

    /**
     * Defines the identifier in this exact scope.
     * <p>
     * Shadowing an identifier of an ancestor scope is allowed.
     *
     * @throws DuplicateBindingException If this exact scope already defines the identifier.
     */
    public Binding define(final String identifier, final TypeAnnotation type) throws DuplicateBindingException {
        if (bindings.containsKey(identifier)) {
            throw new DuplicateBindingException(identifier);
        }
        bindings.put(identifier, type);
        return new Binding(identifier);
    }

    /**
     * Looks the identifier up, from this scope outwards.
     *
     * @return The type of the innermost definition, or {@code null} if no scope in the chain defines it.
     */
    public @Nullable TypeAnnotation lookup(final String identifier) {
        for (var scope = this; scope != null; scope = scope.parent) {
            final var type = scope.bindings.get(identifier);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    /**
     * Returns {@code true} iff this exact scope defines the identifier.
     */
    public boolean definesLocally(final String identifier) {
        return bindings.containsKey(identifier);
    }

    /**
     * Removes the identifier from this exact scope.
     * <p>
     * Only ever undoes a definition made in this scope; {@link Binding#close()} is the usual caller.
     *
     * @throws IllegalStateException If this scope does not define the identifier.
     */
    public void remove(final String identifier) {
        if (bindings.remove(identifier) == null) {
            throw new IllegalStateException("The identifier '" + identifier + "' is not defined in this scope");
        }
    }

    /**
     * Retrieves the number of scopes in the chain, this one included.
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns an immutable copy of every scope in the chain, outermost first.
     */
    public List<Map<String, TypeAnnotation>> snapshot() {
        final var result = new ArrayList<Map<String, TypeAnnotation>>(depth);
        for (var scope = this; scope != null; scope = scope.parent) {
            result.add(Collections.unmodifiableMap(new LinkedHashMap<>(scope.bindings)));
        }
        Collections.reverse(result);
        return Collections.unmodifiableList(result);
    }

    private final @Nullable Environment parent;
    private final int depth;
    private final LinkedHashMap<String, TypeAnnotation> bindings = new LinkedHashMap<>();

    /**
     * A definition made in an environment, intended to be used within try-with-resources. Closing the binding
     * removes the definition again.
     */
    public final class Binding implements AutoCloseable {
        private Binding(final String identifier) {
            this.identifier = identifier;
        }

        /**
         * Retrieves the defined identifier.
         */
        public String identifier() {
            return identifier;
        }

        /**
         * Does nothing; silences warnings about unreferenced auto-closeable resources.
         */
        @SuppressWarnings("EmptyMethod")
        public void use() {
        }

        /**
         * Removes the definition. Closing a binding a second time does nothing.
         */
        @Override
        public void close() {
            if (!closed) {
                closed = true;
                remove(identifier);
            }
        }

        private final String identifier;
        private boolean closed = false;
    }
}
