// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.IdentityHashMap;
import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Inferred types of expression nodes, keyed by node identity.
 */
public final class TypeMap {
    private TypeMap(final IdentityHashMap<Expression, TypeAnnotation> types) {
        this.types = types;
    }

    /**
     * Returns a new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retrieves the type of the given node.
     *
     * @throws IllegalStateException If no type was inferred for the node.
     */
    public TypeAnnotation require(final Expression node) {
        final var type = types.get(node);
        if (type == null) {
            throw new IllegalStateException("No type was inferred for the " + node.kind() + " node " + node);
        }
        return type;
    }

    /**
     * Returns {@code true} iff a type was inferred for the given node.
     */
    public boolean contains(final Expression node) {
        return types.containsKey(node);
    }

    private final IdentityHashMap<Expression, TypeAnnotation> types;

    /**
     * Accumulates node types. A builder must not be used after {@link #build()}.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Records the type of the given node, replacing any earlier one.
         */
        public Builder put(final Expression node, final TypeAnnotation type) {
            types.put(node, type);
            return this;
        }

        @CheckReturnValue
        public TypeMap build() {
            return new TypeMap(new IdentityHashMap<>(types));
        }

        private final Map<Expression, TypeAnnotation> types = new IdentityHashMap<>();
    }
}
