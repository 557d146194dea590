// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

/**
 * The outcome of rendering a node: either a fragment or an error, never both.
 */
public sealed interface RenderResult {
    /**
     * Returns {@code true} iff rendering succeeded.
     */
    boolean isSuccess();

    /**
     * Retrieves the rendered fragment.
     *
     * @throws IllegalStateException If rendering failed.
     */
    Fragment fragment();

    /**
     * Retrieves the error.
     *
     * @throws IllegalStateException If rendering succeeded.
     */
    RenderError error();

    static RenderResult success(final Fragment fragment) {
        return new Success(fragment);
    }

    static RenderResult failure(final RenderError error) {
        return new Failure(error);
    }

    record Success(Fragment value) implements RenderResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Fragment fragment() {
            return value;
        }

        @Override
        public RenderError error() {
            throw new IllegalStateException("Rendering succeeded, there is no error");
        }
    }

    record Failure(RenderError value) implements RenderResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Fragment fragment() {
            throw new IllegalStateException("Rendering failed: " + value.message());
        }

        @Override
        public RenderError error() {
            return value;
        }
    }
}
