// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition;

/**
 * Throwable used by the restart mechanism to transfer control to a restart point.
 * <p>
 * Public only so that methods can declare it and so that it can be carried across thread boundaries; it should
 * otherwise never be caught or thrown by hand. It extends {@link Throwable} directly because it is neither an
 * exceptional situation nor an unrecoverable error.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient Restart target;
}
