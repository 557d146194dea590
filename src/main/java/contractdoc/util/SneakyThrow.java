// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, whatever its static or dynamic type.
     * <p>
     * Reserved for {@link InterruptedException} and {@link contractdoc.util.condition.Unwind}, which would otherwise
     * have to be declared nearly everywhere.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)}
     * to help the compiler's control flow analysis.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is inferred as RuntimeException at the call site and erased to Throwable, so the cast is a no-op.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
