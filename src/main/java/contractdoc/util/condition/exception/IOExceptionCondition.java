// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition.exception;

import java.io.IOException;

/**
 * A condition type indicating that an I/O error occurred while writing the generated site.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Initializes a new {@code IOExceptionCondition} representing the given {@link IOException}.
     */
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
