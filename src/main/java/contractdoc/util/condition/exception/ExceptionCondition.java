// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.util.condition.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import contractdoc.util.condition.Condition;

abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Retrieves the wrapped exception.
     */
    public final E exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        final var writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + exception;
    }

    private final E exception;
}
