// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

/**
 * Thrown when an identifier is defined twice in the same scope of an {@link Environment}.
 */
public final class DuplicateBindingException extends Exception {
    DuplicateBindingException(final String identifier) {
        super("The identifier '" + identifier + "' is already defined in this scope");
        this.identifier = identifier;
    }

    /**
     * Retrieves the identifier that was defined twice.
     */
    public String identifier() {
        return identifier;
    }

    private final String identifier;
}
