// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

/**
 * A DOM element's attribute. All attributes the generator emits carry string values.
 */
public record Attribute(String name, String value) {
    /**
     * Returns a new attribute with the given name and value.
     */
    public static Attribute of(final String name, final String value) {
        return new Attribute(name, value);
    }
}
