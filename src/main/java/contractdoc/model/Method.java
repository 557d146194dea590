// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A declared method of a class.
 *
 * @param name        The identifier of the method.
 * @param arguments   The declared arguments, not including the receiver.
 * @param returns     The declared return type, or {@code null} if the method returns nothing.
 * @param description A short user-readable description, possibly empty.
 */
public record Method(String name, List<Argument> arguments, @Nullable TypeAnnotation returns, String description) {
    public Method {
        arguments = List.copyOf(arguments);
    }
}
