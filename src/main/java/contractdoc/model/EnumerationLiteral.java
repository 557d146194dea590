// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * A literal of an enumeration.
 *
 * @param name        The identifier of the literal.
 * @param value       The serialized value of the literal.
 * @param description A short user-readable description, possibly empty.
 */
public record EnumerationLiteral(String name, String value, String description) {
}
