// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * A declared property of a class.
 *
 * @param name        The identifier of the property.
 * @param type        The declared type of the property.
 * @param description A short user-readable description, possibly empty.
 */
public record Property(String name, TypeAnnotation type, String description) {
}
