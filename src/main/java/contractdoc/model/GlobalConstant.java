// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * A named global constant that contracts may refer to, such as a set of allowed enumeration literals.
 *
 * @param name        The identifier of the constant.
 * @param type        The type of the constant.
 * @param description A short user-readable description, possibly empty.
 */
public record GlobalConstant(String name, TypeAnnotation type, String description) {
}
