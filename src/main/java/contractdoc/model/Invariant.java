// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * A boolean contract that every instance of a class must satisfy.
 *
 * @param description A short user-readable description of the invariant.
 * @param body        The parsed expression of the invariant.
 */
public record Invariant(String description, Expression body) {
}
