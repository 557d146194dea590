// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

/**
 * A declared argument of a verification function or a method.
 */
public record Argument(String name, TypeAnnotation type) {
}
