// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The documented data model: classes, enumerations, constrained primitives, constants and verification functions,
 * the parsed contract expressions attached to them, and the type annotations inferred for those expressions.
 * <p>
 * Everything here is immutable and built once per run.
 */
@NonNullByDefault
package contractdoc.model;

import contractdoc.util.annotation.NonNullByDefault;
