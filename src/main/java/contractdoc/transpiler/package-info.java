// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The expression transpiler: turns typed contract expressions into syntax-highlighted, cross-linked HTML fragments.
 * <p>
 * Transpilation never throws for user-facing problems. Every rendering yields a
 * {@link contractdoc.transpiler.RenderResult}, and failures of sub-expressions are aggregated into a tree of
 * {@link contractdoc.transpiler.RenderError}s.
 */
@NonNullByDefault
package contractdoc.transpiler;

import contractdoc.util.annotation.NonNullByDefault;
