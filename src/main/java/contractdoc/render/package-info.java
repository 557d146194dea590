// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Whole-contract rendering: seeding environments, running type inference and wrapping transpiled bodies in code
 * blocks.
 */
@NonNullByDefault
package contractdoc.render;

import contractdoc.util.annotation.NonNullByDefault;
