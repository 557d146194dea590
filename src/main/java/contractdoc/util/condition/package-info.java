// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Code that detects a problem signals a {@link contractdoc.util.condition.Condition}; handlers established further
 * up the stack run <em>before</em> the stack is unwound and decide what to do, typically by transferring control to
 * a named {@link contractdoc.util.condition.Restart}.
 */
@NonNullByDefault
package contractdoc.util.condition;

import contractdoc.util.annotation.NonNullByDefault;
