// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small general-purpose utilities: operation traces, sneaky throws and concurrent collection processing.
 */
@NonNullByDefault
package contractdoc.util;

import contractdoc.util.annotation.NonNullByDefault;
