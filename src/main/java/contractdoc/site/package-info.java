// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The documentation site generator: one page per class, enumeration, constant and verification function, plus an
 * index page.
 */
@NonNullByDefault
package contractdoc.site;

import contractdoc.util.annotation.NonNullByDefault;
