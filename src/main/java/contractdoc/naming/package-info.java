// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Naming schemes: how model identifiers are displayed, and which page and anchor each entity is documented at.
 */
@NonNullByDefault
package contractdoc.naming;

import contractdoc.util.annotation.NonNullByDefault;
