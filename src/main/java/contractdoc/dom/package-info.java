// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * An immutable HTML DOM, together with a verifier and a serializer.
 */
@NonNullByDefault
package contractdoc.dom;

import contractdoc.util.annotation.NonNullByDefault;
