// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

import java.util.List;

record VerificationError(String message, List<Tag> ancestorTags) {
}
