// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import contractdoc.model.EntityRef;
import contractdoc.model.Invariant;
import contractdoc.render.ContractRendering;

/**
 * An invariant shown on a page, declared either by the documented entity itself or by one of its ancestors.
 *
 * @param declaredBy The class or constrained primitive declaring the invariant.
 */
record RenderedInvariant(EntityRef declaredBy, Invariant invariant, ContractRendering.Rendered rendering) {
}
