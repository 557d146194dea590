// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.render;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import contractdoc.dom.Node;
import contractdoc.dom.Serializer;
import contractdoc.model.EntityRef;
import contractdoc.transpiler.RenderError;

/**
 * The outcome of rendering a whole contract.
 */
public sealed interface ContractRendering {
    /**
     * The contract rendered successfully.
     *
     * @param codeBlock  The code block, ready to be embedded in a page.
     * @param references The entities the code links to, in the order they first appear.
     */
    record Rendered(Node codeBlock, Set<EntityRef> references) implements ContractRendering {
        public Rendered {
            references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
        }

        /**
         * Serializes the code block to HTML.
         */
        public String html() {
            return Serializer.serializeToString(codeBlock);
        }
    }

    /**
     * The contract could not be rendered.
     */
    record Failed(RenderError error) implements ContractRendering {
    }
}
