// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

enum Context implements ChildContext {
    ROOT("root"),
    HEAD_AND_BODY("head and body"),
    METADATA("metadata"),
    TEXT_ONLY("text only"),
    FLOW("flow"),
    PHRASING("phrasing"),
    LIST_ELEMENT("list element");

    Context(final String readableName) {
        this.readableName = readableName;
    }

    @Override
    public String toString() {
        return readableName;
    }

    private final String readableName;
}
