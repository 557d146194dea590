// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.dom;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import contractdoc.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The DOM verifier.
 * <p>
 * Performs a best-effort check that a DOM tree serializes into valid HTML: elements appear only where they may,
 * attributes are known, required attributes are present and IDs are unique.
 */
public final class Verifier {
    private Verifier() {
    }

    /**
     * Verifies the DOM tree rooted at {@code rootNode}.
     * <p>
     * Returns normally if the tree is valid. Otherwise, a fatal condition of type {@link VerificationErrorCondition}
     * is signaled.
     */
    public static void verify(final Node rootNode) {
        new Verifier().verifyRoot(rootNode);
    }

    private void verifyRoot(final Node rootNode) {
        verify(rootNode, Context.ROOT);
        if (!verificationErrors.isEmpty()) {
            throw ConditionContext.error(new VerificationErrorCondition(verificationErrors));
        }
    }

    private void verify(final Node node, final Context context) {
        if (node instanceof Node.Element element) {
            verifyElement(element, context);
        } else if (!rawTextContexts.contains(context)) {
            recordNestingError(null, context, rawTextContexts.toString());
        }
    }

    private void verifyElement(final Node.Element element, final Context context) {
        final var tag = element.tag();
        if (!tag.allowedIn(context)) {
            recordNestingError(tag, context, tag.allowedContextsString());
        }
        verifyAttributes(element);
        verifyChildren(element, getEffectiveChildContext(tag, context));
    }

    private void verifyAttributes(final Node.Element element) {
        final var tag = element.tag();
        for (final var attribute : element.attributes()) {
            final var verifier = findAttributeVerifier(attribute, tag);
            if (verifier != null) {
                verifier.verify(new AttributeVerificationContext(this, tag, attribute));
            } else {
                recordAttributeError(tag, attribute.name(), "not a valid attribute for this element");
            }
        }

        for (final var attributeName : tag.requiredAttributes()) {
            if (element.getAttribute(attributeName) == null) {
                recordAttributeError(tag, attributeName, "required attribute not found");
            }
        }

        final var id = element.getAttribute("id");
        if (id != null && !foundIds.add(id.value())) {
            recordAttributeError(tag, "id", "duplicate ID found: '" + id.value() + '\'');
        }
    }

    private static @Nullable AttributeVerifier findAttributeVerifier(final Attribute attribute, final Tag tag) {
        final var name = attribute.name();
        final var globalVerifier = globalAttributes.get(name);
        return (globalVerifier != null) ? globalVerifier : tag.allowedAttributes().get(name);
    }

    private void verifyChildren(final Node.Element element, final @Nullable Context childContext) {
        if (childContext == null) {
            if (!element.children().isEmpty()) {
                recordError("Empty element '" + element.tag().htmlName() + "' has children");
            }
            return;
        }
        ancestors.add(element.tag());
        try {
            for (final var child : element.children()) {
                verify(child, childContext);
            }
        } finally {
            ancestors.remove(ancestors.size() - 1);
        }
    }

    private void recordAttributeError(final Tag tag, final String attributeName, final String message) {
        recordError("Attribute '" + attributeName + "' of element '" + tag.htmlName() + "': " + message);
    }

    private void recordNestingError(final @Nullable Tag tag, final Context actualContext, final String allowed) {
        final var tagName = (tag == null) ? "A text node" : "A '" + tag.htmlName() + "' element";
        recordError(tagName + " found in context " + actualContext + ", but is allowed only in contexts " + allowed);
    }

    private void recordError(final String message) {
        verificationErrors.add(new VerificationError(message, List.copyOf(ancestors)));
    }

    private static @Nullable Context getEffectiveChildContext(final Tag tag, final Context context) {
        final var childContext = tag.childContext();
        if (childContext instanceof Context concrete) {
            return concrete;
        } else if (childContext instanceof ChildContext.Transparent) {
            return context;
        } else {
            return null;
        }
    }

    static final AttributeVerifier anyValue = context -> {
    };

    private static final Map<String, AttributeVerifier> globalAttributes = Map.of(
        "class", anyValue,
        "id", anyValue,
        "lang", anyValue,
        "title", anyValue
    );
    private static final EnumSet<Context> rawTextContexts =
        EnumSet.of(Context.FLOW, Context.PHRASING, Context.TEXT_ONLY);

    private final List<VerificationError> verificationErrors = new ArrayList<>();
    private final List<Tag> ancestors = new ArrayList<>();
    private final HashSet<String> foundIds = new HashSet<>();

    @FunctionalInterface
    interface AttributeVerifier {
        void verify(AttributeVerificationContext context);
    }

    record AttributeVerificationContext(Verifier verifier, Tag tag, Attribute attribute) {
        void recordError(final String message) {
            verifier.recordAttributeError(tag, attribute.name(), message);
        }
    }
}
