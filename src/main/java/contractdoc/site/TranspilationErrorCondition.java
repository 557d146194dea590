// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import java.util.ArrayList;
import java.util.List;
import contractdoc.model.EntityRef;
import contractdoc.transpiler.RenderError;
import contractdoc.util.Trace;
import contractdoc.util.condition.Condition;

/**
 * A condition type representing the failure to render a contract of a documented entity.
 */
public final class TranspilationErrorCondition extends Condition {
    TranspilationErrorCondition(final EntityRef entity, final RenderError error) {
        super("Failed to render the contracts of " + describe(entity));
        this.entity = entity;
        this.error = error;
        final var activeTraces = new ArrayList<String>();
        for (final var trace : Trace.activeTraces()) {
            activeTraces.add(trace);
        }
        traces = List.copyOf(activeTraces);
    }

    /**
     * Retrieves the entity whose page could not be generated.
     */
    public EntityRef entity() {
        return entity;
    }

    /**
     * Retrieves the rendering error.
     */
    public RenderError error() {
        return error;
    }

    /**
     * Retrieves the trace messages that were active when the failure was detected, innermost first.
     */
    public List<String> traces() {
        return traces;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + error.format();
    }

    static String describe(final EntityRef entity) {
        return switch (entity.kind()) {
            case CLASS -> "the class " + entity.name();
            case CONSTRAINED_PRIMITIVE -> "the constrained primitive " + entity.name();
            case VERIFICATION_FUNCTION -> "the verification function " + entity.name();
            default -> entity.kind() + " " + entity.name();
        };
    }

    private final EntityRef entity;
    private final RenderError error;
    private final List<String> traces;
}
