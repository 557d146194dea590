// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.List;
import contractdoc.model.Expression;
import contractdoc.model.TypeMap;

/**
 * The type inference collaborator: annotates every node of a contract body with its inferred type.
 * <p>
 * The transpiler trusts the annotations it is given and never validates them.
 */
@FunctionalInterface
public interface TypeInferrer {
    /**
     * Infers the types of the given body statements.
     *
     * @param body        The statements of the body; an invariant is a single statement.
     * @param environment The seeded environment, binding {@code self} or the function arguments.
     */
    Result infer(List<Expression> body, Environment environment);

    /**
     * The outcome of type inference.
     */
    sealed interface Result {
    }

    /**
     * Every node of the body was annotated.
     */
    record Success(TypeMap types) implements Result {
    }

    /**
     * Inference failed; the errors are user-readable messages.
     */
    record Failure(List<String> errors) implements Result {
        public Failure {
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("A failed inference must report at least one error");
            }
            errors = List.copyOf(errors);
        }
    }
}
