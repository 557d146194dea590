// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.ArrayList;
import java.util.List;
import contractdoc.model.Expression;
import contractdoc.model.TypeMap;

/**
 * A type inferrer for models whose annotations were computed ahead of time.
 * <p>
 * Inference succeeds iff every node whose type the transpiler consults has one: instances of member accesses,
 * callee names, quantifier variables and assigned values.
 */
public final class PrecomputedTypes implements TypeInferrer {
    public PrecomputedTypes(final TypeMap types) {
        this.types = types;
    }

    @Override
    public Result infer(final List<Expression> body, final Environment environment) {
        final var missing = new MissingTypes();
        for (final var statement : body) {
            missing.check(statement);
        }
        return missing.errors.isEmpty() ? new Success(types) : new Failure(missing.errors);
    }

    private final TypeMap types;

    private final class MissingTypes implements Expression.Visitor<Void> {
        void check(final Expression node) {
            node.accept(this);
        }

        private void require(final Expression node, final String what) {
            if (!types.contains(node)) {
                errors.add("No type was inferred for " + what);
            }
        }

        @Override
        public Void visitName(final Expression.Name node) {
            return null;
        }

        @Override
        public Void visitMember(final Expression.Member node) {
            require(node.instance(), "the instance of the member access '" + node.name() + '\'');
            check(node.instance());
            return null;
        }

        @Override
        public Void visitIndex(final Expression.Index node) {
            check(node.collection());
            check(node.index());
            return null;
        }

        @Override
        public Void visitComparison(final Expression.Comparison node) {
            check(node.left());
            check(node.right());
            return null;
        }

        @Override
        public Void visitIsIn(final Expression.IsIn node) {
            check(node.member());
            check(node.container());
            return null;
        }

        @Override
        public Void visitImplication(final Expression.Implication node) {
            check(node.antecedent());
            check(node.consequent());
            return null;
        }

        @Override
        public Void visitNot(final Expression.Not node) {
            check(node.operand());
            return null;
        }

        @Override
        public Void visitAnd(final Expression.And node) {
            node.values().forEach(this::check);
            return null;
        }

        @Override
        public Void visitOr(final Expression.Or node) {
            node.values().forEach(this::check);
            return null;
        }

        @Override
        public Void visitAdd(final Expression.Add node) {
            check(node.left());
            check(node.right());
            return null;
        }

        @Override
        public Void visitSubtract(final Expression.Subtract node) {
            check(node.left());
            check(node.right());
            return null;
        }

        @Override
        public Void visitFunctionCall(final Expression.FunctionCall node) {
            require(node.name(), "the called function '" + node.name().identifier() + '\'');
            node.arguments().forEach(this::check);
            return null;
        }

        @Override
        public Void visitMethodCall(final Expression.MethodCall node) {
            check(node.member());
            node.arguments().forEach(this::check);
            return null;
        }

        @Override
        public Void visitConstant(final Expression.Constant node) {
            return null;
        }

        @Override
        public Void visitJoinedString(final Expression.JoinedString node) {
            for (final var segment : node.segments()) {
                if (segment instanceof Expression.JoinedString.Interpolation interpolation) {
                    check(interpolation.value());
                }
            }
            return null;
        }

        @Override
        public Void visitIsNone(final Expression.IsNone node) {
            check(node.value());
            return null;
        }

        @Override
        public Void visitIsNotNone(final Expression.IsNotNone node) {
            check(node.value());
            return null;
        }

        @Override
        public Void visitAssignment(final Expression.Assignment node) {
            require(node.value(), "the value assigned to '" + node.target().identifier() + '\'');
            check(node.value());
            return null;
        }

        @Override
        public Void visitReturn(final Expression.Return node) {
            final var value = node.value();
            if (value != null) {
                check(value);
            }
            return null;
        }

        @Override
        public Void visitQuantifier(final Expression.Quantifier node) {
            require(node.variable(), "the quantifier variable '" + node.variable().identifier() + '\'');
            final var generator = node.generator();
            if (generator instanceof Expression.ForEach forEach) {
                check(forEach.collection());
            } else if (generator instanceof Expression.ForRange forRange) {
                check(forRange.start());
                check(forRange.end());
            }
            check(node.condition());
            return null;
        }

        private final List<String> errors = new ArrayList<>();
    }
}
