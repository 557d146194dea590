// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import java.util.ArrayList;
import java.util.List;
import contractdoc.model.Expression;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.TypeMap;
import contractdoc.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The expression transpiler: renders expression trees as highlighted, cross-linked code.
 * <p>
 * Every node kind has exactly one rendering rule. Rules render all their children before deciding anything, so a
 * node with several failing children reports all of their errors, wrapped in one error naming the construct.
 * Nothing is ever partially emitted: a node either renders completely or contributes only to the error tree.
 * <p>
 * Each call transpiles in a fresh body scope below the given environment. Assignments define their targets in that
 * scope, so the environment passed in is the same before and after every call.
 */
public final class Transpiler {
    /**
     * Initializes a new transpiler.
     *
     * @param resolver The name resolution strategy of the contract being rendered.
     * @param types    The inferred types of the nodes to be rendered.
     * @param settings The layout settings.
     */
    public Transpiler(final NameResolver resolver, final TypeMap types, final LayoutSettings settings) {
        this.resolver = resolver;
        this.types = types;
        layout = new Layout(settings);
    }

    /**
     * Transpiles a single expression.
     */
    public RenderResult transpile(final Expression node, final Environment environment) {
        return node.accept(new Rules(environment.pushChild()));
    }

    /**
     * Transpiles the statements of a function body, in order, sharing one body scope so that variables assigned by
     * a statement are visible in the following ones.
     *
     * @return The results, one per statement.
     */
    public List<RenderResult> transpileStatements(final List<Expression> statements, final Environment environment) {
        final var rules = new Rules(environment.pushChild());
        final var results = new ArrayList<RenderResult>(statements.size());
        for (final var statement : statements) {
            results.add(statement.accept(rules));
        }
        return results;
    }

    private final NameResolver resolver;
    private final TypeMap types;
    private final Layout layout;

    private record Children(List<Fragment> fragments, List<RenderError> errors) {
        boolean failed() {
            return !errors.isEmpty();
        }

        Fragment get(final int index) {
            return fragments.get(index);
        }
    }

    private final class Rules implements Expression.Visitor<RenderResult> {
        Rules(final Environment environment) {
            this.environment = environment;
        }

        private Children render(final List<? extends Expression> nodes) {
            final var fragments = new ArrayList<Fragment>(nodes.size());
            final var errors = new ArrayList<RenderError>();
            for (final var node : nodes) {
                final var result = node.accept(this);
                if (result.isSuccess()) {
                    fragments.add(result.fragment());
                } else {
                    errors.add(result.error());
                }
            }
            return new Children(fragments, errors);
        }

        private RenderResult failed(final Expression node, final String construct, final List<RenderError> causes) {
            return RenderResult.failure(RenderError.aggregate(node, "Failed to transpile the " + construct, causes));
        }

        private RenderResult binary(
            final Expression node,
            final String construct,
            final Expression left,
            final Fragment operator,
            final Expression right,
            final Slot slot
        ) {
            final var children = render(List.of(left, right));
            if (children.failed()) {
                return failed(node, construct, children.errors());
            }
            return RenderResult.success(Fragment.builder()
                .append(layout.inSlot(left, slot, children.get(0)))
                .text(" ")
                .append(operator)
                .text(" ")
                .append(layout.inSlot(right, slot, children.get(1)))
                .build());
        }

        private RenderResult prefixed(
            final Expression node,
            final String construct,
            final Fragment prefix,
            final Expression operand,
            final Slot slot
        ) {
            final var result = operand.accept(this);
            if (!result.isSuccess()) {
                return failed(node, construct, List.of(result.error()));
            }
            return RenderResult.success(Fragment.builder()
                .append(prefix)
                .text(" ")
                .append(layout.inSlot(operand, slot, result.fragment()))
                .build());
        }

        private RenderResult suffixed(
            final Expression node,
            final String construct,
            final Expression operand,
            final List<Fragment> suffix
        ) {
            final var result = operand.accept(this);
            if (!result.isSuccess()) {
                return failed(node, construct, List.of(result.error()));
            }
            final var builder = Fragment.builder()
                .append(layout.inSlot(operand, Slot.NONE_TEST_VALUE, result.fragment()));
            for (final var token : suffix) {
                builder.text(" ").append(token);
            }
            return RenderResult.success(builder.build());
        }

        private RenderResult junction(
            final Expression node,
            final String construct,
            final String keyword,
            final List<Expression> values
        ) {
            final var children = render(values);
            if (children.failed()) {
                return failed(node, construct, children.errors());
            }
            if (values.size() == 1) {
                return RenderResult.success(children.get(0));
            }
            final var lines = new ArrayList<Fragment>(values.size());
            for (int i = 0; i < values.size(); i += 1) {
                final var value = layout.inSlot(values.get(i), Slot.AND_OR_OPERAND, children.get(i));
                lines.add((i == 0)
                    ? value
                    : Fragment.builder().append(Tokens.operatorWord(keyword)).text(" ").append(value).build());
            }
            return RenderResult.success(layout.block(Fragment.empty(), lines));
        }

        @Override
        public RenderResult visitName(final Expression.Name node) {
            return resolver.resolveName(node, environment);
        }

        @Override
        public RenderResult visitMember(final Expression.Member node) {
            final var instance = node.instance().accept(this);
            final var member = resolver.resolveMember(node, types.require(node.instance()));
            if (!instance.isSuccess()) {
                final var causes = new ArrayList<RenderError>(2);
                causes.add(instance.error());
                if (!member.isSuccess()) {
                    causes.add(member.error());
                }
                return failed(node, "member access", causes);
            }
            if (!member.isSuccess()) {
                return member;
            }
            return RenderResult.success(Fragment.builder()
                .append(layout.inSlot(node.instance(), Slot.MEMBER_INSTANCE, instance.fragment()))
                .append(Tokens.operator("."))
                .append(member.fragment())
                .build());
        }

        @Override
        public RenderResult visitIndex(final Expression.Index node) {
            final var children = render(List.of(node.collection(), node.index()));
            if (children.failed()) {
                return failed(node, "index access", children.errors());
            }
            return RenderResult.success(Fragment.builder()
                .append(layout.inSlot(node.collection(), Slot.INDEX_COLLECTION, children.get(0)))
                .append(Tokens.punctuation("["))
                .append(children.get(1))
                .append(Tokens.punctuation("]"))
                .build());
        }

        @Override
        public RenderResult visitComparison(final Expression.Comparison node) {
            return binary(
                node,
                "comparison",
                node.left(),
                Tokens.operator(node.operator().symbol()),
                node.right(),
                Slot.COMPARISON_OPERAND
            );
        }

        @Override
        public RenderResult visitIsIn(final Expression.IsIn node) {
            return binary(
                node,
                "membership relation",
                node.member(),
                Tokens.operatorWord("in"),
                node.container(),
                Slot.MEMBERSHIP_OPERAND
            );
        }

        @Override
        public RenderResult visitImplication(final Expression.Implication node) {
            final var children = render(List.of(node.antecedent(), node.consequent()));
            if (children.failed()) {
                return failed(node, "implication", children.errors());
            }
            return RenderResult.success(Fragment.builder()
                .append(Tokens.operatorWord("not"))
                .text(" ")
                .append(layout.inSlot(node.antecedent(), Slot.IMPLICATION_OPERAND, children.get(0)))
                .text("\n")
                .append(Tokens.operatorWord("or"))
                .text(" ")
                .append(layout.inSlot(node.consequent(), Slot.IMPLICATION_OPERAND, children.get(1)))
                .build());
        }

        @Override
        public RenderResult visitNot(final Expression.Not node) {
            return prefixed(node, "negation", Tokens.operatorWord("not"), node.operand(), Slot.NOT_OPERAND);
        }

        @Override
        public RenderResult visitAnd(final Expression.And node) {
            return junction(node, "conjunction", "and", node.values());
        }

        @Override
        public RenderResult visitOr(final Expression.Or node) {
            return junction(node, "disjunction", "or", node.values());
        }

        @Override
        public RenderResult visitAdd(final Expression.Add node) {
            return binary(node, "addition", node.left(), Tokens.operator("+"), node.right(), Slot.ADD_SUBTRACT_OPERAND);
        }

        @Override
        public RenderResult visitSubtract(final Expression.Subtract node) {
            return binary(
                node,
                "subtraction",
                node.left(),
                Tokens.operator("-"),
                node.right(),
                Slot.ADD_SUBTRACT_OPERAND
            );
        }

        @Override
        public RenderResult visitFunctionCall(final Expression.FunctionCall node) {
            final var arguments = render(node.arguments());
            if (arguments.failed()) {
                return failed(node, "function call", arguments.errors());
            }
            final var calleeType = types.require(node.name());
            if (calleeType instanceof TypeAnnotation.VerificationType) {
                final var callee = resolver.resolveName(node.name(), environment);
                if (!callee.isSuccess()) {
                    return failed(node, "function call", List.of(callee.error()));
                }
                return RenderResult.success(layout.delimitedList(callee.fragment(), arguments.fragments(), false));
            }
            if (calleeType instanceof TypeAnnotation.BuiltinType builtin) {
                final var name = builtin.functionName();
                if (lengthFunction.equals(name)) {
                    return RenderResult.success(Fragment.builder()
                        .append(Tokens.builtin(name))
                        .append(Tokens.punctuation("("))
                        .append(Layout.join(arguments.fragments(), ", "))
                        .append(Tokens.punctuation(")"))
                        .build());
                }
                if (matchFunction.equals(name)) {
                    return RenderResult.success(
                        layout.delimitedList(Tokens.builtin(name), arguments.fragments(), true)
                    );
                }
                return RenderResult.failure(RenderError.of(
                    node,
                    RenderError.Kind.UNSUPPORTED_BUILTIN,
                    "The handling of the built-in function '" + name + "' has not been implemented"
                ));
            }
            return RenderResult.failure(RenderError.of(
                node,
                RenderError.Kind.NOT_A_FUNCTION,
                "Expected the name to refer to a function, but its inferred type was " + calleeType.describe()
            ));
        }

        @Override
        public RenderResult visitMethodCall(final Expression.MethodCall node) {
            final var member = node.member().accept(this);
            final var arguments = render(node.arguments());
            if (!member.isSuccess() || arguments.failed()) {
                final var causes = new ArrayList<RenderError>(arguments.errors().size() + 1);
                if (!member.isSuccess()) {
                    causes.add(member.error());
                }
                causes.addAll(arguments.errors());
                return failed(node, "method call", causes);
            }
            return RenderResult.success(layout.delimitedList(member.fragment(), arguments.fragments(), false));
        }

        @Override
        public RenderResult visitConstant(final Expression.Constant node) {
            final var value = node.value();
            if (value instanceof Expression.Constant.BooleanValue bool) {
                return RenderResult.success(Tokens.keywordConstant(Literals.booleanLiteral(bool.value())));
            }
            if (value instanceof Expression.Constant.IntegerValue integer) {
                return RenderResult.success(Fragment.text(integer.value().toString()));
            }
            if (value instanceof Expression.Constant.FloatValue floating) {
                return RenderResult.success(Fragment.text(Literals.floatLiteral(floating.value())));
            }
            if (value instanceof Expression.Constant.StringValue string) {
                return RenderResult.success(Tokens.string(Literals.stringLiteral(string.value())));
            }
            if (value instanceof Expression.Constant.BytesValue bytes) {
                final var lines = Literals.bytesLiteralLines(bytes);
                if (lines.size() == 1) {
                    return RenderResult.success(Tokens.string(lines.get(0)));
                }
                final var fragments = new ArrayList<Fragment>(lines.size());
                for (final var line : lines) {
                    fragments.add(Tokens.string(line));
                }
                return RenderResult.success(layout.block(Fragment.empty(), fragments));
            }
            throw new UnreachableCodeReachedError("Unknown constant value " + value);
        }

        @Override
        public RenderResult visitJoinedString(final Expression.JoinedString node) {
            final var segments = node.segments();
            if (!node.hasInterpolations()) {
                final var text = new StringBuilder();
                for (final var segment : segments) {
                    text.append(((Expression.JoinedString.Literal) segment).text());
                }
                return RenderResult.success(Tokens.string(Literals.stringLiteral(text.toString())));
            }
            final var quote = Literals.chooseQuote(segments);
            final var quoteToken = Tokens.styled(
                (quote == '\'') ? Tokens.singleQuoteClass : Tokens.doubleQuoteClass,
                String.valueOf(quote)
            );
            final var builder = Fragment.builder()
                .append(Tokens.styled(Tokens.stringAffixClass, "f"))
                .append(quoteToken);
            final var errors = new ArrayList<RenderError>();
            for (final var segment : segments) {
                if (segment instanceof Expression.JoinedString.Literal literal) {
                    if (!literal.text().isEmpty()) {
                        builder.append(Tokens.string(Literals.escape(literal.text(), quote, true)));
                    }
                } else if (segment instanceof Expression.JoinedString.Interpolation interpolation) {
                    final var result = interpolation.value().accept(this);
                    if (!result.isSuccess()) {
                        errors.add(result.error());
                    } else if (result.fragment().isMultiLine()) {
                        errors.add(RenderError.of(
                            interpolation.value(),
                            RenderError.Kind.MULTI_LINE_INTERPOLATION,
                            "The interpolated value would span several lines, which a formatted string cannot hold"
                        ));
                    } else {
                        builder.append(Tokens.styled(Tokens.interpolationClass, "{"))
                            .append(result.fragment())
                            .append(Tokens.styled(Tokens.interpolationClass, "}"));
                    }
                }
            }
            if (!errors.isEmpty()) {
                return failed(node, "interpolated string", errors);
            }
            return RenderResult.success(builder.append(quoteToken).build());
        }

        @Override
        public RenderResult visitIsNone(final Expression.IsNone node) {
            return suffixed(node, "is-none test", node.value(), List.of(
                Tokens.operatorWord("is"),
                Tokens.keywordConstant("None")
            ));
        }

        @Override
        public RenderResult visitIsNotNone(final Expression.IsNotNone node) {
            return suffixed(node, "is-not-none test", node.value(), List.of(
                Tokens.operatorWord("is"),
                Tokens.operatorWord("not"),
                Tokens.keywordConstant("None")
            ));
        }

        @Override
        public RenderResult visitAssignment(final Expression.Assignment node) {
            final var errors = new ArrayList<RenderError>();
            final var value = node.value().accept(this);
            if (!value.isSuccess()) {
                errors.add(value.error());
            }
            final var target = node.target();
            if (environment.lookup(target.identifier()) == null) {
                try {
                    // The body scope is discarded as a whole, so the binding is never closed.
                    environment.define(target.identifier(), types.require(node.value())).use();
                } catch (final DuplicateBindingException e) {
                    errors.add(duplicateBinding(target, e));
                }
            }
            final var renderedTarget = resolver.resolveName(target, environment);
            if (!renderedTarget.isSuccess()) {
                errors.add(renderedTarget.error());
            }
            if (!errors.isEmpty()) {
                return failed(node, "assignment", errors);
            }
            return RenderResult.success(Fragment.builder()
                .append(renderedTarget.fragment())
                .text(" ")
                .append(Tokens.operator("="))
                .text(" ")
                .append(layout.wrapIfLong(value.fragment()))
                .build());
        }

        @Override
        public RenderResult visitReturn(final Expression.Return node) {
            final var keyword = Tokens.keyword("return");
            final var returned = node.value();
            if (returned == null) {
                return RenderResult.success(keyword);
            }
            final var value = returned.accept(this);
            if (!value.isSuccess()) {
                return failed(node, "return statement", List.of(value.error()));
            }
            return RenderResult.success(Fragment.builder()
                .append(keyword)
                .text(" ")
                .append(layout.wrapIfLong(value.fragment()))
                .build());
        }

        @Override
        public RenderResult visitQuantifier(final Expression.Quantifier node) {
            final var errors = new ArrayList<RenderError>();
            final var source = renderSource(node.generator(), errors);
            final var variable = node.variable();
            final var outer = environment;
            final var inner = outer.pushChild();
            @Nullable RenderResult renderedVariable = null;
            @Nullable RenderResult condition = null;
            try (final var binding = inner.define(variable.identifier(), types.require(variable))) {
                binding.use();
                environment = inner;
                renderedVariable = resolver.resolveName(variable, inner);
                condition = node.condition().accept(this);
            } catch (final DuplicateBindingException e) {
                errors.add(duplicateBinding(variable, e));
            } finally {
                environment = outer;
            }
            if (renderedVariable != null && !renderedVariable.isSuccess()) {
                errors.add(renderedVariable.error());
            }
            if (condition != null && !condition.isSuccess()) {
                errors.add(condition.error());
            }
            if (!errors.isEmpty() || source == null || renderedVariable == null || condition == null) {
                return failed(node, "generator expression", errors);
            }
            final var forClause = Fragment.builder()
                .append(Tokens.keyword("for"))
                .text(" ")
                .append(renderedVariable.fragment())
                .text(" ")
                .append(Tokens.operatorWord("in"))
                .text(" ")
                .append(source)
                .build();
            return RenderResult.success(layout.block(
                Tokens.builtin(node.quantifierKind().functionName()),
                List.of(condition.fragment(), forClause)
            ));
        }

        private @Nullable Fragment renderSource(final Expression.Generator generator, final List<RenderError> errors) {
            if (generator instanceof Expression.ForEach forEach) {
                final var collection = forEach.collection().accept(this);
                if (!collection.isSuccess()) {
                    errors.add(collection.error());
                    return null;
                }
                return layout.inSlot(forEach.collection(), Slot.QUANTIFIER_SOURCE, collection.fragment());
            }
            if (generator instanceof Expression.ForRange range) {
                final var bounds = render(List.of(range.start(), range.end()));
                if (bounds.failed()) {
                    errors.addAll(bounds.errors());
                    return null;
                }
                return layout.block(Tokens.builtin(rangeFunction), List.of(
                    Fragment.builder().append(bounds.get(0)).append(Tokens.punctuation(",")).build(),
                    bounds.get(1)
                ));
            }
            throw new UnreachableCodeReachedError("Unknown generator " + generator);
        }

        private RenderError duplicateBinding(final Expression.Name name, final DuplicateBindingException exception) {
            return RenderError.of(
                name,
                RenderError.Kind.DUPLICATE_BINDING,
                "The name '" + exception.identifier() + "' is already defined in this scope"
            );
        }

        private Environment environment;
    }

    private static final String lengthFunction = "len";
    private static final String matchFunction = "match";
    private static final String rangeFunction = "range";
}
