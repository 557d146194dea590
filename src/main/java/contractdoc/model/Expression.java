// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.model;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of a parsed contract expression.
 * <p>
 * Nodes are immutable and own their children; the tree never shares a node between two parents. Type annotations
 * are attached from the outside through a {@link TypeMap}, which is keyed by node identity, so two structurally equal
 * nodes are still distinct occurrences.
 * <p>
 * Consumers dispatch through {@link Visitor}, so that adding a node kind is a compile-time obligation for every
 * consumer.
 */
public sealed interface Expression {
    /**
     * Retrieves the kind of this node.
     */
    NodeKind kind();

    /**
     * Calls the method of the visitor corresponding to the kind of this node.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * A bare identifier.
     */
    record Name(String identifier) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.NAME;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * Access of a property, method, or enumeration literal: {@code instance.name}.
     */
    record Member(Expression instance, String name) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.MEMBER;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }

    /**
     * Subscript: {@code collection[index]}.
     */
    record Index(Expression collection, Expression index) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.INDEX;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    record Comparison(Expression left, ComparisonOperator operator, Expression right) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.COMPARISON;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * Membership test: {@code member in container}.
     */
    record IsIn(Expression member, Expression container) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.IS_IN;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIsIn(this);
        }
    }

    /**
     * {@code antecedent} implies {@code consequent}.
     */
    record Implication(Expression antecedent, Expression consequent) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.IMPLICATION;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitImplication(this);
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.NOT;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    /**
     * Conjunction of one or more values.
     */
    record And(List<Expression> values) implements Expression {
        public And {
            values = requireNonEmpty(values, "conjunction");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.AND;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    /**
     * Disjunction of one or more values.
     */
    record Or(List<Expression> values) implements Expression {
        public Or {
            values = requireNonEmpty(values, "disjunction");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.OR;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Add(Expression left, Expression right) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.ADD;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAdd(this);
        }
    }

    record Subtract(Expression left, Expression right) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.SUBTRACT;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitSubtract(this);
        }
    }

    /**
     * Call of a verification function or a built-in function.
     */
    record FunctionCall(Name name, List<Expression> arguments) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_CALL;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    record MethodCall(Member member, List<Expression> arguments) implements Expression {
        public MethodCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.METHOD_CALL;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitMethodCall(this);
        }
    }

    /**
     * A literal value.
     */
    record Constant(Value value) implements Expression {
        public static Constant of(final boolean value) {
            return new Constant(new BooleanValue(value));
        }

        public static Constant of(final long value) {
            return new Constant(new IntegerValue(BigInteger.valueOf(value)));
        }

        public static Constant of(final double value) {
            return new Constant(new FloatValue(value));
        }

        public static Constant of(final String value) {
            return new Constant(new StringValue(value));
        }

        public static Constant ofBytes(final byte[] value) {
            return new Constant(new BytesValue(value));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONSTANT;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        /**
         * The value of a constant.
         */
        public sealed interface Value permits BooleanValue, IntegerValue, FloatValue, StringValue, BytesValue {
        }

        public record BooleanValue(boolean value) implements Value {
        }

        public record IntegerValue(BigInteger value) implements Value {
        }

        public record FloatValue(double value) implements Value {
        }

        public record StringValue(String value) implements Value {
        }

        /**
         * A byte sequence. The array is copied on the way in and on the way out.
         */
        public record BytesValue(byte[] value) implements Value {
            public BytesValue {
                value = value.clone();
            }

            @Override
            public byte[] value() {
                return value.clone();
            }

            public int length() {
                return value.length;
            }

            public byte get(final int index) {
                return value[index];
            }

            @Override
            public boolean equals(final @Nullable Object other) {
                return other instanceof BytesValue bytes && Arrays.equals(value, bytes.value);
            }

            @Override
            public int hashCode() {
                return Arrays.hashCode(value);
            }

            @Override
            public String toString() {
                return "BytesValue[" + HexFormat.of().formatHex(value) + ']';
            }
        }
    }

    /**
     * An interpolated string: literal segments alternating with interpolated expressions.
     */
    record JoinedString(List<Segment> segments) implements Expression {
        public JoinedString {
            segments = List.copyOf(segments);
        }

        /**
         * Returns {@code true} iff at least one segment is an interpolation.
         */
        public boolean hasInterpolations() {
            return segments.stream().anyMatch(Interpolation.class::isInstance);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.JOINED_STRING;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitJoinedString(this);
        }

        public sealed interface Segment permits Literal, Interpolation {
        }

        public record Literal(String text) implements Segment {
        }

        public record Interpolation(Expression value) implements Segment {
        }
    }

    record IsNone(Expression value) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.IS_NONE;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIsNone(this);
        }
    }

    record IsNotNone(Expression value) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.IS_NOT_NONE;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIsNotNone(this);
        }
    }

    /**
     * {@code target = value}. The first assignment to an unbound name defines it.
     */
    record Assignment(Name target, Expression value) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGNMENT;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * A return statement, with or without a value.
     */
    record Return(@Nullable Expression value) implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.RETURN;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * {@code any(condition for variable in source)} or its {@code all} counterpart.
     */
    record Quantifier(QuantifierKind quantifierKind, Name variable, Generator generator, Expression condition)
        implements Expression {
        @Override
        public NodeKind kind() {
            return NodeKind.QUANTIFIER;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitQuantifier(this);
        }
    }

    enum QuantifierKind {
        ANY("any"),
        ALL("all");

        QuantifierKind(final String functionName) {
            this.functionName = functionName;
        }

        /**
         * Retrieves the name of the built-in function this quantifier is written with.
         */
        public String functionName() {
            return functionName;
        }

        private final String functionName;
    }

    /**
     * The source of a quantifier's variable.
     */
    sealed interface Generator permits ForEach, ForRange {
    }

    /**
     * Iteration over the elements of a collection.
     */
    record ForEach(Expression collection) implements Generator {
    }

    /**
     * Iteration over the half-open numeric range {@code [start, end)}.
     */
    record ForRange(Expression start, Expression end) implements Generator {
    }

    /**
     * An exhaustive visitor over expression nodes.
     */
    interface Visitor<R> {
        R visitName(Name node);

        R visitMember(Member node);

        R visitIndex(Index node);

        R visitComparison(Comparison node);

        R visitIsIn(IsIn node);

        R visitImplication(Implication node);

        R visitNot(Not node);

        R visitAnd(And node);

        R visitOr(Or node);

        R visitAdd(Add node);

        R visitSubtract(Subtract node);

        R visitFunctionCall(FunctionCall node);

        R visitMethodCall(MethodCall node);

        R visitConstant(Constant node);

        R visitJoinedString(JoinedString node);

        R visitIsNone(IsNone node);

        R visitIsNotNone(IsNotNone node);

        R visitAssignment(Assignment node);

        R visitReturn(Return node);

        R visitQuantifier(Quantifier node);
    }

    private static List<Expression> requireNonEmpty(final List<Expression> values, final String construct) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A " + construct + " needs at least one value");
        }
        return List.copyOf(values);
    }
}
