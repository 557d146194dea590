// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.test;

import java.util.List;
import contractdoc.model.ComparisonOperator;
import contractdoc.model.EntityRef;
import contractdoc.model.Expression;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.TypeMap;
import contractdoc.naming.VerbatimNaming;
import contractdoc.transpiler.DuplicateBindingException;
import contractdoc.transpiler.Environment;
import contractdoc.transpiler.LayoutSettings;
import contractdoc.transpiler.NameResolver;
import contractdoc.transpiler.RenderError;
import contractdoc.transpiler.Transpiler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class TranspilerTest {
    @Test
    void memberOfSelfLinksToProperty() throws DuplicateBindingException {
        final var self = new Expression.Name("self");
        final var types = TypeMap.builder().put(self, TypeAnnotation.our("Referable")).build();
        final var result = invariantTranspiler("Referable", types)
            .transpile(new Expression.Member(self, "id_short"), selfEnvironment("Referable"));
        assertThat(result.fragment().toHtml()).isEqualTo(
            "<span class=\"bp\">self</span><span class=\"o\">.</span><a href=\"Referable.html#id_short\">id_short</a>"
        );
        assertThat(result.fragment().plainText()).isEqualTo("self.id_short");
        assertThat(result.fragment().references()).containsExactly(EntityRef.ofProperty("Referable", "id_short"));
    }

    @Test
    void negatedConjunctionIsParenthesizedOnce() throws DuplicateBindingException {
        final var node = new Expression.Not(new Expression.And(List.of(
            new Expression.Name("a"),
            new Expression.Name("b")
        )));
        final var result = functionTranspiler(TypeMap.builder().build())
            .transpile(node, environment(TypeAnnotation.bool(), "a", "b"));
        assertThat(result.fragment().plainText()).isEqualTo("not (\n    a\n    and b\n)");
        assertThat(result.fragment().toHtml()).startsWith(
            "<span class=\"ow\">not</span> <span class=\"p\">(</span>\n    <span class=\"nv\">a</span>\n"
                + "    <span class=\"ow\">and</span> <span class=\"nv\">b</span>\n<span class=\"p\">)</span>"
        );
    }

    @Test
    void quantifierRendersSourceInOuterScope() throws DuplicateBindingException {
        final var self = new Expression.Name("self");
        final var variable = new Expression.Name("x");
        final var variableUse = new Expression.Name("x");
        final var types = TypeMap.builder()
            .put(self, TypeAnnotation.our("Submodel"))
            .put(variable, TypeAnnotation.our("Referable"))
            .put(variableUse, TypeAnnotation.our("Referable"))
            .build();
        final var node = new Expression.Quantifier(
            Expression.QuantifierKind.ALL,
            variable,
            new Expression.ForEach(new Expression.Member(self, "submodel_elements")),
            new Expression.IsNotNone(new Expression.Member(variableUse, "id_short"))
        );
        final var result = invariantTranspiler("Submodel", types).transpile(node, selfEnvironment("Submodel"));
        assertThat(result.fragment().plainText())
            .isEqualTo("all(\n    x.id_short is not None\n    for x in self.submodel_elements\n)");
        assertThat(result.fragment().references()).containsExactlyInAnyOrder(
            EntityRef.ofProperty("Submodel", "submodel_elements"),
            EntityRef.ofProperty("Referable", "id_short")
        );
    }

    @Test
    void quantifierVariableIsNotVisibleToSiblings() throws DuplicateBindingException {
        final var self = new Expression.Name("self");
        final var variable = new Expression.Name("x");
        final var variableUse = new Expression.Name("x");
        final var sibling = new Expression.Name("x");
        final var types = TypeMap.builder()
            .put(self, TypeAnnotation.our("Submodel"))
            .put(variable, TypeAnnotation.our("Referable"))
            .put(variableUse, TypeAnnotation.our("Referable"))
            .build();
        final var node = new Expression.And(List.of(
            new Expression.Quantifier(
                Expression.QuantifierKind.ALL,
                variable,
                new Expression.ForEach(new Expression.Member(self, "submodel_elements")),
                new Expression.IsNotNone(new Expression.Member(variableUse, "id_short"))
            ),
            sibling
        ));
        final var environment = selfEnvironment("Submodel");
        final var before = environment.snapshot();
        final var result = invariantTranspiler("Submodel", types).transpile(node, environment);
        assertThat(result.isSuccess()).isFalse();
        final var error = result.error();
        assertThat(error.kind()).isEqualTo(RenderError.Kind.AGGREGATE);
        assertThat(error.message()).isEqualTo("Failed to transpile the conjunction");
        assertThat(error.causes()).hasSize(1);
        assertThat(error.causes().get(0).kind()).isEqualTo(RenderError.Kind.UNRESOLVED_IDENTIFIER);
        assertThat(error.causes().get(0).node()).isSameAs(sibling);
        assertThat(environment.snapshot()).isEqualTo(before);
    }

    @Test
    void rangeQuantifierRendersRangeAsBlock() throws DuplicateBindingException {
        final var variable = new Expression.Name("i");
        final var len = new Expression.Name("len");
        final var types = TypeMap.builder()
            .put(variable, TypeAnnotation.integer())
            .put(len, new TypeAnnotation.BuiltinType("len"))
            .build();
        final var node = new Expression.Quantifier(
            Expression.QuantifierKind.ANY,
            variable,
            new Expression.ForRange(
                Expression.Constant.of(0),
                new Expression.FunctionCall(len, List.of(new Expression.Name("text")))
            ),
            new Expression.Comparison(
                new Expression.Index(new Expression.Name("text"), new Expression.Name("i")),
                ComparisonOperator.EQUAL,
                Expression.Constant.of("a")
            )
        );
        final var result = functionTranspiler(types).transpile(node, environment(TypeAnnotation.string(), "text"));
        assertThat(result.fragment().plainText()).isEqualTo("""
            any(
                text[i] == "a"
                for i in range(
                    0,
                    len(text)
                )
            )""");
    }

    @Test
    void failingQuantifierLeavesEnvironmentBalanced() throws DuplicateBindingException {
        final var variable = new Expression.Name("x");
        final var types = TypeMap.builder().put(variable, TypeAnnotation.string()).build();
        final var node = new Expression.Quantifier(
            Expression.QuantifierKind.ANY,
            variable,
            new Expression.ForEach(new Expression.Name("text")),
            new Expression.Comparison(new Expression.Name("x"), ComparisonOperator.EQUAL, new Expression.Name("nope"))
        );
        final var environment = environment(TypeAnnotation.string(), "text");
        final var before = environment.snapshot();
        final var result = functionTranspiler(types).transpile(node, environment);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().message()).isEqualTo("Failed to transpile the generator expression");
        assertThat(environment.snapshot()).isEqualTo(before);
        assertThat(environment.lookup("x")).isNull();
    }

    @Test
    void functionCallWrapsWhenArgumentsExceedBudget() throws DuplicateBindingException {
        final var transpiler = invariantTranspiler("Referable", calleeTypes());
        final var environment = selfEnvironment("Referable");

        final var inline = transpiler.transpile(call(
            Expression.Constant.of("a"),
            Expression.Constant.of("b"),
            Expression.Constant.of("c")
        ), environment);
        assertThat(inline.fragment().plainText()).isEqualTo("is_valid_combination(\"a\", \"b\", \"c\")");
        assertThat(inline.fragment().toHtml()).startsWith(
            "<span class=\"nf\"><a href=\"is_valid_combination.html\">is_valid_combination</a></span>"
                + "<span class=\"p\">(</span>"
        );

        final var wrapped = transpiler.transpile(call(
            Expression.Constant.of("first_argument_value"),
            Expression.Constant.of("second_argument_value"),
            Expression.Constant.of("third")
        ), environment);
        assertThat(wrapped.fragment().plainText()).isEqualTo("""
            is_valid_combination(
                "first_argument_value",
                "second_argument_value",
                "third"
            )""");
    }

    @Test
    void lineBudgetIsInclusive() throws DuplicateBindingException {
        final var transpiler = invariantTranspiler("Referable", calleeTypes());
        final var environment = selfEnvironment("Referable");
        final var fits = transpiler.transpile(call(Expression.Constant.of("x".repeat(48))), environment);
        assertThat(fits.fragment().isMultiLine()).isFalse();
        final var overflows = transpiler.transpile(call(Expression.Constant.of("x".repeat(49))), environment);
        assertThat(overflows.fragment().isMultiLine()).isTrue();
    }

    @Test
    void undefinedMemberIsReportedDirectly() throws DuplicateBindingException {
        final var self = new Expression.Name("self");
        final var types = TypeMap.builder().put(self, TypeAnnotation.our("Referable")).build();
        final var node = new Expression.Member(self, "undefined_field");
        final var result = invariantTranspiler("Referable", types).transpile(node, selfEnvironment("Referable"));
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo(RenderError.of(
            node,
            RenderError.Kind.UNRESOLVABLE_MEMBER,
            "The property or method 'undefined_field' has not been defined in the class 'Referable'"
        ));
    }

    @Test
    void failedInstanceAggregatesMemberErrors() throws DuplicateBindingException {
        final var instance = new Expression.Name("nope");
        final var types = TypeMap.builder().put(instance, TypeAnnotation.our("Referable")).build();
        final var transpiler = invariantTranspiler("Referable", types);

        final var onlyInstance = transpiler.transpile(new Expression.Member(instance, "id_short"), Environment.root());
        assertThat(onlyInstance.error().message()).isEqualTo("Failed to transpile the member access");
        assertThat(onlyInstance.error().causes())
            .extracting(RenderError::kind)
            .containsExactly(RenderError.Kind.UNRESOLVED_IDENTIFIER);

        final var both = transpiler.transpile(new Expression.Member(instance, "undefined_field"), Environment.root());
        assertThat(both.error().causes())
            .extracting(RenderError::kind)
            .containsExactly(RenderError.Kind.UNRESOLVED_IDENTIFIER, RenderError.Kind.UNRESOLVABLE_MEMBER);
    }

    @Test
    void errorsOfAllChildrenAreCollected() {
        final var left = new Expression.Name("first_unknown");
        final var right = new Expression.Name("second_unknown");
        final var node = new Expression.Comparison(left, ComparisonOperator.NOT_EQUAL, right);
        final var result = functionTranspiler(TypeMap.builder().build()).transpile(node, Environment.root());
        final var error = result.error();
        assertThat(error.node()).isSameAs(node);
        assertThat(error.message()).isEqualTo("Failed to transpile the comparison");
        assertThat(error.causes()).hasSize(2);
        assertThat(error.causes().get(0).node()).isSameAs(left);
        assertThat(error.causes().get(1).node()).isSameAs(right);
        assertThat(error.format()).isEqualTo("""
            Failed to transpile the comparison
              The name 'first_unknown' in the verification function 'has_content' is neither a local variable \
            nor a global constant, verification function or enumeration
              The name 'second_unknown' in the verification function 'has_content' is neither a local variable \
            nor a global constant, verification function or enumeration""");
    }

    @Test
    void implicationRendersAsNegatedDisjunction() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var referable = model.requireClass("Referable");
        final var body = referable.invariants().get(0).body();
        final var result = invariantTranspiler("Referable", model.types())
            .transpile(body, selfEnvironment("Referable"));
        assertThat(result.fragment().plainText())
            .isEqualTo("not (self.id_short is not None)\nor is_id_short(self.id_short)");
        assertThat(result.fragment().references()).containsExactlyInAnyOrder(
            EntityRef.ofProperty("Referable", "id_short"),
            EntityRef.ofFunction("is_id_short")
        );
    }

    @Test
    void everyEntityMentionIsLinked() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var submodel = model.requireClass("Submodel");
        final var body = submodel.invariants().get(0).body();
        final var result = invariantTranspiler("Submodel", model.types()).transpile(body, selfEnvironment("Submodel"));
        assertThat(result.fragment().plainText())
            .isEqualTo("not (self.kind is not None)\nor (self.kind == ModellingKind.Instance)");
        assertThat(result.fragment().references()).containsExactlyInAnyOrder(
            EntityRef.ofProperty("Submodel", "kind"),
            EntityRef.ofEnumeration("ModellingKind"),
            EntityRef.ofLiteral("ModellingKind", "Instance")
        );
        assertThat(result.fragment().toHtml())
            .contains("<a href=\"Submodel.html#kind\">kind</a>")
            .contains("<span class=\"nc\"><a href=\"ModellingKind.html\">ModellingKind</a></span>")
            .contains("<a href=\"ModellingKind.html#Instance\">Instance</a>");
    }

    @Test
    void transpilationIsDeterministic() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var body = model.requireClass("Referable").invariants().get(1).body();
        final var transpiler = invariantTranspiler("Referable", model.types());
        final var first = transpiler.transpile(body, selfEnvironment("Referable"));
        final var second = transpiler.transpile(body, selfEnvironment("Referable"));
        assertThat(first.fragment().toHtml()).isEqualTo(second.fragment().toHtml());
        assertThat(first.fragment().references()).containsExactlyElementsOf(second.fragment().references());
        assertThat(first.fragment().plainText())
            .isEqualTo("(\n    (self.category is None)\n    or (self.category in VALID_CATEGORIES)\n)");
    }

    @Test
    void singleValueJunctionIsBare() throws DuplicateBindingException {
        final var node = new Expression.Or(List.of(new Expression.Name("a")));
        final var result = functionTranspiler(TypeMap.builder().build())
            .transpile(node, environment(TypeAnnotation.bool(), "a"));
        assertThat(result.fragment().plainText()).isEqualTo("a");
    }

    @Test
    void nestedJunctionsIndentTheirBlocks() throws DuplicateBindingException {
        final var node = new Expression.And(List.of(
            new Expression.Comparison(new Expression.Name("a"), ComparisonOperator.EQUAL, new Expression.Name("b")),
            new Expression.Or(List.of(new Expression.Name("c"), new Expression.Name("d"))),
            new Expression.Not(new Expression.Name("c"))
        ));
        final var result = functionTranspiler(TypeMap.builder().build())
            .transpile(node, environment(TypeAnnotation.bool(), "a", "b", "c", "d"));
        assertThat(result.fragment().plainText()).isEqualTo("""
            (
                a == b
                and (
                    c
                    or d
                )
                and (not c)
            )""");
    }

    @Test
    void methodCallRendersMemberAndArguments() throws DuplicateBindingException {
        final var self = new Expression.Name("self");
        final var types = TypeMap.builder().put(self, TypeAnnotation.our("Submodel")).build();
        final var node = new Expression.MethodCall(new Expression.Member(self, "has_category"), List.of());
        final var result = invariantTranspiler("Submodel", types).transpile(node, selfEnvironment("Submodel"));
        assertThat(result.fragment().plainText()).isEqualTo("self.has_category()");
        assertThat(result.fragment().references()).containsExactly(EntityRef.ofMethod("Referable", "has_category"));
    }

    @Test
    void statementsShareBodyScope() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var function = model.requireFunction("has_content");
        final var environment = environment(TypeAnnotation.string(), "text");
        final var before = environment.snapshot();
        final var transpiler = new Transpiler(
            NameResolver.forVerificationFunction(model.symbolTable(), VerbatimNaming.instance(), function),
            model.types(),
            LayoutSettings.defaultSettings
        );
        final var results = transpiler.transpileStatements(function.body(), environment);
        assertThat(results).hasSize(2);
        assertThat(results.get(0).fragment().plainText()).isEqualTo("length = len(text)");
        assertThat(results.get(1).fragment().plainText()).isEqualTo("return length > 0");
        assertThat(results.get(0).fragment().toHtml()).startsWith(
            "<span class=\"nv\">length</span> <span class=\"o\">=</span> <span class=\"nb\">len</span>"
        );
        assertThat(environment.snapshot()).isEqualTo(before);
        assertThat(environment.lookup("length")).isNull();
    }

    @Test
    void longAssignedValueIsWrapped() {
        final var value = Expression.Constant.of("a".repeat(60));
        final var types = TypeMap.builder().put(value, TypeAnnotation.string()).build();
        final var node = new Expression.Assignment(new Expression.Name("pattern"), value);
        final var result = functionTranspiler(types).transpile(node, Environment.root());
        assertThat(result.fragment().plainText()).isEqualTo("pattern = (\n    \"" + "a".repeat(60) + "\"\n)");
    }

    @Test
    void returnWithoutValueIsKeywordOnly() {
        final var result = functionTranspiler(TypeMap.builder().build())
            .transpile(new Expression.Return(null), Environment.root());
        assertThat(result.fragment().toHtml()).isEqualTo("<span class=\"k\">return</span>");
    }

    @Test
    void matchIsAlwaysBrokenIntoLines() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var function = model.requireFunction("is_id_short");
        final var transpiler = new Transpiler(
            NameResolver.forVerificationFunction(model.symbolTable(), VerbatimNaming.instance(), function),
            model.types(),
            LayoutSettings.defaultSettings
        );
        final var results = transpiler.transpileStatements(
            function.body(),
            environment(TypeAnnotation.string(), "text")
        );
        assertThat(results.get(0).fragment().plainText()).isEqualTo("""
            return match(
                "^[a-zA-Z][a-zA-Z0-9_]*$",
                text
            ) is not None""");
    }

    @Test
    void unsupportedBuiltinIsReported() throws DuplicateBindingException {
        final var sorted = new Expression.Name("sorted");
        final var types = TypeMap.builder().put(sorted, new TypeAnnotation.BuiltinType("sorted")).build();
        final var node = new Expression.FunctionCall(sorted, List.of(new Expression.Name("text")));
        final var result = functionTranspiler(types).transpile(node, environment(TypeAnnotation.string(), "text"));
        assertThat(result.error()).isEqualTo(RenderError.of(
            node,
            RenderError.Kind.UNSUPPORTED_BUILTIN,
            "The handling of the built-in function 'sorted' has not been implemented"
        ));
    }

    @Test
    void callingNonFunctionIsReported() throws DuplicateBindingException {
        final var callee = new Expression.Name("count");
        final var types = TypeMap.builder().put(callee, TypeAnnotation.integer()).build();
        final var node = new Expression.FunctionCall(callee, List.of());
        final var result = functionTranspiler(types).transpile(node, environment(TypeAnnotation.integer(), "count"));
        assertThat(result.error().kind()).isEqualTo(RenderError.Kind.NOT_A_FUNCTION);
        assertThat(result.error().message())
            .isEqualTo("Expected the name to refer to a function, but its inferred type was int");
    }

    static Transpiler invariantTranspiler(final String owner, final TypeMap types) {
        final var model = ModelFixture.create();
        final var resolver = NameResolver.forInvariant(
            model.symbolTable(),
            VerbatimNaming.instance(),
            model.requireClass(owner)
        );
        return new Transpiler(resolver, types, LayoutSettings.defaultSettings);
    }

    static Transpiler functionTranspiler(final TypeMap types) {
        final var model = ModelFixture.create();
        final var resolver = NameResolver.forVerificationFunction(
            model.symbolTable(),
            VerbatimNaming.instance(),
            model.requireFunction("has_content")
        );
        return new Transpiler(resolver, types, LayoutSettings.defaultSettings);
    }

    static Environment selfEnvironment(final String owner) throws DuplicateBindingException {
        return environment(TypeAnnotation.our(owner), "self");
    }

    static Environment environment(final TypeAnnotation type, final String... identifiers)
        throws DuplicateBindingException {
        final var result = Environment.root();
        for (final var identifier : identifiers) {
            result.define(identifier, type).use();
        }
        return result;
    }

    private static TypeMap calleeTypes() {
        return TypeMap.builder()
            .put(combinationCallee, new TypeAnnotation.VerificationType("is_valid_combination"))
            .build();
    }

    private static Expression.FunctionCall call(final Expression... arguments) {
        return new Expression.FunctionCall(combinationCallee, List.of(arguments));
    }

    private static final Expression.Name combinationCallee = new Expression.Name("is_valid_combination");
}
