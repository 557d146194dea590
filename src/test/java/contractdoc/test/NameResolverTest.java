// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.test;

import contractdoc.model.EntityRef;
import contractdoc.model.Expression;
import contractdoc.model.TypeAnnotation;
import contractdoc.naming.CamelCaseNaming;
import contractdoc.naming.VerbatimNaming;
import contractdoc.transpiler.DuplicateBindingException;
import contractdoc.transpiler.Environment;
import contractdoc.transpiler.NameResolver;
import contractdoc.transpiler.RenderError;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class NameResolverTest {
    @Test
    void selfRendersAsPseudoName() throws DuplicateBindingException {
        final var environment = Environment.root();
        environment.define("self", TypeAnnotation.our("Referable")).use();
        final var result = resolver().resolveName(new Expression.Name("self"), environment);
        assertThat(result.fragment().toHtml()).isEqualTo("<span class=\"bp\">self</span>");
        assertThat(result.fragment().references()).isEmpty();
    }

    @Test
    void localVariableRendersUnlinked() throws DuplicateBindingException {
        final var environment = Environment.root();
        environment.define("id_short", TypeAnnotation.string()).use();
        final var result = resolver().resolveName(new Expression.Name("id_short"), environment);
        assertThat(result.fragment().toHtml()).isEqualTo("<span class=\"nv\">id_short</span>");
    }

    @Test
    void localVariableShadowsGlobalConstant() throws DuplicateBindingException {
        final var environment = Environment.root();
        environment.define("VALID_CATEGORIES", TypeAnnotation.string()).use();
        final var result = resolver().resolveName(new Expression.Name("VALID_CATEGORIES"), environment);
        assertThat(result.fragment().toHtml()).isEqualTo("<span class=\"nv\">VALID_CATEGORIES</span>");
        assertThat(result.fragment().references()).isEmpty();
    }

    @Test
    void globalsRenderAsLinks() {
        final var environment = Environment.root();
        final var resolver = resolver();

        final var constant = resolver.resolveName(new Expression.Name("VALID_CATEGORIES"), environment);
        assertThat(constant.fragment().toHtml())
            .isEqualTo("<span class=\"no\"><a href=\"VALID_CATEGORIES.html\">VALID_CATEGORIES</a></span>");
        assertThat(constant.fragment().references()).containsExactly(EntityRef.ofConstant("VALID_CATEGORIES"));

        final var function = resolver.resolveName(new Expression.Name("is_id_short"), environment);
        assertThat(function.fragment().toHtml())
            .isEqualTo("<span class=\"nf\"><a href=\"is_id_short.html\">is_id_short</a></span>");
        assertThat(function.fragment().references()).containsExactly(EntityRef.ofFunction("is_id_short"));

        final var enumeration = resolver.resolveName(new Expression.Name("ModellingKind"), environment);
        assertThat(enumeration.fragment().toHtml())
            .isEqualTo("<span class=\"nc\"><a href=\"ModellingKind.html\">ModellingKind</a></span>");
        assertThat(enumeration.fragment().references()).containsExactly(EntityRef.ofEnumeration("ModellingKind"));
    }

    @Test
    void unknownNameIsUnresolved() {
        final var name = new Expression.Name("nope");
        final var result = resolver().resolveName(name, Environment.root());
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo(RenderError.of(
            name,
            RenderError.Kind.UNRESOLVED_IDENTIFIER,
            "The name 'nope' in the invariant of class Referable is neither a local variable nor a global constant,"
                + " verification function or enumeration"
        ));
    }

    @Test
    void classMembersLinkToDeclaringClass() {
        final var resolver = resolver();
        final var submodel = TypeAnnotation.our("Submodel");

        final var own = resolver.resolveMember(member("kind"), submodel);
        assertThat(own.fragment().toHtml()).isEqualTo("<a href=\"Submodel.html#kind\">kind</a>");
        assertThat(own.fragment().references()).containsExactly(EntityRef.ofProperty("Submodel", "kind"));

        final var inherited = resolver.resolveMember(member("id_short"), TypeAnnotation.optional(submodel));
        assertThat(inherited.fragment().toHtml()).isEqualTo("<a href=\"Referable.html#id_short\">id_short</a>");
        assertThat(inherited.fragment().references()).containsExactly(EntityRef.ofProperty("Referable", "id_short"));

        final var method = resolver.resolveMember(member("has_category"), submodel);
        assertThat(method.fragment().toHtml()).isEqualTo("<a href=\"Referable.html#has_category\">has_category</a>");
        assertThat(method.fragment().references()).containsExactly(EntityRef.ofMethod("Referable", "has_category"));
    }

    @Test
    void enumerationMembersAreLiterals() {
        final var resolver = resolver();
        final var modellingKind = TypeAnnotation.our("ModellingKind");

        final var literal = resolver.resolveMember(member("Instance"), modellingKind);
        assertThat(literal.fragment().toHtml()).isEqualTo("<a href=\"ModellingKind.html#Instance\">Instance</a>");
        assertThat(literal.fragment().references()).containsExactly(EntityRef.ofLiteral("ModellingKind", "Instance"));

        final var missing = resolver.resolveMember(member("Draft"), modellingKind);
        assertThat(missing.error().kind()).isEqualTo(RenderError.Kind.UNRESOLVABLE_MEMBER);
        assertThat(missing.error().message())
            .isEqualTo("The literal 'Draft' has not been defined in the enumeration 'ModellingKind'");
    }

    @Test
    void unknownMembersAreUnresolvable() {
        final var resolver = resolver();

        final var undeclared = resolver.resolveMember(member("undefined_field"), TypeAnnotation.our("Referable"));
        assertThat(undeclared.error().kind()).isEqualTo(RenderError.Kind.UNRESOLVABLE_MEMBER);
        assertThat(undeclared.error().message())
            .isEqualTo("The property or method 'undefined_field' has not been defined in the class 'Referable'");

        final var primitive = resolver.resolveMember(member("upper"), TypeAnnotation.string());
        assertThat(primitive.error().message()).isEqualTo("The member 'upper' cannot be resolved in the type str");

        final var unknownType = resolver.resolveMember(member("x"), TypeAnnotation.our("Nonexistent"));
        assertThat(unknownType.error().kind()).isEqualTo(RenderError.Kind.UNRESOLVABLE_MEMBER);
    }

    @Test
    void namingSchemeAppliesToDisplayedNamesAndLinks() throws DuplicateBindingException {
        final var model = ModelFixture.create();
        final var resolver = NameResolver.forInvariant(
            model.symbolTable(),
            CamelCaseNaming.instance(),
            model.requireClass("Referable")
        );
        final var environment = Environment.root();
        environment.define("submodel_element", TypeAnnotation.our("Referable")).use();

        final var variable = resolver.resolveName(new Expression.Name("submodel_element"), environment);
        assertThat(variable.fragment().toHtml()).isEqualTo("<span class=\"nv\">submodelElement</span>");

        final var function = resolver.resolveName(new Expression.Name("is_id_short"), environment);
        assertThat(function.fragment().toHtml())
            .isEqualTo("<span class=\"nf\"><a href=\"IsIdShort.html\">IsIdShort</a></span>");

        final var property = resolver.resolveMember(member("id_short"), TypeAnnotation.our("Referable"));
        assertThat(property.fragment().toHtml()).isEqualTo("<a href=\"Referable.html#idShort\">idShort</a>");
    }

    private static NameResolver resolver() {
        final var model = ModelFixture.create();
        final var referable = model.requireClass("Referable");
        return NameResolver.forInvariant(model.symbolTable(), VerbatimNaming.instance(), referable);
    }

    private static Expression.Member member(final String name) {
        return new Expression.Member(new Expression.Name("instance"), name);
    }
}
