// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.test;

import java.util.List;
import contractdoc.model.Argument;
import contractdoc.model.ClassType;
import contractdoc.model.ComparisonOperator;
import contractdoc.model.ConstrainedPrimitive;
import contractdoc.model.Enumeration;
import contractdoc.model.EnumerationLiteral;
import contractdoc.model.Expression;
import contractdoc.model.GlobalConstant;
import contractdoc.model.Invariant;
import contractdoc.model.Method;
import contractdoc.model.Property;
import contractdoc.model.SimpleSymbolTable;
import contractdoc.model.SymbolTable;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.TypeMap;
import contractdoc.model.VerificationFunction;

/**
 * A small model in the shape of an asset administration shell meta-model, with the types its contracts need.
 */
record ModelFixture(SymbolTable symbolTable, TypeMap types) {
    static ModelFixture create() {
        return create(false);
    }

    /**
     * Builds the model.
     *
     * @param withBrokenClass If {@code true}, the model also has a class whose invariant mentions an undefined name.
     */
    static ModelFixture create(final boolean withBrokenClass) {
        final var types = TypeMap.builder();
        final var builder = SimpleSymbolTable.builder();

        builder.add(new Enumeration(
            "ModellingKind",
            "Enumeration for denoting whether an element is a template.",
            List.of(
                new EnumerationLiteral("Template", "Template", "Element which specifies the common attributes."),
                new EnumerationLiteral("Instance", "Instance", "Concrete, clearly identifiable component.")
            )
        ));

        final var lengthOfSelf = new Expression.Name("len");
        types.put(lengthOfSelf, new TypeAnnotation.BuiltinType("len"));
        builder.add(new ConstrainedPrimitive(
            "Non_empty_string",
            "A string with at least one character.",
            TypeAnnotation.PrimitiveKind.STR,
            List.of(),
            List.of(new Invariant("Check that the string is not empty.", new Expression.Comparison(
                new Expression.FunctionCall(lengthOfSelf, List.of(new Expression.Name("self"))),
                ComparisonOperator.GREATER_THAN_OR_EQUAL,
                Expression.Constant.of(1)
            )))
        ));

        final var matchesDateTime = new Expression.Name("matches_xs_date_time");
        types.put(matchesDateTime, new TypeAnnotation.VerificationType("matches_xs_date_time"));
        builder.add(new ConstrainedPrimitive(
            "Date_time",
            "A timestamp in the xs:dateTime format.",
            TypeAnnotation.PrimitiveKind.STR,
            List.of("Non_empty_string"),
            List.of(new Invariant("The value shall match the xs:dateTime format.", new Expression.FunctionCall(
                matchesDateTime,
                List.of(new Expression.Name("self"))
            )))
        ));

        builder.add(new ClassType(
            "HasExtensions",
            "Element that can be extended by proprietary extensions.",
            List.of(),
            List.of(new Property(
                "extensions",
                TypeAnnotation.optional(TypeAnnotation.list(TypeAnnotation.string())),
                ""
            )),
            List.of(),
            List.of()
        ));

        final var selfIdShort = self(types, "Referable");
        final var selfIdShortArgument = self(types, "Referable");
        final var isIdShort = new Expression.Name("is_id_short");
        types.put(isIdShort, new TypeAnnotation.VerificationType("is_id_short"));
        final var selfCategory = self(types, "Referable");
        final var selfCategoryMember = self(types, "Referable");
        builder.add(new ClassType(
            "Referable",
            "An element that is referable by its short identifier.",
            List.of("HasExtensions"),
            List.of(
                new Property("id_short", TypeAnnotation.optional(TypeAnnotation.string()), "Short identifier."),
                new Property("category", TypeAnnotation.optional(TypeAnnotation.string()), "")
            ),
            List.of(new Method("has_category", List.of(), TypeAnnotation.bool(), "")),
            List.of(
                new Invariant(
                    "ID-short shall only feature letters, digits and underscores.",
                    new Expression.Implication(
                        new Expression.IsNotNone(new Expression.Member(selfIdShort, "id_short")),
                        new Expression.FunctionCall(isIdShort, List.of(
                            new Expression.Member(selfIdShortArgument, "id_short")
                        ))
                    )
                ),
                new Invariant("The category shall be one of the valid categories.", new Expression.Or(List.of(
                    new Expression.IsNone(new Expression.Member(selfCategory, "category")),
                    new Expression.IsIn(
                        new Expression.Member(selfCategoryMember, "category"),
                        new Expression.Name("VALID_CATEGORIES")
                    )
                )))
            )
        ));

        final var selfKind = self(types, "Submodel");
        final var selfKindCompared = self(types, "Submodel");
        final var modellingKind = new Expression.Name("ModellingKind");
        types.put(modellingKind, TypeAnnotation.our("ModellingKind"));
        final var selfElements = self(types, "Submodel");
        final var element = new Expression.Name("element");
        final var elementUse = new Expression.Name("element");
        types.put(element, TypeAnnotation.our("Referable"));
        types.put(elementUse, TypeAnnotation.our("Referable"));
        builder.add(new ClassType(
            "Submodel",
            "",
            List.of("Referable"),
            List.of(
                new Property("kind", TypeAnnotation.optional(TypeAnnotation.our("ModellingKind")), ""),
                new Property("last_update", TypeAnnotation.optional(TypeAnnotation.our("Date_time")), ""),
                new Property(
                    "submodel_elements",
                    TypeAnnotation.optional(TypeAnnotation.list(TypeAnnotation.our("Referable"))),
                    ""
                )
            ),
            List.of(),
            List.of(
                new Invariant("", new Expression.Implication(
                    new Expression.IsNotNone(new Expression.Member(selfKind, "kind")),
                    new Expression.Comparison(
                        new Expression.Member(selfKindCompared, "kind"),
                        ComparisonOperator.EQUAL,
                        new Expression.Member(modellingKind, "Instance")
                    )
                )),
                new Invariant("All elements shall have a short identifier.", new Expression.Quantifier(
                    Expression.QuantifierKind.ALL,
                    element,
                    new Expression.ForEach(new Expression.Member(selfElements, "submodel_elements")),
                    new Expression.IsNotNone(new Expression.Member(elementUse, "id_short"))
                ))
            )
        ));

        if (withBrokenClass) {
            builder.add(new ClassType("Broken", "", List.of(), List.of(), List.of(), List.of(
                new Invariant("", new Expression.Comparison(
                    new Expression.Name("undefined_thing"),
                    ComparisonOperator.EQUAL,
                    Expression.Constant.of(1)
                ))
            )));
        }

        builder.add(new GlobalConstant(
            "VALID_CATEGORIES",
            TypeAnnotation.list(TypeAnnotation.string()),
            "Categories for data elements."
        ));

        final var match = new Expression.Name("match");
        types.put(match, new TypeAnnotation.BuiltinType("match"));
        builder.add(new VerificationFunction(
            "is_id_short",
            "Check that the text is a valid short identifier.",
            VerificationFunction.Kind.PATTERN,
            List.of(new Argument("text", TypeAnnotation.string())),
            TypeAnnotation.bool(),
            List.of(new Expression.Return(new Expression.IsNotNone(new Expression.FunctionCall(match, List.of(
                Expression.Constant.of("^[a-zA-Z][a-zA-Z0-9_]*$"),
                new Expression.Name("text")
            )))))
        ));

        builder.add(new VerificationFunction(
            "matches_xs_date_time",
            "Check that the text conforms to xs:dateTime.",
            VerificationFunction.Kind.IMPLEMENTATION_SPECIFIC,
            List.of(new Argument("text", TypeAnnotation.string())),
            TypeAnnotation.bool(),
            List.of()
        ));

        builder.add(new VerificationFunction(
            "is_valid_combination",
            "",
            VerificationFunction.Kind.TRANSPILABLE,
            List.of(
                new Argument("category", TypeAnnotation.string()),
                new Argument("kind", TypeAnnotation.our("ModellingKind")),
                new Argument("id_short", TypeAnnotation.string())
            ),
            TypeAnnotation.bool(),
            List.of()
        ));

        final var length = new Expression.Name("length");
        final var len = new Expression.Name("len");
        types.put(len, new TypeAnnotation.BuiltinType("len"));
        final var lengthOfText = new Expression.FunctionCall(len, List.of(new Expression.Name("text")));
        types.put(lengthOfText, TypeAnnotation.integer());
        builder.add(new VerificationFunction(
            "has_content",
            "Check that the text is not empty.",
            VerificationFunction.Kind.TRANSPILABLE,
            List.of(new Argument("text", TypeAnnotation.string())),
            TypeAnnotation.bool(),
            List.of(
                new Expression.Assignment(length, lengthOfText),
                new Expression.Return(new Expression.Comparison(
                    new Expression.Name("length"),
                    ComparisonOperator.GREATER_THAN,
                    Expression.Constant.of(0)
                ))
            )
        ));

        return new ModelFixture(builder.build(), types.build());
    }

    ClassType requireClass(final String name) {
        final var result = symbolTable.findClass(name);
        assert result != null : "No class " + name + " @AssumeAssertion(nullness)";
        return result;
    }

    ConstrainedPrimitive requirePrimitive(final String name) {
        final var result = symbolTable.findConstrainedPrimitive(name);
        assert result != null : "No constrained primitive " + name + " @AssumeAssertion(nullness)";
        return result;
    }

    VerificationFunction requireFunction(final String name) {
        final var result = symbolTable.findVerificationFunction(name);
        assert result != null : "No verification function " + name + " @AssumeAssertion(nullness)";
        return result;
    }

    private static Expression.Name self(final TypeMap.Builder types, final String className) {
        final var result = new Expression.Name("self");
        types.put(result, TypeAnnotation.our(className));
        return result;
    }
}
