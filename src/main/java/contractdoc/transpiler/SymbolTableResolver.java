// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import contractdoc.model.EntityRef;
import contractdoc.model.Expression;
import contractdoc.model.SymbolTable;
import contractdoc.model.TypeAnnotation;
import contractdoc.naming.NamingScheme;

final class SymbolTableResolver implements NameResolver {
    SymbolTableResolver(final SymbolTable symbolTable, final NamingScheme naming, final String construct) {
        this.symbolTable = symbolTable;
        this.naming = naming;
        this.construct = construct;
    }

    @Override
    public RenderResult resolveName(final Expression.Name name, final Environment environment) {
        final var identifier = name.identifier();
        if (environment.lookup(identifier) != null) {
            return RenderResult.success(selfIdentifier.equals(identifier)
                ? Tokens.pseudoName(identifier)
                : Tokens.variable(naming.variableName(identifier)));
        }
        if (symbolTable.findConstant(identifier) != null) {
            return RenderResult.success(link(Tokens.constantClass, EntityRef.ofConstant(identifier)));
        }
        if (symbolTable.findVerificationFunction(identifier) != null) {
            return RenderResult.success(link(Tokens.functionClass, EntityRef.ofFunction(identifier)));
        }
        if (symbolTable.findEnumeration(identifier) != null) {
            return RenderResult.success(link(Tokens.typeClass, EntityRef.ofEnumeration(identifier)));
        }
        return RenderResult.failure(RenderError.of(
            name,
            RenderError.Kind.UNRESOLVED_IDENTIFIER,
            "The name '" + identifier + "' in " + construct
                + " is neither a local variable nor a global constant, verification function or enumeration"
        ));
    }

    @Override
    public RenderResult resolveMember(final Expression.Member member, final TypeAnnotation instanceType) {
        final var memberName = member.name();
        final var type = instanceType.beneathOptional();
        if (type instanceof TypeAnnotation.OurType ourType) {
            final var enumeration = symbolTable.findEnumeration(ourType.name());
            if (enumeration != null) {
                if (enumeration.findLiteral(memberName) == null) {
                    return unresolvable(member, "The literal '" + memberName
                        + "' has not been defined in the enumeration '" + enumeration.name() + '\'');
                }
                return RenderResult.success(memberLink(EntityRef.ofLiteral(enumeration.name(), memberName)));
            }
            final var classType = symbolTable.findClass(ourType.name());
            if (classType != null) {
                final var declaringClass = symbolTable.findDeclaringClass(classType, memberName);
                if (declaringClass == null) {
                    return unresolvable(member, "The property or method '" + memberName
                        + "' has not been defined in the class '" + classType.name() + '\'');
                }
                final var entity = (declaringClass.findProperty(memberName) != null)
                    ? EntityRef.ofProperty(declaringClass.name(), memberName)
                    : EntityRef.ofMethod(declaringClass.name(), memberName);
                return RenderResult.success(memberLink(entity));
            }
        }
        return unresolvable(member, "The member '" + memberName + "' cannot be resolved in the type "
            + instanceType.describe());
    }

    private Fragment link(final String tokenClass, final EntityRef entity) {
        return Tokens.link(tokenClass, naming.displayName(entity), naming.href(entity), entity);
    }

    private Fragment memberLink(final EntityRef entity) {
        return Tokens.memberLink(naming.displayName(entity), naming.href(entity), entity);
    }

    private static RenderResult unresolvable(final Expression.Member member, final String message) {
        return RenderResult.failure(RenderError.of(member, RenderError.Kind.UNRESOLVABLE_MEMBER, message));
    }

    private static final String selfIdentifier = "self";

    private final SymbolTable symbolTable;
    private final NamingScheme naming;
    private final String construct;
}
