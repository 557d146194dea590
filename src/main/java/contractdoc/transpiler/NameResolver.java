// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.transpiler;

import contractdoc.model.ClassType;
import contractdoc.model.ConstrainedPrimitive;
import contractdoc.model.Expression;
import contractdoc.model.SymbolTable;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.VerificationFunction;
import contractdoc.naming.NamingScheme;

/**
 * Resolves identifiers and members to rendered tokens, linked to the documentation of what they denote.
 * <p>
 * Resolution is pure: it reads the environment and the symbol table, and renders no children.
 */
public interface NameResolver {
    /**
     * Resolves a bare identifier.
     * <p>
     * Identifiers bound in the environment render as unlinked tokens, {@code self} styled as a pseudo-name and
     * everything else as a variable. Otherwise, global constants, verification functions and enumerations render
     * as links to their pages. Anything else is an {@link RenderError.Kind#UNRESOLVED_IDENTIFIER} error.
     */
    RenderResult resolveName(Expression.Name name, Environment environment);

    /**
     * Resolves the member of a member access, given the inferred type of its instance.
     * <p>
     * An enclosing optional is ignored. Enumeration members must be literals and class members must be declared or
     * inherited properties or methods; either renders as a link to the member's anchor. Anything else is an
     * {@link RenderError.Kind#UNRESOLVABLE_MEMBER} error.
     */
    RenderResult resolveMember(Expression.Member member, TypeAnnotation instanceType);

    /**
     * Returns a resolver for the invariants of the given class.
     */
    static NameResolver forInvariant(
        final SymbolTable symbolTable,
        final NamingScheme naming,
        final ClassType owner
    ) {
        return new SymbolTableResolver(symbolTable, naming, "the invariant of class " + owner.name());
    }

    /**
     * Returns a resolver for the invariants of the given constrained primitive.
     */
    static NameResolver forInvariant(
        final SymbolTable symbolTable,
        final NamingScheme naming,
        final ConstrainedPrimitive owner
    ) {
        return new SymbolTableResolver(symbolTable, naming, "the invariant of constrained primitive " + owner.name());
    }

    /**
     * Returns a resolver for the body of the given verification function.
     */
    static NameResolver forVerificationFunction(
        final SymbolTable symbolTable,
        final NamingScheme naming,
        final VerificationFunction function
    ) {
        return new SymbolTableResolver(symbolTable, naming, "the verification function '" + function.name() + '\'');
    }
}
