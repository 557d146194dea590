// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import contractdoc.dom.Node;
import contractdoc.dom.Tag;
import contractdoc.model.ClassType;
import contractdoc.model.ConstrainedPrimitive;
import contractdoc.model.Expression;
import contractdoc.model.Invariant;
import contractdoc.model.SymbolTable;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.VerificationFunction;
import contractdoc.naming.NamingScheme;
import contractdoc.transpiler.DuplicateBindingException;
import contractdoc.transpiler.Environment;
import contractdoc.transpiler.Fragment;
import contractdoc.transpiler.Layout;
import contractdoc.transpiler.LayoutSettings;
import contractdoc.transpiler.NameResolver;
import contractdoc.transpiler.RenderError;
import contractdoc.transpiler.Tokens;
import contractdoc.transpiler.Transpiler;
import contractdoc.transpiler.TypeInferrer;
import contractdoc.util.Trace;
import contractdoc.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The contract renderer: renders whole invariants and verification-function bodies into code blocks.
 * <p>
 * Rendering is free of side effects, so a single renderer can be shared by any number of threads.
 */
public final class ContractRenderer {
    /**
     * Initializes a new contract renderer.
     *
     * @param symbolTable The symbol table of the model.
     * @param naming      The naming scheme used for displayed identifiers and links.
     * @param inferrer    The type inferrer.
     * @param settings    The layout settings.
     */
    public ContractRenderer(
        final SymbolTable symbolTable,
        final NamingScheme naming,
        final TypeInferrer inferrer,
        final LayoutSettings settings
    ) {
        this.symbolTable = symbolTable;
        this.naming = naming;
        this.inferrer = inferrer;
        this.settings = settings;
    }

    /**
     * Renders an invariant of the given class, with {@code self} bound to that class.
     * <p>
     * Inherited invariants are rendered with their declaring class as the owner.
     */
    public ContractRendering renderInvariant(final ClassType owner, final Invariant invariant) {
        try (final var trace = new Trace(() -> "Rendering an invariant of the class " + owner.name())) {
            trace.use();
            return renderInvariant(
                TypeAnnotation.our(owner.name()),
                NameResolver.forInvariant(symbolTable, naming, owner),
                invariant
            );
        }
    }

    /**
     * Renders an invariant of the given constrained primitive, with {@code self} bound to the constrained primitive
     * type.
     */
    public ContractRendering renderInvariant(final ConstrainedPrimitive owner, final Invariant invariant) {
        try (final var trace = new Trace(() -> "Rendering an invariant of the constrained primitive " + owner.name())) {
            trace.use();
            return renderInvariant(
                new TypeAnnotation.Primitive(owner.constrainee()),
                NameResolver.forInvariant(symbolTable, naming, owner),
                invariant
            );
        }
    }

    private ContractRendering renderInvariant(
        final TypeAnnotation selfType,
        final NameResolver resolver,
        final Invariant invariant
    ) {
        final var environment = Environment.root();
        try {
            environment.define(selfIdentifier, selfType).use();
        } catch (final DuplicateBindingException e) {
            throw new UnreachableCodeReachedError("A fresh environment already defines " + e.identifier());
        }
        final var body = invariant.body();
        final var inference = inferrer.infer(List.of(body), environment);
        if (inference instanceof TypeInferrer.Failure failure) {
            return typeInferenceFailure(body, "the invariant", failure);
        }
        final var types = ((TypeInferrer.Success) inference).types();
        final var result = new Transpiler(resolver, types, settings).transpile(body, environment);
        if (!result.isSuccess()) {
            return new ContractRendering.Failed(result.error());
        }
        return codeBlock(result.fragment());
    }

    /**
     * Renders the body of a verification function, with every argument bound to its declared type.
     */
    public ContractRendering renderVerificationFunction(final VerificationFunction function) {
        final var name = function.name();
        try (final var trace = new Trace(() -> "Rendering the verification function " + name)) {
            trace.use();
            if (function.kind() == VerificationFunction.Kind.IMPLEMENTATION_SPECIFIC) {
                return new ContractRendering.Rendered(implementationSpecificNote(), Set.of());
            }
            final var environment = Environment.root();
            for (final var argument : function.arguments()) {
                try {
                    environment.define(argument.name(), argument.type()).use();
                } catch (final DuplicateBindingException e) {
                    return new ContractRendering.Failed(RenderError.of(
                        null,
                        RenderError.Kind.DUPLICATE_BINDING,
                        "The argument '" + e.identifier() + "' of the verification function '" + name
                            + "' is declared more than once"
                    ));
                }
            }
            final var body = function.body();
            if (body.isEmpty()) {
                return codeBlock(Tokens.comment("# No implementation specified"));
            }
            final var inference = inferrer.infer(body, environment);
            if (inference instanceof TypeInferrer.Failure failure) {
                return typeInferenceFailure(null, "the verification function '" + name + '\'', failure);
            }
            final var types = ((TypeInferrer.Success) inference).types();
            final var resolver = NameResolver.forVerificationFunction(symbolTable, naming, function);
            final var results = new Transpiler(resolver, types, settings).transpileStatements(body, environment);
            final var statements = new ArrayList<Fragment>(results.size());
            final var errors = new ArrayList<RenderError>();
            for (final var result : results) {
                if (result.isSuccess()) {
                    statements.add(result.fragment());
                } else {
                    errors.add(result.error());
                }
            }
            if (!errors.isEmpty()) {
                return new ContractRendering.Failed(RenderError.aggregate(
                    null,
                    "Failed to transpile the verification function '" + name + '\'',
                    errors
                ));
            }
            return codeBlock(Layout.join(statements, "\n"));
        }
    }

    private static ContractRendering typeInferenceFailure(
        final @Nullable Expression node,
        final String construct,
        final TypeInferrer.Failure failure
    ) {
        final var causes = new ArrayList<RenderError>(failure.errors().size());
        for (final var message : failure.errors()) {
            causes.add(RenderError.of(null, RenderError.Kind.TYPE_INFERENCE, message));
        }
        return new ContractRendering.Failed(new RenderError(
            node,
            RenderError.Kind.TYPE_INFERENCE,
            "Failed to infer the types in " + construct,
            causes
        ));
    }

    private static ContractRendering codeBlock(final Fragment code) {
        final var block = Node.classed(Tag.DIV, highlightClass, List.of(Node.simple(Tag.PRE, code.nodes())));
        return new ContractRendering.Rendered(block, code.references());
    }

    private static Node implementationSpecificNote() {
        return Node.simple(Tag.DIV, Node.simple(
            Tag.EM,
            new Node.Text("Code not available as this is implementation-specific.")
        ));
    }

    private static final String selfIdentifier = "self";
    private static final String highlightClass = "highlight";

    private final SymbolTable symbolTable;
    private final NamingScheme naming;
    private final TypeInferrer inferrer;
    private final LayoutSettings settings;
}
