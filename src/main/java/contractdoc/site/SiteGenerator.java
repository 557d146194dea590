// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import contractdoc.dom.Node;
import contractdoc.dom.Serializer;
import contractdoc.dom.Verifier;
import contractdoc.model.ClassType;
import contractdoc.model.ConstrainedPrimitive;
import contractdoc.model.EntityKind;
import contractdoc.model.EntityRef;
import contractdoc.model.SymbolTable;
import contractdoc.model.VerificationFunction;
import contractdoc.naming.NamingScheme;
import contractdoc.render.ContractRenderer;
import contractdoc.render.ContractRendering;
import contractdoc.util.CollectionExecutorService;
import contractdoc.util.MessageSupplier;
import contractdoc.util.Trace;
import contractdoc.util.UnreachableCodeReachedError;
import contractdoc.util.condition.ConditionContext;
import contractdoc.util.condition.Handler;
import contractdoc.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The entry point to documentation generation: the page assembler consuming contract renderings.
 */
public final class SiteGenerator {
    /**
     * Initializes a new site generator that will write the pages of the model described by the symbol table into the
     * given output directory.
     * <p>
     * Contracts are rendered and pages written in parallel, by tasks submitted to the given executor service.
     */
    public SiteGenerator(
        final SymbolTable symbolTable,
        final NamingScheme naming,
        final ContractRenderer renderer,
        final Path outputDirectory,
        final ExecutorService executorService,
        final FailurePolicy failurePolicy
    ) {
        this.symbolTable = symbolTable;
        this.naming = naming;
        this.renderer = renderer;
        this.outputDirectory = outputDirectory;
        executor = new CollectionExecutorService(executorService);
        this.failurePolicy = failurePolicy;
    }

    /**
     * Generates the whole site.
     * <p>
     * Generation has two phases. First, every contract is rendered; a failure signals
     * {@link TranspilationErrorCondition}, which the failure policy answers by unwinding either to the
     * {@value #skipRestartName} restart, leaving the page of that entity out, or to the {@value #abortRestartName}
     * restart, stopping the run before any page is written. Second, the pages are written: the index, then one page
     * per entity, each listing the contracts that link to it.
     * <p>
     * Handlers established by the caller see every condition the policy does not handle, such as
     * {@link IOExceptionCondition} on I/O errors. Worker threads inherit the caller's restarts and thread-safe
     * handlers.
     */
    public GenerationReport generate() {
        final var failures = new ConcurrentLinkedQueue<TranspilationErrorCondition>();
        try (final var handler = new Handler(new FailurePolicyHandler(failurePolicy, failures))) {
            handler.use();
            final var writtenPages = ConditionContext.withRestart(abortRestartName, restart -> {
                try (final var trace = new Trace(() -> "Generating documentation into " + outputDirectory)) {
                    trace.use();
                    ensureDirectoryExists(outputDirectory);
                    final var prepared = prepareContractPages();
                    return writePages(prepared);
                }
            });
            return new GenerationReport(
                (writtenPages != null) ? writtenPages : List.of(),
                new ArrayList<>(failures),
                writtenPages == null
            );
        }
    }

    private Map<EntityRef, PreparedPage> prepareContractPages() {
        try (final var trace = new Trace("Rendering contracts")) {
            trace.use();
            final var entities = new ArrayList<EntityRef>();
            for (final var primitive : symbolTable.constrainedPrimitives()) {
                entities.add(EntityRef.ofConstrainedPrimitive(primitive.name()));
            }
            for (final var classType : symbolTable.classes()) {
                entities.add(EntityRef.ofClass(classType.name()));
            }
            for (final var function : symbolTable.verificationFunctions()) {
                entities.add(EntityRef.ofFunction(function.name()));
            }
            final var prepared = executor.map(entities, entity -> ConditionContext.withRestart(
                skipRestartName,
                restart -> preparePage(entity)
            ));
            final var result = new HashMap<EntityRef, PreparedPage>();
            for (final var page : prepared) {
                if (page != null) {
                    result.put(page.entity(), page);
                }
            }
            return result;
        }
    }

    private PreparedPage preparePage(final EntityRef entity) {
        final MessageSupplier message =
            () -> "Rendering the contracts of " + TranspilationErrorCondition.describe(entity);
        try (final var trace = new Trace(message)) {
            trace.use();
            if (entity.kind() == EntityKind.CLASS) {
                final var classType = symbolTable.findClass(entity.name());
                assert classType != null : "Class vanished from the symbol table @AssumeAssertion(nullness)";
                return prepareClassPage(entity, classType);
            }
            if (entity.kind() == EntityKind.CONSTRAINED_PRIMITIVE) {
                final var primitive = symbolTable.findConstrainedPrimitive(entity.name());
                assert primitive != null : "Primitive vanished from the symbol table @AssumeAssertion(nullness)";
                return preparePrimitivePage(entity, primitive);
            }
            final var function = symbolTable.findVerificationFunction(entity.name());
            assert function != null : "Verification function vanished from the symbol table @AssumeAssertion(nullness)";
            return prepareFunctionPage(entity, function);
        }
    }

    private PreparedPage prepareClassPage(final EntityRef entity, final ClassType classType) {
        final var invariants = new ArrayList<RenderedInvariant>();
        final var declaringClasses = new ArrayList<ClassType>();
        declaringClasses.add(classType);
        declaringClasses.addAll(symbolTable.ancestors(classType));
        for (final var declaringClass : declaringClasses) {
            for (final var invariant : declaringClass.invariants()) {
                final var rendering = requireRendered(entity, renderer.renderInvariant(declaringClass, invariant));
                invariants.add(new RenderedInvariant(EntityRef.ofClass(declaringClass.name()), invariant, rendering));
            }
        }
        return new PreparedPage(entity, invariants, null, ownReferences(entity, invariants));
    }

    private PreparedPage preparePrimitivePage(final EntityRef entity, final ConstrainedPrimitive primitive) {
        final var invariants = new ArrayList<RenderedInvariant>();
        final var declaringPrimitives = new ArrayList<ConstrainedPrimitive>();
        declaringPrimitives.add(primitive);
        declaringPrimitives.addAll(symbolTable.ancestors(primitive));
        for (final var declaringPrimitive : declaringPrimitives) {
            final var declaredBy = EntityRef.ofConstrainedPrimitive(declaringPrimitive.name());
            for (final var invariant : declaringPrimitive.invariants()) {
                final var rendering = requireRendered(entity, renderer.renderInvariant(declaringPrimitive, invariant));
                invariants.add(new RenderedInvariant(declaredBy, invariant, rendering));
            }
        }
        return new PreparedPage(entity, invariants, null, ownReferences(entity, invariants));
    }

    // Inherited invariants are credited to their declaring entity.
    private static Set<EntityRef> ownReferences(final EntityRef entity, final List<RenderedInvariant> invariants) {
        final var references = new LinkedHashSet<EntityRef>();
        for (final var invariant : invariants) {
            if (invariant.declaredBy().equals(entity)) {
                references.addAll(invariant.rendering().references());
            }
        }
        return references;
    }

    private PreparedPage prepareFunctionPage(final EntityRef entity, final VerificationFunction function) {
        final var rendering = requireRendered(entity, renderer.renderVerificationFunction(function));
        return new PreparedPage(entity, List.of(), rendering, rendering.references());
    }

    private static ContractRendering.Rendered requireRendered(
        final EntityRef entity,
        final ContractRendering rendering
    ) {
        if (rendering instanceof ContractRendering.Failed failed) {
            throw ConditionContext.error(new TranspilationErrorCondition(entity, failed.error()));
        }
        return (ContractRendering.Rendered) rendering;
    }

    private List<String> writePages(final Map<EntityRef, PreparedPage> prepared) {
        try (final var trace = new Trace("Writing pages")) {
            trace.use();
            final var pages = new ArrayList<EntityRef>();
            for (final var enumeration : symbolTable.enumerations()) {
                pages.add(EntityRef.ofEnumeration(enumeration.name()));
            }
            for (final var primitive : symbolTable.constrainedPrimitives()) {
                addIfPrepared(pages, prepared, EntityRef.ofConstrainedPrimitive(primitive.name()));
            }
            for (final var classType : symbolTable.classes()) {
                addIfPrepared(pages, prepared, EntityRef.ofClass(classType.name()));
            }
            for (final var constant : symbolTable.constants()) {
                pages.add(EntityRef.ofConstant(constant.name()));
            }
            for (final var function : symbolTable.verificationFunctions()) {
                addIfPrepared(pages, prepared, EntityRef.ofFunction(function.name()));
            }
            final var backlinks = collectBacklinks(prepared);
            final var pageRenderer = new PageRenderer(symbolTable, naming, pages);
            final var jobs = new ArrayList<PageJob>();
            jobs.add(new PageJob(PageRenderer.indexFileName, pageRenderer::renderIndex));
            for (final var page : pages) {
                final var referencedBy = backlinks.getOrDefault(page, Set.of());
                jobs.add(new PageJob(
                    naming.pageFile(page),
                    () -> renderPage(pageRenderer, page, prepared, referencedBy)
                ));
            }
            executor.forEach(jobs, job -> serializeDomTree(job.fileName(), job.renderer().get()));
            copyStyleSheet();
            final var written = new ArrayList<String>();
            for (final var job : jobs) {
                written.add(job.fileName());
            }
            written.add(styleSheetFileName);
            Collections.sort(written);
            return written;
        }
    }

    private static void addIfPrepared(
        final List<EntityRef> pages,
        final Map<EntityRef, PreparedPage> prepared,
        final EntityRef entity
    ) {
        if (prepared.containsKey(entity)) {
            pages.add(entity);
        }
    }

    private static Map<EntityRef, Set<EntityRef>> collectBacklinks(final Map<EntityRef, PreparedPage> prepared) {
        final var result = new HashMap<EntityRef, Set<EntityRef>>();
        for (final var page : prepared.values()) {
            for (final var reference : page.references()) {
                final var target = reference.page();
                if (!target.equals(page.entity())) {
                    result.computeIfAbsent(target, key -> new TreeSet<>(backlinkOrder)).add(page.entity());
                }
            }
        }
        return result;
    }

    private Node.Element renderPage(
        final PageRenderer pageRenderer,
        final EntityRef page,
        final Map<EntityRef, PreparedPage> prepared,
        final Set<EntityRef> referencedBy
    ) {
        final var name = page.name();
        switch (page.kind()) {
            case CLASS -> {
                final var classType = symbolTable.findClass(name);
                final var contracts = prepared.get(page);
                assert classType != null && contracts != null
                    : "Class page without a class @AssumeAssertion(nullness)";
                return pageRenderer.renderClassPage(classType, contracts.invariants(), referencedBy);
            }
            case CONSTRAINED_PRIMITIVE -> {
                final var primitive = symbolTable.findConstrainedPrimitive(name);
                final var contracts = prepared.get(page);
                assert primitive != null && contracts != null
                    : "Constrained primitive page without a constrained primitive @AssumeAssertion(nullness)";
                return pageRenderer.renderConstrainedPrimitivePage(primitive, contracts.invariants(), referencedBy);
            }
            case ENUMERATION -> {
                final var enumeration = symbolTable.findEnumeration(name);
                assert enumeration != null : "Enumeration page without an enumeration @AssumeAssertion(nullness)";
                return pageRenderer.renderEnumerationPage(enumeration, referencedBy);
            }
            case CONSTANT -> {
                final var constant = symbolTable.findConstant(name);
                assert constant != null : "Constant page without a constant @AssumeAssertion(nullness)";
                return pageRenderer.renderConstantPage(constant, referencedBy);
            }
            case VERIFICATION_FUNCTION -> {
                final var function = symbolTable.findVerificationFunction(name);
                final var contracts = prepared.get(page);
                assert function != null && contracts != null && contracts.code() != null
                    : "Function page without a function @AssumeAssertion(nullness)";
                return pageRenderer.renderFunctionPage(function, contracts.code(), referencedBy);
            }
            default -> throw new UnreachableCodeReachedError("Members have no pages of their own: " + page);
        }
    }

    private void serializeDomTree(final String fileName, final Node rootNode) {
        Verifier.verify(rootNode);
        final var destinationPath = outputDirectory.resolve(fileName);
        try (final var trace = new Trace(() -> "Saving HTML to " + destinationPath)) {
            trace.use();
            try (final var writer = Files.newBufferedWriter(destinationPath)) {
                writer.write("<!DOCTYPE html>");
                Serializer.serialize(writer, rootNode);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private void copyStyleSheet() {
        final var destinationPath = outputDirectory.resolve(styleSheetFileName);
        try (final var trace = new Trace(() -> "Copying the style sheet to " + destinationPath)) {
            trace.use();
            try (final InputStream stream = SiteGenerator.class.getResourceAsStream(styleSheetFileName)) {
                if (stream == null) {
                    throw new IOException("Style sheet resource " + styleSheetFileName + " not found");
                }
                Files.copy(stream, destinationPath, StandardCopyOption.REPLACE_EXISTING);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private static void ensureDirectoryExists(final Path path) {
        try (final var trace = new Trace(() -> "Ensuring directory exists: " + path)) {
            trace.use();
            Files.createDirectories(path);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    static final String skipRestartName = "skip-entity";
    static final String abortRestartName = "abort-generation";
    static final String styleSheetFileName = "style.css";

    private static final Comparator<EntityRef> backlinkOrder =
        Comparator.comparing((final EntityRef entity) -> entity.kind()).thenComparing(EntityRef::name);

    private final SymbolTable symbolTable;
    private final NamingScheme naming;
    private final ContractRenderer renderer;
    private final Path outputDirectory;
    private final CollectionExecutorService executor;
    private final FailurePolicy failurePolicy;

    private record PreparedPage(
        EntityRef entity,
        List<RenderedInvariant> invariants,
        ContractRendering.@Nullable Rendered code,
        Set<EntityRef> references
    ) {
    }

    private record PageJob(String fileName, Supplier<Node.Element> renderer) {
    }
}
