// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import contractdoc.dom.Attribute;
import contractdoc.dom.Node;
import contractdoc.dom.Tag;
import contractdoc.model.Argument;
import contractdoc.model.ClassType;
import contractdoc.model.ConstrainedPrimitive;
import contractdoc.model.EntityKind;
import contractdoc.model.EntityRef;
import contractdoc.model.Enumeration;
import contractdoc.model.GlobalConstant;
import contractdoc.model.Method;
import contractdoc.model.SymbolTable;
import contractdoc.model.TypeAnnotation;
import contractdoc.model.VerificationFunction;
import contractdoc.naming.NamingScheme;
import contractdoc.render.ContractRendering;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The page renderer: turns model entities and their rendered contracts into complete DOM trees.
 * <p>
 * This class is thread-safe: it holds no mutable state, so one instance serves every page of a run.
 */
final class PageRenderer {
    /**
     * Initializes a new page renderer.
     *
     * @param pages The top-level entities that get a page in this run, in display order.
     */
    PageRenderer(final SymbolTable symbolTable, final NamingScheme naming, final List<EntityRef> pages) {
        this.symbolTable = symbolTable;
        this.naming = naming;
        this.pages = List.copyOf(pages);
        navigation = Node.simple(Tag.NAV, Node.simple(Tag.UL, renderNavigationItems()));
    }

    Node.Element renderIndex() {
        final var content = new ArrayList<Node>();
        content.add(Node.simple(Tag.HEADER, Node.simple(Tag.H1, new Node.Text(indexTitle))));
        for (final var group : PageGroup.values()) {
            final var members = group.select(pages);
            if (!members.isEmpty()) {
                content.add(Node.simple(Tag.SECTION, List.of(
                    Node.simple(Tag.H2, new Node.Text(group.title)),
                    renderLinkList(members)
                )));
            }
        }
        return renderDocument(indexTitle, content);
    }

    Node.Element renderClassPage(
        final ClassType classType,
        final List<RenderedInvariant> invariants,
        final Collection<EntityRef> referencedBy
    ) {
        final var entity = EntityRef.ofClass(classType.name());
        final var content = renderHeading(entity, classType.description());
        final var parents = new ArrayList<EntityRef>();
        for (final var parent : classType.parents()) {
            parents.add(EntityRef.ofClass(parent));
        }
        addLinkSection(content, "Inheritances", parents);
        final var descendants = new ArrayList<EntityRef>();
        for (final var descendant : symbolTable.descendants(classType)) {
            descendants.add(EntityRef.ofClass(descendant.name()));
        }
        addLinkSection(content, "Descendants", descendants);
        if (!classType.properties().isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var property : classType.properties()) {
                final var ref = EntityRef.ofProperty(classType.name(), property.name());
                final var signature = new ArrayList<Node>();
                signature.add(Node.simple(Tag.CODE, new Node.Text(naming.displayName(ref))));
                signature.add(new Node.Text(": "));
                signature.add(renderType(property.type()));
                items.add(renderMember(ref, signature, property.description()));
            }
            content.add(renderSection("Properties", Node.simple(Tag.UL, items)));
        }
        if (!classType.methods().isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var method : classType.methods()) {
                final var ref = EntityRef.ofMethod(classType.name(), method.name());
                items.add(renderMember(ref, renderMethodSignature(ref, method), method.description()));
            }
            content.add(renderSection("Methods", Node.simple(Tag.UL, items)));
        }
        if (!invariants.isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var invariant : invariants) {
                items.add(renderInvariant(entity, invariant));
            }
            content.add(renderSection("Invariants", Node.simple(Tag.UL, items)));
        }
        addUsages(content, classType.name());
        addLinkSection(content, "Referenced by", referencedBy);
        return renderDocument(naming.displayName(entity), content);
    }

    Node.Element renderConstrainedPrimitivePage(
        final ConstrainedPrimitive primitive,
        final List<RenderedInvariant> invariants,
        final Collection<EntityRef> referencedBy
    ) {
        final var entity = EntityRef.ofConstrainedPrimitive(primitive.name());
        final var content = renderHeading(entity, primitive.description());
        content.add(Node.simple(Tag.P, List.of(
            new Node.Text("Primitive type: "),
            Node.simple(Tag.CODE, new Node.Text(primitive.constrainee().sourceName()))
        )));
        final var parents = new ArrayList<EntityRef>();
        for (final var parent : primitive.parents()) {
            parents.add(EntityRef.ofConstrainedPrimitive(parent));
        }
        addLinkSection(content, "Inheritances", parents);
        if (!invariants.isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var invariant : invariants) {
                items.add(renderInvariant(entity, invariant));
            }
            content.add(renderSection("Invariants", Node.simple(Tag.UL, items)));
        }
        addUsages(content, primitive.name());
        addLinkSection(content, "Referenced by", referencedBy);
        return renderDocument(naming.displayName(entity), content);
    }

    Node.Element renderEnumerationPage(final Enumeration enumeration, final Collection<EntityRef> referencedBy) {
        final var entity = EntityRef.ofEnumeration(enumeration.name());
        final var content = renderHeading(entity, enumeration.description());
        if (!enumeration.literals().isEmpty()) {
            final var items = new ArrayList<Node>();
            for (final var literal : enumeration.literals()) {
                final var ref = EntityRef.ofLiteral(enumeration.name(), literal.name());
                items.add(renderMember(ref, List.of(
                    Node.simple(Tag.CODE, new Node.Text(naming.displayName(ref))),
                    new Node.Text(" = "),
                    Node.simple(Tag.CODE, new Node.Text(literal.value()))
                ), literal.description()));
            }
            content.add(renderSection("Literals", Node.simple(Tag.UL, items)));
        }
        addUsages(content, enumeration.name());
        addLinkSection(content, "Referenced by", referencedBy);
        return renderDocument(naming.displayName(entity), content);
    }

    Node.Element renderConstantPage(final GlobalConstant constant, final Collection<EntityRef> referencedBy) {
        final var entity = EntityRef.ofConstant(constant.name());
        final var content = renderHeading(entity, constant.description());
        content.add(Node.simple(Tag.P, List.of(new Node.Text("Type: "), renderType(constant.type()))));
        addLinkSection(content, "Referenced by", referencedBy);
        return renderDocument(naming.displayName(entity), content);
    }

    Node.Element renderFunctionPage(
        final VerificationFunction function,
        final ContractRendering.Rendered code,
        final Collection<EntityRef> referencedBy
    ) {
        final var entity = EntityRef.ofFunction(function.name());
        final var content = renderHeading(entity, function.description());
        final var kind = switch (function.kind()) {
            case TRANSPILABLE -> "Transpilable verification function";
            case PATTERN -> "Pattern verification";
            case IMPLEMENTATION_SPECIFIC -> "Implementation specific";
        };
        content.add(Node.simple(Tag.P, new Node.Text("Type: " + kind)));
        final var signature = new ArrayList<Node>();
        signature.add(new Node.Text(naming.displayName(entity)));
        signature.addAll(renderArguments(function.arguments(), function.returns()));
        content.add(Node.simple(Tag.P, Node.simple(Tag.CODE, signature)));
        content.add(renderSection("Code", code.codeBlock()));
        addLinkSection(content, "Referenced by", referencedBy);
        return renderDocument(naming.displayName(entity), content);
    }

    private List<Node> renderNavigationItems() {
        final var items = new ArrayList<Node>();
        items.add(Node.simple(Tag.LI, renderLink(indexFileName, indexTitle)));
        for (final var group : PageGroup.values()) {
            final var members = group.select(pages);
            if (!members.isEmpty()) {
                items.add(Node.simple(Tag.LI, List.of(new Node.Text(group.title), renderLinkList(members))));
            }
        }
        return items;
    }

    private Node.Element renderDocument(final String title, final List<Node> content) {
        final var head = Node.simple(Tag.HEAD, List.of(
            Node.empty(Tag.META_CHARSET_UTF8, List.of()),
            Node.simple(Tag.TITLE, new Node.Text(title)),
            Node.empty(Tag.LINK, List.of(
                Attribute.of("rel", "stylesheet"),
                Attribute.of("href", SiteGenerator.styleSheetFileName)
            ))
        ));
        return new Node.Element(
            Tag.HTML,
            List.of(Attribute.of("lang", "en")),
            List.of(head, Node.simple(Tag.BODY, List.of(navigation, Node.simple(Tag.MAIN, content))))
        );
    }

    private List<Node> renderHeading(final EntityRef entity, final String description) {
        final var content = new ArrayList<Node>();
        content.add(Node.simple(Tag.HEADER, Node.simple(Tag.H1, new Node.Text(naming.displayName(entity)))));
        if (!description.isEmpty()) {
            content.add(Node.classed(Tag.P, "description", description));
        }
        return content;
    }

    private static Node.Element renderSection(final String title, final Node body) {
        return Node.simple(Tag.SECTION, List.of(Node.simple(Tag.H2, new Node.Text(title)), body));
    }

    private void addLinkSection(final List<Node> content, final String title, final Collection<EntityRef> entities) {
        if (!entities.isEmpty()) {
            content.add(renderSection(title, renderLinkList(entities)));
        }
    }

    private void addUsages(final List<Node> content, final String typeName) {
        final var usages = new ArrayList<EntityRef>();
        for (final var classType : symbolTable.classes()) {
            for (final var property : classType.properties()) {
                if (mentions(property.type(), typeName)) {
                    usages.add(EntityRef.ofProperty(classType.name(), property.name()));
                }
            }
        }
        if (usages.isEmpty()) {
            return;
        }
        final var items = new ArrayList<Node>();
        for (final var usage : usages) {
            final var owner = EntityRef.ofClass(usage.page().name());
            items.add(Node.simple(Tag.LI, renderLink(
                naming.href(usage),
                naming.displayName(owner) + '.' + naming.displayName(usage)
            )));
        }
        content.add(renderSection("Usages", Node.simple(Tag.UL, items)));
    }

    private static boolean mentions(final TypeAnnotation type, final String typeName) {
        if (type instanceof TypeAnnotation.OurType ourType) {
            return ourType.name().equals(typeName);
        } else if (type instanceof TypeAnnotation.OptionalType optional) {
            return mentions(optional.value(), typeName);
        } else if (type instanceof TypeAnnotation.ListType list) {
            return mentions(list.items(), typeName);
        } else {
            return false;
        }
    }

    private Node.Element renderMember(final EntityRef entity, final List<Node> signature, final String description) {
        final var children = new ArrayList<Node>();
        children.add(Node.simple(Tag.P, signature));
        if (!description.isEmpty()) {
            children.add(Node.classed(Tag.P, "description", description));
        }
        return new Node.Element(Tag.LI, List.of(Attribute.of("id", naming.anchor(entity))), children);
    }

    private List<Node> renderMethodSignature(final EntityRef entity, final Method method) {
        final var signature = new ArrayList<Node>();
        signature.add(Node.simple(Tag.CODE, new Node.Text(naming.displayName(entity))));
        signature.addAll(renderArguments(method.arguments(), method.returns()));
        return signature;
    }

    private List<Node> renderArguments(final List<Argument> arguments, final @Nullable TypeAnnotation returns) {
        final var nodes = new ArrayList<Node>();
        nodes.add(new Node.Text("("));
        var first = true;
        for (final var argument : arguments) {
            if (!first) {
                nodes.add(new Node.Text(", "));
            }
            nodes.add(new Node.Text(naming.variableName(argument.name()) + ": "));
            nodes.add(renderType(argument.type()));
            first = false;
        }
        nodes.add(new Node.Text(")"));
        if (returns != null) {
            nodes.add(new Node.Text(" -> "));
            nodes.add(renderType(returns));
        }
        return nodes;
    }

    private Node.Element renderInvariant(final EntityRef page, final RenderedInvariant invariant) {
        final var children = new ArrayList<Node>();
        final var description = invariant.invariant().description();
        if (!description.isEmpty()) {
            children.add(Node.classed(Tag.P, "description", description));
        }
        final var declaredBy = invariant.declaredBy();
        if (!declaredBy.equals(page)) {
            children.add(Node.simple(Tag.P, Node.simple(Tag.EM, List.of(
                new Node.Text("(From "),
                renderLink(naming.href(declaredBy), naming.displayName(declaredBy)),
                new Node.Text(")")
            ))));
        }
        children.add(invariant.rendering().codeBlock());
        return Node.simple(Tag.LI, children);
    }

    private Node.Element renderType(final TypeAnnotation type) {
        final var nodes = new ArrayList<Node>();
        appendType(nodes, type);
        return Node.classed(Tag.SPAN, "type-annotation", nodes);
    }

    private void appendType(final List<Node> nodes, final TypeAnnotation type) {
        if (type instanceof TypeAnnotation.OurType ourType) {
            final var name = ourType.name();
            final EntityRef ref;
            if (symbolTable.findEnumeration(name) != null) {
                ref = EntityRef.ofEnumeration(name);
            } else if (symbolTable.findClass(name) != null) {
                ref = EntityRef.ofClass(name);
            } else if (symbolTable.findConstrainedPrimitive(name) != null) {
                ref = EntityRef.ofConstrainedPrimitive(name);
            } else {
                nodes.add(new Node.Text(name));
                return;
            }
            nodes.add(renderLink(naming.href(ref), naming.displayName(ref)));
        } else if (type instanceof TypeAnnotation.OptionalType optional) {
            nodes.add(new Node.Text("Optional["));
            appendType(nodes, optional.value());
            nodes.add(new Node.Text("]"));
        } else if (type instanceof TypeAnnotation.ListType list) {
            nodes.add(new Node.Text("List["));
            appendType(nodes, list.items());
            nodes.add(new Node.Text("]"));
        } else {
            nodes.add(new Node.Text(type.describe()));
        }
    }

    private Node.Element renderLinkList(final Collection<EntityRef> entities) {
        final var items = new ArrayList<Node>(entities.size());
        for (final var entity : entities) {
            items.add(Node.simple(Tag.LI, renderLink(naming.href(entity), naming.displayName(entity))));
        }
        return Node.simple(Tag.UL, items);
    }

    private static Node.Element renderLink(final String href, final String text) {
        return new Node.Element(Tag.A, List.of(Attribute.of("href", href)), List.of(new Node.Text(text)));
    }

    static final String indexFileName = "index.html";
    private static final String indexTitle = "Model documentation";

    private final SymbolTable symbolTable;
    private final NamingScheme naming;
    private final List<EntityRef> pages;
    private final Node.Element navigation;

    private enum PageGroup {
        ENUMERATIONS("Enumerations", EntityKind.ENUMERATION),
        CONSTRAINED_PRIMITIVES("Constrained primitives", EntityKind.CONSTRAINED_PRIMITIVE),
        CLASSES("Classes", EntityKind.CLASS),
        CONSTANTS("Constants", EntityKind.CONSTANT),
        VERIFICATION_FUNCTIONS("Verification functions", EntityKind.VERIFICATION_FUNCTION);

        PageGroup(final String title, final EntityKind kind) {
            this.title = title;
            this.kind = kind;
        }

        List<EntityRef> select(final List<EntityRef> pages) {
            final var result = new ArrayList<EntityRef>();
            for (final var page : pages) {
                if (page.kind() == kind) {
                    result.add(page);
                }
            }
            return result;
        }

        private final String title;
        private final EntityKind kind;
    }
}
