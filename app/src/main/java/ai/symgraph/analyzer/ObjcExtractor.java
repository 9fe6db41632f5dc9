package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.objc.ObjcTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Objective-C: {@code #import}/{@code #include}/{@code @import}, {@code @interface} (or {@code Class(Category)}),
 * {@code @implementation} and {@code @protocol} blocks with property and method children, C functions, and
 * message-send calls.
 *
 * <p>Methods are named by their selector ({@code initWithName:age:}); {@code +} methods are {@code class_method}.
 */
public final class ObjcExtractor extends TreeSitterExtractor {
    private static final Set<String> COMMENT_TYPES = Set.of(COMMENT);
    private static final Set<String> CALLER_TYPES = Set.of(METHOD_DEFINITION, FUNCTION_DEFINITION);
    private static final Set<String> METHOD_TYPES = Set.of(METHOD_DECLARATION, METHOD_DEFINITION);
    private static final Set<String> PROTOCOL_LISTS =
            Set.of(PROTOCOL_QUALIFIERS, PROTOCOL_REFERENCE_LIST, PARAMETERIZED_ARGUMENTS);

    public ObjcExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.OBJC;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("imports", this::extractImports),
                step("declarations", this::extractDeclarations),
                step("calls", this::extractCalls));
    }

    private void extractImports(ExtractionContext ctx) {
        for (var include : SyntaxNodes.findAllNodesByType(ctx.root(), PREPROC_INCLUDE)) {
            var pathNode = SyntaxNodes.firstChildOfType(include, SYSTEM_LIB_STRING, STRING_LITERAL);
            var path = Signatures.stripQuotes(ctx.text(pathNode));
            if (pathNode == null || path.isEmpty()) {
                continue;
            }
            boolean external = ImportClassifier.isExternal(path, Language.OBJC, ctx.path());
            ctx.addDependency(ParsedDependency.importOf("", path, path, external));
        }
        for (var module : SyntaxNodes.findAllNodesByType(ctx.root(), MODULE_IMPORT)) {
            var path = ctx.text(module).replace("@import", "").replace(";", "").trim();
            if (!path.isEmpty()) {
                ctx.addDependency(ParsedDependency.importOf(
                        "", path, path, ImportClassifier.isExternal(path, Language.OBJC, ctx.path())));
            }
        }
    }

    private void extractDeclarations(ExtractionContext ctx) {
        for (var node : SyntaxNodes.namedChildren(ctx.root())) {
            switch (node.getType()) {
                case CLASS_INTERFACE -> classInterface(ctx, node);
                case CLASS_IMPLEMENTATION -> classImplementation(ctx, node);
                case PROTOCOL_DECLARATION -> protocol(ctx, node);
                case FUNCTION_DEFINITION -> function(ctx, node);
                default -> {}
            }
        }
    }

    private void classInterface(ExtractionContext ctx, TSNode decl) {
        var names = headerNames(ctx, decl);
        if (names.className().isEmpty()) {
            return;
        }
        var category = names.category();
        var name = category == null ? names.className() : names.className() + "(" + category + ")";
        var kind = category == null ? SymbolKinds.INTERFACE : SymbolKinds.CATEGORY;
        var symbol = ctx.symbol(name, kind, signature(ctx, decl), decl, precedingDoc(ctx, decl, COMMENT_TYPES));
        addMembers(ctx, symbol, decl);

        if (category != null) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, names.className()));
        } else if (names.superclass() != null) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, names.superclass()));
        }
        for (var protocol : protocolList(ctx, decl)) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.CONFORMS, name, protocol));
        }
        ctx.addTopLevel(symbol);
    }

    private void classImplementation(ExtractionContext ctx, TSNode impl) {
        var names = headerNames(ctx, impl);
        if (names.className().isEmpty()) {
            return;
        }
        var name = names.category() == null ? names.className() : names.className() + "(" + names.category() + ")";
        var symbol = ctx.symbol(
                name, SymbolKinds.IMPLEMENTATION, signature(ctx, impl), impl, precedingDoc(ctx, impl, COMMENT_TYPES));
        addMembers(ctx, symbol, impl);
        for (var definition : SyntaxNodes.childrenOfType(impl, Set.of(IMPLEMENTATION_DEFINITION))) {
            addMembers(ctx, symbol, definition);
        }
        ctx.addTopLevel(symbol);
    }

    private void protocol(ExtractionContext ctx, TSNode decl) {
        var name = ctx.text(SyntaxNodes.firstChildOfType(decl, IDENTIFIER));
        if (name.isEmpty()) {
            return;
        }
        var symbol = ctx.symbol(
                name, SymbolKinds.PROTOCOL, signature(ctx, decl), decl, precedingDoc(ctx, decl, COMMENT_TYPES));
        addMembers(ctx, symbol, decl);
        for (var section : SyntaxNodes.childrenOfType(decl, Set.of(QUALIFIED_PROTOCOL_INTERFACE_DECLARATION))) {
            addMembers(ctx, symbol, section);
        }
        for (var parent : protocolList(ctx, decl)) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.CONFORMS, name, parent));
        }
        ctx.addTopLevel(symbol);
    }

    private void function(ExtractionContext ctx, TSNode fn) {
        var declarator = SyntaxNodes.findNodeRecursive(
                SyntaxNodes.field(fn, "declarator"), n -> FUNCTION_DECLARATOR.equals(n.getType()));
        var name = ctx.fieldText(declarator == null ? fn : declarator, "declarator");
        if (declarator == null || name.isEmpty()) {
            return;
        }
        ctx.addTopLevel(ctx.symbol(
                name,
                SymbolKinds.FUNCTION,
                Signatures.headerUpToBody(ctx.text(fn)),
                fn,
                precedingDoc(ctx, fn, COMMENT_TYPES)));
    }

    private void addMembers(ExtractionContext ctx, ParsedSymbol owner, TSNode container) {
        for (var member : SyntaxNodes.namedChildren(container)) {
            if (PROPERTY_DECLARATION.equals(member.getType())) {
                var name = propertyName(ctx, member);
                if (!name.isEmpty()) {
                    owner.addChild(ctx.symbol(
                            name,
                            SymbolKinds.PROPERTY,
                            Signatures.collapseWhitespace(ctx.text(member)),
                            member,
                            precedingDoc(ctx, member, COMMENT_TYPES)));
                }
            } else if (METHOD_TYPES.contains(member.getType())) {
                var selector = selector(ctx, member);
                if (!selector.isEmpty()) {
                    var kind = ctx.text(member).stripLeading().startsWith("+")
                            ? SymbolKinds.CLASS_METHOD
                            : SymbolKinds.METHOD;
                    owner.addChild(ctx.symbol(
                            selector,
                            kind,
                            Signatures.headerUpToBody(ctx.text(member)),
                            member,
                            precedingDoc(ctx, member, COMMENT_TYPES)));
                }
            }
        }
    }

    /** Selector of a method: identifiers in order, each followed by {@code :} when it takes a parameter. */
    private static String selector(ExtractionContext ctx, TSNode method) {
        var parts = new StringBuilder();
        int lastIdentifierEnd = -1;
        for (var child : SyntaxNodes.children(method)) {
            if (IDENTIFIER.equals(child.getType())) {
                parts.append(ctx.text(child));
                lastIdentifierEnd = parts.length();
            } else if (METHOD_PARAMETER.equals(child.getType()) && lastIdentifierEnd == parts.length()) {
                parts.append(':');
            }
        }
        return parts.toString();
    }

    private static String propertyName(ExtractionContext ctx, TSNode property) {
        var declarator = SyntaxNodes.findNodeRecursive(property, n -> STRUCT_DECLARATOR.equals(n.getType()));
        var ident = SyntaxNodes.findNodeRecursive(declarator, n -> IDENTIFIER.equals(n.getType()));
        return ctx.text(ident);
    }

    private record HeaderNames(String className, @Nullable String superclass, @Nullable String category) {}

    /** {@code @interface Name : Super}, {@code @interface Name (Category)} and the same for implementations. */
    private static HeaderNames headerNames(ExtractionContext ctx, TSNode decl) {
        String className = "";
        String superclass = null;
        String category = null;
        boolean afterColon = false;
        boolean inParens = false;
        for (var child : SyntaxNodes.children(decl)) {
            switch (child.getType()) {
                case ":" -> afterColon = true;
                case "(" -> inParens = true;
                case ")" -> inParens = false;
                case IDENTIFIER, TYPE_IDENTIFIER -> {
                    var text = ctx.text(child);
                    if (className.isEmpty()) {
                        className = text;
                    } else if (inParens && category == null) {
                        category = text;
                    } else if (afterColon && superclass == null) {
                        superclass = text;
                    }
                }
                default -> {}
            }
        }
        return new HeaderNames(className, superclass, category);
    }

    private static List<String> protocolList(ExtractionContext ctx, TSNode decl) {
        var protocols = new ArrayList<String>();
        for (var list : SyntaxNodes.childrenOfType(decl, PROTOCOL_LISTS)) {
            var idents = SyntaxNodes.findAllNodesRecursive(
                    list, n -> IDENTIFIER.equals(n.getType()) || TYPE_IDENTIFIER.equals(n.getType()));
            for (var ident : idents) {
                protocols.add(ctx.text(ident));
            }
        }
        return protocols;
    }

    private static String signature(ExtractionContext ctx, TSNode decl) {
        return Signatures.collapseWhitespace(Signatures.firstLine(ctx.text(decl)));
    }

    private void extractCalls(ExtractionContext ctx) {
        for (var message : SyntaxNodes.findAllNodesByType(ctx.root(), MESSAGE_EXPRESSION)) {
            var caller = ctx.enclosingSymbol(message, CALLER_TYPES);
            var target = messageSelector(ctx, message);
            if (caller != null && !target.isEmpty()) {
                ctx.addDependency(ParsedDependency.of(DependencyTypes.CALL, caller.name(), target));
            }
        }
    }

    /** {@code [obj greet]} sends {@code greet}; {@code [obj setX:1 y:2]} sends {@code setX:y:}. */
    private static String messageSelector(ExtractionContext ctx, TSNode message) {
        var children = SyntaxNodes.children(message);
        int receiver = -1;
        boolean keyword = false;
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (receiver < 0 && !"[".equals(child.getType())) {
                receiver = i;
            } else if (":".equals(child.getType())) {
                keyword = true;
            }
        }
        if (receiver < 0) {
            return "";
        }
        var selector = new StringBuilder();
        for (int i = receiver + 1; i < children.size(); i++) {
            var child = children.get(i);
            if (!IDENTIFIER.equals(child.getType())) {
                continue;
            }
            if (!keyword) {
                return ctx.text(child);
            }
            if (i + 1 < children.size() && ":".equals(children.get(i + 1).getType())) {
                selector.append(ctx.text(child)).append(':');
            }
        }
        return selector.toString();
    }
}
