package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.swift.SwiftTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Swift: imports, classes, structs, enums, protocols and extensions with their members, top-level functions and
 * properties.
 *
 * <p>The first inherited type of a class is its superclass ({@code extends}); every other inherited type, and all of
 * those of structs, enums and extensions, is a protocol ({@code conforms}). Protocols {@code extends} the protocols
 * they refine. Extensions are named {@code extension_<Type>}.
 */
public final class SwiftExtractor extends TreeSitterExtractor {
    private static final Set<String> COMMENT_TYPES = Set.of(COMMENT, MULTILINE_COMMENT);
    private static final Set<String> CALLER_TYPES = Set.of(FUNCTION_DECLARATION, INIT_DECLARATION);
    private static final Set<String> IMPORT_KINDS =
            Set.of("class", "struct", "enum", "protocol", "func", "var", "let", "typealias");

    public SwiftExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.SWIFT;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("imports", this::extractImports),
                step("declarations", this::extractDeclarations),
                step("calls", this::extractCalls));
    }

    private void extractImports(ExtractionContext ctx) {
        for (var decl : SyntaxNodes.childrenOfType(ctx.root(), Set.of(IMPORT_DECLARATION))) {
            var tokens = new ArrayList<String>();
            for (var token : Signatures.collapseWhitespace(ctx.text(decl)).split(" ")) {
                if (!token.isEmpty() && !token.startsWith("@")) {
                    tokens.add(token);
                }
            }
            // import [kind] Module[.Symbol]
            int index = tokens.indexOf("import") + 1;
            if (index < tokens.size() && IMPORT_KINDS.contains(tokens.get(index))) {
                index++;
            }
            if (index <= 0 || index >= tokens.size()) {
                continue;
            }
            var path = tokens.get(index);
            boolean external = ImportClassifier.isExternal(path, Language.SWIFT, "");
            ctx.addDependency(ParsedDependency.importOf("", path, path, external));
        }
    }

    private void extractDeclarations(ExtractionContext ctx) {
        for (var node : SyntaxNodes.namedChildren(ctx.root())) {
            var symbol = switch (node.getType()) {
                case CLASS_DECLARATION -> typeSymbol(ctx, node);
                case PROTOCOL_DECLARATION -> protocolSymbol(ctx, node);
                case FUNCTION_DECLARATION -> functionSymbol(ctx, node, SymbolKinds.FUNCTION);
                case PROPERTY_DECLARATION -> propertySymbol(ctx, node);
                default -> null;
            };
            if (symbol != null) {
                ctx.addTopLevel(symbol);
            }
        }
    }

    private @Nullable ParsedSymbol typeSymbol(ExtractionContext ctx, TSNode decl) {
        var keyword = declarationKeyword(decl);
        boolean extension = EXTENSION_KEYWORD.equals(keyword);
        var typeName = extension ? extendedTypeName(ctx, decl) : ctx.fieldText(decl, "name");
        if (typeName.isEmpty()) {
            var ident = SyntaxNodes.firstChildOfType(decl, TYPE_IDENTIFIER);
            typeName = ctx.text(ident);
        }
        if (typeName.isEmpty()) {
            return null;
        }
        var name = extension ? "extension_" + typeName : typeName;
        var kind = switch (keyword) {
            case STRUCT_KEYWORD -> SymbolKinds.STRUCT;
            case ENUM_KEYWORD -> SymbolKinds.ENUM;
            case EXTENSION_KEYWORD -> SymbolKinds.EXTENSION;
            default -> SymbolKinds.CLASS;
        };
        var symbol = ctx.symbol(name, kind, signature(ctx, decl), decl, precedingDoc(ctx, decl, COMMENT_TYPES));

        var inherited = inheritedTypes(ctx, decl);
        if (extension) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, typeName));
        }
        for (int i = 0; i < inherited.size(); i++) {
            boolean superclass = i == 0 && (CLASS_KEYWORD.equals(keyword) || ACTOR_KEYWORD.equals(keyword));
            var type = superclass ? DependencyTypes.EXTENDS : DependencyTypes.CONFORMS;
            ctx.addDependency(ParsedDependency.of(type, name, inherited.get(i)));
        }

        var body = SyntaxNodes.firstChildOfType(decl, CLASS_BODY, ENUM_CLASS_BODY);
        for (var member : SyntaxNodes.namedChildren(body)) {
            switch (member.getType()) {
                case ENUM_ENTRY -> enumCases(ctx, member).forEach(symbol::addChild);
                default -> {
                    var child = memberSymbol(ctx, member);
                    if (child != null) {
                        symbol.addChild(child);
                    }
                }
            }
        }
        return symbol;
    }

    private @Nullable ParsedSymbol protocolSymbol(ExtractionContext ctx, TSNode decl) {
        var name = ctx.fieldText(decl, "name");
        if (name.isEmpty()) {
            name = ctx.text(SyntaxNodes.firstChildOfType(decl, TYPE_IDENTIFIER));
        }
        if (name.isEmpty()) {
            return null;
        }
        var symbol = ctx.symbol(
                name, SymbolKinds.PROTOCOL, signature(ctx, decl), decl, precedingDoc(ctx, decl, COMMENT_TYPES));
        for (var parent : inheritedTypes(ctx, decl)) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, parent));
        }
        var body = SyntaxNodes.firstChildOfType(decl, PROTOCOL_BODY);
        for (var requirement : SyntaxNodes.namedChildren(body)) {
            var child = memberSymbol(ctx, requirement);
            if (child != null) {
                symbol.addChild(child);
            }
        }
        return symbol;
    }

    private @Nullable ParsedSymbol memberSymbol(ExtractionContext ctx, TSNode member) {
        return switch (member.getType()) {
            case FUNCTION_DECLARATION, PROTOCOL_FUNCTION_DECLARATION -> {
                var kind = isStatic(ctx, member) ? SymbolKinds.STATIC_METHOD : SymbolKinds.METHOD;
                yield functionSymbol(ctx, member, kind);
            }
            case PROPERTY_DECLARATION, PROTOCOL_PROPERTY_DECLARATION -> propertySymbol(ctx, member);
            case INIT_DECLARATION -> ctx.symbol(
                    "init",
                    SymbolKinds.INITIALIZER,
                    signature(ctx, member),
                    member,
                    precedingDoc(ctx, member, COMMENT_TYPES));
            default -> null;
        };
    }

    private @Nullable ParsedSymbol functionSymbol(ExtractionContext ctx, TSNode fn, String kind) {
        var name = ctx.fieldText(fn, "name");
        if (name.isEmpty()) {
            name = ctx.text(SyntaxNodes.firstChildOfType(fn, SIMPLE_IDENTIFIER));
        }
        if (name.isEmpty()) {
            return null;
        }
        return ctx.symbol(name, kind, signature(ctx, fn), fn, precedingDoc(ctx, fn, COMMENT_TYPES));
    }

    private @Nullable ParsedSymbol propertySymbol(ExtractionContext ctx, TSNode property) {
        var pattern = SyntaxNodes.findNodeRecursive(property, n -> PATTERN.equals(n.getType()));
        var ident = SyntaxNodes.findNodeRecursive(pattern, n -> SIMPLE_IDENTIFIER.equals(n.getType()));
        var name = ctx.text(ident);
        if (name.isEmpty()) {
            return null;
        }
        var text = ctx.text(property);
        var kind = text.contains("willSet") || text.contains("didSet")
                ? SymbolKinds.PROPERTY_OBSERVER
                : SymbolKinds.PROPERTY;
        return ctx.symbol(
                name,
                kind,
                Signatures.upTo(signature(ctx, property), '='),
                property,
                precedingDoc(ctx, property, COMMENT_TYPES));
    }

    private List<ParsedSymbol> enumCases(ExtractionContext ctx, TSNode entry) {
        var doc = precedingDoc(ctx, entry, COMMENT_TYPES);
        var cases = new ArrayList<ParsedSymbol>();
        var signature = Signatures.collapseWhitespace(ctx.text(entry));
        for (var ident : SyntaxNodes.childrenOfType(entry, Set.of(SIMPLE_IDENTIFIER))) {
            // span the whole entry; the identifier carries the node association
            cases.add(ctx.symbol(ctx.text(ident), SymbolKinds.ENUM_CASE, signature, ident, entry, doc));
        }
        return cases;
    }

    private static String declarationKeyword(TSNode decl) {
        for (var child : SyntaxNodes.children(decl)) {
            switch (child.getType()) {
                case CLASS_KEYWORD, STRUCT_KEYWORD, ENUM_KEYWORD, EXTENSION_KEYWORD, ACTOR_KEYWORD -> {
                    return child.getType();
                }
                default -> {}
            }
        }
        return CLASS_KEYWORD;
    }

    private static String extendedTypeName(ExtractionContext ctx, TSNode decl) {
        var name = SyntaxNodes.field(decl, "name");
        if (name == null) {
            name = SyntaxNodes.firstChildOfType(decl, USER_TYPE, TYPE_IDENTIFIER);
        }
        return Declarations.stripTypeArguments(ctx.text(name));
    }

    private static List<String> inheritedTypes(ExtractionContext ctx, TSNode decl) {
        var types = new ArrayList<String>();
        for (var spec : SyntaxNodes.childrenOfType(decl, Set.of(INHERITANCE_SPECIFIER))) {
            var type = SyntaxNodes.firstChildOfType(spec, USER_TYPE, TYPE_IDENTIFIER);
            var name = Declarations.stripTypeArguments(ctx.text(type != null ? type : spec));
            if (!name.isEmpty()) {
                types.add(name);
            }
        }
        return types;
    }

    private static boolean isStatic(ExtractionContext ctx, TSNode fn) {
        var text = ctx.text(fn);
        int func = text.indexOf("func ");
        if (func < 0) {
            return false;
        }
        for (var token : Signatures.collapseWhitespace(text.substring(0, func)).split(" ")) {
            if (token.equals("static") || token.equals("class")) {
                return true;
            }
        }
        return false;
    }

    private static String signature(ExtractionContext ctx, TSNode decl) {
        var attributes = new ArrayList<TSNode>(SyntaxNodes.childrenOfType(decl, Set.of(ATTRIBUTE)));
        var modifiers = SyntaxNodes.firstChildOfType(decl, MODIFIERS);
        attributes.addAll(SyntaxNodes.childrenOfType(modifiers, Set.of(ATTRIBUTE)));
        return Declarations.signatureWithAttributes(ctx, decl, attributes);
    }

    private void extractCalls(ExtractionContext ctx) {
        var callees = new ArrayList<TSNode>();
        for (var call : SyntaxNodes.findAllNodesByType(ctx.root(), CALL_EXPRESSION)) {
            var callee = call.getNamedChildCount() > 0 ? call.getNamedChild(0) : null;
            if (SyntaxNodes.isPresent(callee)) {
                callees.add(callee);
            }
        }
        recordCalls(ctx, callees, CALLER_TYPES);
    }
}
