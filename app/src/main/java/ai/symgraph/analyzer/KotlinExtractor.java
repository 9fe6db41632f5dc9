package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.kotlin.KotlinTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Kotlin: package and imports as for Java; classes, data classes, enums, interfaces and objects named by their
 * fully qualified name with property and method children; top-level functions (plain, {@code suspend} or extension)
 * and properties, also package-qualified.
 */
public final class KotlinExtractor extends TreeSitterExtractor {
    private static final Set<String> COMMENT_TYPES = Set.of(COMMENT, LINE_COMMENT, MULTILINE_COMMENT);
    // a KDoc right after the package line or the imports is parsed as the last child of those nodes
    private static final Set<String> HEADER_CONTAINERS = Set.of(PACKAGE_HEADER, IMPORT_LIST, IMPORT_HEADER);
    private static final Set<String> CALLER_TYPES = Set.of(FUNCTION_DECLARATION, SECONDARY_CONSTRUCTOR);
    private static final Set<String> TYPE_DECLARATIONS = Set.of(CLASS_DECLARATION, OBJECT_DECLARATION);

    public KotlinExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.KOTLIN;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("package", this::extractPackage),
                step("imports", this::extractImports),
                step("declarations", this::extractDeclarations),
                step("calls", this::extractCalls));
    }

    private void extractPackage(ExtractionContext ctx) {
        var header = SyntaxNodes.firstChildOfType(ctx.root(), PACKAGE_HEADER);
        var name = Signatures.collapseWhitespace(ctx.text(SyntaxNodes.firstChildOfType(header, IDENTIFIER)));
        if (header == null || name.isEmpty()) {
            var inferred = Declarations.inferJvmPackage(ctx.path());
            ctx.setPackageName(inferred);
            if (!inferred.isEmpty()) {
                ctx.addTopLevel(new ParsedSymbol(
                        inferred, SymbolKinds.PACKAGE, "package " + inferred, ParsedSpan.EMPTY, null, null));
            }
            return;
        }
        ctx.setPackageName(name);
        ctx.addTopLevel(ctx.symbol(
                name, SymbolKinds.PACKAGE, "package " + name, header, kdoc(ctx, header)));
    }

    private void extractImports(ExtractionContext ctx) {
        for (var header : SyntaxNodes.findAllNodesByType(ctx.root(), IMPORT_HEADER)) {
            var path = Signatures.collapseWhitespace(ctx.text(SyntaxNodes.firstChildOfType(header, IDENTIFIER)));
            if (path.isEmpty()) {
                continue;
            }
            if (SyntaxNodes.hasChildOfType(header, WILDCARD_IMPORT) || ctx.text(header).trim().endsWith("*")) {
                path = path + ".*";
            }
            boolean external = ImportClassifier.isExternal(path, Language.KOTLIN, ctx.packageName());
            ctx.addDependency(ParsedDependency.importOf("", path, path, external));
        }
    }

    private void extractDeclarations(ExtractionContext ctx) {
        for (var node : SyntaxNodes.namedChildren(ctx.root())) {
            if (TYPE_DECLARATIONS.contains(node.getType())) {
                var symbol = typeSymbol(ctx, node, ctx.packageName());
                if (symbol != null) ctx.addTopLevel(symbol);
            } else if (FUNCTION_DECLARATION.equals(node.getType())) {
                var symbol = functionSymbol(ctx, node, false);
                if (symbol != null) ctx.addTopLevel(symbol);
            } else if (PROPERTY_DECLARATION.equals(node.getType())) {
                var symbol = propertySymbol(ctx, node, true);
                if (symbol != null) ctx.addTopLevel(symbol);
            }
        }
    }

    private @Nullable ParsedSymbol typeSymbol(ExtractionContext ctx, TSNode decl, String scope) {
        var simpleName = ctx.text(SyntaxNodes.firstChildOfType(decl, TYPE_IDENTIFIER));
        if (simpleName.isEmpty()) {
            return null;
        }
        var fqName = scope.isEmpty() ? simpleName : scope + "." + simpleName;
        var symbol = ctx.symbol(
                fqName, typeKind(ctx, decl), signature(ctx, decl), decl, kdoc(ctx, decl));

        for (var supertype : supertypes(ctx, decl)) {
            ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, fqName, supertype));
        }

        var body = SyntaxNodes.firstChildOfType(decl, CLASS_BODY, ENUM_CLASS_BODY);
        for (var member : SyntaxNodes.namedChildren(body)) {
            ParsedSymbol child = switch (member.getType()) {
                case FUNCTION_DECLARATION -> functionSymbol(ctx, member, true);
                case PROPERTY_DECLARATION -> propertySymbol(ctx, member, false);
                case ENUM_ENTRY -> enumEntry(ctx, member);
                case CLASS_DECLARATION, OBJECT_DECLARATION -> typeSymbol(ctx, member, fqName);
                default -> null;
            };
            if (child != null) {
                symbol.addChild(child);
            }
        }
        return symbol;
    }

    private static String typeKind(ExtractionContext ctx, TSNode decl) {
        if (OBJECT_DECLARATION.equals(decl.getType())) {
            return SymbolKinds.OBJECT;
        }
        if (SyntaxNodes.hasChildOfType(decl, INTERFACE_KEYWORD)) {
            return SymbolKinds.INTERFACE;
        }
        var modifiers = SyntaxNodes.firstChildOfType(decl, MODIFIERS);
        for (var modifier : SyntaxNodes.childrenOfType(modifiers, Set.of(CLASS_MODIFIER))) {
            switch (ctx.text(modifier).trim()) {
                case "data" -> {
                    return SymbolKinds.DATA_CLASS;
                }
                case "enum" -> {
                    return SymbolKinds.ENUM;
                }
                default -> {}
            }
        }
        return SymbolKinds.CLASS;
    }

    private static List<String> supertypes(ExtractionContext ctx, TSNode decl) {
        var specifiers = new ArrayList<TSNode>(SyntaxNodes.childrenOfType(decl, Set.of(DELEGATION_SPECIFIER)));
        var grouped = SyntaxNodes.firstChildOfType(decl, DELEGATION_SPECIFIERS);
        specifiers.addAll(SyntaxNodes.childrenOfType(grouped, Set.of(DELEGATION_SPECIFIER)));
        var names = new ArrayList<String>();
        for (var specifier : specifiers) {
            var userType = SyntaxNodes.findNodeRecursive(specifier, n -> USER_TYPE.equals(n.getType()));
            var text = Declarations.stripTypeArguments(ctx.text(userType != null ? userType : specifier));
            if (!text.isEmpty()) {
                names.add(text);
            }
        }
        return names;
    }

    private @Nullable ParsedSymbol functionSymbol(ExtractionContext ctx, TSNode fn, boolean isMember) {
        var name = ctx.text(SyntaxNodes.firstChildOfType(fn, SIMPLE_IDENTIFIER));
        if (name.isEmpty()) {
            return null;
        }
        boolean suspend = hasModifier(ctx, fn, "suspend");
        String kind;
        if (isMember) {
            kind = suspend ? SymbolKinds.SUSPEND_METHOD : SymbolKinds.METHOD;
        } else if (suspend) {
            kind = SymbolKinds.SUSPEND_FUNCTION;
        } else if (isExtension(ctx, fn)) {
            kind = SymbolKinds.EXTENSION_FUNCTION;
        } else {
            kind = SymbolKinds.FUNCTION;
        }
        var symbolName = isMember ? name : ctx.qualify(name);
        return ctx.symbol(symbolName, kind, signature(ctx, fn), fn, kdoc(ctx, fn));
    }

    private @Nullable ParsedSymbol propertySymbol(ExtractionContext ctx, TSNode property, boolean topLevel) {
        var declaration = SyntaxNodes.firstChildOfType(property, VARIABLE_DECLARATION);
        var name = ctx.text(SyntaxNodes.firstChildOfType(declaration, SIMPLE_IDENTIFIER));
        if (name.isEmpty()) {
            return null;
        }
        return ctx.symbol(
                topLevel ? ctx.qualify(name) : name,
                SymbolKinds.PROPERTY,
                Signatures.upTo(signature(ctx, property), '='),
                property,
                kdoc(ctx, property));
    }

    private static @Nullable ParsedSymbol enumEntry(ExtractionContext ctx, TSNode entry) {
        var name = ctx.text(SyntaxNodes.firstChildOfType(entry, SIMPLE_IDENTIFIER));
        if (name.isEmpty()) {
            return null;
        }
        return ctx.symbol(
                name,
                SymbolKinds.ENUM_CONSTANT,
                Signatures.collapseWhitespace(ctx.text(entry)),
                entry,
                kdoc(ctx, entry));
    }

    private static boolean hasModifier(ExtractionContext ctx, TSNode decl, String modifier) {
        var modifiers = SyntaxNodes.firstChildOfType(decl, MODIFIERS);
        if (modifiers == null) {
            return false;
        }
        for (var token : Signatures.collapseWhitespace(ctx.text(modifiers)).split(" ")) {
            if (token.equals(modifier)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExtension(ExtractionContext ctx, TSNode fn) {
        if (SyntaxNodes.hasChildOfType(fn, RECEIVER_TYPE)) {
            return true;
        }
        // grammars without receiver_type: "fun Type.name(" has a dot before the parameter list
        var text = ctx.text(fn);
        int fun = text.indexOf("fun ");
        int paren = text.indexOf('(');
        if (fun < 0 || paren < fun) {
            return false;
        }
        var head = text.substring(fun + 4, paren);
        int gt = head.lastIndexOf('>');
        return head.substring(gt + 1).contains(".");
    }

    private static String signature(ExtractionContext ctx, TSNode decl) {
        var modifiers = SyntaxNodes.firstChildOfType(decl, MODIFIERS);
        var annotations = SyntaxNodes.childrenOfType(modifiers, Set.of(ANNOTATION));
        return Declarations.signatureWithAttributes(ctx, decl, annotations);
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

    private static @Nullable String kdoc(ExtractionContext ctx, TSNode node) {
        return precedingDoc(ctx, node, COMMENT_TYPES, HEADER_CONTAINERS);
    }
}
