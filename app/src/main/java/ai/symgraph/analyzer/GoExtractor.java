package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.go.GoTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Go: a {@code package} marker, imports, free functions, receiver methods and type declarations (structs with their
 * fields, interfaces with their method sets, everything else as {@code type}). Names are bare.
 */
public final class GoExtractor extends TreeSitterExtractor {
    private static final Set<String> COMMENT_TYPES = Set.of(COMMENT);
    private static final Set<String> CALLER_TYPES = Set.of(FUNCTION_DECLARATION, METHOD_DECLARATION);

    public GoExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.GO;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("package", this::extractPackage),
                step("imports", this::extractImports),
                step("functions", this::extractFunctions),
                step("methods", this::extractMethods),
                step("types", this::extractTypes),
                step("calls", this::extractCalls));
    }

    private void extractPackage(ExtractionContext ctx) {
        var clause = SyntaxNodes.firstChildOfType(ctx.root(), PACKAGE_CLAUSE);
        var ident = SyntaxNodes.firstChildOfType(clause, PACKAGE_IDENTIFIER);
        if (clause == null || ident == null) {
            return;
        }
        var name = ctx.text(ident);
        ctx.setPackageName(name);
        var symbol = ctx.symbol(
                name, SymbolKinds.PACKAGE, "package " + name, ident, precedingDoc(ctx, clause, COMMENT_TYPES));
        ctx.addTopLevel(symbol);
    }

    private void extractImports(ExtractionContext ctx) {
        for (var pathNode : capturedNodes(ctx, "imports", "import.path")) {
            var path = Signatures.stripQuotes(ctx.text(pathNode));
            if (path.isEmpty()) {
                continue;
            }
            boolean external = ImportClassifier.isExternal(path, Language.GO, "");
            ctx.addDependency(ParsedDependency.importOf(ctx.packageName(), path, path, external));
        }
    }

    private void extractFunctions(ExtractionContext ctx) {
        for (var fn : SyntaxNodes.childrenOfType(ctx.root(), Set.of(FUNCTION_DECLARATION))) {
            var name = ctx.fieldText(fn, "name");
            if (name.isEmpty()) {
                continue;
            }
            ctx.addTopLevel(ctx.symbol(
                    name,
                    SymbolKinds.FUNCTION,
                    Signatures.headerUpToBody(ctx.text(fn)),
                    fn,
                    precedingDoc(ctx, fn, COMMENT_TYPES)));
        }
    }

    private void extractMethods(ExtractionContext ctx) {
        for (var method : SyntaxNodes.childrenOfType(ctx.root(), Set.of(METHOD_DECLARATION))) {
            var name = ctx.fieldText(method, "name");
            if (name.isEmpty()) {
                continue;
            }
            ctx.addTopLevel(ctx.symbol(
                    name,
                    SymbolKinds.METHOD,
                    Signatures.headerUpToBody(ctx.text(method)),
                    method,
                    precedingDoc(ctx, method, COMMENT_TYPES)));
        }
    }

    private void extractTypes(ExtractionContext ctx) {
        for (var decl : SyntaxNodes.childrenOfType(ctx.root(), Set.of(TYPE_DECLARATION))) {
            var specs = SyntaxNodes.childrenOfType(decl, Set.of(TYPE_SPEC, TYPE_ALIAS));
            for (var spec : specs) {
                // A lone spec is documented by the comment above "type"; grouped specs carry their own.
                var docAnchor = specs.size() == 1 ? decl : spec;
                var symbol = typeSymbol(ctx, spec, precedingDoc(ctx, docAnchor, COMMENT_TYPES));
                if (symbol != null) {
                    ctx.addTopLevel(symbol);
                }
            }
        }
    }

    private @Nullable ParsedSymbol typeSymbol(ExtractionContext ctx, TSNode spec, @Nullable String doc) {
        var name = ctx.fieldText(spec, "name");
        if (name.isEmpty()) {
            return null;
        }
        var type = SyntaxNodes.field(spec, "type");
        var typeKind = type == null ? "" : type.getType();
        if (STRUCT_TYPE.equals(typeKind)) {
            var symbol = ctx.symbol(name, SymbolKinds.STRUCT, "type " + name + " struct", spec, doc);
            addStructFields(ctx, symbol, type);
            return symbol;
        }
        if (INTERFACE_TYPE.equals(typeKind)) {
            var symbol = ctx.symbol(name, SymbolKinds.INTERFACE, "type " + name + " interface", spec, doc);
            addInterfaceMethods(ctx, symbol, type);
            return symbol;
        }
        return ctx.symbol(name, SymbolKinds.TYPE, "type " + Signatures.collapseWhitespace(ctx.text(spec)), spec, doc);
    }

    private void addStructFields(ExtractionContext ctx, ParsedSymbol struct, TSNode structType) {
        var list = SyntaxNodes.firstChildOfType(structType, FIELD_DECLARATION_LIST);
        for (var field : SyntaxNodes.childrenOfType(list, Set.of(FIELD_DECLARATION))) {
            var typeText = Signatures.collapseWhitespace(ctx.fieldText(field, "type"));
            var doc = precedingDoc(ctx, field, COMMENT_TYPES);
            var names = SyntaxNodes.childrenOfType(field, Set.of(FIELD_IDENTIFIER));
            if (names.isEmpty()) {
                // embedded field: the type is the name
                var embedded = typeText.startsWith("*") ? typeText.substring(1) : typeText;
                if (!embedded.isEmpty()) {
                    struct.addChild(ctx.symbol(embedded, SymbolKinds.FIELD, typeText, field, doc));
                }
                continue;
            }
            for (var nameNode : names) {
                var fieldName = ctx.text(nameNode);
                struct.addChild(ctx.symbol(
                        fieldName, SymbolKinds.FIELD, (fieldName + " " + typeText).trim(), nameNode, field, doc));
            }
        }
    }

    private void addInterfaceMethods(ExtractionContext ctx, ParsedSymbol iface, TSNode interfaceType) {
        for (var elem : SyntaxNodes.childrenOfType(interfaceType, Set.of(METHOD_ELEM, METHOD_SPEC))) {
            var name = ctx.fieldText(elem, "name");
            if (name.isEmpty()) {
                continue;
            }
            iface.addChild(ctx.symbol(
                    name,
                    SymbolKinds.METHOD,
                    Signatures.collapseWhitespace(ctx.text(elem)),
                    elem,
                    precedingDoc(ctx, elem, COMMENT_TYPES)));
        }
    }

    private void extractCalls(ExtractionContext ctx) {
        recordCalls(ctx, capturedNodes(ctx, "calls", "call.target"), CALLER_TYPES);
    }
}
