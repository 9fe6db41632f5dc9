package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Python: module docstring, imports, functions, classes and their methods. Docstrings come from the first string
 * statement of a body; decorators are prepended to signatures and classify {@code @staticmethod} and
 * {@code @classmethod} methods.
 */
public final class PythonExtractor extends TreeSitterExtractor {
    public static final String MODULE_SYMBOL = "__module__";

    private static final Set<String> CALLER_TYPES = Set.of(FUNCTION_DEFINITION);
    private static final Set<String> DEFINITION_TYPES = Set.of(FUNCTION_DEFINITION, CLASS_DEFINITION);

    public PythonExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("module docstring", this::extractModuleDocstring),
                step("imports", this::extractImports),
                step("definitions", this::extractDefinitions),
                step("calls", this::extractCalls));
    }

    /** Dotted module path of a file, e.g. {@code pkg.sub.mod} for {@code pkg/sub/mod.py}. */
    static String modulePath(String path) {
        var p = path.replace('\\', '/');
        int dot = p.lastIndexOf('.');
        if (dot > p.lastIndexOf('/')) {
            p = p.substring(0, dot);
        }
        while (p.startsWith("./") || p.startsWith("/")) {
            p = p.substring(p.indexOf('/') + 1);
        }
        return p.replace('/', '.');
    }

    private void extractModuleDocstring(ExtractionContext ctx) {
        var first = firstStatement(ctx.root());
        var string = docstringNode(first);
        if (string == null) {
            return;
        }
        var doc = Docstrings.stripStringQuotes(ctx.text(string));
        ctx.addTopLevel(ctx.symbol(MODULE_SYMBOL, SymbolKinds.MODULE, "", string, doc));
    }

    private void extractImports(ExtractionContext ctx) {
        var context = modulePath(ctx.path());
        for (var stmt : SyntaxNodes.namedChildren(ctx.root())) {
            switch (stmt.getType()) {
                case IMPORT_STATEMENT -> {
                    for (var name : SyntaxNodes.namedChildren(stmt)) {
                        var dotted = ALIASED_IMPORT.equals(name.getType()) ? SyntaxNodes.field(name, "name") : name;
                        if (dotted != null && DOTTED_NAME.equals(dotted.getType())) {
                            addImport(ctx, ctx.text(dotted), context);
                        }
                    }
                }
                case IMPORT_FROM_STATEMENT -> {
                    var module = SyntaxNodes.field(stmt, "module_name");
                    if (module != null) {
                        addImport(ctx, ctx.text(module), context);
                    }
                }
                case FUTURE_IMPORT_STATEMENT -> addImport(ctx, "__future__", context);
                default -> {}
            }
        }
    }

    private static void addImport(ExtractionContext ctx, String rawPath, String context) {
        var path = Signatures.collapseWhitespace(rawPath).replace(" ", "");
        if (path.isEmpty()) {
            return;
        }
        boolean external = ImportClassifier.isExternal(path, Language.PYTHON, context);
        ctx.addDependency(ParsedDependency.importOf("", path, path, external));
    }

    private void extractDefinitions(ExtractionContext ctx) {
        for (var stmt : SyntaxNodes.namedChildren(ctx.root())) {
            var def = unwrapDecorated(stmt);
            if (def == null) {
                continue;
            }
            if (FUNCTION_DEFINITION.equals(def.getType())) {
                var symbol = functionSymbol(ctx, stmt, def, false);
                if (symbol != null) ctx.addTopLevel(symbol);
            } else if (CLASS_DEFINITION.equals(def.getType())) {
                var symbol = classSymbol(ctx, stmt, def);
                if (symbol != null) ctx.addTopLevel(symbol);
            }
        }
    }

    private @Nullable ParsedSymbol classSymbol(ExtractionContext ctx, TSNode outer, TSNode classDef) {
        var name = ctx.fieldText(classDef, "name");
        if (name.isEmpty()) {
            return null;
        }
        var body = SyntaxNodes.field(classDef, "body");
        var signature = withDecorators(ctx, outer, Signatures.upTo(ctx.text(classDef), ':'));
        var symbol = ctx.symbol(name, SymbolKinds.CLASS, signature, classDef, outer, bodyDocstring(ctx, body));

        var bases = SyntaxNodes.field(classDef, "superclasses");
        for (var base : SyntaxNodes.namedChildren(bases)) {
            if (IDENTIFIER.equals(base.getType()) || ATTRIBUTE.equals(base.getType())) {
                ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, ctx.text(base)));
            }
        }

        for (var member : SyntaxNodes.namedChildren(body)) {
            var def = unwrapDecorated(member);
            // nested classes are not members
            if (def != null && FUNCTION_DEFINITION.equals(def.getType())) {
                var method = functionSymbol(ctx, member, def, true);
                if (method != null) symbol.addChild(method);
            }
        }
        return symbol;
    }

    private @Nullable ParsedSymbol functionSymbol(ExtractionContext ctx, TSNode outer, TSNode fn, boolean isMethod) {
        var name = ctx.fieldText(fn, "name");
        if (name.isEmpty()) {
            return null;
        }
        var decorators = decoratorNames(ctx, outer);
        boolean async = SyntaxNodes.hasChildOfType(fn, ASYNC);
        String kind;
        if (!isMethod) {
            kind = async ? SymbolKinds.ASYNC_FUNCTION : SymbolKinds.FUNCTION;
        } else if (decorators.contains("staticmethod")) {
            kind = SymbolKinds.STATIC_METHOD;
        } else if (decorators.contains("classmethod")) {
            kind = SymbolKinds.CLASS_METHOD;
        } else {
            kind = async ? SymbolKinds.ASYNC_METHOD : SymbolKinds.METHOD;
        }
        var signature = withDecorators(ctx, outer, Signatures.upTo(ctx.text(fn), ':'));
        return ctx.symbol(name, kind, signature, fn, outer, bodyDocstring(ctx, SyntaxNodes.field(fn, "body")));
    }

    private static @Nullable TSNode unwrapDecorated(TSNode node) {
        if (DEFINITION_TYPES.contains(node.getType())) {
            return node;
        }
        if (DECORATED_DEFINITION.equals(node.getType())) {
            return SyntaxNodes.field(node, "definition");
        }
        return null;
    }

    private static List<String> decoratorNames(ExtractionContext ctx, TSNode outer) {
        var names = new ArrayList<String>();
        for (var decorator : SyntaxNodes.childrenOfType(outer, Set.of(DECORATOR))) {
            var text = ctx.text(decorator).strip();
            if (text.startsWith("@")) {
                text = text.substring(1).strip();
            }
            int paren = text.indexOf('(');
            names.add(paren >= 0 ? text.substring(0, paren) : text);
        }
        return names;
    }

    private static String withDecorators(ExtractionContext ctx, TSNode outer, String header) {
        var decorators = SyntaxNodes.childrenOfType(outer, Set.of(DECORATOR));
        if (decorators.isEmpty()) {
            return header;
        }
        var lines = new ArrayList<String>();
        for (var decorator : decorators) {
            lines.add(Signatures.collapseWhitespace(ctx.text(decorator)));
        }
        lines.add(header);
        return String.join("\n", lines);
    }

    private static @Nullable String bodyDocstring(ExtractionContext ctx, @Nullable TSNode body) {
        var string = docstringNode(firstStatement(body));
        return string == null ? null : Docstrings.stripStringQuotes(ctx.text(string));
    }

    private static @Nullable TSNode firstStatement(@Nullable TSNode block) {
        for (var child : SyntaxNodes.namedChildren(block)) {
            if (!COMMENT.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static @Nullable TSNode docstringNode(@Nullable TSNode statement) {
        if (statement == null || !EXPRESSION_STATEMENT.equals(statement.getType())) {
            return null;
        }
        var expr = SyntaxNodes.namedChildren(statement);
        if (expr.size() == 1 && STRING.equals(expr.get(0).getType())) {
            return expr.get(0);
        }
        return null;
    }

    private void extractCalls(ExtractionContext ctx) {
        recordCalls(ctx, capturedNodes(ctx, "calls", "call.target"), CALLER_TYPES);
    }
}
