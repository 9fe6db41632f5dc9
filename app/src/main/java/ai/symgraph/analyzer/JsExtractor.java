package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * JavaScript: ES module and CommonJS imports, top-level functions (declared, or bound to a {@code const}/{@code let}/
 * {@code var}), classes with their methods and fields, and calls.
 *
 * <p>A declaration wrapped in {@code export} is extracted like an unwrapped one, with the {@code export} keyword kept
 * in its signature and span. Any other export statement ({@code export { a, b }}, {@code export default expr}) becomes
 * an {@link SymbolKinds#EXPORT} symbol named {@value #EXPORT_SYMBOL}. JSDoc is read from the comments directly above a
 * declaration or above the export wrapping it.
 */
public class JsExtractor extends TreeSitterExtractor {
    public static final String EXPORT_SYMBOL = "export";

    static final int MAX_FIELD_SIGNATURE = 100;

    private static final Set<String> COMMENT_TYPES = Set.of(COMMENT);
    private static final Set<String> CALLER_TYPES = Set.of(
            FUNCTION_DECLARATION,
            GENERATOR_FUNCTION_DECLARATION,
            FUNCTION_EXPRESSION,
            FUNCTION,
            GENERATOR_FUNCTION,
            ARROW_FUNCTION,
            METHOD_DEFINITION);
    private static final Set<String> FUNCTION_VALUES =
            Set.of(FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION, ARROW_FUNCTION);

    public JsExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.JAVASCRIPT;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("imports", this::extractImports),
                step("declarations", this::extractDeclarations),
                step("calls", this::extractCalls));
    }

    private void extractImports(ExtractionContext ctx) {
        for (var capture : ctx.namedQuery("imports")) {
            var node = capture.node();
            if (capture.captureName().equals("require.path") && !isRequireArgument(ctx, node)) {
                continue;
            }
            var path = Signatures.stripQuotes(ctx.text(node));
            if (!path.isEmpty()) {
                boolean external = ImportClassifier.isExternal(path, language(), ctx.path());
                ctx.addDependency(ParsedDependency.importOf("", path, path, external));
            }
        }
    }

    private static boolean isRequireArgument(ExtractionContext ctx, TSNode argument) {
        var call = SyntaxNodes.ancestorOfType(argument, Set.of(CALL_EXPRESSION));
        return call != null && "require".equals(ctx.fieldText(call, "function"));
    }

    private void extractDeclarations(ExtractionContext ctx) {
        for (var stmt : SyntaxNodes.namedChildren(ctx.root())) {
            if (!EXPORT_STATEMENT.equals(stmt.getType())) {
                declare(ctx, stmt, stmt);
                continue;
            }
            var declaration = SyntaxNodes.field(stmt, "declaration");
            if (declaration != null) {
                declare(ctx, declaration, stmt);
            } else {
                var signature = Signatures.firstLine(ctx.text(stmt));
                ctx.addTopLevel(ctx.symbol(EXPORT_SYMBOL, SymbolKinds.EXPORT, signature, stmt, jsdoc(ctx, stmt)));
            }
        }
    }

    /**
     * Adds the top-level symbols declared by {@code node}. {@code outer} is the statement that carries the doc comment
     * and the span: the export statement when the declaration is exported, the node itself otherwise.
     */
    protected void declare(ExtractionContext ctx, TSNode node, TSNode outer) {
        switch (node.getType()) {
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION -> addTopLevel(ctx, functionSymbol(ctx, node, outer));
            case LEXICAL_DECLARATION, VARIABLE_DECLARATION -> {
                for (var declarator : SyntaxNodes.childrenOfType(node, Set.of(VARIABLE_DECLARATOR))) {
                    addTopLevel(ctx, boundFunctionSymbol(ctx, node, declarator, outer));
                }
            }
            case CLASS_DECLARATION -> addTopLevel(ctx, classSymbol(ctx, node, outer));
            default -> {}
        }
    }

    protected static void addTopLevel(ExtractionContext ctx, @Nullable ParsedSymbol symbol) {
        if (symbol != null) {
            ctx.addTopLevel(symbol);
        }
    }

    private @Nullable ParsedSymbol functionSymbol(ExtractionContext ctx, TSNode fn, TSNode outer) {
        var name = ctx.fieldText(fn, "name");
        if (name.isEmpty()) {
            return null;
        }
        String kind;
        if (GENERATOR_FUNCTION_DECLARATION.equals(fn.getType())) {
            kind = SymbolKinds.GENERATOR_FUNCTION;
        } else {
            kind = isAsync(fn) ? SymbolKinds.ASYNC_FUNCTION : SymbolKinds.FUNCTION;
        }
        var signature = Signatures.headerUpToBody(ctx.text(outer));
        return ctx.symbol(name, kind, signature, fn, outer, jsdoc(ctx, outer));
    }

    /** {@code const name = function/arrow}; declarators bound to anything else are not symbols. */
    private @Nullable ParsedSymbol boundFunctionSymbol(
            ExtractionContext ctx, TSNode declaration, TSNode declarator, TSNode outer) {
        var name = SyntaxNodes.field(declarator, "name");
        var value = SyntaxNodes.field(declarator, "value");
        if (name == null || value == null || !IDENTIFIER.equals(name.getType())
                || !FUNCTION_VALUES.contains(value.getType())) {
            return null;
        }
        boolean async = isAsync(value);
        var kind = switch (value.getType()) {
            case ARROW_FUNCTION -> async ? SymbolKinds.ASYNC_ARROW_FUNCTION : SymbolKinds.ARROW_FUNCTION;
            case GENERATOR_FUNCTION -> SymbolKinds.GENERATOR_FUNCTION;
            default -> async ? SymbolKinds.ASYNC_FUNCTION : SymbolKinds.FUNCTION;
        };

        var keywords = SyntaxNodes.children(declaration);
        var keyword = keywords.isEmpty() ? "" : ctx.text(keywords.get(0)) + " ";
        var exported = SyntaxNodes.sameNode(outer, declaration) ? "" : "export ";
        var signature = exported + keyword + ctx.text(name) + " = " + Signatures.headerUpToBody(ctx.text(value));
        return ctx.symbol(ctx.text(name), kind, signature, value, outer, jsdoc(ctx, outer));
    }

    protected @Nullable ParsedSymbol classSymbol(ExtractionContext ctx, TSNode cls, TSNode outer) {
        var name = ctx.fieldText(cls, "name");
        if (name.isEmpty()) {
            return null;
        }
        var signature = Signatures.headerUpToBody(ctx.text(outer));
        var symbol = ctx.symbol(name, SymbolKinds.CLASS, signature, cls, outer, jsdoc(ctx, outer));
        for (var heritage : SyntaxNodes.childrenOfType(cls, Set.of(CLASS_HERITAGE))) {
            recordHeritage(ctx, name, heritage);
        }
        for (var member : SyntaxNodes.namedChildren(SyntaxNodes.field(cls, "body"))) {
            var child = memberSymbol(ctx, member);
            if (child != null) {
                symbol.addChild(child);
            }
        }
        return symbol;
    }

    /** JavaScript heritage is a single {@code extends <expression>}. */
    protected void recordHeritage(ExtractionContext ctx, String className, TSNode heritage) {
        for (var base : SyntaxNodes.namedChildren(heritage)) {
            if (IDENTIFIER.equals(base.getType()) || MEMBER_EXPRESSION.equals(base.getType())) {
                ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, className, ctx.text(base)));
            }
        }
    }

    protected @Nullable ParsedSymbol memberSymbol(ExtractionContext ctx, TSNode member) {
        return switch (member.getType()) {
            case METHOD_DEFINITION -> methodSymbol(ctx, member);
            case FIELD_DEFINITION -> fieldSymbol(ctx, member, "property");
            default -> null;
        };
    }

    protected @Nullable ParsedSymbol methodSymbol(ExtractionContext ctx, TSNode method) {
        var name = ctx.fieldText(method, "name");
        if (name.isEmpty()) {
            return null;
        }
        String kind;
        if ("constructor".equals(name)) {
            kind = SymbolKinds.CONSTRUCTOR;
        } else if (SyntaxNodes.hasChildOfType(method, STATIC)) {
            kind = SymbolKinds.STATIC_METHOD;
        } else if (isAsync(method)) {
            kind = SymbolKinds.ASYNC_METHOD;
        } else {
            kind = SymbolKinds.METHOD;
        }
        return ctx.symbol(name, kind, Signatures.headerUpToBody(ctx.text(method)), method, jsdoc(ctx, method));
    }

    /** Fields keep their initializer in the signature, cut at {@value #MAX_FIELD_SIGNATURE} characters. */
    protected @Nullable ParsedSymbol fieldSymbol(ExtractionContext ctx, TSNode field, String nameField) {
        var name = ctx.fieldText(field, nameField);
        if (name.isEmpty()) {
            return null;
        }
        var kind = SyntaxNodes.hasChildOfType(field, STATIC) ? SymbolKinds.STATIC_PROPERTY : SymbolKinds.PROPERTY;
        var signature = Signatures.collapseWhitespace(ctx.text(field));
        if (signature.length() > MAX_FIELD_SIGNATURE) {
            signature = signature.substring(0, MAX_FIELD_SIGNATURE) + "...";
        }
        return ctx.symbol(name, kind, signature, field, jsdoc(ctx, field));
    }

    protected static boolean isAsync(TSNode node) {
        return SyntaxNodes.hasChildOfType(node, ASYNC);
    }

    protected static @Nullable String jsdoc(ExtractionContext ctx, TSNode node) {
        return precedingDoc(ctx, node, COMMENT_TYPES);
    }

    private void extractCalls(ExtractionContext ctx) {
        recordCalls(ctx, capturedNodes(ctx, "calls", "call.target"), CALLER_TYPES);
    }
}
