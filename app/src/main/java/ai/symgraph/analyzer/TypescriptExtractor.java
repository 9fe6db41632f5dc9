package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.typescript.TypeScriptTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.javascript.JavaScriptTreeSitterNodeTypes;
import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * TypeScript: everything {@link JsExtractor} extracts, plus interfaces, type aliases, enums, abstract classes and
 * function overload signatures. Type annotations stay in signatures. A class's {@code implements} clause becomes
 * {@code implements} edges, an interface's {@code extends} clause becomes {@code extends} edges.
 */
public final class TypescriptExtractor extends JsExtractor {
    private static final Set<String> TYPE_REFERENCES = Set.of(TYPE_IDENTIFIER, NESTED_TYPE_IDENTIFIER, GENERIC_TYPE);

    public TypescriptExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.TYPESCRIPT;
    }

    @Override
    protected void declare(ExtractionContext ctx, TSNode node, TSNode outer) {
        switch (node.getType()) {
            case ABSTRACT_CLASS_DECLARATION -> addTopLevel(ctx, classSymbol(ctx, node, outer));
            case INTERFACE_DECLARATION -> addTopLevel(ctx, interfaceSymbol(ctx, node, outer));
            case TYPE_ALIAS_DECLARATION -> addTopLevel(ctx, typeAliasSymbol(ctx, node, outer));
            case ENUM_DECLARATION -> addTopLevel(ctx, enumSymbol(ctx, node, outer));
            case FUNCTION_SIGNATURE -> addTopLevel(
                    ctx, headerSymbol(ctx, node, outer, SymbolKinds.FUNCTION_DECLARATION));
            default -> super.declare(ctx, node, outer);
        }
    }

    private @Nullable ParsedSymbol headerSymbol(ExtractionContext ctx, TSNode node, TSNode outer, String kind) {
        var name = ctx.fieldText(node, "name");
        if (name.isEmpty()) {
            return null;
        }
        return ctx.symbol(name, kind, Signatures.headerUpToBody(ctx.text(outer)), node, outer, jsdoc(ctx, outer));
    }

    /** The whole alias is the signature; object types would otherwise be cut at their brace. */
    private @Nullable ParsedSymbol typeAliasSymbol(ExtractionContext ctx, TSNode alias, TSNode outer) {
        var name = ctx.fieldText(alias, "name");
        if (name.isEmpty()) {
            return null;
        }
        var signature = Signatures.collapseWhitespace(ctx.text(outer));
        if (signature.length() > MAX_FIELD_SIGNATURE) {
            signature = signature.substring(0, MAX_FIELD_SIGNATURE) + "...";
        }
        return ctx.symbol(name, SymbolKinds.TYPE, signature, alias, outer, jsdoc(ctx, outer));
    }

    private @Nullable ParsedSymbol interfaceSymbol(ExtractionContext ctx, TSNode iface, TSNode outer) {
        var symbol = headerSymbol(ctx, iface, outer, SymbolKinds.INTERFACE);
        if (symbol == null) {
            return null;
        }
        for (var clause : SyntaxNodes.childrenOfType(iface, Set.of(EXTENDS_TYPE_CLAUSE))) {
            recordTypeReferences(ctx, symbol.name(), clause, DependencyTypes.EXTENDS);
        }
        for (var member : SyntaxNodes.namedChildren(SyntaxNodes.field(iface, "body"))) {
            var child = memberSymbol(ctx, member);
            if (child != null) {
                symbol.addChild(child);
            }
        }
        return symbol;
    }

    private @Nullable ParsedSymbol enumSymbol(ExtractionContext ctx, TSNode enumNode, TSNode outer) {
        var symbol = headerSymbol(ctx, enumNode, outer, SymbolKinds.ENUM);
        if (symbol == null) {
            return null;
        }
        for (var member : SyntaxNodes.namedChildren(SyntaxNodes.field(enumNode, "body"))) {
            var nameNode = ENUM_ASSIGNMENT.equals(member.getType()) ? SyntaxNodes.field(member, "name") : member;
            if (nameNode == null || JavaScriptTreeSitterNodeTypes.COMMENT.equals(member.getType())) {
                continue;
            }
            var name = Signatures.stripQuotes(ctx.text(nameNode));
            symbol.addChild(ctx.symbol(
                    name,
                    SymbolKinds.ENUM_CONSTANT,
                    Signatures.collapseWhitespace(ctx.text(member)),
                    member,
                    jsdoc(ctx, member)));
        }
        return symbol;
    }

    /** {@code extends Base<T>, implements A, B}: the class clause is an expression, the implements clause types. */
    @Override
    protected void recordHeritage(ExtractionContext ctx, String className, TSNode heritage) {
        for (var clause : SyntaxNodes.namedChildren(heritage)) {
            switch (clause.getType()) {
                case EXTENDS_CLAUSE -> {
                    var base = SyntaxNodes.field(clause, "value");
                    if (base != null) {
                        ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, className, ctx.text(base)));
                    }
                }
                case IMPLEMENTS_CLAUSE -> recordTypeReferences(ctx, className, clause, DependencyTypes.IMPLEMENTS);
                default -> {}
            }
        }
    }

    private static void recordTypeReferences(ExtractionContext ctx, String source, TSNode clause, String type) {
        for (var ref : SyntaxNodes.namedChildren(clause)) {
            if (!TYPE_REFERENCES.contains(ref.getType())) {
                continue;
            }
            var target = GENERIC_TYPE.equals(ref.getType()) ? ctx.fieldText(ref, "name") : ctx.text(ref);
            if (!target.isEmpty()) {
                ctx.addDependency(ParsedDependency.of(type, source, target));
            }
        }
    }

    @Override
    protected @Nullable ParsedSymbol memberSymbol(ExtractionContext ctx, TSNode member) {
        return switch (member.getType()) {
            case PUBLIC_FIELD_DEFINITION, PROPERTY_SIGNATURE -> fieldSymbol(ctx, member, "name");
            case METHOD_SIGNATURE, ABSTRACT_METHOD_SIGNATURE -> methodSymbol(ctx, member);
            default -> super.memberSymbol(ctx, member);
        };
    }
}
