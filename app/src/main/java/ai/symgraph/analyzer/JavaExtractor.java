package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.java.JavaTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Java: package (declared, or inferred from the source path), imports, and type declarations named by their fully
 * qualified name. Members become children; nested types become children named {@code pkg.Outer.Inner}.
 */
public final class JavaExtractor extends TreeSitterExtractor {
    private static final Set<String> COMMENT_TYPES = Set.of(LINE_COMMENT, BLOCK_COMMENT);
    private static final Set<String> TYPE_DECLARATIONS = Set.of(
            CLASS_DECLARATION,
            INTERFACE_DECLARATION,
            ENUM_DECLARATION,
            RECORD_DECLARATION,
            ANNOTATION_TYPE_DECLARATION);
    private static final Set<String> CALLER_TYPES = Set.of(METHOD_DECLARATION, CONSTRUCTOR_DECLARATION);
    private static final Set<String> ANNOTATION_TYPES = Set.of(MARKER_ANNOTATION, ANNOTATION);

    public JavaExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("package", this::extractPackage),
                step("imports", this::extractImports),
                step("types", this::extractTypes),
                step("calls", this::extractCalls));
    }

    private void extractPackage(ExtractionContext ctx) {
        var decl = SyntaxNodes.firstChildOfType(ctx.root(), PACKAGE_DECLARATION);
        if (decl == null) {
            var inferred = Declarations.inferJvmPackage(ctx.path());
            ctx.setPackageName(inferred);
            if (!inferred.isEmpty()) {
                var symbol = new ParsedSymbol(
                        inferred, SymbolKinds.PACKAGE, "package " + inferred, ParsedSpan.EMPTY, null, null);
                ctx.addTopLevel(symbol);
            }
            return;
        }
        var nameNode = SyntaxNodes.firstChildOfType(decl, SCOPED_IDENTIFIER, "identifier");
        var name = ctx.text(nameNode);
        if (name.isEmpty()) {
            return;
        }
        ctx.setPackageName(name);
        ctx.addTopLevel(ctx.symbol(
                name, SymbolKinds.PACKAGE, "package " + name, decl, precedingDoc(ctx, decl, COMMENT_TYPES)));
    }

    private void extractImports(ExtractionContext ctx) {
        for (var decl : SyntaxNodes.childrenOfType(ctx.root(), Set.of(IMPORT_DECLARATION))) {
            var nameNode = SyntaxNodes.firstChildOfType(decl, SCOPED_IDENTIFIER, "identifier");
            var path = ctx.text(nameNode);
            if (path.isEmpty()) {
                continue;
            }
            if (SyntaxNodes.hasChildOfType(decl, ASTERISK)) {
                path = path + ".*";
            }
            boolean external = ImportClassifier.isExternal(path, Language.JAVA, ctx.packageName());
            ctx.addDependency(ParsedDependency.importOf("", path, path, external));
        }
    }

    private void extractTypes(ExtractionContext ctx) {
        for (var decl : SyntaxNodes.childrenOfType(ctx.root(), TYPE_DECLARATIONS)) {
            var symbol = typeSymbol(ctx, decl, ctx.packageName());
            if (symbol != null) {
                ctx.addTopLevel(symbol);
            }
        }
    }

    private @Nullable ParsedSymbol typeSymbol(ExtractionContext ctx, TSNode decl, String scope) {
        var simpleName = ctx.fieldText(decl, "name");
        if (simpleName.isEmpty()) {
            return null;
        }
        var fqName = scope.isEmpty() ? simpleName : scope + "." + simpleName;
        var kind = switch (decl.getType()) {
            case INTERFACE_DECLARATION -> SymbolKinds.INTERFACE;
            case ENUM_DECLARATION -> SymbolKinds.ENUM;
            case RECORD_DECLARATION -> SymbolKinds.RECORD;
            case ANNOTATION_TYPE_DECLARATION -> SymbolKinds.ANNOTATION;
            default -> SymbolKinds.CLASS;
        };
        var symbol = ctx.symbol(fqName, kind, signature(ctx, decl), decl, precedingDoc(ctx, decl, COMMENT_TYPES));

        addSupertypes(ctx, decl, fqName);

        var body = SyntaxNodes.field(decl, "body");
        if (body == null) {
            return symbol;
        }
        if (ENUM_BODY.equals(body.getType())) {
            for (var constant : SyntaxNodes.childrenOfType(body, Set.of(ENUM_CONSTANT))) {
                var name = ctx.fieldText(constant, "name");
                if (!name.isEmpty()) {
                    symbol.addChild(ctx.symbol(
                            name,
                            SymbolKinds.ENUM_CONSTANT,
                            Signatures.collapseWhitespace(ctx.text(constant)),
                            constant,
                            precedingDoc(ctx, constant, COMMENT_TYPES)));
                }
            }
            addMembers(ctx, symbol, SyntaxNodes.firstChildOfType(body, ENUM_BODY_DECLARATIONS), fqName);
        } else {
            addMembers(ctx, symbol, body, fqName);
        }
        return symbol;
    }

    private void addSupertypes(ExtractionContext ctx, TSNode decl, String fqName) {
        var superclass = SyntaxNodes.field(decl, "superclass");
        for (var type : SyntaxNodes.namedChildren(superclass)) {
            ctx.addDependency(ParsedDependency.of(
                    DependencyTypes.EXTENDS, fqName, Declarations.stripTypeArguments(ctx.text(type))));
        }
        var interfaces = SyntaxNodes.firstChildOfType(decl, SUPER_INTERFACES);
        for (var type : SyntaxNodes.namedChildren(SyntaxNodes.firstChildOfType(interfaces, TYPE_LIST))) {
            ctx.addDependency(ParsedDependency.of(
                    DependencyTypes.IMPLEMENTS, fqName, Declarations.stripTypeArguments(ctx.text(type))));
        }
        var extendsInterfaces = SyntaxNodes.firstChildOfType(decl, EXTENDS_INTERFACES);
        for (var type : SyntaxNodes.namedChildren(SyntaxNodes.firstChildOfType(extendsInterfaces, TYPE_LIST))) {
            ctx.addDependency(ParsedDependency.of(
                    DependencyTypes.EXTENDS, fqName, Declarations.stripTypeArguments(ctx.text(type))));
        }
    }

    private void addMembers(ExtractionContext ctx, ParsedSymbol owner, @Nullable TSNode body, String fqName) {
        for (var member : SyntaxNodes.namedChildren(body)) {
            var doc = precedingDoc(ctx, member, COMMENT_TYPES);
            switch (member.getType()) {
                case METHOD_DECLARATION, ANNOTATION_TYPE_ELEMENT_DECLARATION -> {
                    var name = ctx.fieldText(member, "name");
                    if (!name.isEmpty()) {
                        owner.addChild(ctx.symbol(name, SymbolKinds.METHOD, signature(ctx, member), member, doc));
                    }
                }
                case CONSTRUCTOR_DECLARATION, COMPACT_CONSTRUCTOR_DECLARATION -> {
                    var name = ctx.fieldText(member, "name");
                    if (!name.isEmpty()) {
                        owner.addChild(
                                ctx.symbol(name, SymbolKinds.CONSTRUCTOR, signature(ctx, member), member, doc));
                    }
                }
                case FIELD_DECLARATION, CONSTANT_DECLARATION -> {
                    var signature = signature(ctx, member);
                    for (var declarator : SyntaxNodes.childrenOfType(member, Set.of(VARIABLE_DECLARATOR))) {
                        var name = ctx.fieldText(declarator, "name");
                        if (!name.isEmpty()) {
                            owner.addChild(
                                    ctx.symbol(name, SymbolKinds.FIELD, signature, declarator, member, doc));
                        }
                    }
                }
                default -> {
                    if (TYPE_DECLARATIONS.contains(member.getType())) {
                        var nested = typeSymbol(ctx, member, fqName);
                        if (nested != null) {
                            owner.addChild(nested);
                        }
                    }
                }
            }
        }
    }

    private static String signature(ExtractionContext ctx, TSNode decl) {
        var modifiers = SyntaxNodes.firstChildOfType(decl, MODIFIERS);
        var annotations = SyntaxNodes.childrenOfType(modifiers, ANNOTATION_TYPES);
        return Declarations.signatureWithAttributes(ctx, decl, annotations);
    }

    private void extractCalls(ExtractionContext ctx) {
        var targets = capturedNodes(ctx, "calls", "call.target");
        for (var target : targets) {
            var caller = ctx.enclosingSymbol(target, CALLER_TYPES);
            if (caller != null) {
                ctx.addDependency(ParsedDependency.of(
                        DependencyTypes.CALL, caller.name(), Declarations.stripTypeArguments(ctx.text(target))));
            }
        }
    }
}
