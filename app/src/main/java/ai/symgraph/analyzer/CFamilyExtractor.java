package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.cpp.CppTreeSitterNodeTypes.*;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Shared walker for the C and C++ grammars.
 *
 * <p>Namespace, {@code extern "C"} and conditional-compilation bodies are flattened: their declarations are reported
 * at top level under bare names, and a namespace gets a marker symbol of its own. Out-of-line member definitions keep
 * their qualified {@code Class::member} name. Calls are only recorded for implementation files.
 */
abstract class CFamilyExtractor extends TreeSitterExtractor {
    private static final Set<String> CALLER_TYPES = Set.of(FUNCTION_DEFINITION);
    private static final Set<String> TRANSPARENT_CONTAINERS =
            Set.of(LINKAGE_SPECIFICATION, PREPROC_IF, PREPROC_IFDEF, PREPROC_ELSE, PREPROC_ELIF, DECLARATION_LIST);
    private static final Set<String> WRAPPING_DECLARATORS =
            Set.of(POINTER_DECLARATOR, REFERENCE_DECLARATOR, PARENTHESIZED_DECLARATOR, INIT_DECLARATOR);
    private static final Set<String> MEMBER_TYPES = Set.of(FUNCTION_DEFINITION, FIELD_DECLARATION, DECLARATION);
    private static final Set<String> RECORD_SPECIFIERS = Set.of(CLASS_SPECIFIER, STRUCT_SPECIFIER);
    private static final Pattern VIRTUAL = Pattern.compile("\\bvirtual\\b");

    protected CFamilyExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    protected List<Step> steps() {
        return List.of(
                step("includes", this::extractIncludes),
                step("declarations", ctx -> walkScope(ctx, ctx.root())),
                step("calls", this::extractCalls));
    }

    private void extractIncludes(ExtractionContext ctx) {
        for (var pathNode : capturedNodes(ctx, "includes", "include.path")) {
            var path = Signatures.stripQuotes(ctx.text(pathNode));
            if (path.isEmpty()) {
                continue;
            }
            boolean external = ImportClassifier.isExternal(path, language(), ctx.path());
            ctx.addDependency(ParsedDependency.importOf("", path, path, external));
        }
    }

    private void walkScope(ExtractionContext ctx, TSNode scope) {
        for (var node : SyntaxNodes.namedChildren(scope)) {
            switch (node.getType()) {
                case NAMESPACE_DEFINITION -> namespace(ctx, node);
                case FUNCTION_DEFINITION -> topLevelFunction(ctx, node, node, false);
                case TEMPLATE_DECLARATION -> template(ctx, node);
                case DECLARATION -> topLevelDeclaration(ctx, node);
                case TYPE_DEFINITION -> typedef(ctx, node);
                case ALIAS_DECLARATION -> alias(ctx, node);
                case CLASS_SPECIFIER, STRUCT_SPECIFIER, ENUM_SPECIFIER -> addType(ctx, node, node, null, false);
                default -> {
                    if (TRANSPARENT_CONTAINERS.contains(node.getType())) {
                        walkScope(ctx, node);
                    }
                }
            }
        }
    }

    private void namespace(ExtractionContext ctx, TSNode ns) {
        var name = Signatures.collapseWhitespace(ctx.fieldText(ns, "name"));
        if (!name.isEmpty()) {
            ctx.addTopLevel(ctx.symbol(name, SymbolKinds.NAMESPACE, "namespace " + name, ns, doxygen(ctx, ns)));
        }
        walkScope(ctx, SyntaxNodes.field(ns, "body"));
    }

    private void template(ExtractionContext ctx, TSNode template) {
        for (var inner : SyntaxNodes.namedChildren(template)) {
            switch (inner.getType()) {
                case FUNCTION_DEFINITION -> topLevelFunction(ctx, inner, template, true);
                case CLASS_SPECIFIER, STRUCT_SPECIFIER -> addType(ctx, inner, template, null, true);
                case DECLARATION -> {
                    var type = SyntaxNodes.field(inner, "type");
                    if (type != null && RECORD_SPECIFIERS.contains(type.getType())) {
                        addType(ctx, type, template, null, true);
                    } else if (functionDeclarator(SyntaxNodes.field(inner, "declarator")) != null) {
                        addFunctionDeclaration(ctx, inner, template);
                    }
                }
                default -> {}
            }
        }
    }

    private void topLevelFunction(ExtractionContext ctx, TSNode fn, TSNode outer, boolean isTemplate) {
        var declarator = functionDeclarator(SyntaxNodes.field(fn, "declarator"));
        if (declarator == null) {
            return;
        }
        var nameNode = SyntaxNodes.field(declarator, "declarator");
        var name = Signatures.collapseWhitespace(ctx.text(nameNode));
        if (name.isEmpty()) {
            return;
        }
        String kind;
        if (nameNode != null && QUALIFIED_IDENTIFIER.equals(nameNode.getType())) {
            kind = outOfLineKind(nameNode, name);
        } else if (isTemplate) {
            kind = SymbolKinds.FUNCTION_TEMPLATE;
        } else if (nameNode != null && OPERATOR_NAME.equals(nameNode.getType())) {
            kind = SymbolKinds.OPERATOR;
        } else if (hasStorageClass(ctx, fn, "static")) {
            kind = SymbolKinds.STATIC_FUNCTION;
        } else if (hasStorageClass(ctx, fn, "inline")) {
            kind = SymbolKinds.INLINE_FUNCTION;
        } else {
            kind = SymbolKinds.FUNCTION;
        }
        ctx.addTopLevel(ctx.symbol(
                name, kind, Signatures.headerUpToBody(ctx.text(outer)), fn, outer, doxygen(ctx, outer)));
    }

    /** Kind of a {@code Class::member} definition. */
    private static String outOfLineKind(TSNode qualified, String name) {
        var last = name.substring(name.lastIndexOf("::") + 2);
        var scope = name.substring(0, name.lastIndexOf("::"));
        var owner = scope.substring(scope.lastIndexOf("::") + 1);
        var leaf = SyntaxNodes.findNodeRecursive(qualified, n -> OPERATOR_NAME.equals(n.getType()));
        if (last.startsWith("~")) {
            return SymbolKinds.DESTRUCTOR;
        }
        if (leaf != null) {
            return SymbolKinds.OPERATOR;
        }
        return Declarations.stripTypeArguments(owner).equals(last) ? SymbolKinds.CONSTRUCTOR : SymbolKinds.METHOD;
    }

    private void topLevelDeclaration(ExtractionContext ctx, TSNode decl) {
        var type = SyntaxNodes.field(decl, "type");
        if (type != null && (RECORD_SPECIFIERS.contains(type.getType()) || ENUM_SPECIFIER.equals(type.getType()))) {
            addType(ctx, type, decl, null, false);
        }
        if (functionDeclarator(SyntaxNodes.field(decl, "declarator")) != null) {
            addFunctionDeclaration(ctx, decl, decl);
        }
    }

    private void addFunctionDeclaration(ExtractionContext ctx, TSNode decl, TSNode outer) {
        var declarator = functionDeclarator(SyntaxNodes.field(decl, "declarator"));
        var name = Signatures.collapseWhitespace(ctx.text(SyntaxNodes.field(declarator, "declarator")));
        if (name.isEmpty()) {
            return;
        }
        ctx.addTopLevel(ctx.symbol(
                name,
                SymbolKinds.FUNCTION_DECLARATION,
                Signatures.headerUpToBody(ctx.text(outer)),
                decl,
                outer,
                doxygen(ctx, outer)));
    }

    private void typedef(ExtractionContext ctx, TSNode typedef) {
        var alias = Signatures.collapseWhitespace(ctx.fieldText(typedef, "declarator"));
        var type = SyntaxNodes.field(typedef, "type");
        if (type != null && SyntaxNodes.isPresent(SyntaxNodes.field(type, "body"))) {
            addType(ctx, type, typedef, alias, false);
            return;
        }
        if (!alias.isEmpty() && functionDeclarator(SyntaxNodes.field(typedef, "declarator")) == null) {
            ctx.addTopLevel(ctx.symbol(
                    alias,
                    SymbolKinds.TYPE,
                    Signatures.headerUpToBody(ctx.text(typedef)),
                    typedef,
                    doxygen(ctx, typedef)));
        }
    }

    private void alias(ExtractionContext ctx, TSNode alias) {
        var name = ctx.fieldText(alias, "name");
        if (!name.isEmpty()) {
            ctx.addTopLevel(ctx.symbol(
                    name, SymbolKinds.TYPE, Signatures.headerUpToBody(ctx.text(alias)), alias, doxygen(ctx, alias)));
        }
    }

    /**
     * Records a class, struct or enum that has a body. {@code outer} is the node carrying the span and comments (the
     * specifier itself, or the declaration/typedef/template wrapping it).
     */
    private void addType(
            ExtractionContext ctx, TSNode spec, TSNode outer, @Nullable String fallbackName, boolean isTemplate) {
        var body = SyntaxNodes.field(spec, "body");
        if (!SyntaxNodes.isPresent(body)) {
            return;
        }
        var name = Signatures.collapseWhitespace(ctx.fieldText(spec, "name"));
        if (name.isEmpty()) {
            name = fallbackName == null ? "" : fallbackName;
        }
        if (name.isEmpty()) {
            return;
        }
        var symbol = ctx.symbol(
                name, typeKind(spec, isTemplate), typeSignature(ctx, spec, outer), spec, outer, doxygen(ctx, outer));

        if (ENUM_SPECIFIER.equals(spec.getType())) {
            for (var enumerator : SyntaxNodes.childrenOfType(body, Set.of(ENUMERATOR))) {
                var constant = ctx.fieldText(enumerator, "name");
                if (!constant.isEmpty()) {
                    symbol.addChild(ctx.symbol(
                            constant,
                            SymbolKinds.ENUM_CONSTANT,
                            Signatures.collapseWhitespace(ctx.text(enumerator)),
                            enumerator,
                            doxygen(ctx, enumerator)));
                }
            }
        } else {
            for (var base : baseClasses(ctx, spec)) {
                ctx.addDependency(ParsedDependency.of(DependencyTypes.EXTENDS, name, base));
            }
            addMembers(ctx, symbol, body, Declarations.stripTypeArguments(name));
        }
        ctx.addTopLevel(symbol);
    }

    private static String typeKind(TSNode spec, boolean isTemplate) {
        if (isTemplate) {
            return SymbolKinds.CLASS_TEMPLATE;
        }
        return switch (spec.getType()) {
            case CLASS_SPECIFIER -> SymbolKinds.CLASS;
            case ENUM_SPECIFIER -> SymbolKinds.ENUM;
            default -> SymbolKinds.STRUCT;
        };
    }

    private static String typeSignature(ExtractionContext ctx, TSNode spec, TSNode outer) {
        var body = SyntaxNodes.field(spec, "body");
        int end = body != null ? body.getStartByte() : spec.getEndByte();
        return Signatures.collapseWhitespace(ctx.tree().slice(outer.getStartByte(), end));
    }

    private static List<String> baseClasses(ExtractionContext ctx, TSNode spec) {
        var clause = SyntaxNodes.firstChildOfType(spec, BASE_CLASS_CLAUSE);
        var bases = new ArrayList<String>();
        for (var child : SyntaxNodes.namedChildren(clause)) {
            if (ACCESS_SPECIFIER.equals(child.getType()) || VIRTUAL_SPECIFIER.equals(child.getType())) {
                continue;
            }
            var base = Declarations.stripTypeArguments(ctx.text(child));
            if (!base.isEmpty() && !base.equals("virtual")) {
                bases.add(base);
            }
        }
        return bases;
    }

    private void addMembers(ExtractionContext ctx, ParsedSymbol owner, TSNode body, String ownerName) {
        for (var member : SyntaxNodes.namedChildren(body)) {
            switch (member.getType()) {
                case FUNCTION_DEFINITION, FIELD_DECLARATION, DECLARATION ->
                        addMember(ctx, owner, member, member, ownerName);
                case TEMPLATE_DECLARATION -> {
                    for (var inner : SyntaxNodes.namedChildren(member)) {
                        if (MEMBER_TYPES.contains(inner.getType())) {
                            addMember(ctx, owner, inner, member, ownerName);
                        }
                    }
                }
                default -> {}
            }
        }
    }

    private void addMember(ExtractionContext ctx, ParsedSymbol owner, TSNode member, TSNode outer, String ownerName) {
        var doc = doxygen(ctx, outer);
        var signature = Signatures.headerUpToBody(ctx.text(outer));
        for (var child : SyntaxNodes.namedChildren(member)) {
            var target = unwrapDeclarator(child);
            if (target == null) {
                continue;
            }
            if (FUNCTION_DECLARATOR.equals(target.getType())) {
                var nameNode = SyntaxNodes.field(target, "declarator");
                if (nameNode != null && PARENTHESIZED_DECLARATOR.equals(nameNode.getType())) {
                    // function pointer member: void (*callback)(int);
                    var pointer = SyntaxNodes.findNodeRecursive(nameNode, n -> FIELD_IDENTIFIER.equals(n.getType()));
                    if (pointer != null) {
                        var field = ctx.text(pointer);
                        owner.addChild(ctx.symbol(field, SymbolKinds.FIELD, signature, pointer, outer, doc));
                    }
                    return;
                }
                var name = Signatures.collapseWhitespace(ctx.text(nameNode));
                if (!name.isEmpty()) {
                    var kind = memberKind(nameNode, name, ownerName, signature, target);
                    owner.addChild(ctx.symbol(name, kind, signature, member, outer, doc));
                }
                // a member declaration holds at most one function declarator
                return;
            }
            if (FIELD_IDENTIFIER.equals(target.getType()) && FIELD_DECLARATION.equals(member.getType())) {
                owner.addChild(ctx.symbol(ctx.text(target), SymbolKinds.FIELD, signature, target, outer, doc));
            }
        }
    }

    private static String memberKind(
            @Nullable TSNode nameNode, String name, String ownerName, String signature, TSNode declarator) {
        if (name.startsWith("~") || (nameNode != null && DESTRUCTOR_NAME.equals(nameNode.getType()))) {
            return SymbolKinds.DESTRUCTOR;
        }
        if (nameNode != null && OPERATOR_NAME.equals(nameNode.getType())) {
            return SymbolKinds.OPERATOR;
        }
        if (name.equals(ownerName)) {
            return SymbolKinds.CONSTRUCTOR;
        }
        if (VIRTUAL.matcher(signature).find() || SyntaxNodes.hasChildOfType(declarator, VIRTUAL_SPECIFIER)) {
            return SymbolKinds.VIRTUAL_METHOD;
        }
        return SymbolKinds.METHOD;
    }

    /** The function declarator inside {@code declarator}, looking through pointer/reference/init wrappers. */
    private static @Nullable TSNode functionDeclarator(@Nullable TSNode declarator) {
        var target = unwrapDeclarator(declarator);
        return target != null && FUNCTION_DECLARATOR.equals(target.getType()) ? target : null;
    }

    private static @Nullable TSNode unwrapDeclarator(@Nullable TSNode declarator) {
        var current = declarator;
        while (SyntaxNodes.isPresent(current) && WRAPPING_DECLARATORS.contains(current.getType())) {
            var inner = SyntaxNodes.field(current, "declarator");
            if (inner == null) {
                int count = current.getNamedChildCount();
                inner = count > 0 ? current.getNamedChild(count - 1) : null;
            }
            current = inner;
        }
        if (!SyntaxNodes.isPresent(current)) {
            return null;
        }
        var type = current.getType();
        if (FUNCTION_DECLARATOR.equals(type) || FIELD_IDENTIFIER.equals(type) || ARRAY_DECLARATOR.equals(type)) {
            return ARRAY_DECLARATOR.equals(type) ? unwrapArray(current) : current;
        }
        return null;
    }

    private static @Nullable TSNode unwrapArray(TSNode array) {
        var inner = SyntaxNodes.field(array, "declarator");
        return inner != null && FIELD_IDENTIFIER.equals(inner.getType()) ? inner : null;
    }

    private static boolean hasStorageClass(ExtractionContext ctx, TSNode decl, String storage) {
        for (var spec : SyntaxNodes.childrenOfType(decl, Set.of(STORAGE_CLASS_SPECIFIER))) {
            if (ctx.text(spec).trim().equals(storage)) {
                return true;
            }
        }
        return false;
    }

    /** Doxygen comment ({@code /**}, {@code /*!}, {@code ///}, {@code //!}) directly above {@code node}. */
    protected static @Nullable String doxygen(ExtractionContext ctx, TSNode node) {
        var comments = SyntaxNodes.precedingComments(node, n -> COMMENT.equals(n.getType()));
        var raw = new ArrayList<String>();
        for (var comment : comments) {
            var text = ctx.text(comment);
            if (text.startsWith("/**") || text.startsWith("/*!") || text.startsWith("///")
                    || text.startsWith("//!")) {
                raw.add(text);
            }
        }
        return Docstrings.joinComments(raw);
    }

    private void extractCalls(ExtractionContext ctx) {
        if (Language.isHeaderPath(ctx.path())) {
            return;
        }
        recordCalls(ctx, capturedNodes(ctx, "calls", "call.target"), CALLER_TYPES);
    }
}
