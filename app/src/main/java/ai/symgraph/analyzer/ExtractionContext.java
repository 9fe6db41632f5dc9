package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.QueryCapture;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import ai.symgraph.analyzer.treesitter.TreeSitterQueries;
import ai.symgraph.analyzer.treesitter.TreeSitterTree;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * State of one extraction call: the file being populated, its tree, and the association from tree nodes to the
 * symbols created for them. Confined to the thread running the extraction and discarded when it returns.
 */
public final class ExtractionContext {
    private final ParsedFile file;
    private final TreeSitterTree tree;
    private final SyntaxProvider provider;
    private final Map<NodeRef, ParsedSymbol> symbolsByNode = new HashMap<>();
    private String packageName = "";

    ExtractionContext(ParsedFile file, TreeSitterTree tree, SyntaxProvider provider) {
        this.file = file;
        this.tree = tree;
        this.provider = provider;
    }

    public ParsedFile file() {
        return file;
    }

    public String path() {
        return file.path();
    }

    public TreeSitterTree tree() {
        return tree;
    }

    public TSNode root() {
        return tree.root();
    }

    public String text(@Nullable TSNode node) {
        return tree.text(node);
    }

    /** Text of the child stored under {@code field}, or empty. */
    public String fieldText(TSNode node, String field) {
        return tree.text(SyntaxNodes.field(node, field));
    }

    /** Runs the named class-path query for the tree's grammar, e.g. {@code treesitter/go/calls.scm}. */
    public List<QueryCapture> namedQuery(String name) {
        return provider.query(tree, TreeSitterQueries.load(tree.language(), name));
    }

    public String packageName() {
        return packageName;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    /** {@code package.name} when a package is known, {@code name} otherwise. */
    public String qualify(String name) {
        return packageName.isEmpty() ? name : packageName + "." + name;
    }

    /** Creates a symbol spanning {@code node} and remembers it as that node's symbol. */
    public ParsedSymbol symbol(String name, String kind, String signature, TSNode node, @Nullable String docstring) {
        var ref = tree.ref(node);
        var symbol = new ParsedSymbol(name, kind, signature, tree.span(node), docstring, ref);
        symbolsByNode.putIfAbsent(ref, symbol);
        return symbol;
    }

    /** Creates a symbol whose span is {@code spanNode} but that is associated with {@code node}. */
    public ParsedSymbol symbol(
            String name, String kind, String signature, TSNode node, TSNode spanNode, @Nullable String docstring) {
        var ref = tree.ref(node);
        var symbol = new ParsedSymbol(name, kind, signature, tree.span(spanNode), docstring, ref);
        symbolsByNode.putIfAbsent(ref, symbol);
        return symbol;
    }

    public void addTopLevel(ParsedSymbol symbol) {
        file.addSymbol(symbol);
    }

    public void addDependency(ParsedDependency dependency) {
        file.addDependency(dependency);
    }

    public @Nullable ParsedSymbol symbolAt(TSNode node) {
        return symbolsByNode.get(tree.ref(node));
    }

    /**
     * Nearest ancestor of {@code node} whose type is one of {@code declarationTypes} and that has a recorded symbol.
     * Unrecorded declarations (skipped local or nested ones) are walked through.
     */
    public @Nullable ParsedSymbol enclosingSymbol(TSNode node, Set<String> declarationTypes) {
        for (var ancestor : SyntaxNodes.ancestorsOfType(node, declarationTypes)) {
            var symbol = symbolAt(ancestor);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }
}
