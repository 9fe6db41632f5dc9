package ai.symgraph.analyzer.treesitter;

import ai.symgraph.analyzer.Language;
import ai.symgraph.analyzer.NodeRef;
import ai.symgraph.analyzer.ParsedSpan;
import ai.symgraph.analyzer.SyntaxTree;
import ai.symgraph.util.TextCanonicalizer;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A parsed tree together with the exact bytes it was parsed from. Node text is sliced from those bytes using the
 * node's UTF-8 byte offsets.
 */
public final class TreeSitterTree implements SyntaxTree {
    private @Nullable TSTree tree;
    private final byte[] content;
    private final Language language;

    TreeSitterTree(TSTree tree, byte[] content, Language language) {
        this.tree = tree;
        this.content = content;
        this.language = language;
    }

    public Language language() {
        return language;
    }

    public TSNode root() {
        var t = tree;
        if (t == null) {
            throw new IllegalStateException("Syntax tree has been closed");
        }
        return t.getRootNode();
    }

    @Override
    public boolean hasErrors() {
        return tree != null && root().hasError();
    }

    @Override
    public String rootType() {
        return root().getType();
    }

    /** First ERROR or MISSING node in document order, if any. */
    public Optional<TSNode> firstErrorNode() {
        if (!hasErrors()) {
            return Optional.empty();
        }
        return Optional.ofNullable(
                SyntaxNodes.findNodeRecursive(root(), n -> "ERROR".equals(n.getType()) || n.isMissing()));
    }

    /** Source text of {@code node}; empty for null or out-of-range nodes. */
    public String text(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return slice(node.getStartByte(), node.getEndByte());
    }

    public String slice(int startByte, int endByte) {
        return TextCanonicalizer.sliceUtf8(content, startByte, endByte);
    }

    public NodeRef ref(TSNode node) {
        return new NodeRef(node.getStartByte(), node.getEndByte(), node.getType());
    }

    public ParsedSpan span(TSNode node) {
        return new ParsedSpan(
                node.getStartPoint().getRow() + 1,
                node.getEndPoint().getRow() + 1,
                node.getStartByte(),
                node.getEndByte());
    }

    /** Drops the native tree; it is reclaimed by the Tree-sitter runtime once unreachable. */
    @Override
    public void close() {
        tree = null;
    }
}
