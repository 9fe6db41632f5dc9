package ai.symgraph.analyzer;

/** Arena holding a concrete syntax tree; owned by exactly one {@link ParsedFile}. */
public interface SyntaxTree extends AutoCloseable {
    boolean hasErrors();

    String rootType();

    /** Releases the tree. Any {@link NodeRef} taken from it is meaningless afterwards. Idempotent. */
    @Override
    void close();
}
