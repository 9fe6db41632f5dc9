package ai.symgraph.analyzer;

/**
 * Non-owning handle to a node of the syntax tree held by a {@link ParsedFile}. Only meaningful while that file's
 * tree is open; it carries no pointer into the tree itself.
 */
public record NodeRef(int startByte, int endByte, String nodeType) {}
