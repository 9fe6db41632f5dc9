package ai.symgraph.analyzer.treesitter;

import ai.symgraph.analyzer.Language;
import java.util.List;

/** Turns bytes into concrete syntax trees and answers structural pattern queries over them. */
public interface SyntaxProvider {

    /**
     * Parses {@code content} with the grammar of {@code language}. Never throws for malformed input: a tree that
     * contains error nodes is returned together with an error message, and a missing tree is reported through
     * {@link ParseOutcome#error()} alone.
     */
    ParseOutcome parse(byte[] content, Language language);

    /**
     * Runs a structural pattern over {@code tree}.
     *
     * @return captures ordered by match, then by position within the match
     * @throws org.treesitter.TSQueryException if the pattern does not compile against the tree's grammar
     */
    List<QueryCapture> query(TreeSitterTree tree, String pattern);
}
