package ai.symgraph.analyzer.treesitter;

import ai.symgraph.analyzer.Language;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSParser;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;
import org.treesitter.TSTree;

/**
 * {@link SyntaxProvider} backed by the Tree-sitter runtime. Grammar handles are shared; parsers and compiled queries
 * are confined to the thread that created them, so one instance can serve any number of workers.
 */
public final class TreeSitterSyntaxProvider implements SyntaxProvider {
    private static final Logger log = LoggerFactory.getLogger(TreeSitterSyntaxProvider.class);

    static final String EMPTY_CONTENT = "empty content";
    static final String NO_TREE = "parser produced no tree";
    static final String TREE_HAS_ERRORS = "parse tree contains errors";

    private final ThreadLocal<Map<Language, TSParser>> parsers =
            ThreadLocal.withInitial(() -> new EnumMap<>(Language.class));
    private final ThreadLocal<Map<String, TSQuery>> queries = ThreadLocal.withInitial(HashMap::new);

    @Override
    public ParseOutcome parse(byte[] content, Language language) {
        if (content.length == 0) {
            return ParseOutcome.failed(EMPTY_CONTENT);
        }
        var parser = parserFor(language);
        TSTree tsTree = parser.parseString(null, new String(content, StandardCharsets.UTF_8));
        if (tsTree == null || tsTree.getRootNode() == null || tsTree.getRootNode().isNull()) {
            log.warn("Parsing produced no root node for {} content of {} bytes", language, content.length);
            return ParseOutcome.failed(NO_TREE);
        }
        var tree = new TreeSitterTree(tsTree, content, language);
        if (tree.hasErrors()) {
            log.trace("Parse tree for {} content contains errors", language);
            return new ParseOutcome(tree, TREE_HAS_ERRORS);
        }
        return new ParseOutcome(tree, null);
    }

    @Override
    public List<QueryCapture> query(TreeSitterTree tree, String pattern) {
        var query = queryFor(tree.language(), pattern);
        var cursor = new TSQueryCursor();
        cursor.exec(query, tree.root());

        var captures = new ArrayList<QueryCapture>();
        var match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            for (TSQueryCapture capture : match.getCaptures()) {
                var node = capture.getNode();
                if (node == null || node.isNull()) {
                    continue;
                }
                captures.add(new QueryCapture(
                        node, capture.getIndex(), query.getCaptureNameForId(capture.getIndex()), match.getId()));
            }
        }
        return captures;
    }

    private TSParser parserFor(Language language) {
        return parsers.get().computeIfAbsent(language, lang -> {
            var parser = new TSParser();
            if (!parser.setLanguage(Grammars.forLanguage(lang))) {
                throw new IllegalStateException("Failed to set language on TSParser for " + lang);
            }
            log.debug("Created parser for {} on thread {}", lang, Thread.currentThread().getName());
            return parser;
        });
    }

    private TSQuery queryFor(Language language, String pattern) {
        var key = language.tag() + '\u0000' + pattern;
        var cache = queries.get();
        var query = cache.get(key);
        if (query == null) {
            query = new TSQuery(Grammars.forLanguage(language), pattern);
            cache.put(key, query);
        }
        return query;
    }
}
