package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.Signatures;
import ai.symgraph.analyzer.treesitter.SyntaxNodes;
import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import ai.symgraph.analyzer.treesitter.TreeSitterTree;
import ai.symgraph.util.TextCanonicalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

/**
 * Language-agnostic extraction driver backed by Tree-sitter.
 *
 * <p>Reads the file, parses it and runs the subclass's {@link Step}s in order against the (possibly error-laden)
 * tree. A step that throws is logged and skipped; the next step still runs. Read failures and missing trees are
 * reported as errors alongside a minimal {@link ParsedFile}; recoverable syntax errors are reported alongside the
 * fully populated one.
 *
 * <p>Subclasses provide the language-specific bits: which grammar and which steps.
 */
public abstract class TreeSitterExtractor implements LanguageExtractor {
    protected static final Logger log = LoggerFactory.getLogger(TreeSitterExtractor.class);

    /** A named, independently failing unit of extraction work. */
    protected record Step(String name, Consumer<ExtractionContext> action) {}

    protected final SyntaxProvider provider;
    private final ExtractionSettings settings;

    protected TreeSitterExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        this.provider = provider;
        this.settings = settings;
    }

    protected static Step step(String name, Consumer<ExtractionContext> action) {
        return new Step(name, action);
    }

    /** Grammar used to parse; the extractor's own language unless it borrows another's. */
    protected Language grammar() {
        return language();
    }

    protected abstract List<Step> steps();

    @Override
    public ExtractionResult extract(SourceFile file) {
        byte[] bytes;
        try {
            long size = Files.size(file.absPath());
            if (size > settings.maxFileBytes()) {
                log.debug("Skipping {}: {} bytes exceeds limit of {}", file.path(), size, settings.maxFileBytes());
                return ExtractionResult.partial(
                        ParsedFile.minimal(file.path(), language()),
                        DetailedParseError.filesystem(
                                file.path(),
                                "file too large: " + size + " bytes (limit " + settings.maxFileBytes() + ")"));
            }
            bytes = readFileBytes(file);
        } catch (IOException | UncheckedIOException e) {
            var cause = e instanceof UncheckedIOException u ? u.getCause() : e;
            log.warn("Failed to read {}: {}", file.absPath(), cause.toString());
            return ExtractionResult.partial(
                    ParsedFile.minimal(file.path(), language()),
                    DetailedParseError.filesystem(file.path(), "failed to read file: " + cause.getMessage()));
        }
        return extract(file.path(), bytes);
    }

    /** Extracts from in-memory content that is reported under {@code path}. */
    public ExtractionResult extract(String path, byte[] rawContent) {
        var content = TextCanonicalizer.stripUtf8Bom(rawContent);
        var outcome = provider.parse(content, grammar());
        var tree = outcome.tree();
        if (tree == null) {
            var message = outcome.errorMessage().orElse("parser produced no tree");
            log.debug("No syntax tree for {}: {}", path, message);
            return ExtractionResult.partial(
                    new ParsedFile(path, language(), content, null), DetailedParseError.parse(path, message));
        }

        var parsed = new ParsedFile(path, language(), content, tree);
        var ctx = new ExtractionContext(parsed, tree, provider);
        for (var step : steps()) {
            runStep(step, ctx);
        }

        if (tree.hasErrors()) {
            return ExtractionResult.partial(parsed, syntaxError(path, tree));
        }
        return ExtractionResult.ok(parsed);
    }

    private void runStep(Step step, ExtractionContext ctx) {
        try {
            step.action().accept(ctx);
        } catch (RuntimeException e) {
            log.debug("Extraction step '{}' failed for {}; continuing", step.name(), ctx.path(), e);
        }
    }

    private DetailedParseError syntaxError(String path, TreeSitterTree tree) {
        var message = "syntax error in " + language().tag() + " file";
        return tree.firstErrorNode()
                .map(n -> DetailedParseError.parse(
                        path, n.getStartPoint().getRow() + 1, n.getStartPoint().getColumn() + 1, message))
                .orElseGet(() -> DetailedParseError.parse(path, message));
    }

    protected static byte[] readFileBytes(SourceFile file) {
        try {
            return Files.readAllBytes(file.absPath());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /* ---------- helpers shared by the language extractors ---------- */

    /** Cleaned text of the contiguous comments immediately preceding {@code node}, or null. */
    protected static @Nullable String precedingDoc(ExtractionContext ctx, TSNode node, Set<String> commentTypes) {
        return precedingDoc(ctx, node, commentTypes, Set.of());
    }

    /** As above, also reading trailing comments nested at the end of a preceding {@code containers} node. */
    protected static @Nullable String precedingDoc(
            ExtractionContext ctx, TSNode node, Set<String> commentTypes, Set<String> containers) {
        var comments = SyntaxNodes.precedingComments(node, n -> commentTypes.contains(n.getType()), containers);
        if (comments.isEmpty()) {
            return null;
        }
        var raw = new ArrayList<String>(comments.size());
        for (var comment : comments) {
            raw.add(ctx.text(comment));
        }
        return Docstrings.joinComments(raw);
    }

    /**
     * Records a {@code call} dependency for each target whose nearest recorded enclosing declaration is found. Targets
     * outside any recorded declaration are ignored.
     */
    protected static void recordCalls(ExtractionContext ctx, List<TSNode> targets, Set<String> callerTypes) {
        for (var target : targets) {
            var caller = ctx.enclosingSymbol(target, callerTypes);
            if (caller == null) {
                continue;
            }
            var callee = Signatures.collapseWhitespace(ctx.text(target));
            if (!callee.isEmpty()) {
                ctx.addDependency(ParsedDependency.of(DependencyTypes.CALL, caller.name(), callee));
            }
        }
    }

    /** Nodes captured under {@code captureName} by the named class-path query. */
    protected static List<TSNode> capturedNodes(ExtractionContext ctx, String queryName, String captureName) {
        var nodes = new ArrayList<TSNode>();
        for (var capture : ctx.namedQuery(queryName)) {
            if (capture.captureName().equals(captureName)) {
                nodes.add(capture.node());
            }
        }
        return nodes;
    }
}
