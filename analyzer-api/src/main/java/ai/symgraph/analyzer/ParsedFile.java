package ai.symgraph.analyzer;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * Extraction result for a single source file: its content, the syntax tree it was parsed into and the symbols and
 * dependencies found in it.
 *
 * <p>A {@code ParsedFile} exists as soon as extraction of a file starts, so callers always get one back, even when
 * the file could not be read or parsed. The only mutation after an extractor returns is the cross-reference pass
 * appending dependencies via {@link #addDependency(ParsedDependency)}.
 */
public final class ParsedFile {
    private static final byte[] NO_CONTENT = new byte[0];

    private final String path;
    private Language language;
    private final byte[] content;
    private final String checksum;
    private @Nullable SyntaxTree tree;
    private final List<ParsedSymbol> symbols = new ArrayList<>();
    private final List<ParsedDependency> dependencies = new ArrayList<>();

    public ParsedFile(String path, Language language, byte[] content, @Nullable SyntaxTree tree) {
        this.path = Objects.requireNonNull(path, "path");
        this.language = Objects.requireNonNull(language, "language");
        this.content = content.clone();
        this.checksum = checksumOf(this.content);
        this.tree = tree;
    }

    /** A file carrying only its identity, used when the content could not be read. */
    public static ParsedFile minimal(String path, Language language) {
        return new ParsedFile(path, language, NO_CONTENT, null);
    }

    public static String checksumOf(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }

    public String path() {
        return path;
    }

    public Language language() {
        return language;
    }

    /** Re-tags the file, used when one language's extractor stands in for another. */
    public void relabel(Language language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public byte[] content() {
        return content.clone();
    }

    public String contentText() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int contentLength() {
        return content.length;
    }

    public String checksum() {
        return checksum;
    }

    public Optional<SyntaxTree> tree() {
        return Optional.ofNullable(tree);
    }

    /** Closes and drops the syntax tree. Symbol node handles must not be used afterwards. */
    public void releaseTree() {
        var t = tree;
        tree = null;
        if (t != null) {
            t.close();
        }
    }

    public List<ParsedSymbol> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    public List<ParsedDependency> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Appends a file-scope symbol.
     *
     * @throws IllegalArgumentException if the symbol is owned by another symbol
     */
    public void addSymbol(ParsedSymbol symbol) {
        if (symbol.hasParent()) {
            throw new IllegalArgumentException("Symbol " + symbol.name() + " is a child and cannot be top-level");
        }
        symbols.add(symbol);
    }

    public void addDependency(ParsedDependency dependency) {
        dependencies.add(Objects.requireNonNull(dependency, "dependency"));
    }

    /** All symbols including nested children, depth-first. */
    public Stream<ParsedSymbol> allSymbols() {
        return symbols.stream().flatMap(s -> s.flatten().stream());
    }

    public List<ParsedDependency> dependenciesOfType(String type) {
        return dependencies.stream().filter(d -> d.type().equals(type)).toList();
    }

    public Optional<ParsedSymbol> findSymbol(String name) {
        return allSymbols().filter(s -> s.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "ParsedFile[" + path + " (" + language + "), symbols=" + symbols.size() + ", dependencies="
                + dependencies.size() + "]";
    }
}
