package ai.symgraph.analyzer.treesitter;

import ai.symgraph.analyzer.Language;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Loads structural query patterns from class-path resources such as {@code treesitter/go/calls.scm}. */
public final class TreeSitterQueries {
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private TreeSitterQueries() {}

    public static String load(Language language, String name) {
        var path = "treesitter/" + language.tag() + "/" + name + ".scm";
        return CACHE.computeIfAbsent(path, TreeSitterQueries::loadResource);
    }

    private static String loadResource(String path) {
        try (InputStream in = TreeSitterQueries.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
