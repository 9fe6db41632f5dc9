package ai.symgraph.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Pairs headers with implementation files of the same directory and base name, e.g. {@code a/b.h}, {@code a/b.cpp}. */
public final class HeaderImplPairs {
    private static final Set<String> HEADER_EXTENSIONS = Set.of("h", "hpp", "hh", "hxx");
    private static final Set<String> IMPL_EXTENSIONS = Set.of("c", "cpp", "cc", "cxx", "m", "mm");

    public record Pair(ParsedFile header, ParsedFile implementation) {}

    private HeaderImplPairs() {}

    /** Pairs in input order of the implementation files. A header may pair with several implementations. */
    public static List<Pair> find(Collection<ParsedFile> files) {
        var headers = new LinkedHashMap<String, ParsedFile>();
        for (var file : files) {
            if (HEADER_EXTENSIONS.contains(extension(file.path()))) {
                headers.putIfAbsent(stem(file.path()), file);
            }
        }
        var pairs = new ArrayList<Pair>();
        for (var file : files) {
            if (!IMPL_EXTENSIONS.contains(extension(file.path()))) {
                continue;
            }
            var header = headers.get(stem(file.path()));
            if (header != null) {
                pairs.add(new Pair(header, file));
            }
        }
        return pairs;
    }

    /** Runs {@link CrossReferenceMatcher#match} over every pair, sequentially. */
    public static int matchAll(Collection<ParsedFile> files) {
        int added = 0;
        for (var pair : find(files)) {
            added += CrossReferenceMatcher.match(pair.header(), pair.implementation());
        }
        return added;
    }

    private static String extension(String path) {
        var name = path.substring(path.replace('\\', '/').lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String stem(String path) {
        var normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        int dot = normalized.lastIndexOf('.');
        return dot > slash ? normalized.substring(0, dot) : normalized;
    }
}
