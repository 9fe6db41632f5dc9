package ai.symgraph.analyzer;

import java.nio.file.Path;

/**
 * Read-only descriptor of a candidate source file, as produced by file discovery.
 *
 * @param path the path relative to the scanned root, used as the identity of results
 * @param absPath the absolute path that is actually read
 * @param language the language tag the file was classified as
 * @param size the size in bytes reported at discovery time
 */
public record SourceFile(String path, Path absPath, Language language, long size) {
    public SourceFile {
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }

    /** Descriptor for a file whose relative and absolute path coincide, sized at zero. */
    public static SourceFile of(Path absPath, Language language) {
        return new SourceFile(absPath.toString(), absPath, language, 0L);
    }

    public static SourceFile of(Path root, Path absPath) {
        var relative = root.relativize(absPath).toString().replace('\\', '/');
        return new SourceFile(relative, absPath, Language.fromPath(absPath), absPath.toFile().length());
    }
}
