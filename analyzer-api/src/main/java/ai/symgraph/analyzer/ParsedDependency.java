package ai.symgraph.analyzer;

import java.util.Objects;

/**
 * A directed, best-effort named relation between two identifiers. Neither end is guaranteed to resolve to a
 * {@link ParsedSymbol}.
 *
 * @param type one of {@link DependencyTypes}
 * @param source the issuing symbol name, empty for file-level imports
 * @param target the referenced name as written
 * @param targetModule the module or path an import resolves to, empty when not applicable
 * @param external whether an import was classified as external to the project
 */
public record ParsedDependency(String type, String source, String target, String targetModule, boolean external) {
    public ParsedDependency {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(targetModule, "targetModule");
    }

    public static ParsedDependency of(String type, String source, String target) {
        return new ParsedDependency(type, source, target, "", false);
    }

    public static ParsedDependency importOf(String source, String target, String targetModule, boolean external) {
        return new ParsedDependency(DependencyTypes.IMPORT, source, target, targetModule, external);
    }

    /** Identity used when merging results of two extractors over the same file. */
    public String dedupKey() {
        return type + ":" + source + ":" + target;
    }
}
