package ai.symgraph.analyzer;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Languages understood by the extractors, with the tag used in file descriptors and results. */
public enum Language {
    GO("go", List.of("go")),
    CPP("cpp", List.of("cpp", "cc", "cxx", "hpp", "hh", "hxx", "h")),
    C("c", List.of("c")),
    PYTHON("python", List.of("py", "pyi")),
    JAVA("java", List.of("java")),
    KOTLIN("kotlin", List.of("kt", "kts")),
    SWIFT("swift", List.of("swift")),
    OBJC("objc", List.of("m")),
    OBJCPP("objcpp", List.of("mm")),
    JAVASCRIPT("javascript", List.of("js", "jsx", "mjs", "cjs")),
    TYPESCRIPT("typescript", List.of("ts", "tsx", "mts", "cts")),
    NONE("none", List.of());

    private static final Map<String, Language> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Language::tag, Function.identity()));

    private static final Map<String, Language> ALIASES = Map.of(
            "c++", CPP,
            "golang", GO,
            "py", PYTHON,
            "kt", KOTLIN,
            "objective-c", OBJC,
            "objectivec", OBJC,
            "objective-c++", OBJCPP,
            "js", JAVASCRIPT,
            "ts", TYPESCRIPT);

    private static final Set<String> HEADER_EXTENSIONS = Set.of("h", "hpp", "hh", "hxx");

    private final String tag;
    private final List<String> extensions;

    Language(String tag, List<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    public String tag() {
        return tag;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isJvm() {
        return this == JAVA || this == KOTLIN;
    }

    public boolean isCFamily() {
        return this == C || this == CPP || this == OBJC || this == OBJCPP;
    }

    /** Resolves a language tag, case-insensitively. Unknown tags map to {@link #NONE}. */
    public static Language fromTag(String tag) {
        var key = tag.trim().toLowerCase(Locale.ROOT);
        var lang = BY_TAG.get(key);
        if (lang != null) {
            return lang;
        }
        return ALIASES.getOrDefault(key, NONE);
    }

    public static Language fromExtension(String extension) {
        var ext = extension.startsWith(".") ? extension.substring(1) : extension;
        ext = ext.toLowerCase(Locale.ROOT);
        for (var lang : values()) {
            if (lang.extensions.contains(ext)) {
                return lang;
            }
        }
        return NONE;
    }

    public static Language fromPath(Path path) {
        return fromExtension(extensionOf(path.getFileName().toString()));
    }

    /** True for C-family header extensions ({@code .h}, {@code .hpp}, {@code .hh}, {@code .hxx}). */
    public static boolean isHeaderPath(String path) {
        return HEADER_EXTENSIONS.contains(extensionOf(path).toLowerCase(Locale.ROOT));
    }

    static String extensionOf(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        return dot > slash ? fileName.substring(dot + 1) : "";
    }

    @Override
    public String toString() {
        return tag;
    }
}
