package ai.symgraph.analyzer;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic internal/external classification of import paths.
 *
 * <p>An import without a separator is treated as standard-library/internal. One with a separator is external unless
 * it shares the base package of the importing file's module context. No build manifest is consulted, so results are
 * deterministic for a given (path, language, context) and may be wrong for projects that do not follow the base
 * package convention.
 */
public final class ImportClassifier {
    private static final Splitter DOT = Splitter.on('.').omitEmptyStrings();
    private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();

    private static final List<String> JVM_PLATFORM_PREFIXES = List.of("java.", "javax.", "kotlin.", "kotlinx.");
    private static final Set<String> HEADER_SUFFIXES = Set.of(".h", ".hpp", ".hh", ".hxx", ".inl");
    private static final Set<String> APPLE_FRAMEWORKS = Set.of(
            "Foundation",
            "UIKit",
            "SwiftUI",
            "Combine",
            "CoreData",
            "CoreGraphics",
            "CoreLocation",
            "MapKit",
            "AVFoundation",
            "WebKit",
            "AppKit",
            "Cocoa");

    private ImportClassifier() {}

    /**
     * @param importPath the imported module/package/header path as written, without quotes or brackets
     * @param language the language of the importing file
     * @param moduleContext the importing file's package (JVM), dotted module path (Python), or relative file path
     *     (C family, JavaScript, TypeScript); blank when the file has no module context
     */
    public static boolean isExternal(String importPath, Language language, String moduleContext) {
        var path = importPath.trim();
        if (path.isEmpty()) {
            return false;
        }
        return switch (language) {
            case JAVA, KOTLIN -> isExternalJvm(path, moduleContext);
            case PYTHON -> isExternalPython(path, moduleContext);
            case C, CPP, OBJC, OBJCPP -> isExternalInclude(path, moduleContext);
            case SWIFT -> isExternalSwift(path, moduleContext);
            case JAVASCRIPT, TYPESCRIPT -> isExternalModuleSpecifier(path, moduleContext);
            default -> isExternalDotted(path, firstSegment(moduleContext));
        };
    }

    private static boolean isExternalJvm(String path, String currentPackage) {
        for (var prefix : JVM_PLATFORM_PREFIXES) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        if (path.indexOf('.') < 0) {
            return false;
        }
        var base = BasePackages.of(currentPackage);
        return base.isEmpty() || !base.equals(BasePackages.of(path));
    }

    private static boolean isExternalPython(String path, String currentModule) {
        if (path.startsWith(".")) {
            return false;
        }
        return isExternalDotted(path, firstSegment(currentModule));
    }

    private static boolean isExternalSwift(String path, String currentModule) {
        if (APPLE_FRAMEWORKS.contains(firstSegment(path))) {
            return true;
        }
        return isExternalDotted(path, firstSegment(currentModule));
    }

    private static boolean isExternalDotted(String path, String base) {
        if (path.indexOf('.') < 0) {
            return false;
        }
        return base.isEmpty() || !base.equals(firstSegment(path));
    }

    private static boolean isExternalModuleSpecifier(String path, String currentFile) {
        if (path.startsWith(".") || path.startsWith("/")) {
            return false;
        }
        return isExternalSlashed(path, currentFile);
    }

    private static boolean isExternalInclude(String path, String currentFile) {
        return isExternalSlashed(stripHeaderSuffix(path.replace('\\', '/')), currentFile);
    }

    private static boolean isExternalSlashed(String normalized, String currentFile) {
        if (normalized.indexOf('/') < 0) {
            return false;
        }
        var segments = SLASH.splitToList(normalized);
        var fileSegments = SLASH.splitToList(currentFile.replace('\\', '/'));
        if (segments.isEmpty() || fileSegments.size() < 2) {
            return true;
        }
        return !segments.get(0).equals(fileSegments.get(0));
    }

    private static String stripHeaderSuffix(String path) {
        var lower = path.toLowerCase(Locale.ROOT);
        for (var suffix : HEADER_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return path.substring(0, path.length() - suffix.length());
            }
        }
        return path;
    }

    private static String firstSegment(String dotted) {
        var parts = DOT.splitToList(dotted.trim());
        return parts.isEmpty() ? "" : parts.get(0);
    }
}
