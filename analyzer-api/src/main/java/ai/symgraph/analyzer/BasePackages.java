package ai.symgraph.analyzer;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/** Base package of a dotted JVM package name: its first two segments, e.g. {@code com.example}. */
public final class BasePackages {
    private static final Splitter DOT = Splitter.on('.').omitEmptyStrings().trimResults();

    private BasePackages() {}

    public static String of(String packageName) {
        var parts = DOT.splitToList(packageName);
        if (parts.size() >= 2) {
            return Joiner.on('.').join(parts.subList(0, 2));
        }
        return parts.isEmpty() ? "" : parts.get(0);
    }
}
