package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.Signatures;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.treesitter.TSNode;

/** Signature and naming helpers shared by extractors of annotation-bearing languages. */
final class Declarations {
    private static final List<String> SOURCE_ROOTS = List.of(
            "src/main/java/", "src/test/java/", "src/main/kotlin/", "src/test/kotlin/", "src/", "java/", "kotlin/");

    private Declarations() {}

    /**
     * Header of {@code decl} (see {@link Signatures#headerUpToBody}) with the given attribute nodes cut out and
     * rendered as a prefix block, one per line.
     */
    static String signatureWithAttributes(ExtractionContext ctx, TSNode decl, List<TSNode> attributes) {
        if (attributes.isEmpty()) {
            return Signatures.headerUpToBody(ctx.text(decl));
        }
        var sorted = new ArrayList<>(attributes);
        sorted.sort(Comparator.comparingInt(TSNode::getStartByte));

        var prefix = new ArrayList<String>();
        var rest = new StringBuilder();
        int cursor = decl.getStartByte();
        for (var attr : sorted) {
            prefix.add(Signatures.collapseWhitespace(ctx.text(attr)));
            if (attr.getStartByte() >= cursor) {
                rest.append(ctx.tree().slice(cursor, attr.getStartByte())).append(' ');
                cursor = attr.getEndByte();
            }
        }
        rest.append(ctx.tree().slice(cursor, decl.getEndByte()));
        prefix.add(Signatures.headerUpToBody(rest.toString()));
        return String.join("\n", prefix);
    }

    /** {@code Map<K, V>} becomes {@code Map}; {@code Outer.Inner<T>} becomes {@code Outer.Inner}. */
    static String stripTypeArguments(String type) {
        var t = Signatures.collapseWhitespace(type);
        int lt = t.indexOf('<');
        return lt >= 0 ? t.substring(0, lt).trim() : t;
    }

    /** Package implied by a JVM source path, e.g. {@code com.acme} for {@code src/main/java/com/acme/A.java}. */
    static String inferJvmPackage(String path) {
        var p = path.replace('\\', '/');
        int slash = p.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        var dir = p.substring(0, slash + 1);
        for (var root : SOURCE_ROOTS) {
            int idx = dir.indexOf(root);
            if (idx >= 0 && (idx == 0 || dir.charAt(idx - 1) == '/')) {
                var rel = dir.substring(idx + root.length());
                return rel.isEmpty() ? "" : rel.substring(0, rel.length() - 1).replace('/', '.');
            }
        }
        return "";
    }
}
