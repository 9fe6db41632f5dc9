package ai.symgraph.analyzer;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Removes comment markers and quote delimiters from documentation text. */
public final class Docstrings {
    private static final Splitter LINES = Splitter.onPattern("\r?\n");

    private Docstrings() {}

    /**
     * Strips {@code /** * /}, {@code /*! * /}, {@code /* * /}, {@code ///}, {@code //!}, {@code //} and {@code #}
     * markers and leading {@code *} gutters, dropping blank leading and trailing lines.
     */
    public static String cleanComment(String raw) {
        var text = raw.strip();
        if (text.startsWith("/**") || text.startsWith("/*!")) {
            text = text.substring(3);
        } else if (text.startsWith("/*")) {
            text = text.substring(2);
        }
        if (text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        var lines = new ArrayList<String>();
        for (var line : LINES.split(text)) {
            lines.add(stripLineMarker(line.strip()));
        }
        return joinTrimmed(lines);
    }

    private static String stripLineMarker(String line) {
        if (line.startsWith("///") || line.startsWith("//!")) {
            return line.substring(3).strip();
        }
        if (line.startsWith("//")) {
            return line.substring(2).strip();
        }
        if (line.startsWith("#")) {
            return line.substring(1).strip();
        }
        if (line.startsWith("*") && !line.startsWith("*/")) {
            return line.substring(1).strip();
        }
        return line;
    }

    /** Joins cleaned comment texts with newlines; null when nothing remains. */
    public static @Nullable String joinComments(List<String> rawComments) {
        var parts = new ArrayList<String>();
        for (var raw : rawComments) {
            var cleaned = cleanComment(raw);
            if (!cleaned.isEmpty()) {
                parts.add(cleaned);
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    /** Strips Python-style string delimiters, including prefixes and triple quotes. */
    public static String stripStringQuotes(String literal) {
        var text = literal.strip();
        int prefix = 0;
        while (prefix < text.length() && "rRbBuUfF".indexOf(text.charAt(prefix)) >= 0) {
            prefix++;
        }
        text = text.substring(prefix);
        for (var quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (text.length() >= 2 * quote.length() && text.startsWith(quote) && text.endsWith(quote)) {
                text = text.substring(quote.length(), text.length() - quote.length());
                break;
            }
        }
        var lines = new ArrayList<String>();
        for (var line : LINES.split(text)) {
            lines.add(line.strip());
        }
        return joinTrimmed(lines);
    }

    private static String joinTrimmed(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isEmpty()) start++;
        while (end > start && lines.get(end - 1).isEmpty()) end--;
        return String.join("\n", lines.subList(start, end));
    }
}
