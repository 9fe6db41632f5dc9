package ai.symgraph.analyzer.treesitter;

import java.util.regex.Pattern;

/** Text helpers for rendering declaration signatures. */
public final class Signatures {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Signatures() {}

    public static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return (nl >= 0 ? text.substring(0, nl) : text).trim();
    }

    /**
     * Text up to (excluding) the first top-level {@code {}, or up to (including) the first {@code ;}, whichever comes
     * first, with whitespace collapsed onto one line.
     */
    public static String headerUpToBody(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == '{' && depth == 0) {
                return collapseWhitespace(text.substring(0, i));
            } else if (c == ';' && depth == 0) {
                return collapseWhitespace(text.substring(0, i + 1));
            }
        }
        return collapseWhitespace(text);
    }

    /** Text up to (excluding) the first occurrence of {@code stop} outside brackets, collapsed onto one line. */
    public static String upTo(String text, char stop) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == stop && depth == 0) {
                return collapseWhitespace(text.substring(0, i));
            }
        }
        return collapseWhitespace(text);
    }

    public static String stripQuotes(String text) {
        var t = text.trim();
        if (t.length() >= 2) {
            char first = t.charAt(0);
            char last = t.charAt(t.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'') || (first == '`' && last == '`')
                    || (first == '<' && last == '>')) {
                return t.substring(1, t.length() - 1);
            }
        }
        return t;
    }
}
