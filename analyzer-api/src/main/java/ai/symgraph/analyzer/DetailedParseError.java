package ai.symgraph.analyzer;

import java.util.Objects;

/**
 * Structured diagnostic for one file.
 *
 * @param file path of the file the diagnostic refers to
 * @param line 1-based line, or 0 when unknown
 * @param column 1-based column, or 0 when unknown
 * @param message human readable description
 * @param kind error category
 */
public record DetailedParseError(String file, int line, int column, String message, ErrorKind kind) {

    public enum ErrorKind {
        /** The file could not be read; no tree exists. */
        FILESYSTEM("filesystem"),
        /** The parser reported a syntax error or produced no tree. */
        PARSE("parse"),
        /** The syntax tree could not be mapped onto the model. */
        MAPPING("mapping");

        private final String tag;

        ErrorKind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public DetailedParseError {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(kind, "kind");
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line/column must be >= 0");
        }
    }

    public static DetailedParseError filesystem(String file, String message) {
        return new DetailedParseError(file, 0, 0, message, ErrorKind.FILESYSTEM);
    }

    public static DetailedParseError parse(String file, String message) {
        return new DetailedParseError(file, 0, 0, message, ErrorKind.PARSE);
    }

    public static DetailedParseError parse(String file, int line, int column, String message) {
        return new DetailedParseError(file, line, column, message, ErrorKind.PARSE);
    }

    public static DetailedParseError mapping(String file, String message) {
        return new DetailedParseError(file, 0, 0, message, ErrorKind.MAPPING);
    }

    public boolean hasLocation() {
        return line > 0;
    }

    /** {@code path:line:col: message} when the location is known, {@code path: message} otherwise. */
    public String render() {
        if (hasLocation()) {
            return file + ":" + line + ":" + column + ": " + message;
        }
        return file + ": " + message;
    }

    @Override
    public String toString() {
        return render();
    }
}
