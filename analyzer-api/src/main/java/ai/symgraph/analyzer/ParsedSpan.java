package ai.symgraph.analyzer;

/** Source location of a symbol: 1-based inclusive lines and a half-open byte range. */
public record ParsedSpan(int startLine, int endLine, int startByte, int endByte) {
    public static final ParsedSpan EMPTY = new ParsedSpan(0, 0, 0, 0);

    public ParsedSpan {
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine " + endLine + " < startLine " + startLine);
        }
        if (endByte < startByte) {
            throw new IllegalArgumentException("endByte " + endByte + " < startByte " + startByte);
        }
    }

    public int lineCount() {
        return startLine == 0 ? 0 : endLine - startLine + 1;
    }
}
