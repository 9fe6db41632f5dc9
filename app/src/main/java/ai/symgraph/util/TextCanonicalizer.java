package ai.symgraph.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Byte-level normalization of source content before parsing and when slicing node text. */
public final class TextCanonicalizer {
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private TextCanonicalizer() {}

    public static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= UTF8_BOM.length && Arrays.equals(bytes, 0, UTF8_BOM.length, UTF8_BOM, 0, UTF8_BOM.length);
    }

    /** The content without a leading UTF-8 BOM; the same array when there is none. */
    public static byte[] stripUtf8Bom(byte[] bytes) {
        return hasUtf8Bom(bytes) ? Arrays.copyOfRange(bytes, UTF8_BOM.length, bytes.length) : bytes;
    }

    /**
     * Decodes {@code [startByte, endByte)} of {@code content} as UTF-8. Offsets are clamped to the array; an empty or
     * inverted range yields the empty string.
     */
    public static String sliceUtf8(byte[] content, int startByte, int endByte) {
        int start = Math.max(0, startByte);
        int end = Math.min(content.length, endByte);
        if (start >= end) {
            return "";
        }
        return new String(content, start, end - start, StandardCharsets.UTF_8);
    }
}
