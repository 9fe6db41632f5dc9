package ai.symgraph.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class TextCanonicalizerTest {

    @Test
    void stripsOnlyALeadingBom() {
        byte[] withBom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a'};
        assertTrue(TextCanonicalizer.hasUtf8Bom(withBom));
        assertArrayEquals(new byte[] {'a'}, TextCanonicalizer.stripUtf8Bom(withBom));

        byte[] plain = {'a', 'b'};
        assertSame(plain, TextCanonicalizer.stripUtf8Bom(plain));
        assertFalse(TextCanonicalizer.hasUtf8Bom(new byte[] {(byte) 0xEF}));
    }

    @Test
    void slicesByByteOffsets() {
        byte[] content = "é = f(x)".getBytes(StandardCharsets.UTF_8);
        assertEquals("é", TextCanonicalizer.sliceUtf8(content, 0, 2));
        assertEquals("f(x)", TextCanonicalizer.sliceUtf8(content, 5, 100));
        assertEquals("", TextCanonicalizer.sliceUtf8(content, 4, 4));
        assertEquals("", TextCanonicalizer.sliceUtf8(content, 7, 3));
    }
}
