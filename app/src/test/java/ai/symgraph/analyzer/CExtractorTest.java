package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class CExtractorTest {
    private final CExtractor extractor = new CExtractor(PROVIDER, SETTINGS);

    private static final String SOURCE = """
            #include <stdio.h>
            #include "util.h"

            /** A point. */
            typedef struct {
                int x;
                int y;
            } Point;

            struct node {
                int value;
                struct node *next;
            };

            enum color { RED, GREEN };

            int add(int a, int b);

            static int twice(int v) { return add(v, v); }

            int main(void) {
                printf("%d\\n", twice(2));
                return 0;
            }
            """;

    @Test
    void testDeclarations() {
        var file = extractOk(extractor, "main.c", SOURCE);

        assertEquals(Language.C, file.language());
        assertEquals(List.of("Point", "node", "color", "add", "twice", "main"), topLevelNames(file));

        var point = symbol(file, "Point");
        assertEquals(SymbolKinds.STRUCT, point.kind());
        assertEquals("A point.", point.docstring().orElseThrow());
        assertEquals(List.of("x", "y"), childNames(point));

        assertEquals(List.of("value", "next"), childNames(symbol(file, "node")));
        assertEquals(List.of("RED", "GREEN"), childNames(symbol(file, "color")));
        assertEquals(SymbolKinds.FUNCTION_DECLARATION, symbol(file, "add").kind());
        assertEquals(SymbolKinds.STATIC_FUNCTION, symbol(file, "twice").kind());
        assertEquals(SymbolKinds.FUNCTION, symbol(file, "main").kind());
        assertEquals("int main(void)", symbol(file, "main").signature());
    }

    @Test
    void testIncludesAndCalls() {
        var file = extractOk(extractor, "main.c", SOURCE);

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(List.of("stdio.h", "util.h"), imports.stream().map(ParsedDependency::target).toList());
        assertFalse(imports.get(0).external());
        assertFalse(imports.get(1).external());

        var calls = edges(file, DependencyTypes.CALL);
        assertTrue(calls.contains("twice -> add"), calls.toString());
        assertTrue(calls.contains("main -> printf"), calls.toString());
        assertTrue(calls.contains("main -> twice"), calls.toString());
        assertEquals(3, calls.size());
    }
}
