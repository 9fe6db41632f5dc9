package ai.symgraph.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class ParsedFileTest {

    @Test
    void contentIsCopiedAndChecksummed() {
        var bytes = "package main\n".getBytes(StandardCharsets.UTF_8);
        var file = new ParsedFile("main.go", Language.GO, bytes, null);
        bytes[0] = 'X';

        assertEquals("package main\n", file.contentText());
        assertEquals(ParsedFile.checksumOf("package main\n".getBytes(StandardCharsets.UTF_8)), file.checksum());
        assertEquals(64, file.checksum().length());
        file.content()[0] = 'Y';
        assertEquals('p', file.contentText().charAt(0));
    }

    @Test
    void minimalFileHasNoContentOrSymbols() {
        var file = ParsedFile.minimal("missing.py", Language.PYTHON);
        assertEquals(0, file.contentLength());
        assertTrue(file.symbols().isEmpty());
        assertTrue(file.tree().isEmpty());
    }

    @Test
    void childSymbolsCannotBeTopLevel() {
        var file = ParsedFile.minimal("a.java", Language.JAVA);
        var type = new ParsedSymbol("a.A", SymbolKinds.CLASS, "class A", ParsedSpan.EMPTY, null, null);
        var field = new ParsedSymbol("x", SymbolKinds.FIELD, "int x;", ParsedSpan.EMPTY, null, null);
        type.addChild(field);

        file.addSymbol(type);

        assertThrows(IllegalArgumentException.class, () -> file.addSymbol(field));
        assertEquals(2, file.allSymbols().count());
        assertSame(field, file.findSymbol("x").orElseThrow());
    }

    @Test
    void releaseTreeClosesOnce() {
        var closes = new AtomicInteger();
        var tree = new SyntaxTree() {
            @Override
            public boolean hasErrors() {
                return false;
            }

            @Override
            public String rootType() {
                return "source_file";
            }

            @Override
            public void close() {
                closes.incrementAndGet();
            }
        };
        var file = new ParsedFile("main.go", Language.GO, new byte[] {'x'}, tree);

        file.releaseTree();
        file.releaseTree();

        assertEquals(1, closes.get());
        assertTrue(file.tree().isEmpty());
    }

    @Test
    void dependenciesFilterByType() {
        var file = ParsedFile.minimal("main.go", Language.GO);
        file.addDependency(ParsedDependency.importOf("main", "fmt", "fmt", false));
        file.addDependency(ParsedDependency.of(DependencyTypes.CALL, "main", "fmt.Println"));

        assertEquals(1, file.dependenciesOfType(DependencyTypes.CALL).size());
        assertEquals("call:main:fmt.Println", file.dependenciesOfType(DependencyTypes.CALL).get(0).dedupKey());
    }
}
