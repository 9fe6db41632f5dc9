package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GoExtractorTest {
    private final GoExtractor extractor = new GoExtractor(PROVIDER, SETTINGS);

    @Test
    void helloWorldHasPackageAndFunction() {
        var file = extractOk(extractor, "main.go", """
                package main
                func Hello() string { return "hello" }
                """);

        assertEquals(Language.GO, file.language());
        assertEquals(2, file.symbols().size());
        assertEquals("main", file.symbols().get(0).name());
        assertEquals(SymbolKinds.PACKAGE, file.symbols().get(0).kind());
        var hello = file.symbols().get(1);
        assertEquals("Hello", hello.name());
        assertEquals(SymbolKinds.FUNCTION, hello.kind());
        assertEquals("func Hello() string", hello.signature());
        assertEquals(2, hello.span().startLine());
        assertTrue(file.dependencies().isEmpty());
    }

    @Test
    void testShapesFixture() {
        var file = extractFixture(extractor, "go", "shapes.go");

        assertEquals("shapes.go", file.path());
        assertEquals(List.of("geometry", "Describe", "Area", "Shape", "Rect", "Celsius"), topLevelNames(file));
        assertEquals("Package geometry holds shapes.", symbol(file, "geometry").docstring().orElseThrow());

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(2, imports.size());
        assertEquals("fmt", imports.get(0).target());
        assertEquals("geometry", imports.get(0).source());
        assertFalse(imports.get(0).external());
        assertEquals("github.com/acme/units", imports.get(1).targetModule());
        assertTrue(imports.get(1).external());

        var shape = symbol(file, "Shape");
        assertEquals(SymbolKinds.INTERFACE, shape.kind());
        assertEquals("Shape is anything with an area.", shape.docstring().orElseThrow());
        assertEquals(List.of("Area"), childNames(shape));

        var rect = symbol(file, "Rect");
        assertEquals(SymbolKinds.STRUCT, rect.kind());
        assertEquals(List.of("W", "H", "units.Meter"), childNames(rect));
        assertEquals(SymbolKinds.FIELD, child(rect, "W").kind());

        assertEquals(SymbolKinds.TYPE, symbol(file, "Celsius").kind());

        var area = file.symbols().get(2);
        assertEquals(SymbolKinds.METHOD, area.kind());
        assertEquals("func (r Rect) Area() float64", area.signature());
        assertEquals("Area returns w*h.", area.docstring().orElseThrow());
        assertTrue(area.span().startLine() > 0);

        var calls = edges(file, DependencyTypes.CALL);
        assertEquals(Set.of("Describe -> fmt.Sprintf", "Describe -> s.Area"), new HashSet<>(calls));
        assertEquals(2, calls.size());
    }

    @Test
    void extractionIsRepeatable() {
        var source = read(testcode("go").resolve("shapes.go"));
        var first = extractOk(extractor, "shapes.go", source);
        var second = extractOk(extractor, "shapes.go", source);

        assertEquals(first.symbols(), second.symbols());
        assertEquals(first.dependencies(), second.dependencies());
        assertEquals(first.checksum(), second.checksum());
    }

    @Test
    void syntaxErrorsStillYieldPartialResult() {
        var result = extract(extractor, "broken.go", """
                package main

                func Broken( {
                """);

        assertTrue(result.hasError());
        var error = result.parseError().orElseThrow();
        assertEquals(DetailedParseError.ErrorKind.PARSE, error.kind());
        assertEquals("broken.go", error.file());
        assertTrue(error.hasLocation());
        var file = result.parsedFile().orElseThrow();
        assertEquals("main", file.symbols().get(0).name());
    }

    @Test
    void emptyFileIsAParseError() {
        var result = extractor.extract("empty.go", new byte[0]);

        assertEquals(DetailedParseError.ErrorKind.PARSE, result.parseError().orElseThrow().kind());
        var file = result.parsedFile().orElseThrow();
        assertTrue(file.symbols().isEmpty());
        assertTrue(file.tree().isEmpty());
    }

    @Test
    void missingFileIsAFilesystemError(@TempDir Path dir) {
        var result = extractor.extract(SourceFile.of(dir, dir.resolve("gone.go")));

        var error = result.parseError().orElseThrow();
        assertEquals(DetailedParseError.ErrorKind.FILESYSTEM, error.kind());
        assertEquals("gone.go", error.file());
        assertEquals("gone.go", result.parsedFile().orElseThrow().path());
    }

    @Test
    void oversizedFileIsNotParsed(@TempDir Path dir) throws Exception {
        var path = dir.resolve("big.go");
        Files.writeString(path, "package big\n// padding padding padding\n");
        var small = new GoExtractor(PROVIDER, SETTINGS.withMaxFileBytes(8));

        var result = small.extract(SourceFile.of(dir, path));

        var error = result.parseError().orElseThrow();
        assertEquals(DetailedParseError.ErrorKind.FILESYSTEM, error.kind());
        assertTrue(error.message().startsWith("file too large"));
        assertTrue(result.parsedFile().orElseThrow().symbols().isEmpty());
    }

    @Test
    void byteOrderMarkIsIgnored() {
        var body = "package bom\n".getBytes(java.nio.charset.StandardCharsets.UTF_8);
        var content = new byte[body.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(body, 0, content, 3, body.length);

        var result = extractor.extract("bom.go", content);

        assertFalse(result.hasError());
        assertEquals("bom", result.parsedFile().orElseThrow().symbols().get(0).name());
    }
}
