package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class KotlinExtractorTest {
    private final KotlinExtractor extractor = new KotlinExtractor(PROVIDER, SETTINGS);

    private static final String SOURCE = """
            package com.acme.app

            import kotlinx.coroutines.launch
            import com.acme.util.*
            import org.junit.Test

            /** A user. */
            data class User(val name: String) : Entity(), Comparable<User> {
                val display: String = name

                fun greet(): String = format(name)

                suspend fun refresh() {}
            }

            interface Repo {
                fun find(id: Int): User
            }

            object Registry

            enum class Color { RED, GREEN }

            suspend fun load() {}

            fun String.shout(): String = uppercase()

            fun main() {
                println(User("a").greet())
            }

            val VERSION = "1.0"
            """;

    private ParsedFile parse() {
        return extract(extractor, "src/main/kotlin/com/acme/app/Main.kt", SOURCE)
                .parsedFile()
                .orElseThrow();
    }

    @Test
    void testTypes() {
        var file = parse();

        assertEquals("com.acme.app", file.symbols().get(0).name());
        assertEquals(SymbolKinds.PACKAGE, file.symbols().get(0).kind());

        var user = symbol(file, "com.acme.app.User");
        assertEquals(SymbolKinds.DATA_CLASS, user.kind());
        assertEquals("A user.", user.docstring().orElseThrow());
        assertEquals(List.of("display", "greet", "refresh"), childNames(user));
        assertEquals(SymbolKinds.PROPERTY, child(user, "display").kind());
        assertEquals(SymbolKinds.METHOD, child(user, "greet").kind());
        assertEquals(SymbolKinds.SUSPEND_METHOD, child(user, "refresh").kind());

        assertEquals(SymbolKinds.INTERFACE, symbol(file, "com.acme.app.Repo").kind());
        assertEquals(SymbolKinds.OBJECT, symbol(file, "com.acme.app.Registry").kind());
        var color = symbol(file, "com.acme.app.Color");
        assertEquals(SymbolKinds.ENUM, color.kind());
        assertEquals(List.of("RED", "GREEN"), childNames(color));

        var extendsEdges = edges(file, DependencyTypes.EXTENDS);
        assertTrue(extendsEdges.contains("com.acme.app.User -> Entity"), extendsEdges.toString());
        assertTrue(extendsEdges.contains("com.acme.app.User -> Comparable"), extendsEdges.toString());
    }

    @Test
    void kdocAfterHeaderLinesIsKept() {
        var afterPackage = extract(extractor, "Run.kt", """
                package demo

                /** Entry point. */
                fun run() {}
                """).parsedFile().orElseThrow();
        assertEquals("Entry point.", symbol(afterPackage, "demo.run").docstring().orElseThrow());

        var afterImports = extract(extractor, "Plain.kt", """
                package demo
                /** Not for Plain. */
                import demo.util.Helper

                class Plain
                """).parsedFile().orElseThrow();
        assertTrue(symbol(afterImports, "demo.Plain").docstring().isEmpty());
    }

    @Test
    void topLevelDeclarationsArePackageQualified() {
        var file = parse();

        assertEquals(SymbolKinds.SUSPEND_FUNCTION, symbol(file, "com.acme.app.load").kind());
        assertEquals(SymbolKinds.EXTENSION_FUNCTION, symbol(file, "com.acme.app.shout").kind());
        assertEquals(SymbolKinds.FUNCTION, symbol(file, "com.acme.app.main").kind());
        var version = symbol(file, "com.acme.app.VERSION");
        assertEquals(SymbolKinds.PROPERTY, version.kind());
        assertEquals("val VERSION", version.signature());
    }

    @Test
    void importsAndCalls() {
        var file = parse();

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(
                List.of("kotlinx.coroutines.launch", "com.acme.util.*", "org.junit.Test"),
                imports.stream().map(ParsedDependency::target).toList());
        assertFalse(imports.get(0).external());
        assertFalse(imports.get(1).external());
        assertTrue(imports.get(2).external());

        var calls = edges(file, DependencyTypes.CALL);
        assertTrue(calls.contains("com.acme.app.main -> println"), calls.toString());
    }

    @Test
    void packageIsInferredWhenMissing() {
        var file = extract(extractor, "src/main/kotlin/org/demo/Tool.kt", "fun run() {}\n")
                .parsedFile()
                .orElseThrow();

        assertEquals(List.of("org.demo", "org.demo.run"), topLevelNames(file));
    }
}
