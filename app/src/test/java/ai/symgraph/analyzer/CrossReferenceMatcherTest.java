package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class CrossReferenceMatcherTest {
    private final CppExtractor cpp = new CppExtractor(PROVIDER, SETTINGS);

    @Test
    void qualifiedDefinitionMatchesMemberDeclaration() {
        var header = extractOk(cpp, "a.h", """
                class Class {
                public:
                    void method();
                };
                """);
        var impl = extractOk(cpp, "a.cpp", """
                #include "a.h"
                void Class::method() {}
                """);

        int added = CrossReferenceMatcher.match(header, impl);

        assertEquals(2, added);
        assertEquals(List.of("a.cpp -> a.h"), edges(impl, DependencyTypes.IMPLEMENTS_HEADER));
        assertEquals(List.of("Class::method -> Class::method"), edges(impl, DependencyTypes.IMPLEMENTS_DECLARATION));
        assertTrue(header.dependencies().isEmpty());
    }

    @Test
    void testWidgetFixturePairsOverloadsInOrder() {
        var header = extractFixture(cpp, "cpp", "src/widget.h");
        var impl = extractFixture(cpp, "cpp", "src/widget.cpp");

        int added = CrossReferenceMatcher.match(header, impl);

        assertEquals(5, added);
        assertEquals(
                List.of(
                        "Widget::Widget -> Widget::Widget",
                        "Widget::draw -> Widget::draw",
                        "Widget::draw -> Widget::draw",
                        "widgetCount -> widgetCount"),
                edges(impl, DependencyTypes.IMPLEMENTS_DECLARATION));
    }

    @Test
    void freeFunctionDoesNotMatchSameNamedMethod() {
        var header = extractOk(cpp, "d.h", """
                class Widget {
                public:
                    void draw();
                };
                void draw();
                """);
        var impl = extractOk(cpp, "d.cpp", "void draw() {}\n");

        assertEquals(2, CrossReferenceMatcher.match(header, impl));
        assertEquals(List.of("draw -> draw"), edges(impl, DependencyTypes.IMPLEMENTS_DECLARATION));
    }

    @Test
    void freeFunctionWithoutFreeDeclarationStaysUnmatched() {
        var header = extractOk(cpp, "e.h", """
                class Widget {
                public:
                    void draw();
                };
                """);
        var impl = extractOk(cpp, "e.cpp", "void draw() {}\n");

        assertEquals(1, CrossReferenceMatcher.match(header, impl));
        assertTrue(impl.dependenciesOfType(DependencyTypes.IMPLEMENTS_DECLARATION).isEmpty());
    }

    @Test
    void unmatchedDefinitionsOnlyGetTheHeaderEdge() {
        var header = extractOk(cpp, "b.h", "int declared();\n");
        var impl = extractOk(cpp, "b.cpp", "static int unrelated() { return 0; }\n");

        assertEquals(1, CrossReferenceMatcher.match(header, impl));
        assertTrue(impl.dependenciesOfType(DependencyTypes.IMPLEMENTS_DECLARATION).isEmpty());
    }

    @Test
    void objectiveCImplementationMatchesInterface() {
        var header = ParsedFile.minimal("Person.h", Language.OBJC);
        var iface = symbol("Person", SymbolKinds.INTERFACE);
        iface.addChild(symbol("greet", SymbolKinds.METHOD));
        iface.addChild(symbol("defaultPerson", SymbolKinds.CLASS_METHOD));
        header.addSymbol(iface);

        var source = ParsedFile.minimal("Person.m", Language.OBJC);
        var impl = symbol("Person", SymbolKinds.IMPLEMENTATION);
        impl.addChild(symbol("greet", SymbolKinds.METHOD));
        impl.addChild(symbol("helper", SymbolKinds.METHOD));
        impl.addChild(symbol("defaultPerson", SymbolKinds.CLASS_METHOD));
        source.addSymbol(impl);

        int added = CrossReferenceMatcher.match(header, source);

        assertEquals(4, added);
        assertEquals(
                List.of("Person -> Person", "greet -> greet", "defaultPerson -> defaultPerson"),
                edges(source, DependencyTypes.IMPLEMENTS_DECLARATION));
    }

    @Test
    void eachDeclarationIsUsedOnce() {
        var header = ParsedFile.minimal("c.h", Language.CPP);
        header.addSymbol(symbol("run", SymbolKinds.FUNCTION_DECLARATION));

        var source = ParsedFile.minimal("c.cpp", Language.CPP);
        source.addSymbol(symbol("run", SymbolKinds.FUNCTION));
        source.addSymbol(symbol("run", SymbolKinds.FUNCTION));

        assertEquals(2, CrossReferenceMatcher.match(header, source));
        assertEquals(List.of("run -> run"), edges(source, DependencyTypes.IMPLEMENTS_DECLARATION));
    }

    private static ParsedSymbol symbol(String name, String kind) {
        return new ParsedSymbol(name, kind, name, ParsedSpan.EMPTY, null, null);
    }
}
