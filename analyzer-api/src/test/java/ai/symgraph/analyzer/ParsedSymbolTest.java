package ai.symgraph.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class ParsedSymbolTest {

    private static ParsedSymbol symbol(String name, String kind) {
        return new ParsedSymbol(name, kind, kind + " " + name, new ParsedSpan(1, 1, 0, 10), null, null);
    }

    @Test
    void childrenAreOwnedByOneParent() {
        var shape = symbol("Shape", SymbolKinds.CLASS);
        var other = symbol("Other", SymbolKinds.CLASS);
        var area = symbol("area", SymbolKinds.METHOD);

        shape.addChild(area);

        assertEquals(List.of(area), shape.children());
        assertSame(shape, area.parent().orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> other.addChild(area));
        assertThrows(IllegalArgumentException.class, () -> shape.addChild(shape));
        assertThrows(UnsupportedOperationException.class, () -> shape.children().clear());
    }

    @Test
    void flattenIsPreOrder() {
        var outer = symbol("Outer", SymbolKinds.CLASS);
        var inner = symbol("Inner", SymbolKinds.CLASS);
        var a = symbol("a", SymbolKinds.FIELD);
        var b = symbol("b", SymbolKinds.METHOD);
        inner.addChild(a);
        outer.addChild(inner).addChild(b);

        assertEquals(List.of(outer, inner, a, b), outer.flatten());
    }

    @Test
    void simpleNameDropsQualifiers() {
        assertEquals("area", symbol("Shape::area", SymbolKinds.METHOD).simpleName());
        assertEquals("Shape", symbol("com.acme.Shape", SymbolKinds.CLASS).simpleName());
        assertEquals("run", symbol("run", SymbolKinds.FUNCTION).simpleName());
    }

    @Test
    void blankDocstringIsAbsent() {
        var s = new ParsedSymbol("f", SymbolKinds.FUNCTION, "f()", ParsedSpan.EMPTY, "  ", null);
        assertTrue(s.docstring().isEmpty());
    }

    @Test
    void equalityIgnoresTreeHandle() {
        var a = new ParsedSymbol("f", SymbolKinds.FUNCTION, "f()", ParsedSpan.EMPTY, null, new NodeRef(0, 3, "x"));
        var b = new ParsedSymbol("f", SymbolKinds.FUNCTION, "f()", ParsedSpan.EMPTY, null, null);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void spanRejectsInvertedRanges() {
        assertThrows(IllegalArgumentException.class, () -> new ParsedSpan(3, 2, 0, 1));
        assertEquals(3, new ParsedSpan(2, 4, 10, 50).lineCount());
    }
}
