package ai.symgraph.analyzer.treesitter;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SignaturesTest {

    @Test
    void headerStopsAtTopLevelBrace() {
        assertEquals("int f(int a)", Signatures.headerUpToBody("int f(int a)\n{\n  return a;\n}"));
        assertEquals(
                "void g(std::function<void()> cb = [] {})",
                Signatures.headerUpToBody("void g(std::function<void()> cb = [] {}) { cb(); }"));
        assertEquals("int h();", Signatures.headerUpToBody("int h(); int later() {}"));
    }

    @Test
    void upToIgnoresBracketedStops() {
        assertEquals("def f(a: int, b: str)", Signatures.upTo("def f(a: int, b: str):\n    pass", ':'));
        assertEquals("val x", Signatures.upTo("val x = 1", '='));
    }

    @Test
    void quotesAndWhitespace() {
        assertEquals("fmt", Signatures.stripQuotes("\"fmt\""));
        assertEquals("vector", Signatures.stripQuotes("<vector>"));
        assertEquals("a b c", Signatures.collapseWhitespace("  a\n\tb   c "));
        assertEquals("first", Signatures.firstLine("first\nsecond"));
    }
}
