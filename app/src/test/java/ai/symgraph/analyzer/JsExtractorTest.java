package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class JsExtractorTest {
    private final JsExtractor extractor = new JsExtractor(PROVIDER, SETTINGS);

    private static final String CART = """
            import { api } from "./api";
            import React from "react";
            import merge from "lodash/merge";
            const fs = require("fs");
            track("loaded");

            /** A shopping cart. */
            export class Cart extends Base {
                static count = 0;

                constructor(items) {
                    this.items = items;
                }

                /** Sum of prices. */
                total() {
                    return sum(this.items);
                }

                static create() {
                    return new Cart([]);
                }

                async save() {
                    await api.post(this.items);
                }
            }

            // Adds numbers.
            function sum(items) {
                return items.reduce((a, b) => a + b, 0);
            }

            export const load = async (id) => {
                return api.get(id);
            };

            function* ids() {
                yield 1;
            }

            export { sum };
            """;

    @Test
    void testCartModule() {
        var file = extractOk(extractor, "web/cart.js", CART);

        assertEquals(Language.JAVASCRIPT, file.language());
        assertEquals(List.of("Cart", "sum", "load", "ids", JsExtractor.EXPORT_SYMBOL), topLevelNames(file));

        var cart = symbol(file, "Cart");
        assertEquals(SymbolKinds.CLASS, cart.kind());
        assertEquals("export class Cart extends Base", cart.signature());
        assertEquals("A shopping cart.", cart.docstring().orElseThrow());
        assertEquals(List.of("count", "constructor", "total", "create", "save"), childNames(cart));
        assertEquals(SymbolKinds.STATIC_PROPERTY, child(cart, "count").kind());
        assertEquals("static count = 0", child(cart, "count").signature());
        assertEquals(SymbolKinds.CONSTRUCTOR, child(cart, "constructor").kind());
        assertEquals(SymbolKinds.METHOD, child(cart, "total").kind());
        assertEquals("total()", child(cart, "total").signature());
        assertEquals("Sum of prices.", child(cart, "total").docstring().orElseThrow());
        assertEquals(SymbolKinds.STATIC_METHOD, child(cart, "create").kind());
        assertEquals(SymbolKinds.ASYNC_METHOD, child(cart, "save").kind());

        var sum = symbol(file, "sum");
        assertEquals(SymbolKinds.FUNCTION, sum.kind());
        assertEquals("function sum(items)", sum.signature());
        assertEquals("Adds numbers.", sum.docstring().orElseThrow());

        var load = symbol(file, "load");
        assertEquals(SymbolKinds.ASYNC_ARROW_FUNCTION, load.kind());
        assertEquals("export const load = async (id) =>", load.signature());

        assertEquals(SymbolKinds.GENERATOR_FUNCTION, symbol(file, "ids").kind());

        var export = file.symbols().get(4);
        assertEquals(SymbolKinds.EXPORT, export.kind());
        assertEquals("export { sum };", export.signature());
    }

    @Test
    void classHeritageAndCalls() {
        var file = extractOk(extractor, "web/cart.js", CART);

        assertEquals(List.of("Cart -> Base"), edges(file, DependencyTypes.EXTENDS));

        var calls = edges(file, DependencyTypes.CALL);
        assertTrue(calls.contains("total -> sum"), calls.toString());
        assertTrue(calls.contains("save -> api.post"), calls.toString());
        assertTrue(calls.contains("sum -> items.reduce"), calls.toString());
        assertTrue(calls.contains("load -> api.get"), calls.toString());
        // top-level calls have no caller
        assertTrue(calls.stream().noneMatch(c -> c.endsWith("-> track") || c.endsWith("-> require")), calls.toString());
    }

    @Test
    void esAndCommonJsImports() {
        var file = extractOk(extractor, "web/cart.js", CART);

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(
                List.of("./api", "react", "lodash/merge", "fs"),
                imports.stream().map(ParsedDependency::target).toList());
        assertEquals(
                List.of(false, false, true, false),
                imports.stream().map(ParsedDependency::external).toList());
        assertTrue(imports.stream().allMatch(d -> d.source().isEmpty()));
    }

    @Test
    void reExportsAreImportsAndExports() {
        var file = extractOk(extractor, "web/index.js", """
                export { Cart } from "./cart";
                export * from "web/widgets";
                """);

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(List.of("./cart", "web/widgets"), imports.stream().map(ParsedDependency::target).toList());
        assertTrue(imports.stream().noneMatch(ParsedDependency::external));
        assertEquals(2, file.symbols().size());
        assertTrue(file.symbols().stream().allMatch(s -> s.kind().equals(SymbolKinds.EXPORT)));
    }

    @Test
    void functionExpressionsAndPlainValues() {
        var file = extractOk(extractor, "lib.js", """
                var handler = function (event) {
                    dispatch(event);
                };
                let limit = 10;
                const square = x => x * x;
                """);

        assertEquals(List.of("handler", "square"), topLevelNames(file));
        assertEquals(SymbolKinds.FUNCTION, symbol(file, "handler").kind());
        assertEquals("var handler = function (event)", symbol(file, "handler").signature());
        assertEquals(SymbolKinds.ARROW_FUNCTION, symbol(file, "square").kind());
        assertEquals("const square = x => x * x", symbol(file, "square").signature());
        assertEquals(List.of("handler -> dispatch"), edges(file, DependencyTypes.CALL));
    }

    @Test
    void longFieldInitializersAreCut() {
        var value = "x".repeat(150);
        var file = extractOk(extractor, "big.js", "class Big {\n    label = \"" + value + "\";\n}\n");

        var label = child(symbol(file, "Big"), "label");
        assertEquals(SymbolKinds.PROPERTY, label.kind());
        assertEquals(JsExtractor.MAX_FIELD_SIGNATURE + 3, label.signature().length());
        assertTrue(label.signature().endsWith("..."));
    }

    @Test
    void brokenSourceStillYieldsSymbols() {
        var result = extract(extractor, "broken.js", """
                function ok() {
                    return 1;
                }

                function broken( {
                """);

        assertTrue(result.hasError());
        var file = result.parsedFile().orElseThrow();
        assertTrue(names(file).contains("ok"), names(file).toString());
    }
}
