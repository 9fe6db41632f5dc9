package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class SwiftExtractorTest {
    private final SwiftExtractor extractor = new SwiftExtractor(PROVIDER, SETTINGS);

    private static final String SOURCE = """
            import Foundation
            import NetworkLayer

            /// A shape.
            protocol Shape: Drawable {
                func area() -> Double
            }

            class Circle: Base, Shape {
                var radius: Double = 1.0
                var label: String = "" {
                    didSet { print(label) }
                }

                init(radius: Double) {
                    self.radius = radius
                }

                func area() -> Double {
                    return compute(radius)
                }

                static func unit() -> Circle {
                    return Circle(radius: 1)
                }
            }

            struct Point: Equatable {
                let x: Int
            }

            enum Direction {
                case north, south
            }

            extension Circle: Hashable {
                func describe() -> String { return "" }
            }

            func compute(_ r: Double) -> Double {
                return r * r
            }
            """;

    private ParsedFile parse() {
        return extract(extractor, "Sources/Shapes.swift", SOURCE).parsedFile().orElseThrow();
    }

    @Test
    void testDeclarations() {
        var file = parse();

        assertEquals(
                List.of("Shape", "Circle", "Point", "Direction", "extension_Circle", "compute"), topLevelNames(file));

        var shape = symbol(file, "Shape");
        assertEquals(SymbolKinds.PROTOCOL, shape.kind());
        assertEquals("A shape.", shape.docstring().orElseThrow());
        assertEquals(List.of("area"), childNames(shape));

        var circle = symbol(file, "Circle");
        assertEquals(SymbolKinds.CLASS, circle.kind());
        assertEquals(List.of("radius", "label", "init", "area", "unit"), childNames(circle));
        assertEquals(SymbolKinds.PROPERTY, child(circle, "radius").kind());
        assertEquals(SymbolKinds.PROPERTY_OBSERVER, child(circle, "label").kind());
        assertEquals(SymbolKinds.INITIALIZER, child(circle, "init").kind());
        assertEquals(SymbolKinds.METHOD, child(circle, "area").kind());
        assertEquals(SymbolKinds.STATIC_METHOD, child(circle, "unit").kind());

        assertEquals(SymbolKinds.STRUCT, symbol(file, "Point").kind());
        var direction = symbol(file, "Direction");
        assertEquals(SymbolKinds.ENUM, direction.kind());
        assertEquals(List.of("north", "south"), childNames(direction));
        assertEquals(SymbolKinds.ENUM_CASE, child(direction, "north").kind());

        var extension = symbol(file, "extension_Circle");
        assertEquals(SymbolKinds.EXTENSION, extension.kind());
        assertEquals(List.of("describe"), childNames(extension));
        assertEquals(SymbolKinds.FUNCTION, symbol(file, "compute").kind());
    }

    @Test
    void inheritanceEdges() {
        var file = parse();

        var extendsEdges = edges(file, DependencyTypes.EXTENDS);
        assertTrue(extendsEdges.contains("Shape -> Drawable"), extendsEdges.toString());
        assertTrue(extendsEdges.contains("Circle -> Base"), extendsEdges.toString());
        assertTrue(extendsEdges.contains("extension_Circle -> Circle"), extendsEdges.toString());

        var conforms = edges(file, DependencyTypes.CONFORMS);
        assertTrue(conforms.contains("Circle -> Shape"), conforms.toString());
        assertTrue(conforms.contains("Point -> Equatable"), conforms.toString());
        assertTrue(conforms.contains("extension_Circle -> Hashable"), conforms.toString());
        assertFalse(conforms.contains("Circle -> Base"), conforms.toString());
    }

    @Test
    void importsAndCalls() {
        var file = parse();

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(List.of("Foundation", "NetworkLayer"), imports.stream().map(ParsedDependency::target).toList());
        assertTrue(imports.get(0).external());
        assertFalse(imports.get(1).external());

        var calls = edges(file, DependencyTypes.CALL);
        assertTrue(calls.contains("area -> compute"), calls.toString());
        assertTrue(calls.contains("unit -> Circle"), calls.toString());
    }
}
