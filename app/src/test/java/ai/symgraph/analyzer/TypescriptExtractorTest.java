package ai.symgraph.analyzer;

import static ai.symgraph.analyzer.ExtractorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class TypescriptExtractorTest {
    private final TypescriptExtractor extractor = new TypescriptExtractor(PROVIDER, SETTINGS);

    private static final String SHAPES = """
            import { Injectable } from "@angular/core";
            import type { Item } from "./model";

            /** Something with an area. */
            export interface Shape extends Named, Sized<number> {
                area(): number;
                readonly name: string;
            }

            export type Point = { x: number; y: number };

            export enum Color {
                Red,
                Green = "green",
            }

            export abstract class Base {
                abstract describe(): string;
            }

            export class Circle extends Base implements Shape {
                private radius: number = 1;

                area(): number {
                    return Math.PI * square(this.radius);
                }
            }

            export function square(n: number): number {
                return n * n;
            }

            export function overloaded(a: string): string;
            """;

    @Test
    void testShapesModule() {
        var file = extractOk(extractor, "src/shapes.ts", SHAPES);

        assertEquals(Language.TYPESCRIPT, file.language());
        assertEquals(
                List.of("Shape", "Point", "Color", "Base", "Circle", "square", "overloaded"), topLevelNames(file));

        var shape = symbol(file, "Shape");
        assertEquals(SymbolKinds.INTERFACE, shape.kind());
        assertEquals("export interface Shape extends Named, Sized<number>", shape.signature());
        assertEquals("Something with an area.", shape.docstring().orElseThrow());
        assertEquals(List.of("area", "name"), childNames(shape));
        assertEquals(SymbolKinds.METHOD, child(shape, "area").kind());
        assertEquals(SymbolKinds.PROPERTY, child(shape, "name").kind());

        var point = symbol(file, "Point");
        assertEquals(SymbolKinds.TYPE, point.kind());
        assertTrue(point.signature().startsWith("export type Point = { x: number; y: number }"), point.signature());

        var color = symbol(file, "Color");
        assertEquals(SymbolKinds.ENUM, color.kind());
        assertEquals(List.of("Red", "Green"), childNames(color));
        assertEquals(SymbolKinds.ENUM_CONSTANT, child(color, "Green").kind());

        assertEquals(List.of("describe"), childNames(symbol(file, "Base")));

        var circle = symbol(file, "Circle");
        assertEquals(SymbolKinds.CLASS, circle.kind());
        assertEquals("export class Circle extends Base implements Shape", circle.signature());
        assertEquals(List.of("radius", "area"), childNames(circle));
        assertTrue(child(circle, "radius").signature().startsWith("private radius: number = 1"));

        var square = symbol(file, "square");
        assertEquals(SymbolKinds.FUNCTION, square.kind());
        assertEquals("export function square(n: number): number", square.signature());

        assertEquals(SymbolKinds.FUNCTION_DECLARATION, symbol(file, "overloaded").kind());
    }

    @Test
    void heritageEdges() {
        var file = extractOk(extractor, "src/shapes.ts", SHAPES);

        assertEquals(
                List.of("Shape -> Named", "Shape -> Sized", "Circle -> Base"), edges(file, DependencyTypes.EXTENDS));
        assertEquals(List.of("Circle -> Shape"), edges(file, DependencyTypes.IMPLEMENTS));
        assertTrue(edges(file, DependencyTypes.CALL).contains("area -> square"));
    }

    @Test
    void scopedPackagesAreExternal() {
        var file = extractOk(extractor, "src/shapes.ts", SHAPES);

        var imports = file.dependenciesOfType(DependencyTypes.IMPORT);
        assertEquals(List.of("@angular/core", "./model"), imports.stream().map(ParsedDependency::target).toList());
        assertTrue(imports.get(0).external());
        assertFalse(imports.get(1).external());
    }
}
