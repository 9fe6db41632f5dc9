package ai.symgraph.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links definitions in an implementation file to the declarations they implement in a header.
 *
 * <p>Adds one {@code implements_header} edge from the implementation path to the header path, then one
 * {@code implements_declaration} edge per definition whose declaration is found by name. A qualified definition
 * {@code Class::member} is looked up among the children of {@code Class}; an unqualified one among the header's free
 * function declarations, never among class members. Overloads pair up in declaration order, each declaration used at
 * most once. Objective-C {@code @implementation} blocks are paired with the {@code @interface} of the same name and
 * then method by method.
 *
 * <p>Only the definitions file is mutated. Not safe to run concurrently against the same definitions file.
 */
public final class CrossReferenceMatcher {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceMatcher.class);

    private CrossReferenceMatcher() {}

    /** @return the number of dependencies added to {@code definitions} */
    public static int match(ParsedFile declarations, ParsedFile definitions) {
        int before = definitions.dependencies().size();
        definitions.addDependency(
                ParsedDependency.of(DependencyTypes.IMPLEMENTS_HEADER, definitions.path(), declarations.path()));

        Set<ParsedSymbol> used = Collections.newSetFromMap(new IdentityHashMap<>());
        var declared = declarations.allSymbols().toList();

        for (var definition : definitions.allSymbols().toList()) {
            if (SymbolKinds.IMPLEMENTATION.equals(definition.kind())) {
                matchImplementation(definition, declared, used, definitions);
                continue;
            }
            if (!SymbolKinds.isDefinitionKind(definition.kind()) || isInImplementation(definition)) {
                continue;
            }
            var target = findDeclaration(definition, declared, used);
            if (target != null) {
                used.add(target);
                definitions.addDependency(ParsedDependency.of(
                        DependencyTypes.IMPLEMENTS_DECLARATION, definition.name(), renderTarget(target)));
            }
        }

        int added = definitions.dependencies().size() - before;
        log.debug("Matched {} against {}: {} dependencies added", definitions.path(), declarations.path(), added);
        return added;
    }

    private static @Nullable ParsedSymbol findDeclaration(
            ParsedSymbol definition, List<ParsedSymbol> declared, Set<ParsedSymbol> used) {
        var name = qualifiedName(definition);
        int colons = name.lastIndexOf("::");
        if (colons < 0) {
            for (var candidate : declared) {
                if (isFreeCallable(candidate) && candidate.name().equals(name) && !used.contains(candidate)) {
                    return candidate;
                }
            }
            return null;
        }

        var scope = name.substring(0, colons);
        var member = name.substring(colons + 2);
        var owner = Declarations.stripTypeArguments(scope.substring(scope.lastIndexOf("::") + 1));
        for (var candidate : declared) {
            if (!SymbolKinds.isTypeKind(candidate.kind())) {
                continue;
            }
            var typeName = Declarations.stripTypeArguments(candidate.name());
            if (!typeName.equals(scope) && !typeName.equals(owner)) {
                continue;
            }
            for (var child : candidate.children()) {
                if (child.name().equals(member) && !used.contains(child)) {
                    return child;
                }
            }
        }
        return null;
    }

    private static void matchImplementation(
            ParsedSymbol implementation, List<ParsedSymbol> declared, Set<ParsedSymbol> used, ParsedFile definitions) {
        for (var candidate : declared) {
            if (!SymbolKinds.INTERFACE.equals(candidate.kind()) || !candidate.name().equals(implementation.name())) {
                continue;
            }
            definitions.addDependency(ParsedDependency.of(
                    DependencyTypes.IMPLEMENTS_DECLARATION, implementation.name(), candidate.name()));
            for (var method : implementation.children()) {
                for (var declaredMethod : candidate.children()) {
                    if (declaredMethod.name().equals(method.name())
                            && declaredMethod.kind().equals(method.kind())
                            && !used.contains(declaredMethod)) {
                        used.add(declaredMethod);
                        definitions.addDependency(ParsedDependency.of(
                                DependencyTypes.IMPLEMENTS_DECLARATION, method.name(), declaredMethod.name()));
                        break;
                    }
                }
            }
            return;
        }
    }

    /** Members defined inside a class body in the implementation file are scoped by that class. */
    private static String qualifiedName(ParsedSymbol definition) {
        var parent = definition.parent();
        if (parent.isPresent() && SymbolKinds.isTypeKind(parent.get().kind())) {
            return parent.get().name() + "::" + definition.name();
        }
        return definition.name();
    }

    private static boolean isInImplementation(ParsedSymbol symbol) {
        return symbol.parent()
                .map(p -> SymbolKinds.IMPLEMENTATION.equals(p.kind()))
                .orElse(false);
    }

    /** A function declared at file or namespace scope; class members are only reachable through {@code Class::}. */
    private static boolean isFreeCallable(ParsedSymbol symbol) {
        if (symbol.hasParent()) {
            return false;
        }
        return SymbolKinds.FUNCTION_DECLARATION.equals(symbol.kind()) || SymbolKinds.isDefinitionKind(symbol.kind());
    }

    private static String renderTarget(ParsedSymbol declaration) {
        var parent = declaration.parent();
        return parent.map(p -> p.name() + "::" + declaration.name()).orElse(declaration.name());
    }
}
