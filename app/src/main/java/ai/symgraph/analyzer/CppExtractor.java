package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.SyntaxProvider;

/**
 * C++: includes, namespaces, classes and structs with member children, templates, free functions, prototypes,
 * typedefs and aliases, base-class {@code extends} edges and calls from function bodies.
 */
public final class CppExtractor extends CFamilyExtractor {

    public CppExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.CPP;
    }
}
