package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.SyntaxProvider;

/** C: the C++ walk over the C grammar, which yields includes, functions, prototypes, structs, enums and calls. */
public final class CExtractor extends CFamilyExtractor {

    public CExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        super(provider, settings);
    }

    @Override
    public Language language() {
        return Language.C;
    }
}
