package ai.symgraph.analyzer;

/**
 * Maps a source file of one language onto the uniform symbol/dependency model.
 *
 * <p>Implementations never throw for bad input: unreadable files, empty files and syntax errors are reported through
 * {@link ExtractionResult#error()} alongside the best partial {@link ParsedFile} available. Implementations must be
 * safe to call from several threads at once.
 */
public interface LanguageExtractor {
    Language language();

    ExtractionResult extract(SourceFile file);
}
