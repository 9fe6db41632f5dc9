package ai.symgraph.analyzer;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of extracting one file. A non-null {@code file} is usable even when {@code error} is also set; that is the
 * normal shape for syntactically broken input.
 */
public record ExtractionResult(@Nullable ParsedFile file, @Nullable DetailedParseError error) {

    public static ExtractionResult ok(ParsedFile file) {
        return new ExtractionResult(file, null);
    }

    public static ExtractionResult partial(ParsedFile file, DetailedParseError error) {
        return new ExtractionResult(file, error);
    }

    public static ExtractionResult failed(DetailedParseError error) {
        return new ExtractionResult(null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public Optional<ParsedFile> parsedFile() {
        return Optional.ofNullable(file);
    }

    public Optional<DetailedParseError> parseError() {
        return Optional.ofNullable(error);
    }
}
