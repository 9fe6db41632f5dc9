package ai.symgraph.analyzer;

import java.util.List;

/**
 * Aggregate output of one batch. The two lists are not positionally correlated; match on
 * {@link ParsedFile#path()} / {@link DetailedParseError#file()}.
 */
public record BatchResult(List<ParsedFile> parsedFiles, List<DetailedParseError> errors) {
    public BatchResult {
        parsedFiles = List.copyOf(parsedFiles);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
