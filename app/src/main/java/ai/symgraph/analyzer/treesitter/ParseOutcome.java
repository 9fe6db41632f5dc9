package ai.symgraph.analyzer.treesitter;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Result of {@link SyntaxProvider#parse}. The tree may be present together with an error message when the parser
 * recovered from syntax errors.
 */
public record ParseOutcome(@Nullable TreeSitterTree tree, @Nullable String error) {
    public static ParseOutcome failed(String error) {
        return new ParseOutcome(null, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
