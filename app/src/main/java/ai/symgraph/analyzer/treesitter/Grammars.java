package ai.symgraph.analyzer.treesitter;

import ai.symgraph.analyzer.Language;
import java.util.EnumMap;
import java.util.Map;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterKotlin;
import org.treesitter.TreeSitterObjc;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterSwift;
import org.treesitter.TreeSitterTypescript;

/**
 * Process-wide grammar handles. Each {@link TSLanguage} is created on first use and never mutated afterwards, so the
 * same handle is shared by every parser on every thread.
 */
final class Grammars {
    private static final Map<Language, TSLanguage> LOADED = new EnumMap<>(Language.class);

    private Grammars() {}

    static synchronized TSLanguage forLanguage(Language language) {
        var grammar = LOADED.get(language);
        if (grammar == null) {
            grammar = create(language);
            LOADED.put(language, grammar);
        }
        return grammar;
    }

    private static TSLanguage create(Language language) {
        return switch (language) {
            case GO -> new TreeSitterGo();
            case CPP, OBJCPP -> new TreeSitterCpp();
            case C -> new TreeSitterC();
            case PYTHON -> new TreeSitterPython();
            case JAVA -> new TreeSitterJava();
            case KOTLIN -> new TreeSitterKotlin();
            case SWIFT -> new TreeSitterSwift();
            case OBJC -> new TreeSitterObjc();
            case JAVASCRIPT -> new TreeSitterJavascript();
            case TYPESCRIPT -> new TreeSitterTypescript();
            case NONE -> throw new IllegalArgumentException("No grammar for language " + language);
        };
    }
}
