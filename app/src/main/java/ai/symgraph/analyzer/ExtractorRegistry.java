package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import ai.symgraph.analyzer.treesitter.TreeSitterSyntaxProvider;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Maps each supported {@link Language} to its extractor. Built once; read concurrently by pool workers. */
public final class ExtractorRegistry {
    private final Map<Language, LanguageExtractor> extractors;
    private final ExtractionSettings settings;

    public ExtractorRegistry(Map<Language, LanguageExtractor> extractors, ExtractionSettings settings) {
        var copy = new EnumMap<Language, LanguageExtractor>(Language.class);
        for (var entry : extractors.entrySet()) {
            if (entry.getKey() != entry.getValue().language()) {
                throw new IllegalArgumentException("Extractor for " + entry.getValue().language()
                        + " registered under " + entry.getKey());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.extractors = Collections.unmodifiableMap(copy);
        this.settings = settings;
    }

    /** Every supported language, configured from {@code symgraph.properties} and system properties. */
    public static ExtractorRegistry createDefault() {
        return create(new TreeSitterSyntaxProvider(), ExtractionSettings.load());
    }

    public static ExtractorRegistry create(SyntaxProvider provider, ExtractionSettings settings) {
        var map = new EnumMap<Language, LanguageExtractor>(Language.class);
        register(map, new GoExtractor(provider, settings));
        register(map, new CppExtractor(provider, settings));
        register(map, new CExtractor(provider, settings));
        register(map, new PythonExtractor(provider, settings));
        register(map, new JavaExtractor(provider, settings));
        register(map, new KotlinExtractor(provider, settings));
        register(map, new SwiftExtractor(provider, settings));
        register(map, new ObjcExtractor(provider, settings));
        register(map, new ObjcppExtractor(provider, settings));
        register(map, new JsExtractor(provider, settings));
        register(map, new TypescriptExtractor(provider, settings));
        return new ExtractorRegistry(map, settings);
    }

    private static void register(Map<Language, LanguageExtractor> map, LanguageExtractor extractor) {
        map.put(extractor.language(), extractor);
    }

    public Optional<LanguageExtractor> forLanguage(Language language) {
        return Optional.ofNullable(extractors.get(language));
    }

    public Set<Language> supportedLanguages() {
        return extractors.keySet();
    }

    public ExtractionSettings settings() {
        return settings;
    }
}
