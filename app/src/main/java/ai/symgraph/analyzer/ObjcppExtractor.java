package ai.symgraph.analyzer;

import ai.symgraph.analyzer.treesitter.SyntaxProvider;
import java.util.LinkedHashMap;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Objective-C++ ({@code .mm}). There is no dedicated grammar, so the C++ extractor runs first and the Objective-C
 * extractor is the fallback when the C++ pass yields nothing usable. Results are always labelled {@code objcpp}.
 */
public final class ObjcppExtractor implements LanguageExtractor {
    private static final Logger log = LoggerFactory.getLogger(ObjcppExtractor.class);

    /** Kinds for which the Objective-C reading wins when both passes report the same name. */
    private static final Set<String> OBJC_PREFERRED_KINDS =
            Set.of(SymbolKinds.CLASS, SymbolKinds.IMPLEMENTATION, SymbolKinds.PROTOCOL, SymbolKinds.CATEGORY);

    private final CppExtractor cpp;
    private final ObjcExtractor objc;

    public ObjcppExtractor(SyntaxProvider provider, ExtractionSettings settings) {
        this(new CppExtractor(provider, settings), new ObjcExtractor(provider, settings));
    }

    ObjcppExtractor(CppExtractor cpp, ObjcExtractor objc) {
        this.cpp = cpp;
        this.objc = objc;
    }

    @Override
    public Language language() {
        return Language.OBJCPP;
    }

    @Override
    public ExtractionResult extract(SourceFile file) {
        var cppResult = cpp.extract(file);
        var cppFile = cppResult.file();
        if (!cppResult.hasError()) {
            return relabel(cppResult);
        }
        if (cppFile != null && (!cppFile.symbols().isEmpty() || !cppFile.dependencies().isEmpty())) {
            return relabel(cppResult);
        }
        if (cppFile == null || isReadFailure(cppResult.error())) {
            return relabel(cppResult);
        }

        log.debug("C++ pass found nothing in {}; retrying as Objective-C", file.path());
        cppFile.releaseTree();
        return relabel(objc.extract(file.path(), cppFile.content()));
    }

    /**
     * Runs both passes and merges them: symbols keyed by {@code kind:name} (Objective-C wins for classes,
     * implementations, protocols and categories), dependencies keyed by {@code type:source:target}, first seen kept.
     * When exactly one pass fails, the other's result is returned; when both fail, the C++ one is.
     */
    public ExtractionResult extractWithBoth(SourceFile file) {
        var cppResult = cpp.extract(file);
        var cppFile = cppResult.file();
        if (cppFile == null || isReadFailure(cppResult.error())) {
            return relabel(cppResult);
        }
        var objcResult = objc.extract(file.path(), cppFile.content());
        var objcFile = objcResult.file();

        if (cppResult.hasError() && objcResult.hasError()) {
            if (objcFile != null) objcFile.releaseTree();
            return relabel(cppResult);
        }
        if (cppResult.hasError() || objcFile == null) {
            cppFile.releaseTree();
            return relabel(objcResult);
        }
        if (objcResult.hasError()) {
            objcFile.releaseTree();
            return relabel(cppResult);
        }
        return ExtractionResult.ok(merge(cppFile, objcFile));
    }

    private static ParsedFile merge(ParsedFile cppFile, ParsedFile objcFile) {
        var merged = new ParsedFile(
                cppFile.path(), Language.OBJCPP, cppFile.content(), cppFile.tree().orElse(null));

        var symbols = new LinkedHashMap<String, ParsedSymbol>();
        for (var symbol : cppFile.symbols()) {
            symbols.put(symbol.kind() + ":" + symbol.name(), symbol);
        }
        for (var symbol : objcFile.symbols()) {
            var key = symbol.kind() + ":" + symbol.name();
            if (OBJC_PREFERRED_KINDS.contains(symbol.kind())) {
                symbols.put(key, symbol);
            } else {
                symbols.putIfAbsent(key, symbol);
            }
        }
        symbols.values().forEach(merged::addSymbol);

        var dependencies = new LinkedHashMap<String, ParsedDependency>();
        for (var dependency : cppFile.dependencies()) {
            dependencies.putIfAbsent(dependency.dedupKey(), dependency);
        }
        for (var dependency : objcFile.dependencies()) {
            dependencies.putIfAbsent(dependency.dedupKey(), dependency);
        }
        dependencies.values().forEach(merged::addDependency);

        objcFile.releaseTree();
        return merged;
    }

    private static boolean isReadFailure(@Nullable DetailedParseError error) {
        return error != null && error.kind() == DetailedParseError.ErrorKind.FILESYSTEM;
    }

    private static ExtractionResult relabel(ExtractionResult result) {
        var file = result.file();
        if (file != null) {
            file.relabel(Language.OBJCPP);
        }
        return result;
    }
}
