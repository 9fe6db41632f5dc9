package ai.symgraph.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ImportClassifierTest {

    @Test
    void emptyOrSeparatorFreeImportsAreInternal() {
        assertFalse(ImportClassifier.isExternal("", Language.GO, ""));
        assertFalse(ImportClassifier.isExternal("fmt", Language.GO, ""));
        assertFalse(ImportClassifier.isExternal("os", Language.PYTHON, "app.main"));
        assertFalse(ImportClassifier.isExternal("vector", Language.CPP, "src/main.cpp"));
    }

    @Test
    void goImportsWithDotsAreExternal() {
        assertTrue(ImportClassifier.isExternal("github.com/pkg/errors", Language.GO, ""));
        assertFalse(ImportClassifier.isExternal("net/http", Language.GO, ""));
    }

    @Test
    void jvmImportsShareBasePackage() {
        assertFalse(ImportClassifier.isExternal("java.util.List", Language.JAVA, "com.acme.app"));
        assertFalse(ImportClassifier.isExternal("kotlinx.coroutines.flow.Flow", Language.KOTLIN, "com.acme"));
        assertFalse(ImportClassifier.isExternal("com.acme.util.Strings", Language.JAVA, "com.acme.app"));
        assertTrue(ImportClassifier.isExternal("org.slf4j.Logger", Language.JAVA, "com.acme.app"));
        assertTrue(ImportClassifier.isExternal("com.other.Thing", Language.JAVA, "com.acme.app"));
    }

    @Test
    void jvmImportsWithoutPackageContextAreExternal() {
        assertTrue(ImportClassifier.isExternal("com.acme.util.Strings", Language.JAVA, ""));
    }

    @Test
    void pythonRelativeImportsAreInternal() {
        assertFalse(ImportClassifier.isExternal(".models", Language.PYTHON, "app.views"));
        assertFalse(ImportClassifier.isExternal("app.models", Language.PYTHON, "app.views"));
        assertTrue(ImportClassifier.isExternal("requests.adapters", Language.PYTHON, "app.views"));
    }

    @Test
    void includesCompareTheirFirstDirectory() {
        assertFalse(ImportClassifier.isExternal("widget.h", Language.CPP, "src/widget.cpp"));
        assertFalse(ImportClassifier.isExternal("src/util/strings.h", Language.CPP, "src/widget.cpp"));
        assertTrue(ImportClassifier.isExternal("boost/optional.hpp", Language.CPP, "src/widget.cpp"));
        assertTrue(ImportClassifier.isExternal("Foundation/Foundation.h", Language.OBJC, "MyClass.m"));
    }

    @Test
    void moduleSpecifiersFollowTheSeparatorRule() {
        assertFalse(ImportClassifier.isExternal("./api", Language.JAVASCRIPT, "web/cart.js"));
        assertFalse(ImportClassifier.isExternal("../shared/util", Language.TYPESCRIPT, "src/app.ts"));
        assertFalse(ImportClassifier.isExternal("react", Language.JAVASCRIPT, "web/cart.js"));
        assertFalse(ImportClassifier.isExternal("web/widgets", Language.JAVASCRIPT, "web/cart.js"));
        assertTrue(ImportClassifier.isExternal("lodash/merge", Language.JAVASCRIPT, "web/cart.js"));
        assertTrue(ImportClassifier.isExternal("@angular/core", Language.TYPESCRIPT, "src/app.ts"));
    }

    @Test
    void swiftFrameworksAreExternal() {
        assertTrue(ImportClassifier.isExternal("Foundation", Language.SWIFT, ""));
        assertTrue(ImportClassifier.isExternal("UIKit.UIView", Language.SWIFT, ""));
        assertFalse(ImportClassifier.isExternal("NetworkLayer", Language.SWIFT, ""));
    }

    @Test
    void classificationIsDeterministic() {
        for (int i = 0; i < 3; i++) {
            assertTrue(ImportClassifier.isExternal("org.junit.Test", Language.JAVA, "com.acme"));
        }
    }

    @Test
    void basePackageIsFirstTwoSegments() {
        assertEquals("com.acme", BasePackages.of("com.acme.app.service"));
        assertEquals("acme", BasePackages.of("acme"));
        assertEquals("", BasePackages.of(""));
    }
}
