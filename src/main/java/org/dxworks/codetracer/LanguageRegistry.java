package org.dxworks.codetracer;

import org.dxworks.codetracer.analyzer.JavaScriptFrontEnd;
import org.dxworks.codetracer.analyzer.LanguageFrontEnd;
import org.dxworks.codetracer.analyzer.PythonFrontEnd;
import org.dxworks.codetracer.analyzer.TypeScriptFrontEnd;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class LanguageRegistry {

    private final Map<Language, LanguageFrontEnd> frontEnds;

    public LanguageRegistry(Map<Language, LanguageFrontEnd> frontEnds) {
        this.frontEnds = Collections.unmodifiableMap(new EnumMap<>(frontEnds));
    }

    public static LanguageRegistry create(CodetracerConfig config) {
        Map<Language, LanguageFrontEnd> frontEnds = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            frontEnds.put(language, createFrontEnd(language, config.getRouteMethods()));
        }
        return new LanguageRegistry(frontEnds);
    }

    /**
     * Front-end for the file's language; empty for files no front-end understands.
     */
    public Optional<LanguageFrontEnd> frontEndFor(String filePath) {
        return LanguageDetector.detectLanguage(filePath).map(frontEnds::get);
    }

    private static LanguageFrontEnd createFrontEnd(Language language, Set<String> routeMethods) {
        return switch (language) {
            case JAVASCRIPT -> new JavaScriptFrontEnd(routeMethods);
            case TYPESCRIPT, TSX -> new TypeScriptFrontEnd(language, routeMethods);
            case PYTHON -> new PythonFrontEnd(routeMethods);
        };
    }
}
