package org.dxworks.codetracer;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        return detectLanguage(fileName.toString());
    }

    public static Optional<Language> detectLanguage(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        // .d.ts files only declare types, nothing to call into
        if (lower.endsWith(".d.ts")) {
            return Optional.empty();
        }
        for (Language language : Language.values()) {
            if (language.matchesFileName(lower)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    public static boolean isSupported(Path filePath) {
        return detectLanguage(filePath).isPresent();
    }
}
