package com.examboard.pseudocode.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Source languages accepted by the converter.
 */
public enum Language {
    JAVA("Java", ".java"),
    TYPESCRIPT("TypeScript", ".ts", ".tsx");

    private final String displayName;
    private final String[] extensions;

    Language(String displayName, String... extensions) {
        this.displayName = displayName;
        this.extensions = extensions;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Infers the language from a file name extension.
     */
    public static Optional<Language> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            for (String extension : language.extensions) {
                if (lower.endsWith(extension)) {
                    return Optional.of(language);
                }
            }
        }
        return Optional.empty();
    }
}
