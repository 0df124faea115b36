package com.finclinic.backend.services.catalog;

import java.util.Locale;

public record LocalizedText(String en, String ar) {

    public LocalizedText {
        if (en == null || en.isBlank()) throw new IllegalArgumentException("English text is required");
        if (ar == null || ar.isBlank()) throw new IllegalArgumentException("Arabic text is required");
    }

    public static LocalizedText of(String en, String ar) {
        return new LocalizedText(en, ar);
    }

    /**
     * Arabic for "ar" (any case), English for anything else including null.
     */
    public String resolve(String language) {
        if (language != null && "ar".equals(language.trim().toLowerCase(Locale.ROOT))) {
            return ar;
        }
        return en;
    }
}
