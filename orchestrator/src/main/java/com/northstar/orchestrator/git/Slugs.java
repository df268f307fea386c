package com.northstar.orchestrator.git;

import java.text.Normalizer;
import java.util.Locale;

/** Branch-name-safe identifiers derived from free text. */
public final class Slugs {

    static final int MAX_LENGTH = 50;

    private Slugs() {}

    /**
     * "Increase button contrast!" -> "increase-button-contrast".
     * Never empty: text with no usable characters becomes "change".
     */
    public static String slugify(String text) {
        if (text == null) return "change";
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "change" : slug;
    }
}
