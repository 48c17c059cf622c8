package uk.gegc.learnpath.shared.util;

import java.text.Normalizer;
import java.util.Locale;

public final class SlugUtils {

    private static final int MAX_LENGTH = 200;

    private SlugUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Lowercase ASCII slug with single hyphens between alphanumeric runs, e.g. {@code "Intro to Java!" -> "intro-to-java"}.
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return slug;
    }
}
