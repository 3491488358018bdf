package com.tutorflow.tutorbackend.shared;

import java.text.Normalizer;
import java.util.function.Predicate;

public final class SlugUtil {
    private SlugUtil() {}

    public static String toSlug(String input) {
        if (input == null) return "";
        String n = Normalizer.normalize(input, Normalizer.Form.NFD)
                .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
        String s = n.toLowerCase()
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return s.length() == 0 ? "item" : s;
    }

    /**
     * Slug for {@code input}, suffixed with -2, -3, ... until {@code taken} no longer matches.
     */
    public static String uniqueSlug(String input, Predicate<String> taken) {
        String base = toSlug(input);
        String candidate = base;
        int n = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + n++;
        }
        return candidate;
    }
}
