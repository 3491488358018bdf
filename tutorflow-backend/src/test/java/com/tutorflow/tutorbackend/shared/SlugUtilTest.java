package com.tutorflow.tutorbackend.shared;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SlugUtilTest {

    @Test
    void slugifiesAccentsAndPunctuation() {
        assertEquals("creme-brulee-basics", SlugUtil.toSlug("  Crème Brûlée: Basics! "));
        assertEquals("item", SlugUtil.toSlug("!!!"));
    }

    @Test
    void uniqueSlugAppendsCounter() {
        Set<String> taken = Set.of("java-101", "java-101-2");

        assertEquals("java-101-3", SlugUtil.uniqueSlug("Java 101", taken::contains));
        assertEquals("spring", SlugUtil.uniqueSlug("Spring", taken::contains));
    }
}
