package org.digitera.delivery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlugUtilTest {

    @Test
    void slugifiesStoreNames() {
        assertEquals("janes-art-store", SlugUtil.slugify("Jane's Art Store"));
        assertEquals("cafe-creme", SlugUtil.slugify("  Café   Crème!! "));
        assertEquals("3d-models-more", SlugUtil.slugify("3D Models & More"));
    }

    @Test
    void fallsBackWhenNothingIsLeft() {
        assertEquals("store", SlugUtil.slugify("!!!"));
        assertEquals("store", SlugUtil.slugify("商店"));
        assertEquals("store", SlugUtil.slugify(null));
    }

    @Test
    void truncatesLongNames() {
        String slug = SlugUtil.slugify("a".repeat(150));
        assertEquals(100, slug.length());
        assertTrue(slug.chars().allMatch(c -> c == 'a'));
    }
}
