package org.digitera.delivery.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 店铺名称 -> URL 标识
 */
public final class SlugUtil {

    private static final int MAX_LENGTH = 100;
    private static final String FALLBACK = "store";

    private SlugUtil() {
    }

    /**
     * "Jane's Art Store" -> "janes-art-store"
     */
    public static String slugify(String text) {
        if (text == null) {
            return FALLBACK;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replace("'", "")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (normalized.isEmpty()) {
            return FALLBACK;
        }
        if (normalized.length() > MAX_LENGTH) {
            normalized = normalized.substring(0, MAX_LENGTH).replaceAll("-+$", "");
        }
        return normalized;
    }
}
