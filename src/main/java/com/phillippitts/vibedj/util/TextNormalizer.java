package com.phillippitts.vibedj.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Text normalization shared by catalog matching, history keys and weight keys.
 *
 * <p>Matching keys are conservative (trim + lowercase) to avoid false merges between
 * different tracks. Display text from the catalog is ASCII-folded so oracle prompts and
 * log lines stay plain ASCII.
 */
public final class TextNormalizer {

    /** Separator between title and artist in a track weight key. */
    public static final String TRACK_KEY_SEPARATOR = "|||";

    private TextNormalizer() {}

    /**
     * Returns {@code s.trim().toLowerCase()}, or "" for null.
     */
    public static String key(String s) {
        return s == null ? "" : s.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Builds the normalized track key {@code "<title>|||<artist>"}.
     */
    public static String trackKey(String title, String artist) {
        return key(title) + TRACK_KEY_SEPARATOR + key(artist);
    }

    /**
     * Best-effort ASCII folding: decomposes accents, drops combining marks, then drops
     * anything still outside ASCII.
     */
    public static String asciiSafe(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFKD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char ch = decomposed.charAt(i);
            if (Character.getType(ch) == Character.NON_SPACING_MARK) {
                continue;
            }
            if (ch < 128) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * ASCII-folded matching key, used when comparing catalog text against user filters.
     */
    public static String asciiKey(String s) {
        return key(asciiSafe(s));
    }
}
