package com.phillippitts.vibedj.util;

import java.util.Locale;

/**
 * Codec for the combined {@code "<title> by <artist>"} search string sent to the player.
 *
 * @param title  track title (never null, may be empty)
 * @param artist artist name (never null, may be empty)
 */
public record SearchQuery(String title, String artist) {

    /** Artist recorded when a pick carries no resolvable artist. */
    public static final String UNKNOWN_ARTIST = "Unknown";

    private static final String SEPARATOR = " by ";

    public SearchQuery {
        title = title == null ? "" : title.strip();
        artist = artist == null ? "" : artist.strip();
    }

    /**
     * Builds the combined search string. A blank artist yields the title alone.
     */
    public static String build(String title, String artist) {
        String t = title == null ? "" : title.strip();
        String a = artist == null ? "" : artist.strip();
        if (a.isEmpty()) {
            return t;
        }
        if (t.isEmpty()) {
            return a;
        }
        return t + SEPARATOR + a;
    }

    /**
     * Parses a combined search string, splitting on the last case-insensitive {@code " by "}.
     * Without a separator the whole string is treated as the title.
     */
    public static SearchQuery parse(String query) {
        if (query == null || query.isBlank()) {
            return new SearchQuery("", "");
        }
        String q = query.strip();
        int idx = q.toLowerCase(Locale.ROOT).lastIndexOf(SEPARATOR);
        if (idx <= 0) {
            return new SearchQuery(q, "");
        }
        return new SearchQuery(q.substring(0, idx), q.substring(idx + SEPARATOR.length()));
    }

    /**
     * Resolves a title/artist pair, filling whichever side is blank from the parsed query.
     */
    public static SearchQuery resolve(String title, String artist, String query) {
        String t = title == null ? "" : title.strip();
        String a = artist == null ? "" : artist.strip();
        if ((t.isEmpty() || a.isEmpty()) && query != null && !query.isBlank()) {
            SearchQuery parsed = parse(query);
            if (t.isEmpty()) {
                t = parsed.title();
            }
            if (a.isEmpty()) {
                a = parsed.artist();
            }
        }
        return new SearchQuery(t, a);
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }

    /**
     * Returns this pair with a blank artist replaced by {@link #UNKNOWN_ARTIST}.
     */
    public SearchQuery withDefaultArtist() {
        return artist.isEmpty() ? new SearchQuery(title, UNKNOWN_ARTIST) : this;
    }

    public String asQuery() {
        return build(title, artist);
    }
}
