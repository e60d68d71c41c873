package com.phillippitts.vibedj.service.weights;

import com.phillippitts.vibedj.util.TextNormalizer;

import java.util.Map;

/**
 * Snapshot of all override factors plus per-genre track counts, used to compute a
 * track's effective probability factor.
 */
public record WeightOverrides(
        Map<String, Double> genre,
        Map<String, Double> artist,
        Map<String, Double> track,
        Map<String, Integer> genreCounts
) {

    public static final WeightOverrides NONE = new WeightOverrides(Map.of(), Map.of(), Map.of(), Map.of());

    public WeightOverrides {
        genre = Map.copyOf(genre);
        artist = Map.copyOf(artist);
        track = Map.copyOf(track);
        genreCounts = Map.copyOf(genreCounts);
    }

    /**
     * {@code pf * wTrack * wArtist * wGenre / max(1, genreCount)}, each factor clamped at 0.
     * Keys are looked up on the raw (un-folded) catalog text.
     */
    public double effectiveFactor(double probabilityFactor, String title, String artist, String genreName) {
        double wTrack = track.getOrDefault(TextNormalizer.trackKey(title, artist), 1.0);
        double wArtist = this.artist.getOrDefault(TextNormalizer.key(artist), 1.0);
        double wGenre = genre.getOrDefault(TextNormalizer.key(genreName), 1.0);
        int count = genreCounts.getOrDefault(TextNormalizer.key(genreName), 0);
        double denom = Math.max(1, count);
        return Math.max(0.0, probabilityFactor) * Math.max(0.0, wTrack) * Math.max(0.0, wArtist)
                * Math.max(0.0, wGenre) / denom;
    }
}
