package com.phillippitts.vibedj.domain;

/**
 * An oracle candidate after cooldown scoring.
 *
 * @param title       resolved title (never blank)
 * @param artist      resolved artist, {@code "Unknown"} when absent
 * @param searchQuery combined search string sent to the player
 * @param rationale   the oracle's reasoning for the candidate
 * @param score       cooldown score in [floor, 1.0]
 * @param probability display-only selection probability in percent
 */
public record ScoredCandidate(
        String title,
        String artist,
        String searchQuery,
        String rationale,
        double score,
        double probability
) {

    public ScoredCandidate withProbability(double p) {
        return new ScoredCandidate(title, artist, searchQuery, rationale, score, p);
    }
}
