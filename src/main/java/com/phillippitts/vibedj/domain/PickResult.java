package com.phillippitts.vibedj.domain;

/**
 * Outcome of a synchronous pick.
 *
 * <p>Either a chosen track ({@code skipMusic == false}) or the oracle's request to play
 * nothing for now ({@code skipMusic == true}, with {@code skipReason}).
 */
public record PickResult(
        String title,
        String artist,
        String searchQuery,
        String rationale,
        boolean skipMusic,
        String skipReason,
        VibeTargets targets,
        int backupCount
) {

    public static PickResult chosen(ScoredCandidate winner, VibeTargets targets, int backupCount) {
        return new PickResult(winner.title(), winner.artist(), winner.searchQuery(), winner.rationale(),
                false, "", targets, backupCount);
    }

    public static PickResult skip(String reason, VibeTargets targets) {
        return new PickResult("", "", "", "", true, reason == null || reason.isBlank() ? "skip" : reason,
                targets, 0);
    }
}
