package com.phillippitts.vibedj.domain;

/**
 * Play statistics used for recency filtering and cooldown scoring.
 *
 * @param found          whether the track has ever been played
 * @param playsToday     plays since the last day boundary
 * @param playsWeek      plays since the last ISO-week boundary
 * @param playsAllTime   total plays
 * @param hoursSinceLast hours since the most recent play, {@code null} when never played
 */
public record PlayStats(boolean found, int playsToday, int playsWeek, int playsAllTime, Double hoursSinceLast) {

    public static final PlayStats NEVER_PLAYED = new PlayStats(false, 0, 0, 0, null);
}
