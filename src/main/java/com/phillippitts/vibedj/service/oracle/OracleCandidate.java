package com.phillippitts.vibedj.service.oracle;

/**
 * One recommendation as returned by the recommender. Title and artist may be blank when
 * only a combined search string was given.
 */
public record OracleCandidate(String title, String artist, String searchQuery, String rationale) {

    public OracleCandidate {
        title = title == null ? "" : title.strip();
        artist = artist == null ? "" : artist.strip();
        searchQuery = searchQuery == null ? "" : searchQuery.strip();
        rationale = rationale == null ? "" : rationale;
    }
}
