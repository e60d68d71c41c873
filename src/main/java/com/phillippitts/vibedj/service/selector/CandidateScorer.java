package com.phillippitts.vibedj.service.selector;

/**
 * Scores a (title, artist) pair for selection; higher means more eligible.
 */
@FunctionalInterface
public interface CandidateScorer {

    double score(String title, String artist);
}
