package com.phillippitts.vibedj.service.oracle;

import java.util.List;

/**
 * Output of the recommender oracle: ranked candidates, or a request to play nothing.
 */
public record RecommendationResponse(List<OracleCandidate> candidates, boolean skipMusic, String skipReason) {

    public RecommendationResponse {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        skipReason = skipReason == null ? "" : skipReason;
    }

    public static RecommendationResponse of(List<OracleCandidate> candidates) {
        return new RecommendationResponse(candidates, false, "");
    }

    public static RecommendationResponse skip(String reason) {
        return new RecommendationResponse(List.of(), true, reason);
    }
}
