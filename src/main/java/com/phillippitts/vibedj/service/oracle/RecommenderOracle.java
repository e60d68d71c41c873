package com.phillippitts.vibedj.service.oracle;

import com.phillippitts.vibedj.exception.OracleException;

/**
 * Turns a shortlist plus history into ranked picks.
 */
public interface RecommenderOracle {

    /**
     * @throws OracleException if the oracle is unreachable or its answer is unusable
     */
    RecommendationResponse recommend(RecommendationRequest request);
}
