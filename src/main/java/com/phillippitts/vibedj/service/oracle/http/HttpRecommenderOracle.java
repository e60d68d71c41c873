package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.service.oracle.RecommendationRequest;
import com.phillippitts.vibedj.service.oracle.RecommendationResponse;
import com.phillippitts.vibedj.service.oracle.RecommenderOracle;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * {@link RecommenderOracle} backed by an HTTP endpoint.
 */
public final class HttpRecommenderOracle extends AbstractHttpOracle implements RecommenderOracle {

    public HttpRecommenderOracle(HttpClient httpClient, String endpoint, Duration timeout) {
        super(httpClient, endpoint, timeout);
    }

    @Override
    public String oracleName() {
        return "recommender";
    }

    @Override
    public RecommendationResponse recommend(RecommendationRequest request) {
        return RecommendationJsonParser.parse(postJson(OracleJson.recommendationRequest(request).toString()),
                oracleName());
    }
}
