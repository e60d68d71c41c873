package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.domain.VibePlan;
import com.phillippitts.vibedj.service.oracle.VibeOracle;
import com.phillippitts.vibedj.service.oracle.VibeRequest;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * {@link VibeOracle} backed by an HTTP endpoint that accepts the vibe request as JSON and
 * answers with a plan.
 */
public final class HttpVibeOracle extends AbstractHttpOracle implements VibeOracle {

    private final int defaultPlanMinutes;

    public HttpVibeOracle(HttpClient httpClient, String endpoint, Duration timeout, int defaultPlanMinutes) {
        super(httpClient, endpoint, timeout);
        this.defaultPlanMinutes = defaultPlanMinutes;
    }

    @Override
    public String oracleName() {
        return "vibe";
    }

    @Override
    public VibePlan plan(VibeRequest request) {
        String body = postJson(OracleJson.vibeRequest(request).toString());
        return VibePlanJsonParser.parse(body, oracleName(), defaultPlanMinutes);
    }
}
