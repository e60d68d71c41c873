package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.exception.OracleException;
import com.phillippitts.vibedj.service.oracle.OracleCandidate;
import com.phillippitts.vibedj.service.oracle.RecommendationResponse;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the recommender's JSON answer. Non-object candidate entries are skipped.
 */
final class RecommendationJsonParser {

    private RecommendationJsonParser() {}

    static RecommendationResponse parse(String json, String oracleName) {
        if (json == null || json.isBlank()) {
            throw new OracleException("Empty recommendation response", oracleName);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new OracleException("Malformed recommendation JSON: " + e.getMessage(), oracleName, e);
        }

        if (obj.optBoolean("skip_music", false)) {
            String reason = obj.optString("skip_reason", "");
            return RecommendationResponse.skip(reason.isBlank() ? "skip" : reason);
        }

        List<OracleCandidate> candidates = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("candidates");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject c = arr.optJSONObject(i);
                if (c == null) {
                    continue;
                }
                candidates.add(new OracleCandidate(
                        c.optString("title", ""),
                        c.optString("artist", ""),
                        c.optString("search_query", ""),
                        c.optString("reasoning", "")));
            }
        }
        return RecommendationResponse.of(candidates);
    }
}
