package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.Phase;
import com.phillippitts.vibedj.domain.VibePlan;
import com.phillippitts.vibedj.exception.OracleException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the vibe oracle's JSON answer into a {@link VibePlan}.
 *
 * <p>Only a body that is not a JSON object is rejected. Missing or invalid sliders fall back
 * to {@link AudioTargets#DEFAULTS}, a gradient missing either end falls back to the defaults
 * as a hold, and durations are clamped into their contract ranges.
 */
final class VibePlanJsonParser {

    static final int MIN_PLAN_MINUTES = 15;
    static final int MAX_PLAN_MINUTES = 60;
    static final int MIN_PHASE_MINUTES = 5;
    static final int MAX_PHASE_MINUTES = 60;
    static final int DEFAULT_PHASE_MINUTES = 30;

    private VibePlanJsonParser() {}

    static VibePlan parse(String json, String oracleName, int defaultPlanMinutes) {
        if (json == null || json.isBlank()) {
            throw new OracleException("Empty vibe plan response", oracleName);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new OracleException("Malformed vibe plan JSON: " + e.getMessage(), oracleName, e);
        }

        List<Phase> phases = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("phases");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject p = arr.optJSONObject(i);
                if (p != null) {
                    phases.add(parsePhase(p));
                }
            }
        }

        int planMinutes = obj.has("plan_duration_minutes")
                ? clampInt(obj.optInt("plan_duration_minutes", defaultPlanMinutes), MIN_PLAN_MINUTES, MAX_PLAN_MINUTES)
                : defaultPlanMinutes;

        return new VibePlan(
                obj.optString("verbal_plan", ""),
                obj.optString("current_context_block", ""),
                obj.optString("context_block_ends", ""),
                planMinutes,
                phases,
                parseFilters(obj.optJSONObject("music_filters")),
                optNonBlank(obj, "current_mood", "unknown"),
                optNonBlank(obj, "current_energy", "unknown"),
                optNonBlank(obj, "anxiety_level", "calm"),
                obj.optBoolean("is_continuation", false),
                obj.optString("change_reason", ""),
                obj.optString("reasoning", ""));
    }

    static Phase parsePhase(JSONObject p) {
        int minutes = clampInt(p.optInt("duration_minutes", DEFAULT_PHASE_MINUTES), MIN_PHASE_MINUTES, MAX_PHASE_MINUTES);
        String note = p.optString("note", "");
        JSONObject hold = p.optJSONObject("targets");
        if (hold != null) {
            return Phase.hold(minutes, parseTargets(hold), note);
        }
        JSONObject start = p.optJSONObject("targets_start");
        JSONObject end = p.optJSONObject("targets_end");
        if (start != null && end != null) {
            return Phase.gradient(minutes, parseTargets(start), parseTargets(end), note);
        }
        return Phase.hold(minutes, AudioTargets.DEFAULTS, note);
    }

    static AudioTargets parseTargets(JSONObject o) {
        Map<AudioFeature, Integer> values = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            double v = o.optDouble(f.key(), Double.NaN);
            values.put(f, AudioTargets.clampRound(v, AudioTargets.DEFAULTS.get(f)));
        }
        return AudioTargets.fromMap(values, AudioTargets.DEFAULTS);
    }

    static MusicFilters parseFilters(JSONObject o) {
        if (o == null) {
            return MusicFilters.NONE;
        }
        return new MusicFilters(
                OracleJson.strings(o.optJSONArray("include_genres")),
                OracleJson.strings(o.optJSONArray("exclude_genres")),
                OracleJson.strings(o.optJSONArray("include_artists")),
                OracleJson.strings(o.optJSONArray("exclude_artists")),
                OracleJson.strings(o.optJSONArray("include_keywords")));
    }

    private static String optNonBlank(JSONObject o, String key, String fallback) {
        String s = o.optString(key, "");
        return s.isBlank() ? fallback : s;
    }

    private static int clampInt(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
