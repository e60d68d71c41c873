package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.CalendarEvent;
import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.PlayedTrack;
import com.phillippitts.vibedj.domain.VibeTargets;
import com.phillippitts.vibedj.service.oracle.PreviousVibeState;
import com.phillippitts.vibedj.service.oracle.RecommendationRequest;
import com.phillippitts.vibedj.service.oracle.VibeRequest;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Serializes oracle requests to the snake_case JSON the oracles expect.
 */
final class OracleJson {

    private OracleJson() {}

    static JSONObject vibeRequest(VibeRequest r) {
        JSONObject o = new JSONObject();
        o.put("day_of_week", dayName(r.dayOfWeek()));
        JSONArray events = new JSONArray();
        for (CalendarEvent e : r.calendarEvents()) {
            events.put(new JSONObject()
                    .put("summary", e.summary() == null ? "" : e.summary())
                    .put("start", instant(e.start()))
                    .put("end", instant(e.end())));
        }
        o.put("calendar_events", events);
        JSONArray chat = new JSONArray();
        for (ChatExcerpt m : r.recentChat()) {
            chat.put(new JSONObject()
                    .put("time_utc", m.timestamp().toString())
                    .put("sender", m.sender())
                    .put("content", m.content()));
        }
        o.put("recent_chat", chat);
        o.put("previous_state", r.previousState() == null ? JSONObject.NULL : previousState(r.previousState()));
        return o;
    }

    static JSONObject recommendationRequest(RecommendationRequest r) {
        JSONObject o = new JSONObject();
        o.put("day_of_week", dayName(r.dayOfWeek()));
        o.put("vibe_targets", vibeTargets(r.vibeTargets()));
        JSONArray recent = new JSONArray();
        for (PlayedTrack p : r.recentlyPlayed()) {
            recent.put(playedTrack(p));
        }
        o.put("recently_played", recent);
        o.put("last_played", r.lastPlayed() == null ? JSONObject.NULL : new JSONObject()
                .put("title", r.lastPlayed().title())
                .put("artist", r.lastPlayed().artist())
                .put("search_query", nullable(r.lastPlayed().searchQuery())));
        JSONArray provided = new JSONArray();
        for (CatalogTrack t : r.providedSongs()) {
            JSONObject sliders = new JSONObject();
            t.sliders().asMap().forEach((f, v) -> sliders.put(f.key(), v));
            provided.put(new JSONObject()
                    .put("title", t.title())
                    .put("artist", t.artist())
                    .put("genre", t.genre())
                    .put("sliders", sliders)
                    .put("prob_factor", t.probabilityFactor()));
        }
        o.put("provided_songs", provided);
        return o;
    }

    static JSONObject vibeTargets(VibeTargets t) {
        return new JSONObject()
                .put("audio_targets", audioTargets(t.audioTargets()))
                .put("energy_target", t.energyTarget())
                .put("valence_target", t.valenceTarget())
                .put("vocal_tolerance", t.vocalTolerance())
                .put("context_block", t.contextBlock())
                .put("verbal_plan", t.verbalPlan())
                .put("phase_note", t.phaseNote())
                .put("phase_progress", t.phaseProgress())
                .put("current_mood", t.currentMood())
                .put("current_energy", t.currentEnergy())
                .put("anxiety_level", t.anxietyLevel())
                .put("music_filters", t.musicFilters().isEmpty() ? JSONObject.NULL : musicFilters(t.musicFilters()));
    }

    static JSONObject audioTargets(AudioTargets targets) {
        JSONObject o = new JSONObject();
        for (AudioFeature f : AudioFeature.values()) {
            o.put(f.key(), targets.get(f));
        }
        return o;
    }

    static JSONObject musicFilters(MusicFilters f) {
        return new JSONObject()
                .put("include_genres", new JSONArray(f.includeGenres()))
                .put("exclude_genres", new JSONArray(f.excludeGenres()))
                .put("include_artists", new JSONArray(f.includeArtists()))
                .put("exclude_artists", new JSONArray(f.excludeArtists()))
                .put("include_keywords", new JSONArray(f.includeKeywords()));
    }

    private static JSONObject previousState(PreviousVibeState s) {
        return new JSONObject()
                .put("verbal_plan", s.verbalPlan())
                .put("context_block", s.contextBlock())
                .put("plan_duration_minutes", s.planDurationMinutes())
                .put("elapsed_minutes", s.elapsedMinutes())
                .put("current_targets", s.currentTargets() == null ? JSONObject.NULL : audioTargets(s.currentTargets()))
                .put("current_phase_note", s.currentPhaseNote())
                .put("music_filters", s.musicFilters() == null || s.musicFilters().isEmpty()
                        ? JSONObject.NULL : musicFilters(s.musicFilters()));
    }

    private static JSONObject playedTrack(PlayedTrack p) {
        return new JSONObject()
                .put("title", p.title())
                .put("artist", p.artist())
                .put("last_played_utc", instant(p.lastPlayed()))
                .put("play_count_today", p.playsToday())
                .put("play_count_all_time", p.playsAllTime())
                .put("audio_targets", p.targets() == null ? JSONObject.NULL : audioTargets(p.targets()));
    }

    private static Object instant(Instant i) {
        return i == null ? JSONObject.NULL : i.toString();
    }

    private static Object nullable(String s) {
        return s == null ? JSONObject.NULL : s;
    }

    private static String dayName(DayOfWeek day) {
        return day == null ? "" : day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        ArrayList<String> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            String s = array.optString(i, "");
            if (!s.isBlank()) {
                out.add(s.strip());
            }
        }
        return out;
    }
}
