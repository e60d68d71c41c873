package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.HistoryRecord;
import com.phillippitts.vibedj.util.TextNormalizer;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC access to the {@code played_songs} table.
 *
 * <p>Lookups match on {@code LOWER(TRIM(..))} so rows differing only in case or surrounding
 * whitespace are found together.
 */
public class PlayHistoryRepository {

    private static final String COLUMNS = "id, title, artist, search_query, first_played, last_played, "
            + "plays_today, plays_week, plays_month, plays_year, plays_all_time, last_count_reset, "
            + "energy, valence, loudness, speechiness, acousticness, instrumentalness, liveness, tempo";

    private static final RowMapper<HistoryRecord> ROW_MAPPER = PlayHistoryRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public PlayHistoryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    /**
     * All rows for a normalized (title, artist), canonical (lowest id) first.
     */
    public List<HistoryRecord> findByTrack(String title, String artist) {
        return jdbc.query("SELECT " + COLUMNS + " FROM played_songs"
                        + " WHERE LOWER(TRIM(title)) = :title AND LOWER(TRIM(artist)) = :artist ORDER BY id ASC",
                new MapSqlParameterSource()
                        .addValue("title", TextNormalizer.key(title))
                        .addValue("artist", TextNormalizer.key(artist)),
                ROW_MAPPER);
    }

    /**
     * Most recent play of any track by the artist, or {@code null}.
     */
    public Instant lastPlayedByArtist(String artist) {
        Timestamp ts = jdbc.queryForObject(
                "SELECT MAX(last_played) FROM played_songs WHERE LOWER(TRIM(artist)) = :artist",
                new MapSqlParameterSource("artist", TextNormalizer.key(artist)),
                Timestamp.class);
        return ts == null ? null : ts.toInstant();
    }

    /**
     * The most recently played rows, newest first.
     */
    public List<HistoryRecord> findMostRecent(int limit) {
        return jdbc.query("SELECT " + COLUMNS + " FROM played_songs ORDER BY last_played DESC, id DESC LIMIT :limit",
                new MapSqlParameterSource("limit", Math.max(0, limit)), ROW_MAPPER);
    }

    public long insert(HistoryRecord r) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update("INSERT INTO played_songs (title, artist, search_query, first_played, last_played, "
                        + "plays_today, plays_week, plays_month, plays_year, plays_all_time, last_count_reset, "
                        + "energy, valence, loudness, speechiness, acousticness, instrumentalness, liveness, tempo) "
                        + "VALUES (:title, :artist, :searchQuery, :firstPlayed, :lastPlayed, "
                        + ":playsToday, :playsWeek, :playsMonth, :playsYear, :playsAllTime, :lastCountReset, "
                        + ":energy, :valence, :loudness, :speechiness, :acousticness, :instrumentalness, "
                        + ":liveness, :tempo)",
                params(r), keys, new String[] {"id"});
        Number key = keys.getKey();
        return key == null ? -1L : key.longValue();
    }

    public void update(HistoryRecord r) {
        jdbc.update("UPDATE played_songs SET title = :title, artist = :artist, search_query = :searchQuery, "
                        + "first_played = :firstPlayed, last_played = :lastPlayed, plays_today = :playsToday, "
                        + "plays_week = :playsWeek, plays_month = :playsMonth, plays_year = :playsYear, "
                        + "plays_all_time = :playsAllTime, last_count_reset = :lastCountReset, "
                        + "energy = :energy, valence = :valence, loudness = :loudness, "
                        + "speechiness = :speechiness, acousticness = :acousticness, "
                        + "instrumentalness = :instrumentalness, liveness = :liveness, tempo = :tempo "
                        + "WHERE id = :id",
                params(r).addValue("id", r.id()));
    }

    public void deleteByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        jdbc.update("DELETE FROM played_songs WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids));
    }

    public int count() {
        Integer n = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM played_songs", Integer.class);
        return n == null ? 0 : n;
    }

    private static MapSqlParameterSource params(HistoryRecord r) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("title", r.title())
                .addValue("artist", r.artist())
                .addValue("searchQuery", r.searchQuery())
                .addValue("firstPlayed", toTimestamp(r.firstPlayed()))
                .addValue("lastPlayed", toTimestamp(r.lastPlayed()))
                .addValue("playsToday", r.playsToday())
                .addValue("playsWeek", r.playsWeek())
                .addValue("playsMonth", r.playsMonth())
                .addValue("playsYear", r.playsYear())
                .addValue("playsAllTime", r.playsAllTime())
                .addValue("lastCountReset", r.lastCountReset() == null ? null : r.lastCountReset().toString());
        for (AudioFeature f : AudioFeature.values()) {
            p.addValue(f.key(), r.lastTargets() == null ? null : r.lastTargets().get(f));
        }
        return p;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static HistoryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp first = rs.getTimestamp("first_played");
        Timestamp last = rs.getTimestamp("last_played");
        String reset = rs.getString("last_count_reset");
        return new HistoryRecord(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("artist"),
                rs.getString("search_query"),
                first == null ? null : first.toInstant(),
                last == null ? null : last.toInstant(),
                rs.getInt("plays_today"),
                rs.getInt("plays_week"),
                rs.getInt("plays_month"),
                rs.getInt("plays_year"),
                rs.getInt("plays_all_time"),
                reset == null || reset.isBlank() ? null : LocalDate.parse(reset.strip()),
                mapTargets(rs));
    }

    /**
     * Stored sliders, or {@code null} when none were ever recorded. Individually missing
     * sliders take the neutral defaults.
     */
    private static AudioTargets mapTargets(ResultSet rs) throws SQLException {
        Map<AudioFeature, Integer> values = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            int v = rs.getInt(f.key());
            if (!rs.wasNull()) {
                values.put(f, v);
            }
        }
        return values.isEmpty() ? null : AudioTargets.fromMap(values, AudioTargets.DEFAULTS);
    }
}
