package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.MusicFilters;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC access to the {@code music_tracks} catalog table and {@code music_genre_stats}.
 */
public class CatalogRepository {

    private static final String COLUMNS = "track_id, track_name, artist_name, genre, prob_factor, "
            + "energy, valence, loudness, speechiness, acousticness, instrumentalness, liveness, tempo";

    private static final RowMapper<CatalogRow> ROW_MAPPER = CatalogRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    public CatalogRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    public List<CatalogRow> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM music_tracks", ROW_MAPPER);
    }

    /**
     * Range-gated, filtered query ordered by the coarse energy/valence distance.
     *
     * <p>Only rows with {@code prob_factor > 0} qualify. Exclusions become {@code NOT LIKE}
     * clauses; within an inclusion category entries are OR'd and categories are AND'd.
     * Keywords match the track name or the artist name.
     *
     * @param energyLo  native lower bound for energy (0..1)
     * @param energyHi  native upper bound for energy
     * @param valenceLo native lower bound for valence
     * @param valenceHi native upper bound for valence
     * @param targetEnergy  energy slider the ordering is relative to
     * @param targetValence valence slider the ordering is relative to
     */
    public List<CatalogRow> findGated(double energyLo, double energyHi, double valenceLo, double valenceHi,
                                      MusicFilters filters, double targetEnergy, double targetValence,
                                      int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("energyLo", energyLo)
                .addValue("energyHi", energyHi)
                .addValue("valenceLo", valenceLo)
                .addValue("valenceHi", valenceHi)
                .addValue("targetEnergy", targetEnergy)
                .addValue("targetValence", targetValence)
                .addValue("limit", limit);
        List<String> where = new ArrayList<>();
        where.add("prob_factor > 0");
        where.add("energy BETWEEN :energyLo AND :energyHi");
        where.add("valence BETWEEN :valenceLo AND :valenceHi");
        if (filters != null && !filters.isEmpty()) {
            FilterClauses clauses = new FilterClauses(params);
            clauses.exclude("genre", filters.excludeGenres(), where);
            clauses.exclude("artist_name", filters.excludeArtists(), where);
            clauses.include(List.of("genre"), filters.includeGenres(), where);
            clauses.include(List.of("artist_name"), filters.includeArtists(), where);
            clauses.include(List.of("track_name", "artist_name"), filters.includeKeywords(), where);
        }
        String sql = "SELECT " + COLUMNS + " FROM music_tracks WHERE " + String.join(" AND ", where)
                + " ORDER BY (2.0 * ABS(COALESCE(energy, 0.5) * 100.0 - :targetEnergy)"
                + " + 2.0 * ABS(COALESCE(valence, 0.5) * 100.0 - :targetValence)) ASC"
                + " LIMIT :limit";
        return jdbc.query(sql, params, ROW_MAPPER);
    }

    /**
     * Track count per normalized genre.
     */
    public Map<String, Integer> genreCounts() {
        Map<String, Integer> out = new HashMap<>();
        jdbc.getJdbcTemplate().query("SELECT genre, track_count FROM music_genre_stats", rs -> {
            String genre = rs.getString(1);
            if (genre != null) {
                out.put(genre.strip().toLowerCase(Locale.ROOT), Math.max(0, rs.getInt(2)));
            }
        });
        return out;
    }

    public void insertAll(List<CatalogRow> rows) {
        SqlParameterSource[] batch = rows.stream().map(CatalogRepository::params).toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate("INSERT INTO music_tracks (" + COLUMNS + ") VALUES (:trackId, :trackName, :artistName, "
                + ":genre, :probFactor, :energy, :valence, :loudness, :speechiness, :acousticness, "
                + ":instrumentalness, :liveness, :tempo)", batch);
    }

    /**
     * Rebuilds {@code music_genre_stats} from the catalog table.
     */
    public void refreshGenreStats() {
        jdbc.getJdbcTemplate().update("DELETE FROM music_genre_stats");
        jdbc.getJdbcTemplate().update("INSERT INTO music_genre_stats (genre, track_count) "
                + "SELECT LOWER(TRIM(genre)), COUNT(*) FROM music_tracks WHERE genre IS NOT NULL "
                + "GROUP BY LOWER(TRIM(genre))");
    }

    private static MapSqlParameterSource params(CatalogRow row) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("trackId", row.trackId())
                .addValue("trackName", row.trackName())
                .addValue("artistName", row.artistName())
                .addValue("genre", row.genre())
                .addValue("probFactor", row.probabilityFactor() == null ? 1.0 : row.probabilityFactor());
        for (AudioFeature f : AudioFeature.values()) {
            p.addValue(f.key(), row.nativeFeatures().get(f));
        }
        return p;
    }

    private static CatalogRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        Map<AudioFeature, Double> features = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            double v = rs.getDouble(f.key());
            if (!rs.wasNull()) {
                features.put(f, v);
            }
        }
        double pf = rs.getDouble("prob_factor");
        Double probFactor = rs.wasNull() ? null : pf;
        return new CatalogRow(
                rs.getString("track_id"),
                rs.getString("track_name"),
                rs.getString("artist_name"),
                rs.getString("genre"),
                probFactor,
                features);
    }

    /**
     * Accumulates LIKE clauses with generated parameter names.
     */
    private static final class FilterClauses {
        private final MapSqlParameterSource params;
        private int next;

        FilterClauses(MapSqlParameterSource params) {
            this.params = params;
        }

        void exclude(String column, List<String> values, List<String> where) {
            for (String v : values) {
                where.add("LOWER(" + column + ") NOT LIKE :" + bind(v));
            }
        }

        void include(List<String> columns, List<String> values, List<String> where) {
            if (values.isEmpty()) {
                return;
            }
            List<String> ors = new ArrayList<>();
            for (String column : columns) {
                for (String v : values) {
                    ors.add("LOWER(" + column + ") LIKE :" + bind(v));
                }
            }
            where.add("(" + String.join(" OR ", ors) + ")");
        }

        private String bind(String value) {
            String name = "f" + next++;
            params.addValue(name, "%" + value.strip().toLowerCase(Locale.ROOT) + "%");
            return name;
        }
    }
}
