package com.phillippitts.vibedj.service.weights;

import com.phillippitts.vibedj.domain.WeightScope;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC access to the three override tables ({@code music_genre_weights},
 * {@code music_artist_weights}, {@code music_track_weights}). Keys are stored normalized.
 */
public class WeightOverrideRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public WeightOverrideRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    public Optional<Double> findFactor(WeightScope scope, String key) {
        List<Double> rows = jdbc.query(
                "SELECT factor FROM " + table(scope) + " WHERE " + keyColumn(scope) + " = :key",
                new MapSqlParameterSource("key", key),
                (rs, n) -> {
                    double f = rs.getDouble(1);
                    return rs.wasNull() ? 1.0 : f;
                });
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void upsert(WeightScope scope, String key, double factor) {
        jdbc.update("MERGE INTO " + table(scope) + " (" + keyColumn(scope) + ", factor) KEY ("
                        + keyColumn(scope) + ") VALUES (:key, :factor)",
                new MapSqlParameterSource().addValue("key", key).addValue("factor", factor));
    }

    /**
     * Every override of a scope keyed by its normalized key. A null factor reads as 1.0.
     */
    public Map<String, Double> findAll(WeightScope scope) {
        Map<String, Double> out = new HashMap<>();
        jdbc.getJdbcTemplate().query("SELECT " + keyColumn(scope) + ", factor FROM " + table(scope), rs -> {
            String key = rs.getString(1);
            double f = rs.getDouble(2);
            if (key != null) {
                out.put(key.strip().toLowerCase(Locale.ROOT), rs.wasNull() ? 1.0 : f);
            }
        });
        return out;
    }

    static String table(WeightScope scope) {
        return switch (scope) {
            case GENRE -> "music_genre_weights";
            case ARTIST -> "music_artist_weights";
            case TRACK -> "music_track_weights";
        };
    }

    static String keyColumn(WeightScope scope) {
        return switch (scope) {
            case GENRE -> "genre";
            case ARTIST -> "artist";
            case TRACK -> "track_key";
        };
    }
}
