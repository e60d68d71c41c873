package com.phillippitts.vibedj.service.weights;

import com.phillippitts.vibedj.domain.WeightOverride;
import com.phillippitts.vibedj.domain.WeightScope;
import com.phillippitts.vibedj.util.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Adjusts and sets multiplicative sampling factors per genre, artist or track.
 *
 * <p>An absent override reads as 1.0. Nudging downwards never goes below
 * {@link #MIN_WEIGHT_FACTOR}, so only an explicit {@link #set} with 0 bans a key.
 */
public class WeightOverrideService {

    private static final Logger LOG = LogManager.getLogger(WeightOverrideService.class);

    public static final double MIN_WEIGHT_FACTOR = 0.05;
    public static final double DEFAULT_FACTOR = 1.0;

    private final WeightOverrideRepository repository;

    public WeightOverrideService(WeightOverrideRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /**
     * Builds the normalized key for a scope. Tracks need both title and artist.
     */
    public static String keyFor(WeightScope scope, String title, String artist, String genre) {
        String key = switch (scope) {
            case GENRE -> TextNormalizer.key(genre);
            case ARTIST -> TextNormalizer.key(artist);
            case TRACK -> (title == null || title.isBlank() || artist == null || artist.isBlank())
                    ? "" : TextNormalizer.trackKey(title, artist);
        };
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Missing key parts for scope " + scope);
        }
        return key;
    }

    public double factor(WeightScope scope, String key) {
        return repository.findFactor(scope, TextNormalizer.key(key)).orElse(DEFAULT_FACTOR);
    }

    /**
     * Adds {@code delta} to the current factor. A negative delta floors the result at
     * {@link #MIN_WEIGHT_FACTOR}; a positive one at 0.
     */
    public WeightChange adjust(WeightScope scope, String key, double delta) {
        if (Double.isNaN(delta) || Double.isInfinite(delta)) {
            throw new IllegalArgumentException("delta must be finite, got: " + delta);
        }
        String k = TextNormalizer.key(key);
        double old = repository.findFactor(scope, k).orElse(DEFAULT_FACTOR);
        double next = old + delta;
        next = delta < 0 ? Math.max(MIN_WEIGHT_FACTOR, next) : Math.max(0.0, next);
        repository.upsert(scope, k, next);
        LOG.info("Weight adjusted: scope={} key='{}' {} -> {}", scope, k, old, next);
        return new WeightChange(scope, k, old, next);
    }

    /**
     * Stores {@code max(0, factor)} exactly; 0 bans the key from sampling.
     */
    public WeightChange set(WeightScope scope, String key, double factor) {
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("factor must be a number");
        }
        String k = TextNormalizer.key(key);
        double old = repository.findFactor(scope, k).orElse(DEFAULT_FACTOR);
        double next = Math.max(0.0, factor);
        repository.upsert(scope, k, next);
        LOG.info("Weight set: scope={} key='{}' {} -> {}", scope, k, old, next);
        return new WeightChange(scope, k, old, next);
    }

    public WeightOverride current(WeightScope scope, String key) {
        String k = TextNormalizer.key(key);
        return new WeightOverride(scope, k, factor(scope, k));
    }

    /**
     * Snapshot of every override for effective-factor computation; genre counts come from
     * the catalog.
     */
    public WeightOverrides snapshot(Map<String, Integer> genreCounts) {
        return new WeightOverrides(
                repository.findAll(WeightScope.GENRE),
                repository.findAll(WeightScope.ARTIST),
                repository.findAll(WeightScope.TRACK),
                genreCounts);
    }
}
