package com.phillippitts.vibedj.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Catalog backend selection, shortlist sizing and sampling knobs.
 */
@Validated
@ConfigurationProperties(prefix = "dj.catalog")
public class CatalogProperties {

    public enum Backend { INDEXED, FULL_SCAN }

    static final List<String> DEFAULT_BOOST_GENRES = List.of(
            "alt-rock", "alternative", "grunge", "hard-rock", "psych-rock", "rock",
            "metal", "jazz", "indie", "singer-songwriter", "songwriter", "acoustic");

    @NotNull
    private final Backend backend;

    /** Size of the filtered pool the prompt sample is drawn from. */
    @Positive
    private final int matchPoolSize;

    /** Nearest matches fetched before filtering. */
    @Positive
    private final int basePoolSize;

    @Positive
    private final int promptPickCount;

    @Min(0)
    private final double excludeWithinHours;

    private final boolean excludeIfPlayedToday;

    @NotNull
    private final List<String> boostGenres;

    @Positive
    private final double boostFactor;

    @Min(0)
    private final double maxEnergyDelta;

    @Min(0)
    private final double maxValenceDelta;

    // Indexed backend only
    @Min(0)
    private final double energyWindow;

    @Min(0)
    private final double valenceWindow;

    @Positive
    private final int prefilterLimit;

    @Positive
    private final int refineLimit;

    @Positive
    private final int candidateLimitFactor;

    @ConstructorBinding
    public CatalogProperties(Backend backend,
                             Integer matchPoolSize,
                             Integer basePoolSize,
                             Integer promptPickCount,
                             Double excludeWithinHours,
                             Boolean excludeIfPlayedToday,
                             List<String> boostGenres,
                             Double boostFactor,
                             Double maxEnergyDelta,
                             Double maxValenceDelta,
                             Double energyWindow,
                             Double valenceWindow,
                             Integer prefilterLimit,
                             Integer refineLimit,
                             Integer candidateLimitFactor) {
        this.backend = backend == null ? Backend.INDEXED : backend;
        this.matchPoolSize = matchPoolSize == null ? 100 : matchPoolSize;
        this.basePoolSize = basePoolSize == null ? 10_000 : basePoolSize;
        this.promptPickCount = promptPickCount == null ? 10 : promptPickCount;
        this.excludeWithinHours = excludeWithinHours == null ? 24.0 : excludeWithinHours;
        this.excludeIfPlayedToday = excludeIfPlayedToday == null || excludeIfPlayedToday;
        this.boostGenres = boostGenres == null ? DEFAULT_BOOST_GENRES : List.copyOf(boostGenres);
        this.boostFactor = boostFactor == null ? 4.0 : boostFactor;
        this.maxEnergyDelta = maxEnergyDelta == null ? 5.0 : maxEnergyDelta;
        this.maxValenceDelta = maxValenceDelta == null ? 10.0 : maxValenceDelta;
        this.energyWindow = energyWindow == null ? 5.0 : energyWindow;
        this.valenceWindow = valenceWindow == null ? 15.0 : valenceWindow;
        this.prefilterLimit = prefilterLimit == null ? 50_000 : prefilterLimit;
        this.refineLimit = refineLimit == null ? 10_000 : refineLimit;
        this.candidateLimitFactor = candidateLimitFactor == null ? 20 : candidateLimitFactor;
    }

    public static CatalogProperties defaults() {
        return new CatalogProperties(null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null);
    }

    public Backend getBackend() {
        return backend;
    }

    public int getMatchPoolSize() {
        return matchPoolSize;
    }

    public int getBasePoolSize() {
        return basePoolSize;
    }

    public int getPromptPickCount() {
        return promptPickCount;
    }

    public double getExcludeWithinHours() {
        return excludeWithinHours;
    }

    public boolean isExcludeIfPlayedToday() {
        return excludeIfPlayedToday;
    }

    public List<String> getBoostGenres() {
        return boostGenres;
    }

    public double getBoostFactor() {
        return boostFactor;
    }

    public double getMaxEnergyDelta() {
        return maxEnergyDelta;
    }

    public double getMaxValenceDelta() {
        return maxValenceDelta;
    }

    public double getEnergyWindow() {
        return energyWindow;
    }

    public double getValenceWindow() {
        return valenceWindow;
    }

    public int getPrefilterLimit() {
        return prefilterLimit;
    }

    public int getRefineLimit() {
        return refineLimit;
    }

    public int getCandidateLimitFactor() {
        return candidateLimitFactor;
    }
}
