package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.PlayStats;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;
import com.phillippitts.vibedj.service.history.PlayHistoryService;
import com.phillippitts.vibedj.util.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Builds the shortlist handed to the recommender.
 *
 * <p>An oversized nearest-match base pool is filtered in order by music filters, recent
 * plays (played today, or within the configured hour window), hard energy/valence deltas
 * and duplicate track ids, stopping once the match pool is full. A smaller pool is never
 * padded with looser matches. The prompt sample is drawn without replacement with weight
 * {@code probabilityFactor * genreBoost / (1 + distance)}.
 */
public class ShortlistSampler {

    private static final Logger LOG = LogManager.getLogger(ShortlistSampler.class);

    private final CatalogIndex index;
    private final PlayHistoryService history;
    private final CatalogProperties props;

    public ShortlistSampler(CatalogIndex index, PlayHistoryService history, CatalogProperties props) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @param target  target sliders
     * @param filters optional music filters
     * @param seed    RNG seed; {@code null} for an unseeded generator
     * @return pool and sample; {@link Shortlist#EMPTY} when the catalog is unavailable
     */
    public Shortlist sampleForPrompt(SliderVector target, MusicFilters filters, Long seed) {
        MusicFilters f = filters == null ? MusicFilters.NONE : filters;
        int matchPoolSize = props.getMatchPoolSize();
        int pickCount = props.getPromptPickCount();
        int basePoolSize = Math.max(matchPoolSize, props.getBasePoolSize());

        List<CatalogTrack> base;
        try {
            base = index.nearestMatches(target, basePoolSize, f);
        } catch (CatalogUnavailableException e) {
            LOG.warn("Catalog unavailable, continuing with an empty shortlist: {}", e.getMessage());
            return Shortlist.EMPTY;
        }
        LOG.info("Shortlist sampling: backend={} basePool={} matchPool={} promptPick={} seed={} target={}",
                index.backendName(), base.size(), matchPoolSize, pickCount, seed, target);

        double targetEnergy = target.get(AudioFeature.ENERGY);
        double targetValence = target.get(AudioFeature.VALENCE);
        RecentPlays recent = new RecentPlays();
        Set<String> seenIds = new HashSet<>();
        List<CatalogTrack> pool = new ArrayList<>();
        int rejectedFilters = 0;
        int rejectedRecent = 0;
        int rejectedConstraints = 0;
        int rejectedDupes = 0;

        for (CatalogTrack t : base) {
            if (!MusicFilterMatcher.matches(f, t)) {
                rejectedFilters++;
                continue;
            }
            if (recent.isRecent(t)) {
                rejectedRecent++;
                continue;
            }
            if (Math.abs(t.sliders().get(AudioFeature.ENERGY) - targetEnergy) > props.getMaxEnergyDelta()
                    || Math.abs(t.sliders().get(AudioFeature.VALENCE) - targetValence) > props.getMaxValenceDelta()) {
                rejectedConstraints++;
                continue;
            }
            if (!t.trackId().isEmpty() && !seenIds.add(t.trackId())) {
                rejectedDupes++;
                continue;
            }
            pool.add(t);
            if (pool.size() >= matchPoolSize) {
                break;
            }
        }
        LOG.info("Shortlist filters: kept={} rejectedFilters={} rejectedRecent={} rejectedConstraints={} "
                        + "rejectedDupes={} (maxEnergyDelta={} maxValenceDelta={})",
                pool.size(), rejectedFilters, rejectedRecent, rejectedConstraints, rejectedDupes,
                props.getMaxEnergyDelta(), props.getMaxValenceDelta());

        if (pool.size() <= pickCount) {
            return new Shortlist(pool, pool);
        }

        Random rng = seed != null ? new Random(seed) : new Random();
        ToDoubleFunction<CatalogTrack> weight = samplingWeight(target);
        List<CatalogTrack> sample = WeightedReservoirSampler.sample(pool, weight, pickCount, rng);
        if (LOG.isDebugEnabled()) {
            for (int i = 0; i < sample.size(); i++) {
                CatalogTrack t = sample.get(i);
                LOG.debug("Provided[{}]: {} ({}) dist={} w={} pf={}", i + 1, t.searchQuery(), t.genre(),
                        TrackDistance.between(target, t.sliders()), weight.applyAsDouble(t),
                        t.probabilityFactor());
            }
        }
        return new Shortlist(pool, sample);
    }

    /**
     * {@code pf * boost / (1 + distance)} where boost applies when the normalized genre is
     * one of the configured boost genres.
     */
    ToDoubleFunction<CatalogTrack> samplingWeight(SliderVector target) {
        Set<String> boost = new HashSet<>();
        for (String g : props.getBoostGenres()) {
            String k = TextNormalizer.asciiKey(g);
            if (!k.isEmpty()) {
                boost.add(k);
            }
        }
        double boostFactor = props.getBoostFactor();
        return t -> {
            double genreW = !boost.isEmpty() && boost.contains(TextNormalizer.asciiKey(t.genre())) ? boostFactor : 1.0;
            double distW = 1.0 / (1.0 + Math.max(0.0, TrackDistance.between(target, t.sliders())));
            return Math.max(0.0, t.probabilityFactor()) * genreW * distW;
        };
    }

    /**
     * Per-call cache of history lookups keyed by (title, artist).
     */
    private final class RecentPlays {
        private final Map<String, PlayStats> cache = new HashMap<>();

        boolean isRecent(CatalogTrack t) {
            PlayStats st = cache.computeIfAbsent(TextNormalizer.trackKey(t.title(), t.artist()),
                    k -> lookup(t));
            if (!st.found()) {
                return false;
            }
            if (props.isExcludeIfPlayedToday() && st.playsToday() > 0) {
                return true;
            }
            Double hours = st.hoursSinceLast();
            return hours != null && hours < props.getExcludeWithinHours();
        }

        private PlayStats lookup(CatalogTrack t) {
            try {
                return history.stats(t.title(), t.artist());
            } catch (DataAccessException e) {
                LOG.warn("History lookup failed for '{}', treating as not recently played: {}",
                        t.searchQuery(), e.getMessage());
                return PlayStats.NEVER_PLAYED;
            }
        }
    }
}
