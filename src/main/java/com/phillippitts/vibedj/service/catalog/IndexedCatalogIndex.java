package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;
import com.phillippitts.vibedj.service.scaler.FeatureScaler;
import com.phillippitts.vibedj.service.weights.WeightOverrideService;
import com.phillippitts.vibedj.service.weights.WeightOverrides;
import com.phillippitts.vibedj.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Two-stage nearest-neighbor search against the catalog table.
 *
 * <ol>
 *   <li>SQL gate: energy and valence within a slider window (converted to native 0..1),
 *       filter predicates, ordered by the coarse two-feature distance and capped at
 *       {@code max(prefilterLimit, n * candidateLimitFactor)} rows.</li>
 *   <li>Each row's probability factor is multiplied by its track, artist and genre overrides
 *       and divided by the genre's track count; rows whose effective factor is not positive
 *       are dropped.</li>
 *   <li>Exact weighted distance in-process, keep the best {@code max(refineLimit, n)},
 *       return the first {@code n}.</li>
 * </ol>
 */
public class IndexedCatalogIndex implements CatalogIndex {

    private static final Logger LOG = LogManager.getLogger(IndexedCatalogIndex.class);

    private final CatalogRepository repository;
    private final WeightOverrideService weights;
    private final FeatureScaler scaler;
    private final CatalogProperties props;

    public IndexedCatalogIndex(CatalogRepository repository,
                               WeightOverrideService weights,
                               FeatureScaler scaler,
                               CatalogProperties props) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public List<CatalogTrack> nearestMatches(SliderVector target, int n, MusicFilters filters) {
        int limit = Math.max(1, n);
        int prefilterLimit = Math.max(props.getPrefilterLimit(), limit * props.getCandidateLimitFactor());
        int refineLimit = Math.max(props.getRefineLimit(), limit);

        double e = target.get(AudioFeature.ENERGY);
        double v = target.get(AudioFeature.VALENCE);
        double ew = Math.max(0.0, props.getEnergyWindow());
        double vw = Math.max(0.0, props.getValenceWindow());
        double energyLo = clamp01((e - ew) / 100.0);
        double energyHi = clamp01((e + ew) / 100.0);
        double valenceLo = clamp01((v - vw) / 100.0);
        double valenceHi = clamp01((v + vw) / 100.0);

        long t0 = System.nanoTime();
        List<CatalogRow> rows;
        WeightOverrides overrides;
        try {
            overrides = weights.snapshot(repository.genreCounts());
            rows = repository.findGated(energyLo, energyHi, valenceLo, valenceHi, filters, e, v, prefilterLimit);
        } catch (DataAccessException ex) {
            throw new CatalogUnavailableException("Catalog query failed", ex);
        }
        LOG.info("Catalog gate: energy=[{}+/-{}] valence=[{}+/-{}] -> e=[{}..{}] v=[{}..{}], {} row(s) in {} ms "
                        + "(prefilterLimit={})",
                e, ew, v, vw, energyLo, energyHi, valenceLo, valenceHi, rows.size(),
                TimeUtils.elapsedMillis(t0), prefilterLimit);

        List<CatalogTrack> tracks = new ArrayList<>(rows.size());
        for (CatalogRow row : rows) {
            String rawArtist = row.artistName() == null || row.artistName().isBlank()
                    ? "Unknown" : row.artistName().strip();
            double effective = overrides.effectiveFactor(CatalogTracks.storedFactor(row),
                    row.trackName() == null ? "" : row.trackName().strip(), rawArtist,
                    row.genre() == null ? "" : row.genre().strip());
            if (effective <= 0.0) {
                continue;
            }
            CatalogTrack t = CatalogTracks.fromRow(row, scaler, effective);
            if (t != null) {
                tracks.add(t);
            }
        }

        tracks.sort(Comparator.comparingDouble(t -> TrackDistance.between(target, t.sliders())));
        List<CatalogTrack> refined = tracks.size() <= refineLimit ? tracks : tracks.subList(0, refineLimit);
        return new ArrayList<>(refined.size() <= limit ? refined : refined.subList(0, limit));
    }

    @Override
    public String backendName() {
        return "indexed";
    }

    private static double clamp01(double x) {
        return Math.max(0.0, Math.min(1.0, x));
    }
}
