package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;
import com.phillippitts.vibedj.service.scaler.FeatureScaler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Exact nearest-neighbor search by scanning the whole catalog.
 *
 * <p>The catalog is loaded once on first use and kept in memory; {@link #reload()} drops it.
 * Suitable for small catalogs and as the reference the indexed backend is checked against.
 */
public class FullScanCatalogIndex implements CatalogIndex {

    private static final Logger LOG = LogManager.getLogger(FullScanCatalogIndex.class);

    private final CatalogRepository repository;
    private final FeatureScaler scaler;
    private volatile List<CatalogTrack> tracks;

    public FullScanCatalogIndex(CatalogRepository repository, FeatureScaler scaler) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
    }

    @Override
    public List<CatalogTrack> nearestMatches(SliderVector target, int n, MusicFilters filters) {
        List<CatalogTrack> all = loaded();
        List<CatalogTrack> candidates = new ArrayList<>(all.size());
        for (CatalogTrack t : all) {
            if (MusicFilterMatcher.matches(filters, t)) {
                candidates.add(t);
            }
        }
        candidates.sort(Comparator.comparingDouble(t -> TrackDistance.between(target, t.sliders())));
        int limit = Math.max(1, n);
        return candidates.size() <= limit ? candidates : new ArrayList<>(candidates.subList(0, limit));
    }

    @Override
    public String backendName() {
        return "full-scan";
    }

    public void reload() {
        tracks = null;
    }

    private List<CatalogTrack> loaded() {
        List<CatalogTrack> snapshot = tracks;
        if (snapshot != null) {
            return snapshot;
        }
        long t0 = System.nanoTime();
        List<CatalogRow> rows;
        try {
            rows = repository.findAll();
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("Failed to load catalog", e);
        }
        List<CatalogTrack> out = new ArrayList<>(rows.size());
        for (CatalogRow row : rows) {
            CatalogTrack t = CatalogTracks.fromRow(row, scaler, CatalogTracks.storedFactor(row));
            if (t != null) {
                out.add(t);
            }
        }
        snapshot = List.copyOf(out);
        tracks = snapshot;
        LOG.info("Loaded catalog: {} tracks in {} ms", snapshot.size(), (System.nanoTime() - t0) / 1_000_000L);
        return snapshot;
    }
}
