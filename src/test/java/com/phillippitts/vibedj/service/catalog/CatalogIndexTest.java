package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.domain.WeightScope;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;
import com.phillippitts.vibedj.service.scaler.FeatureScaler;
import com.phillippitts.vibedj.service.weights.WeightOverrideRepository;
import com.phillippitts.vibedj.service.weights.WeightOverrideService;
import com.phillippitts.vibedj.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Both catalog backends against the same H2 catalog.
 */
class CatalogIndexTest {

    private static final SliderVector TARGET = SliderVector.uniform(50);

    private final FeatureScaler scaler = new FeatureScaler();
    private TestDatabase db;
    private CatalogRepository repository;
    private WeightOverrideService weights;
    private FullScanCatalogIndex fullScan;
    private IndexedCatalogIndex indexed;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        repository = new CatalogRepository(db.jdbc());
        weights = new WeightOverrideService(new WeightOverrideRepository(db.jdbc()));
        fullScan = new FullScanCatalogIndex(repository, scaler);
        indexed = new IndexedCatalogIndex(repository, weights, scaler, CatalogProperties.defaults());

        repository.insertAll(List.of(
                row("t1", "Exact Match", "Artist One", "jazz", 0.50, 0.50),
                row("t2", "Close", "Artist Two; Guest", "jazz", 0.52, 0.49),
                row("t3", "Closer Still", "Artist Three", "rock", 0.51, 0.50),
                row("t4", "Loud One", "Artist Four", "rock", 0.90, 0.50),
                row("t5", "Café Song", "Beyoncé", "pop", 0.53, 0.55)));
        repository.refreshGenreStats();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldOrderFullScanByDistance() {
        List<CatalogTrack> out = fullScan.nearestMatches(TARGET, 10, MusicFilters.NONE);

        assertThat(out).extracting(CatalogTrack::trackId).containsExactly("t1", "t3", "t2", "t5", "t4");
        assertThat(out).allSatisfy(t -> assertThat(t.probabilityFactor()).isEqualTo(1.0));
    }

    @Test
    void shouldFoldTextAndKeepPrimaryArtist() {
        List<CatalogTrack> out = fullScan.nearestMatches(TARGET, 10, MusicFilters.NONE);

        assertThat(out).filteredOn(t -> t.trackId().equals("t2")).singleElement()
                .extracting(CatalogTrack::artist).isEqualTo("Artist Two");
        assertThat(out).filteredOn(t -> t.trackId().equals("t5")).singleElement()
                .satisfies(t -> {
                    assertThat(t.title()).isEqualTo("Cafe Song");
                    assertThat(t.artist()).isEqualTo("Beyonce");
                });
    }

    @Test
    void shouldAgreeOnOrderWithinTheGate() {
        List<CatalogTrack> full = fullScan.nearestMatches(TARGET, 10, MusicFilters.NONE);
        List<CatalogTrack> gated = indexed.nearestMatches(TARGET, 10, MusicFilters.NONE);

        // t4 sits outside the energy window
        assertThat(gated).extracting(CatalogTrack::trackId).containsExactly("t1", "t3", "t2", "t5");
        assertThat(full.subList(0, 4)).extracting(CatalogTrack::trackId)
                .containsExactlyElementsOf(gated.stream().map(CatalogTrack::trackId).toList());
    }

    @Test
    void shouldDivideFactorByGenreCountInIndexedBackend() {
        List<CatalogTrack> gated = indexed.nearestMatches(TARGET, 10, MusicFilters.NONE);

        assertThat(factorOf(gated, "t1")).isCloseTo(0.5, within(1e-9));
        assertThat(factorOf(gated, "t5")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldDropTracksBannedByOverride() {
        weights.set(WeightScope.TRACK, WeightOverrideService.keyFor(WeightScope.TRACK, "Exact Match", "Artist One", null), 0.0);

        List<CatalogTrack> gated = indexed.nearestMatches(TARGET, 10, MusicFilters.NONE);

        assertThat(gated).extracting(CatalogTrack::trackId).doesNotContain("t1");
    }

    @Test
    void shouldApplyArtistAndGenreOverridesMultiplicatively() {
        weights.set(WeightScope.GENRE, "rock", 3.0);
        weights.set(WeightScope.ARTIST, "Artist Three", 0.5);

        List<CatalogTrack> gated = indexed.nearestMatches(TARGET, 10, MusicFilters.NONE);

        // 1.0 * 0.5 * 3.0 / 2 rock tracks
        assertThat(factorOf(gated, "t3")).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void shouldApplyFiltersInBothBackends() {
        MusicFilters rockOnly = new MusicFilters(List.of("rock"), List.of(), List.of(), List.of(), List.of());

        assertThat(fullScan.nearestMatches(TARGET, 10, rockOnly)).extracting(CatalogTrack::trackId)
                .containsExactly("t3", "t4");
        assertThat(indexed.nearestMatches(TARGET, 10, rockOnly)).extracting(CatalogTrack::trackId)
                .containsExactly("t3");
    }

    @Test
    void shouldReturnAtLeastOneTrackForNonPositiveLimit() {
        assertThat(fullScan.nearestMatches(TARGET, 0, MusicFilters.NONE)).hasSize(1);
        assertThat(indexed.nearestMatches(TARGET, -3, MusicFilters.NONE)).hasSize(1);
    }

    @Test
    void shouldWrapStorageFailures() {
        CatalogRepository broken = mock(CatalogRepository.class);
        when(broken.findAll()).thenThrow(new DataAccessResourceFailureException("gone"));

        assertThatThrownBy(() -> new FullScanCatalogIndex(broken, scaler).nearestMatches(TARGET, 5, MusicFilters.NONE))
                .isInstanceOf(CatalogUnavailableException.class);
    }

    private static double factorOf(List<CatalogTrack> tracks, String id) {
        return tracks.stream().filter(t -> t.trackId().equals(id)).findFirst().orElseThrow().probabilityFactor();
    }

    private CatalogRow row(String id, String name, String artist, String genre, double energy, double valence) {
        Map<AudioFeature, Double> features = new EnumMap<>(AudioFeature.class);
        for (AudioFeature f : AudioFeature.values()) {
            features.put(f, scaler.sliderToNative(f, 50.0));
        }
        features.put(AudioFeature.ENERGY, energy);
        features.put(AudioFeature.VALENCE, valence);
        return new CatalogRow(id, name, artist, genre, 1.0, features);
    }
}
