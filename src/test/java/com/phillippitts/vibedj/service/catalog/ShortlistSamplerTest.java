package com.phillippitts.vibedj.service.catalog;

import com.phillippitts.vibedj.config.properties.CatalogProperties;
import com.phillippitts.vibedj.domain.AudioFeature;
import com.phillippitts.vibedj.domain.CatalogTrack;
import com.phillippitts.vibedj.domain.MusicFilters;
import com.phillippitts.vibedj.domain.PlayStats;
import com.phillippitts.vibedj.domain.SliderVector;
import com.phillippitts.vibedj.exception.CatalogUnavailableException;
import com.phillippitts.vibedj.service.history.PlayHistoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ShortlistSamplerTest {

    private static final SliderVector TARGET = SliderVector.uniform(50);

    private CatalogIndex index;
    private PlayHistoryService history;
    private ShortlistSampler sampler;

    @BeforeEach
    void setUp() {
        index = mock(CatalogIndex.class);
        history = mock(PlayHistoryService.class);
        when(history.stats(anyString(), anyString())).thenReturn(PlayStats.NEVER_PLAYED);
        when(index.backendName()).thenReturn("test");
        sampler = new ShortlistSampler(index, history, CatalogProperties.defaults());
    }

    @Test
    void shouldReturnEmptyPoolAndSampleWhenEverythingIsHardExcluded() {
        List<CatalogTrack> farAway = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            farAway.add(track("id" + i, "Song " + i, "Artist " + i, 95.0, 50.0));
        }
        when(index.nearestMatches(any(), anyInt(), any())).thenReturn(farAway);

        Shortlist s = sampler.sampleForPrompt(TARGET, MusicFilters.NONE, 1L);

        assertThat(s.pool()).isEmpty();
        assertThat(s.sample()).isEmpty();
    }

    @Test
    void shouldReturnPoolAsSampleWhenPoolIsSmall() {
        List<CatalogTrack> few = List.of(
                track("a", "Song A", "Artist A", 50.0, 50.0),
                track("b", "Song B", "Artist B", 52.0, 48.0));
        when(index.nearestMatches(any(), anyInt(), any())).thenReturn(few);

        Shortlist s = sampler.sampleForPrompt(TARGET, MusicFilters.NONE, 1L);

        assertThat(s.pool()).hasSize(2);
        assertThat(s.sample()).isEqualTo(s.pool());
    }

    @Test
    void shouldSamplePromptCountDistinctTracksFromLargePool() {
        List<CatalogTrack> many = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            many.add(track("id" + i, "Song " + i, "Artist " + i, 50.0 + (i % 5), 50.0 - (i % 7)));
        }
        when(index.nearestMatches(any(), anyInt(), any())).thenReturn(many);

        Shortlist s = sampler.sampleForPrompt(TARGET, MusicFilters.NONE, 123L);

        assertThat(s.pool()).hasSize(60);
        assertThat(s.sample()).hasSize(10);
        assertThat(new HashSet<>(s.sample())).hasSize(10);
    }

    @Test
    void shouldDropDuplicateIdsAndRecentlyPlayedTracks() {
        when(history.stats("Played", "Somebody")).thenReturn(new PlayStats(true, 1, 1, 3, 2.0));
        List<CatalogTrack> base = List.of(
                track("x", "Song X", "Artist X", 50.0, 50.0),
                track("x", "Song X again", "Artist X", 50.0, 50.0),
                track("p", "Played", "Somebody", 50.0, 50.0),
                track("y", "Song Y", "Artist Y", 51.0, 49.0));
        when(index.nearestMatches(any(), anyInt(), any())).thenReturn(base);

        Shortlist s = sampler.sampleForPrompt(TARGET, MusicFilters.NONE, 1L);

        assertThat(s.pool()).extracting(CatalogTrack::trackId).containsExactly("x", "y");
    }

    @Test
    void shouldReturnEmptyShortlistWhenCatalogUnavailable() {
        when(index.nearestMatches(any(), anyInt(), any()))
                .thenThrow(new CatalogUnavailableException("down", new RuntimeException("db")));

        assertThat(sampler.sampleForPrompt(TARGET, MusicFilters.NONE, 1L)).isEqualTo(Shortlist.EMPTY);
    }

    @Test
    void shouldBoostConfiguredGenresInSamplingWeight() {
        CatalogTrack jazz = new CatalogTrack("j", "J", "A", "jazz", TARGET, 1.0);
        CatalogTrack metal = new CatalogTrack("m", "M", "B", "death metal", TARGET, 1.0);

        var weight = sampler.samplingWeight(TARGET);

        assertThat(weight.applyAsDouble(jazz)).isEqualTo(CatalogProperties.defaults().getBoostFactor());
        assertThat(weight.applyAsDouble(metal)).isEqualTo(1.0);
    }

    private static CatalogTrack track(String id, String title, String artist, double energy, double valence) {
        SliderVector v = TARGET.with(AudioFeature.ENERGY, energy).with(AudioFeature.VALENCE, valence);
        return new CatalogTrack(id, title, artist, "pop", v, 1.0);
    }
}
