package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.config.properties.CooldownProperties;
import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.HistoryRecord;
import com.phillippitts.vibedj.domain.PlayStats;
import com.phillippitts.vibedj.domain.PlayedTrack;
import com.phillippitts.vibedj.testutil.MutableClock;
import com.phillippitts.vibedj.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PlayHistoryServiceTest {

    private static final Instant NOON = Instant.parse("2024-05-15T12:00:00Z");

    private TestDatabase db;
    private PlayHistoryRepository repository;
    private MutableClock clock;
    private PlayHistoryService service;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        repository = new PlayHistoryRepository(db.jdbc());
        clock = new MutableClock(NOON);
        service = new PlayHistoryService(repository, new CooldownScorer(CooldownProperties.defaults()), db.tx(), clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldReportUnplayedTrackAsNeverPlayed() {
        assertThat(service.stats("Song A", "Artist X")).isEqualTo(PlayStats.NEVER_PLAYED);
        assertThat(service.score("Song A", "Artist X")).isEqualTo(1.0);
        assertThat(service.lastPlayed()).isEmpty();
    }

    @Test
    void shouldCountPlaysAndDropToFloorAfterRecording() {
        service.recordPlay("Song A", "Artist X", "Song A Artist X", AudioTargets.DEFAULTS);
        clock.advance(Duration.ofMinutes(30));
        service.recordPlay("Song A", "Artist X", null, null);

        PlayStats stats = service.stats("Song A", "Artist X");

        assertThat(stats.found()).isTrue();
        assertThat(stats.playsToday()).isEqualTo(2);
        assertThat(stats.playsAllTime()).isEqualTo(2);
        assertThat(stats.hoursSinceLast()).isCloseTo(0.0, within(1e-9));
        assertThat(service.score("Song A", "Artist X")).isEqualTo(CooldownProperties.DEFAULT_FLOOR);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void shouldKeepStoredQueryAndTargetsWhenNotProvided() {
        service.recordPlay("Song A", "Artist X", "Song A Artist X", AudioTargets.DEFAULTS);
        HistoryRecord second = service.recordPlay("song a", "ARTIST X", " ", null);

        assertThat(second.searchQuery()).isEqualTo("Song A Artist X");
        assertThat(second.lastTargets()).isEqualTo(AudioTargets.DEFAULTS);
        assertThat(second.title()).isEqualTo("Song A");
    }

    @Test
    void shouldMergeCaseVariantDuplicatesOnNextWrite() {
        LocalDate today = LocalDate.of(2024, 5, 15);
        Instant earlier = NOON.minus(Duration.ofHours(3));
        repository.insert(new HistoryRecord(0L, "Song A", "Artist X", null, earlier, earlier,
                1, 1, 1, 1, 4, today, null));
        repository.insert(new HistoryRecord(0L, "SONG A ", "artist x", "legacy query", NOON.minus(Duration.ofDays(30)),
                NOON.minus(Duration.ofHours(1)), 2, 2, 2, 2, 6, today, null));

        assertThat(service.stats("song a", "artist x").playsAllTime()).isEqualTo(10);

        HistoryRecord merged = service.recordPlay("Song A", "Artist X", null, null);

        assertThat(repository.count()).isEqualTo(1);
        assertThat(merged.playsAllTime()).isEqualTo(11);
        assertThat(merged.playsToday()).isEqualTo(4);
        assertThat(merged.searchQuery()).isEqualTo("legacy query");
        assertThat(merged.firstPlayed()).isEqualTo(NOON.minus(Duration.ofDays(30)));
    }

    @Test
    void shouldResetDailyCounterAfterMidnight() {
        service.recordPlay("Song A", "Artist X", null, null);
        clock.advance(Duration.ofHours(13));

        PlayStats stats = service.stats("Song A", "Artist X");

        assertThat(stats.playsToday()).isZero();
        assertThat(stats.playsAllTime()).isEqualTo(1);
        assertThat(stats.hoursSinceLast()).isCloseTo(13.0, within(1e-9));

        HistoryRecord again = service.recordPlay("Song A", "Artist X", null, null);
        assertThat(again.playsToday()).isEqualTo(1);
        assertThat(again.playsAllTime()).isEqualTo(2);
        assertThat(again.lastCountReset()).isEqualTo(LocalDate.of(2024, 5, 16));
    }

    @Test
    void shouldListRecentlyPlayedOldestFirst() {
        service.recordPlay("First", "A", null, null);
        clock.advance(Duration.ofMinutes(5));
        service.recordPlay("Second", "B", null, null);
        clock.advance(Duration.ofMinutes(5));
        service.recordPlay("Third", "C", "Third C", AudioTargets.DEFAULTS);

        List<PlayedTrack> recent = service.recentlyPlayed(2);

        assertThat(recent).extracting(PlayedTrack::title).containsExactly("Second", "Third");
        assertThat(service.lastPlayed()).get().satisfies(last -> {
            assertThat(last.title()).isEqualTo("Third");
            assertThat(last.searchQuery()).isEqualTo("Third C");
            assertThat(last.targets()).isEqualTo(AudioTargets.DEFAULTS);
        });
    }

    @Test
    void shouldApplyArtistCooldownAcrossTracks() {
        service.recordPlay("Other Song", "Artist X", null, null);
        clock.advance(Duration.ofDays(2));

        assertThat(service.artistHoursSinceLast("artist x")).isCloseTo(48.0, within(1e-9));
        assertThat(service.score("Never Played", "Artist X")).isEqualTo(1.0);
        assertThat(service.artistHoursSinceLast("Nobody")).isNull();
    }
}
