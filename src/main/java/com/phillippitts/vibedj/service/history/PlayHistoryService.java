package com.phillippitts.vibedj.service.history;

import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.HistoryRecord;
import com.phillippitts.vibedj.domain.PlayStats;
import com.phillippitts.vibedj.domain.PlayedTrack;
import com.phillippitts.vibedj.util.LogSanitizer;
import com.phillippitts.vibedj.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Play history: recording picks, per-track statistics and cooldown scoring.
 *
 * <p>Rows are keyed by normalized (title, artist). Case-variant duplicates that already
 * exist are folded into the canonical (lowest id) row the next time that track is recorded.
 * Statistics reads apply period resets in memory only; the reset is persisted on the next
 * write.
 */
public class PlayHistoryService {

    private static final Logger LOG = LogManager.getLogger(PlayHistoryService.class);

    private final PlayHistoryRepository repository;
    private final CooldownScorer scorer;
    private final TransactionOperations tx;
    private final Clock clock;

    public PlayHistoryService(PlayHistoryRepository repository,
                              CooldownScorer scorer,
                              TransactionOperations tx,
                              Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.tx = Objects.requireNonNull(tx, "tx must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records a play, creating the row or incrementing every rolling counter.
     *
     * @param searchQuery replaces the stored query when non-blank
     * @param targets     sliders active at pick time; {@code null} keeps the stored ones
     * @return the persisted record
     */
    public HistoryRecord recordPlay(String title, String artist, String searchQuery, AudioTargets targets) {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(artist, "artist must not be null");
        HistoryRecord saved = tx.execute(status -> upsert(title, artist, searchQuery, targets));
        LOG.info("Recorded play: '{}' by '{}' (today={}, allTime={})",
                LogSanitizer.truncate(title, 80), LogSanitizer.truncate(artist, 80),
                saved.playsToday(), saved.playsAllTime());
        return saved;
    }

    private HistoryRecord upsert(String title, String artist, String searchQuery, AudioTargets targets) {
        Instant now = clock.instant();
        LocalDate today = today(now);
        String query = searchQuery == null || searchQuery.isBlank() ? null : searchQuery;

        List<HistoryRecord> matches = repository.findByTrack(title, artist);
        if (matches.isEmpty()) {
            HistoryRecord fresh = new HistoryRecord(0L, title, artist, query, now, now,
                    1, 1, 1, 1, 1, today, targets);
            long id = repository.insert(fresh);
            return withId(fresh, id);
        }

        HistoryRecord canonical = PeriodCounters.resetIfNeeded(matches.get(0), today);
        List<Long> merged = new ArrayList<>();
        for (HistoryRecord other : matches.subList(1, matches.size())) {
            canonical = merge(canonical, PeriodCounters.resetIfNeeded(other, today));
            merged.add(other.id());
        }
        if (!merged.isEmpty()) {
            LOG.info("Merging {} duplicate history row(s) into id={}", merged.size(), canonical.id());
            repository.deleteByIds(merged);
        }

        HistoryRecord updated = new HistoryRecord(
                canonical.id(),
                canonical.title(),
                canonical.artist(),
                query != null ? query : canonical.searchQuery(),
                canonical.firstPlayed(),
                now,
                canonical.playsToday() + 1,
                canonical.playsWeek() + 1,
                canonical.playsMonth() + 1,
                canonical.playsYear() + 1,
                canonical.playsAllTime() + 1,
                canonical.lastCountReset(),
                targets != null ? targets : canonical.lastTargets());
        repository.update(updated);
        return updated;
    }

    static HistoryRecord merge(HistoryRecord into, HistoryRecord other) {
        Instant first = earliest(into.firstPlayed(), other.firstPlayed());
        Instant last = latest(into.lastPlayed(), other.lastPlayed());
        String query = into.searchQuery() == null || into.searchQuery().isBlank()
                ? other.searchQuery() : into.searchQuery();
        return new HistoryRecord(
                into.id(),
                into.title(),
                into.artist(),
                query,
                first,
                last,
                into.playsToday() + other.playsToday(),
                into.playsWeek() + other.playsWeek(),
                into.playsMonth() + other.playsMonth(),
                into.playsYear() + other.playsYear(),
                into.playsAllTime() + other.playsAllTime(),
                into.lastCountReset(),
                into.lastTargets() != null ? into.lastTargets() : other.lastTargets());
    }

    /**
     * Aggregated statistics across case-variant duplicates; hours since last play uses the
     * most recent of them.
     */
    public PlayStats stats(String title, String artist) {
        List<HistoryRecord> rows = repository.findByTrack(title, artist);
        if (rows.isEmpty()) {
            return PlayStats.NEVER_PLAYED;
        }
        Instant now = clock.instant();
        LocalDate today = today(now);
        int playsToday = 0;
        int playsWeek = 0;
        int playsAllTime = 0;
        Instant newest = null;
        for (HistoryRecord raw : rows) {
            HistoryRecord r = PeriodCounters.resetIfNeeded(raw, today);
            playsToday += r.playsToday();
            playsWeek += r.playsWeek();
            playsAllTime += r.playsAllTime();
            newest = latest(newest, r.lastPlayed());
        }
        Double hours = newest == null ? null : TimeUtils.hoursBetween(newest, now);
        return new PlayStats(true, playsToday, playsWeek, playsAllTime, hours);
    }

    /**
     * Hours since any track by this artist was played, or {@code null} if never.
     */
    public Double artistHoursSinceLast(String artist) {
        if (artist == null || artist.isBlank()) {
            return null;
        }
        Instant last = repository.lastPlayedByArtist(artist);
        return last == null ? null : TimeUtils.hoursBetween(last, clock.instant());
    }

    /**
     * Cooldown score in [floor, 1.0]; 1.0 for a track that was never played.
     */
    public double score(String title, String artist) {
        PlayStats stats = stats(title, artist);
        if (!stats.found()) {
            return 1.0;
        }
        return scorer.score(stats, artistHoursSinceLast(artist));
    }

    /**
     * The most recent {@code limit} plays, oldest first.
     */
    public List<PlayedTrack> recentlyPlayed(int limit) {
        List<PlayedTrack> out = new ArrayList<>();
        for (HistoryRecord r : repository.findMostRecent(limit)) {
            out.add(toPlayedTrack(r));
        }
        Collections.reverse(out);
        return out;
    }

    public Optional<PlayedTrack> lastPlayed() {
        List<HistoryRecord> rows = repository.findMostRecent(1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(toPlayedTrack(rows.get(0)));
    }

    private static PlayedTrack toPlayedTrack(HistoryRecord r) {
        return new PlayedTrack(r.title(), r.artist(), r.searchQuery(), r.lastPlayed(),
                r.playsToday(), r.playsAllTime(), r.lastTargets());
    }

    private static LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    private static HistoryRecord withId(HistoryRecord r, long id) {
        return new HistoryRecord(id, r.title(), r.artist(), r.searchQuery(), r.firstPlayed(), r.lastPlayed(),
                r.playsToday(), r.playsWeek(), r.playsMonth(), r.playsYear(), r.playsAllTime(),
                r.lastCountReset(), r.lastTargets());
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b != null && b.isBefore(a) ? b : a;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b != null && b.isAfter(a) ? b : a;
    }
}
