package com.phillippitts.vibedj.service.coordinator;

import com.phillippitts.vibedj.config.properties.CoordinatorProperties;
import com.phillippitts.vibedj.config.properties.VibeProperties;
import com.phillippitts.vibedj.domain.CalendarEvent;
import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.domain.PickResult;
import com.phillippitts.vibedj.domain.PlayedTrack;
import com.phillippitts.vibedj.domain.ScoredCandidate;
import com.phillippitts.vibedj.domain.VibeTargets;
import com.phillippitts.vibedj.exception.OracleException;
import com.phillippitts.vibedj.service.catalog.Shortlist;
import com.phillippitts.vibedj.service.catalog.ShortlistSampler;
import com.phillippitts.vibedj.service.chat.CalendarSource;
import com.phillippitts.vibedj.service.chat.ChatFeed;
import com.phillippitts.vibedj.service.history.PlayHistoryService;
import com.phillippitts.vibedj.service.metrics.DjMetrics;
import com.phillippitts.vibedj.service.oracle.OracleCandidate;
import com.phillippitts.vibedj.service.oracle.RecommendationRequest;
import com.phillippitts.vibedj.service.oracle.RecommendationResponse;
import com.phillippitts.vibedj.service.oracle.RecommenderOracle;
import com.phillippitts.vibedj.service.selector.CandidateSelector;
import com.phillippitts.vibedj.service.vibe.RecheckOutcome;
import com.phillippitts.vibedj.service.vibe.VibePlanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One synchronous pick: refresh the plan, build the shortlist, ask the recommender, enforce
 * its output mix and choose a winner.
 *
 * <p>Runs on the coordinator thread only. Guard flags (enabled, in progress, debounce) are
 * the coordinator's business; this class assumes the pick is allowed.
 */
public class PickPipeline {

    private static final Logger LOG = LogManager.getLogger(PickPipeline.class);

    private final VibePlanner planner;
    private final ShortlistSampler shortlistSampler;
    private final RecommenderOracle recommender;
    private final CandidateSelector selector;
    private final PlayHistoryService history;
    private final ChatFeed chatFeed;
    private final CalendarSource calendar;
    private final CoordinatorProperties props;
    private final VibeProperties vibeProps;
    private final DjMetrics metrics;
    private final Clock clock;

    public PickPipeline(VibePlanner planner,
                        ShortlistSampler shortlistSampler,
                        RecommenderOracle recommender,
                        CandidateSelector selector,
                        PlayHistoryService history,
                        ChatFeed chatFeed,
                        CalendarSource calendar,
                        CoordinatorProperties props,
                        VibeProperties vibeProps,
                        DjMetrics metrics,
                        Clock clock) {
        this.planner = planner;
        this.shortlistSampler = shortlistSampler;
        this.recommender = recommender;
        this.selector = selector;
        this.history = history;
        this.chatFeed = chatFeed;
        this.calendar = calendar;
        this.props = props;
        this.vibeProps = vibeProps;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @return the chosen track or a skip; empty when the recommender produced nothing usable
     * @throws OracleException when the recommender is unavailable or answers malformed JSON
     */
    public Optional<PickResult> pick(String reason) {
        Instant now = clock.instant();

        List<CalendarEvent> events = loadCalendar(now);
        List<ChatExcerpt> chat = chatFeed.since(now.minus(Duration.ofHours(vibeProps.getPlanningLookbackHours())), 0);
        long tVibe = System.nanoTime();
        RecheckOutcome outcome = planner.ensureFreshPlan(events, chat);
        metrics.incrementVibeRecheck(outcome.name().toLowerCase(Locale.ROOT));
        if (outcome == RecheckOutcome.REPLANNED || outcome == RecheckOutcome.FAILED) {
            metrics.recordOracleLatency("vibe", System.nanoTime() - tVibe);
        }
        if (outcome == RecheckOutcome.FAILED) {
            metrics.incrementOracleFailure("vibe");
        }
        VibeTargets targets = planner.currentTargets();

        List<PlayedTrack> recent = history.recentlyPlayed(props.getRecentlyPlayedLimit());
        PlayedTrack last = history.lastPlayed().orElse(null);

        long seed = clock.millis() & 0xFFFFFFFFL;
        Shortlist shortlist = shortlistSampler.sampleForPrompt(
                targets.audioTargets().toSliderVector(), targets.musicFilters(), seed);
        metrics.recordShortlist(shortlist.pool().size(), shortlist.sample().size());
        LOG.info("Pick ({}): block='{}' phase='{}' progress={} shortlist={}/{}", reason,
                targets.contextBlock(), targets.phaseNote(), targets.phaseProgress(),
                shortlist.sample().size(), shortlist.pool().size());

        RecommendationRequest request = new RecommendationRequest(
                now.atZone(clock.getZone()).getDayOfWeek(), targets, recent, last, shortlist.sample());
        RecommendationResponse response;
        long tRec = System.nanoTime();
        try {
            response = recommender.recommend(request);
        } catch (OracleException e) {
            metrics.incrementOracleFailure("recommender");
            throw e;
        } finally {
            metrics.recordOracleLatency("recommender", System.nanoTime() - tRec);
        }

        if (response.skipMusic()) {
            LOG.info("Recommender asked to skip music: {}", response.skipReason());
            return Optional.of(PickResult.skip(response.skipReason(), targets));
        }

        List<OracleCandidate> candidates = CandidateContract.enforce(response.candidates(), shortlist.sample(),
                props.getProvidedCount(), props.getTotalCandidates());
        Optional<ScoredCandidate> winner = selector.choose(candidates);
        if (winner.isEmpty()) {
            LOG.warn("No usable candidate among {} returned by the recommender", response.candidates().size());
            return Optional.empty();
        }
        return Optional.of(PickResult.chosen(winner.get(), targets, selector.backupCount()));
    }

    private List<CalendarEvent> loadCalendar(Instant now) {
        try {
            return calendar.eventsAround(now);
        } catch (RuntimeException e) {
            LOG.warn("Calendar unavailable, planning without events: {}", e.getMessage());
            return List.of();
        }
    }
}
