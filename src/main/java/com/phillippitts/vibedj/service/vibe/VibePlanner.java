package com.phillippitts.vibedj.service.vibe;

import com.phillippitts.vibedj.config.properties.VibeProperties;
import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.CalendarEvent;
import com.phillippitts.vibedj.domain.ChatExcerpt;
import com.phillippitts.vibedj.domain.Phase;
import com.phillippitts.vibedj.domain.VibePlan;
import com.phillippitts.vibedj.domain.VibeTargets;
import com.phillippitts.vibedj.service.oracle.PreviousVibeState;
import com.phillippitts.vibedj.service.oracle.VibeOracle;
import com.phillippitts.vibedj.service.oracle.VibeRequest;
import com.phillippitts.vibedj.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the current {@link VibePlan} and turns it into targets for "now".
 *
 * <p>A recheck happens when the music-chat signature changed since the last recheck, or
 * when no plan exists, the recheck interval elapsed, or the plan ran out. After an oracle
 * failure no recheck is attempted for the configured backoff; the previous plan stays.
 *
 * <p>State is guarded by the instance monitor; the oracle is called outside it so status
 * reads never wait on the network.
 */
public class VibePlanner {

    private static final Logger LOG = LogManager.getLogger(VibePlanner.class);

    private final VibeOracle oracle;
    private final VibeProperties props;
    private final Clock clock;
    private final ZoneId zone;

    private VibePlan plan;
    private Instant planStart;
    private Instant lastCheck;
    private Instant lastFailure;
    private String lastChatSignature;

    public VibePlanner(VibeOracle oracle, VibeProperties props, Clock clock) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = clock.getZone();
    }

    /**
     * Rechecks the plan with the oracle if needed.
     *
     * @param calendar upcoming calendar events, may be empty
     * @param chat     recent music-chat messages, oldest first
     */
    public RecheckOutcome ensureFreshPlan(List<CalendarEvent> calendar, List<ChatExcerpt> chat) {
        Instant now = clock.instant();
        String signature = ChatSignature.of(chat, props.getSignatureMessages(), props.getSignatureChars());
        PreviousVibeState previous;

        synchronized (this) {
            boolean chatChanged = signature != null && !signature.equals(lastChatSignature);
            if (!chatChanged && !needsCheck(now)) {
                return RecheckOutcome.FRESH;
            }
            if (lastFailure != null
                    && Duration.between(lastFailure, now).getSeconds() < props.getFailureBackoffSeconds()) {
                LOG.debug("Vibe recheck suppressed, last failure at {}", lastFailure);
                return RecheckOutcome.BACKOFF;
            }
            lastChatSignature = signature;
            lastCheck = now;
            previous = previousState(now);
            LOG.info("Rechecking vibe plan (chatChanged={}, hasPlan={})", chatChanged, plan != null);
        }

        DayOfWeek day = now.atZone(zone).getDayOfWeek();
        VibePlan fresh;
        try {
            fresh = oracle.plan(new VibeRequest(day, calendar, chat, previous));
        } catch (RuntimeException e) {
            synchronized (this) {
                lastFailure = clock.instant();
            }
            LOG.warn("Vibe oracle failed, keeping previous plan: {}", e.getMessage());
            return RecheckOutcome.FAILED;
        }

        if (fresh.totalPhaseMinutes() != fresh.planDurationMinutes()) {
            LOG.warn("Vibe plan phases sum to {} min but plan says {} min",
                    fresh.totalPhaseMinutes(), fresh.planDurationMinutes());
        }
        synchronized (this) {
            Instant done = clock.instant();
            plan = fresh;
            planStart = done;
            lastCheck = done;
            lastFailure = null;
        }
        LOG.info("New vibe plan: block='{}' duration={} min phases={} continuation={}",
                fresh.contextBlock(), fresh.planDurationMinutes(), fresh.phases().size(), fresh.continuation());
        return RecheckOutcome.REPLANNED;
    }

    /**
     * Targets for the current instant. Without a plan (or with a plan that has no phases)
     * the defaults are returned.
     */
    public synchronized VibeTargets currentTargets() {
        if (plan == null || plan.phases().isEmpty()) {
            return VibeTargets.decorate(AudioTargets.DEFAULTS, plan, "", 0.0);
        }
        double elapsed = Math.max(0.0, TimeUtils.minutesBetween(planStart, clock.instant()));
        PhasePosition pos = locate(plan.phases(), elapsed);
        return VibeTargets.decorate(pos.phase.targetsAt(pos.progress), plan, pos.phase.note(), pos.progress);
    }

    public synchronized Optional<PlanDebug> planDebug() {
        if (plan == null) {
            return Optional.empty();
        }
        return Optional.of(new PlanDebug(plan.verbalPlan(), plan.contextBlock(), plan.planDurationMinutes(),
                round1(TimeUtils.minutesBetween(planStart, clock.instant())), plan.phases().size(),
                lastCheck, plan.musicFilters()));
    }

    public synchronized boolean hasPlan() {
        return plan != null;
    }

    /** Forgets the plan and all recheck bookkeeping. */
    public synchronized void clear() {
        plan = null;
        planStart = null;
        lastCheck = null;
        lastFailure = null;
        lastChatSignature = null;
    }

    private boolean needsCheck(Instant now) {
        if (plan == null || lastCheck == null) {
            return true;
        }
        if (TimeUtils.minutesBetween(lastCheck, now) >= props.getRecheckIntervalMinutes()) {
            return true;
        }
        int duration = plan.planDurationMinutes() > 0
                ? plan.planDurationMinutes() : props.getDefaultPlanDurationMinutes();
        return planStart == null || TimeUtils.minutesBetween(planStart, now) >= duration;
    }

    private PreviousVibeState previousState(Instant now) {
        if (plan == null) {
            return null;
        }
        double elapsed = Math.max(0.0, TimeUtils.minutesBetween(planStart, now));
        AudioTargets current = AudioTargets.DEFAULTS;
        String note = "";
        if (!plan.phases().isEmpty()) {
            PhasePosition pos = locate(plan.phases(), elapsed);
            current = pos.phase.targetsAt(pos.progress);
            note = pos.phase.note();
        }
        return new PreviousVibeState(plan.verbalPlan(), plan.contextBlock(), plan.planDurationMinutes(),
                round1(elapsed), current, note, plan.musicFilters());
    }

    /**
     * First phase whose end lies after {@code elapsed}; past the end of the plan, the last
     * phase. Progress is clamped to [0, 1].
     */
    static PhasePosition locate(List<Phase> phases, double elapsedMinutes) {
        double start = 0.0;
        for (Phase p : phases) {
            double end = start + p.durationMinutes();
            if (elapsedMinutes < end) {
                return new PhasePosition(p, progress(elapsedMinutes, start, p.durationMinutes()));
            }
            start = end;
        }
        Phase last = phases.get(phases.size() - 1);
        double lastStart = start - last.durationMinutes();
        return new PhasePosition(last, progress(elapsedMinutes, lastStart, last.durationMinutes()));
    }

    private static double progress(double elapsed, double phaseStart, int duration) {
        if (duration <= 0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, (elapsed - phaseStart) / duration));
    }

    private static double round1(double v) {
        return new BigDecimal(v).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    static final class PhasePosition {
        final Phase phase;
        final double progress;

        PhasePosition(Phase phase, double progress) {
            this.phase = phase;
            this.progress = progress;
        }
    }
}
