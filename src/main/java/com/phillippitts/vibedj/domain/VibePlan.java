package com.phillippitts.vibedj.domain;

import java.util.List;

/**
 * A time-bounded, multi-phase target description produced by the vibe oracle.
 *
 * <p>Owned by the planner and replaced wholesale on each recheck.
 *
 * @param verbalPlan          human-readable description of the plan
 * @param contextBlock        label of the calendar/context block the plan is for
 * @param contextBlockEnd     end time of that block as given by the oracle (free text)
 * @param planDurationMinutes total plan length, 15-60 minutes
 * @param phases              1-3 ordered phases
 * @param musicFilters        optional filters, {@link MusicFilters#NONE} when absent
 * @param currentMood         mood label
 * @param currentEnergy       energy label
 * @param anxietyLevel        anxiety label
 * @param continuation        whether the plan continues the previous one
 * @param continuationReason  why it does (or does not)
 * @param rationale           free-text reasoning
 */
public record VibePlan(
        String verbalPlan,
        String contextBlock,
        String contextBlockEnd,
        int planDurationMinutes,
        List<Phase> phases,
        MusicFilters musicFilters,
        String currentMood,
        String currentEnergy,
        String anxietyLevel,
        boolean continuation,
        String continuationReason,
        String rationale
) {

    public VibePlan {
        verbalPlan = verbalPlan == null ? "" : verbalPlan;
        contextBlock = contextBlock == null ? "" : contextBlock;
        contextBlockEnd = contextBlockEnd == null ? "" : contextBlockEnd;
        phases = phases == null ? List.of() : List.copyOf(phases);
        musicFilters = musicFilters == null ? MusicFilters.NONE : musicFilters;
        currentMood = currentMood == null ? "unknown" : currentMood;
        currentEnergy = currentEnergy == null ? "unknown" : currentEnergy;
        anxietyLevel = anxietyLevel == null ? "calm" : anxietyLevel;
        continuationReason = continuationReason == null ? "" : continuationReason;
        rationale = rationale == null ? "" : rationale;
    }

    /** Sum of phase durations in minutes. */
    public int totalPhaseMinutes() {
        return phases.stream().mapToInt(Phase::durationMinutes).sum();
    }
}
