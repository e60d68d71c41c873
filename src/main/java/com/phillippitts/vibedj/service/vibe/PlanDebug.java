package com.phillippitts.vibedj.service.vibe;

import com.phillippitts.vibedj.domain.MusicFilters;

import java.time.Instant;

/**
 * Read-only view of the active plan for status output.
 *
 * @param elapsedMinutes minutes since the plan started, one decimal
 */
public record PlanDebug(
        String verbalPlan,
        String contextBlock,
        int planDurationMinutes,
        double elapsedMinutes,
        int phaseCount,
        Instant lastVibeCheck,
        MusicFilters musicFilters
) {
}
