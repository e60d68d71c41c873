package com.phillippitts.vibedj.service.oracle;

import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.MusicFilters;

/**
 * Summary of the active plan sent along with a recheck so the oracle can decide whether to
 * continue it.
 */
public record PreviousVibeState(
        String verbalPlan,
        String contextBlock,
        int planDurationMinutes,
        double elapsedMinutes,
        AudioTargets currentTargets,
        String currentPhaseNote,
        MusicFilters musicFilters
) {
}
