package com.phillippitts.vibedj.service.vibe;

/**
 * What {@link VibePlanner#ensureFreshPlan} did.
 */
public enum RecheckOutcome {
    /** Current plan still valid; oracle not called. */
    FRESH,
    /** Oracle answered and the plan was replaced. */
    REPLANNED,
    /** Oracle call failed; the previous plan (if any) stays. */
    FAILED,
    /** A recheck was due but suppressed by the failure backoff. */
    BACKOFF
}
