package com.phillippitts.vibedj.service.oracle;

import com.phillippitts.vibedj.domain.VibePlan;
import com.phillippitts.vibedj.exception.OracleException;

/**
 * Turns calendar and chat context into a multi-phase {@link VibePlan}.
 */
public interface VibeOracle {

    /**
     * @throws OracleException if the oracle is unreachable or its answer is unusable
     */
    VibePlan plan(VibeRequest request);
}
