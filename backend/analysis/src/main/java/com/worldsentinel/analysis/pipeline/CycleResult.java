package com.worldsentinel.analysis.pipeline;

import com.worldsentinel.analysis.country.CountryTrendState;
import com.worldsentinel.analysis.signal.DedupTable;
import com.worldsentinel.core.model.Baseline;
import com.worldsentinel.core.model.CycleOutput;

import java.util.Map;

/**
 * A finished but uncommitted cycle: the output plus every piece of cross-cycle state it would
 * install. Dropping the instance discards the cycle without side effects.
 */
public record CycleResult(
        CycleOutput output,
        Map<String, Baseline> stagedBaselines,
        CountryTrendState nextTrendState,
        DedupTable nextDedup
) {
    public CycleResult {
        stagedBaselines = Map.copyOf(stagedBaselines);
    }
}
