package com.conversio.service.core.funnel.query;

import com.conversio.service.core.funnel.breakdown.BreakdownDomain;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import java.util.List;

/**
 * Per-partition results of one engine run. {@code skipped} is set when the breakdown domain was empty and no
 * partition was evaluated.
 */
public record EngineRun(BreakdownDomain domain, List<ActorFunnelResult> results, boolean skipped) {

    public EngineRun {
        results = List.copyOf(results);
    }

    static EngineRun skipped(BreakdownDomain domain) {
        return new EngineRun(domain, List.of(), true);
    }
}
