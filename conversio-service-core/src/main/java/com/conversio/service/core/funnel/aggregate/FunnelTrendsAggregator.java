package com.conversio.service.core.funnel.aggregate;

import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelTrendsPeriod;
import com.conversio.service.core.funnel.breakdown.BreakdownDomain;
import com.conversio.service.core.funnel.sampling.SamplingCorrector;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import com.conversio.service.core.funnel.steps.AnchorOutcome;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion rate between two steps per entrance period. An actor counts once per period, with the furthest step
 * reached from any anchor entering in that period. Periods without entrances are reported with zero counts.
 */
public class FunnelTrendsAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final DayOfWeek weekStart;

    public FunnelTrendsAggregator(DayOfWeek weekStart) {
        this.weekStart = weekStart;
    }

    public List<FunnelTrendsPeriod> aggregate(
            FunnelQuery query, BreakdownDomain domain, List<ActorFunnelResult> results) {
        EntrancePeriods periods =
                new EntrancePeriods(query.interval(), ZoneId.of(query.timezone()), weekStart);
        int fromStep = query.resolvedFromStep();
        int toStep = query.resolvedToStep();

        // (breakdown value, period) -> actor -> furthest step
        Map<PeriodKey, Map<String, Integer>> reached = new HashMap<>();
        boolean sawOther = false;
        for (ActorFunnelResult result : results) {
            sawOther |= FunnelBreakdown.OTHER.equals(result.breakdownValue());
            for (AnchorOutcome anchor : result.anchors()) {
                PeriodKey key = new PeriodKey(result.breakdownValue(), periods.truncate(anchor.entrance()));
                reached.computeIfAbsent(key, k -> new HashMap<>())
                        .merge(result.actorId(), anchor.stepsCompleted(), Math::max);
            }
        }

        List<String> values = new ArrayList<>();
        if (!query.hasBreakdown()) {
            values.add(null);
        } else {
            values.addAll(domain.values());
            if (domain.hasOther() && sawOther && !values.contains(FunnelBreakdown.OTHER)) {
                values.add(FunnelBreakdown.OTHER);
            }
        }

        List<FunnelTrendsPeriod> rows = new ArrayList<>();
        for (Instant period : periods.between(query.dateFrom(), query.dateTo())) {
            for (String value : values) {
                Map<String, Integer> actors = reached.getOrDefault(new PeriodKey(value, period), Map.of());
                long reachedFrom = actors.values().stream().filter(steps -> steps >= fromStep + 1).count();
                long reachedTo = actors.values().stream().filter(steps -> steps >= toStep + 1).count();
                rows.add(new FunnelTrendsPeriod(
                        period,
                        SamplingCorrector.correctCount(reachedFrom, query.samplingFactor()),
                        SamplingCorrector.correctCount(reachedTo, query.samplingFactor()),
                        rate(reachedFrom, reachedTo),
                        value));
            }
        }
        return rows;
    }

    static BigDecimal rate(long reachedFrom, long reachedTo) {
        if (reachedFrom == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(reachedTo)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(reachedFrom), 2, RoundingMode.HALF_UP);
    }

    private record PeriodKey(String breakdownValue, Instant period) {}
}
