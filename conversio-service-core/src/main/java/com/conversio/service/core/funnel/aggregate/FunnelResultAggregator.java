package com.conversio.service.core.funnel.aggregate;

import com.conversio.funnel.model.EntityKind;
import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.funnel.model.FunnelStepResult;
import com.conversio.funnel.model.FunnelStepSeries;
import com.conversio.service.core.funnel.breakdown.BreakdownDomain;
import com.conversio.service.core.funnel.breakdown.CohortMembership;
import com.conversio.service.core.funnel.match.ActionLookup;
import com.conversio.service.core.funnel.sampling.SamplingCorrector;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Folds per-actor results into per-step counts and conversion time statistics, one series per breakdown value. */
public class FunnelResultAggregator {

    static final String ALL_EVENTS_NAME = "All events";

    private final ActionLookup actions;
    private final CohortMembership cohorts;
    private final int actorSampleSize;

    public FunnelResultAggregator(ActionLookup actions, CohortMembership cohorts, int actorSampleSize) {
        this.actions = actions;
        this.cohorts = cohorts;
        this.actorSampleSize = actorSampleSize;
    }

    public List<FunnelStepSeries> aggregate(
            FunnelQuery query, BreakdownDomain domain, List<ActorFunnelResult> results) {
        if (!query.hasBreakdown()) {
            return List.of(series(query, null, results));
        }
        Map<String, List<ActorFunnelResult>> byValue = new LinkedHashMap<>();
        if (query.breakdown().type() == FunnelBreakdown.Type.COHORT) {
            // every requested cohort is reported, empty ones with zero counts
            domain.values().forEach(cohort -> byValue.put(cohort, new ArrayList<>()));
        }
        for (ActorFunnelResult result : results) {
            if (result.stepsCompleted() > 0) {
                byValue.computeIfAbsent(result.breakdownValue(), key -> new ArrayList<>())
                        .add(result);
            }
        }
        return byValue.keySet().stream()
                .sorted(Comparator.<String>comparingInt(domain::rank).thenComparing(Comparator.naturalOrder()))
                .map(value -> series(query, value, byValue.get(value)))
                .toList();
    }

    private FunnelStepSeries series(FunnelQuery query, String breakdownValue, List<ActorFunnelResult> results) {
        List<FunnelStepResult> steps = new ArrayList<>(query.stepCount());
        List<String> breakdown = breakdownProperties(query.breakdown());
        for (FunnelStep step : query.steps()) {
            int order = step.order();
            List<ActorFunnelResult> reached =
                    results.stream().filter(result -> result.reached(order)).toList();
            List<Double> times = order == 0
                    ? List.of()
                    : reached.stream()
                            .map(result -> result.conversionTime(order))
                            .filter(Objects::nonNull)
                            .toList();
            List<String> actorIds = actorSampleSize <= 0
                    ? List.of()
                    : reached.stream()
                            .map(ActorFunnelResult::actorId)
                            .sorted()
                            .limit(actorSampleSize)
                            .toList();
            steps.add(new FunnelStepResult(
                    order,
                    stepName(step),
                    step.customName(),
                    step.actionId(),
                    step.kind(),
                    SamplingCorrector.correctCount(reached.size(), query.samplingFactor()),
                    average(times),
                    median(times),
                    breakdown,
                    breakdownValue,
                    actorIds));
        }
        return new FunnelStepSeries(breakdownValue, label(query.breakdown(), breakdownValue), steps);
    }

    private String stepName(FunnelStep step) {
        if (step.kind() == EntityKind.ACTIONS) {
            return actions.find(step.actionId())
                    .map(action -> action.name())
                    .orElse("Action " + step.actionId());
        }
        return step.event() == null ? ALL_EVENTS_NAME : step.event();
    }

    private String label(FunnelBreakdown breakdown, String value) {
        if (breakdown == null || value == null) {
            return null;
        }
        if (breakdown.type() == FunnelBreakdown.Type.COHORT) {
            return cohorts.name(Long.parseLong(value));
        }
        return value;
    }

    private static List<String> breakdownProperties(FunnelBreakdown breakdown) {
        if (breakdown == null) {
            return List.of();
        }
        return breakdown.type() == FunnelBreakdown.Type.COHORT ? List.of("cohort") : breakdown.properties();
    }

    static Double average(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    static Double median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int middle = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2.0;
    }
}
