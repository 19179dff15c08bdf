package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.service.core.funnel.match.StepMatch;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Ranks the breakdown values present in the matched rows by row count (descending, ties by value descending) and
 * keeps the first {@code limit}.
 */
public class BreakdownValueDiscovery {

    private final int defaultLimit;

    public BreakdownValueDiscovery(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public BreakdownDomain discover(FunnelQuery query, List<StepMatch> rows) {
        FunnelBreakdown breakdown = query.breakdown();
        if (breakdown.type() == FunnelBreakdown.Type.COHORT) {
            return new BreakdownDomain(
                    breakdown.cohorts().stream().map(String::valueOf).distinct().toList(), false);
        }
        if (breakdown.isMultiProperty() && breakdown.valueType() != FunnelBreakdown.ValueType.STRING) {
            throw new AmbiguousBreakdownException(breakdown.properties(), breakdown.valueType());
        }
        Predicate<StepMatch> counted = countedRows(breakdown);
        Map<String, Long> counts = new HashMap<>();
        for (StepMatch row : rows) {
            if (counted.test(row)) {
                counts.merge(BreakdownValueReader.read(row.event(), breakdown), 1L, Long::sum);
            }
        }
        int limit = breakdown.limit() == null ? defaultLimit : breakdown.limit();
        List<String> ranked = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .toList();
        if (ranked.size() <= limit) {
            return new BreakdownDomain(ranked, false);
        }
        return new BreakdownDomain(ranked.subList(0, limit), true);
    }

    private static Predicate<StepMatch> countedRows(FunnelBreakdown breakdown) {
        return switch (breakdown.attribution()) {
            case ALL_EVENTS -> row -> row.matchesStep(0);
            case STEP -> {
                int step = breakdown.attributionStep() == null ? 0 : breakdown.attributionStep();
                yield row -> row.matchesStep(step);
            }
            case FIRST_TOUCH, LAST_TOUCH -> StepMatch::matchesAnyStep;
        };
    }
}
