package com.conversio.service.core.funnel.query;

import com.conversio.funnel.model.FunnelActorsResult;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.funnel.model.FunnelStepSeries;
import com.conversio.funnel.model.FunnelTrendsPeriod;
import com.conversio.funnel.model.FunnelWindow;
import com.conversio.funnel.model.TimeToConvertResult;
import com.conversio.service.core.config.FunnelProperties;
import com.conversio.service.core.funnel.aggregate.FunnelResultAggregator;
import com.conversio.service.core.funnel.aggregate.FunnelTrendsAggregator;
import com.conversio.service.core.funnel.aggregate.TimeToConvertAggregator;
import com.conversio.service.core.funnel.breakdown.BreakdownValueMemo;
import com.conversio.service.core.funnel.breakdown.CohortMembership;
import com.conversio.service.core.funnel.match.ActionLookup;
import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Entry points for funnel steps, trends, time to convert and actor drill-down. */
@Service
@Slf4j
@RequiredArgsConstructor
public class FunnelQueryService {

    private final FunnelEngine engine;
    private final FunnelProperties properties;
    private final ActionLookup actions;
    private final CohortMembership cohorts;
    private final Clock clock;

    public List<FunnelStepSeries> steps(FunnelQuery query) {
        return steps(query, newMemo());
    }

    public List<FunnelStepSeries> steps(FunnelQuery query, BreakdownValueMemo memo) {
        FunnelQuery resolved = prepare(query, false);
        EngineRun run = engine.run(resolved, query, memo);
        if (run.skipped()) {
            return List.of();
        }
        List<FunnelStepSeries> series = new FunnelResultAggregator(
                        actions, cohorts, properties.getActors().getStepSampleSize())
                .aggregate(resolved, run.domain(), run.results());
        log.info(
                "Funnel steps computed steps={} series={} actors={} range=[{}, {}]",
                resolved.stepCount(),
                series.size(),
                run.results().size(),
                resolved.dateFrom(),
                resolved.dateTo());
        return series;
    }

    public List<FunnelTrendsPeriod> trends(FunnelQuery query) {
        return trends(query, newMemo());
    }

    public List<FunnelTrendsPeriod> trends(FunnelQuery query, BreakdownValueMemo memo) {
        FunnelQuery resolved = prepare(query, true);
        EngineRun run = engine.run(resolved, query, memo);
        if (run.skipped()) {
            return List.of();
        }
        List<FunnelTrendsPeriod> periods = new FunnelTrendsAggregator(
                        properties.getTrends().getWeekStart())
                .aggregate(resolved, run.domain(), run.results());
        log.info(
                "Funnel trends computed interval={} from={} to={} rows={}",
                resolved.interval(),
                resolved.resolvedFromStep(),
                resolved.resolvedToStep(),
                periods.size());
        return periods;
    }

    public TimeToConvertResult timeToConvert(FunnelQuery query) {
        return timeToConvert(query, newMemo());
    }

    public TimeToConvertResult timeToConvert(FunnelQuery query, BreakdownValueMemo memo) {
        FunnelQuery resolved = prepare(query, true);
        EngineRun run = engine.run(resolved, query, memo);
        if (run.skipped()) {
            return TimeToConvertResult.empty(resolved.resolvedFromStep(), resolved.resolvedToStep());
        }
        TimeToConvertResult result = new TimeToConvertAggregator().aggregate(resolved, run.results());
        log.info(
                "Funnel time to convert computed from={} to={} bins={}",
                result.fromStep(),
                result.toStep(),
                result.bins().size());
        return result;
    }

    public FunnelActorsResult actors(FunnelQuery query, int funnelStep, String breakdownValue) {
        return actors(query, funnelStep, breakdownValue, null, null, newMemo());
    }

    public FunnelActorsResult actors(
            FunnelQuery query, int funnelStep, String breakdownValue, Integer limit, Integer offset) {
        return actors(query, funnelStep, breakdownValue, limit, offset, newMemo());
    }

    /**
     * Actors who reached step {@code funnelStep} (1-based) when positive, or who reached step {@code |funnelStep| - 1}
     * and then dropped off when negative.
     */
    public FunnelActorsResult actors(
            FunnelQuery query,
            int funnelStep,
            String breakdownValue,
            Integer limit,
            Integer offset,
            BreakdownValueMemo memo) {
        FunnelQuery resolved = prepare(query, false);
        int stepCount = resolved.stepCount();
        if (funnelStep == 0 || funnelStep == -1 || Math.abs(funnelStep) > stepCount) {
            throw new FunnelSpecValidationException(
                    "funnelStep must be in [1, " + stepCount + "] or [-" + stepCount + ", -2], got " + funnelStep);
        }
        int pageSize = limit == null ? properties.getActors().getDefaultLimit() : limit;
        int skip = offset == null ? 0 : offset;
        if (pageSize < 1 || skip < 0) {
            throw new FunnelSpecValidationException("limit must be positive and offset non-negative");
        }
        EngineRun run = engine.run(resolved, query, memo);
        List<ActorFunnelResult> matching = perActor(run.results(), breakdownValue).stream()
                .filter(result -> funnelStep > 0
                        ? result.stepsCompleted() >= funnelStep
                        : result.stepsCompleted() == -funnelStep - 1)
                .sorted(Comparator.comparing(ActorFunnelResult::actorId))
                .toList();
        List<FunnelActorsResult.Actor> page = matching.stream()
                .skip(skip)
                .limit(pageSize)
                .map(result -> toActor(result, resolved.includeRecordings()))
                .toList();
        log.info(
                "Funnel actors computed funnelStep={} breakdownValue={} matched={} returned={}",
                funnelStep,
                breakdownValue,
                matching.size(),
                page.size());
        return new FunnelActorsResult(page, pageSize, skip, skip + page.size() < matching.size());
    }

    /**
     * Memo scoped to a single call; pass a shared one to reuse breakdown values across calls. Entries are keyed on
     * the query as the caller wrote it, so a query that leaves {@code dateTo} to the clock keeps hitting the same
     * entry until it expires.
     */
    public BreakdownValueMemo newMemo() {
        return BreakdownValueMemo.from(properties);
    }

    /** Validates and fills in the window, date range and step order. */
    FunnelQuery prepare(FunnelQuery query, boolean conversionRange) {
        List<FunnelStep> ordered = query.steps().stream()
                .sorted(Comparator.comparingInt(FunnelStep::order))
                .toList();
        Instant dateTo = query.dateTo() != null ? query.dateTo() : clock.instant();
        Instant dateFrom = query.dateFrom() != null
                ? query.dateFrom()
                : dateTo.minus(properties.getDefaultDateRange());
        FunnelWindow window =
                query.window() != null ? query.window() : FunnelWindow.parse(properties.getDefaultWindow());
        FunnelQuery resolved = query.toBuilder()
                .steps(ordered)
                .window(window)
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .build();
        FunnelQueryValidator.validate(resolved, conversionRange);
        return resolved;
    }

    private static List<ActorFunnelResult> perActor(List<ActorFunnelResult> results, String breakdownValue) {
        if (breakdownValue != null) {
            return results.stream()
                    .filter(result -> breakdownValue.equals(result.breakdownValue()))
                    .toList();
        }
        return ActorFunnelResult.bestPerActor(results);
    }

    private static FunnelActorsResult.Actor toActor(ActorFunnelResult result, boolean includeRecordings) {
        List<FunnelActorsResult.MatchedEvent> events = new ArrayList<>();
        if (includeRecordings) {
            for (int step = 0; step < result.matchedRows().size(); step++) {
                StepMatch row = result.matchedRows().get(step);
                if (row != null) {
                    events.add(new FunnelActorsResult.MatchedEvent(
                            step,
                            row.event().uuid(),
                            row.event().timestamp(),
                            row.event().sessionId(),
                            row.event().windowId()));
                }
            }
        }
        return new FunnelActorsResult.Actor(
                result.actorId(), result.stepsCompleted(), result.breakdownValue(), events);
    }
}
