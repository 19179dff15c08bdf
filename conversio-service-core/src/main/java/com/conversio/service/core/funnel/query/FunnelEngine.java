package com.conversio.service.core.funnel.query;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.service.core.config.FunnelProperties;
import com.conversio.service.core.funnel.breakdown.BreakdownAttributor;
import com.conversio.service.core.funnel.breakdown.BreakdownDomain;
import com.conversio.service.core.funnel.breakdown.BreakdownValueDiscovery;
import com.conversio.service.core.funnel.breakdown.BreakdownValueMemo;
import com.conversio.service.core.funnel.breakdown.CohortMembership;
import com.conversio.service.core.funnel.match.ActionLookup;
import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.match.StepMatcher;
import com.conversio.service.core.funnel.sequence.ActorPartition;
import com.conversio.service.core.funnel.sequence.SequenceResolver;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import com.conversio.service.core.funnel.steps.StepsCompletedAggregator;
import com.conversio.service.core.funnel.storage.ActorKeys;
import com.conversio.service.core.funnel.storage.FunnelEventQuery;
import com.conversio.service.core.funnel.storage.FunnelEventSource;
import com.conversio.service.core.funnel.window.WindowEvaluator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs a validated query with all defaults resolved: fetch, match, attribute breakdowns, then evaluate every actor
 * partition on the partition executor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FunnelEngine {

    private final FunnelEventSource eventSource;
    private final ActionLookup actions;
    private final CohortMembership cohorts;
    private final FunnelPartitionExecutor executor;
    private final FunnelProperties properties;

    /**
     * @param query validated query with every default resolved
     * @param memoKey query the breakdown domain is remembered under, usually the caller's unresolved one
     */
    public EngineRun run(FunnelQuery query, FunnelQuery memoKey, BreakdownValueMemo memo) {
        StepMatcher matcher = StepMatcher.compile(query, actions);
        List<ActorEvent> events = eventSource.fetch(new FunnelEventQuery(
                matcher.eventNames(), query.dateFrom(), query.dateTo(), query.aggregation(), query.samplingFactor()));

        Map<String, List<StepMatch>> rowsByActor = new LinkedHashMap<>();
        List<StepMatch> relevant = new ArrayList<>();
        for (ActorEvent event : events) {
            String actorId = ActorKeys.actorId(event, query.aggregation());
            if (actorId == null) {
                continue;
            }
            StepMatch match = matcher.match(event);
            if (match.isRelevant()) {
                rowsByActor.computeIfAbsent(actorId, key -> new ArrayList<>()).add(match);
                relevant.add(match);
            }
        }

        BreakdownDomain domain = BreakdownDomain.EMPTY;
        if (query.hasBreakdown()) {
            BreakdownValueDiscovery discovery =
                    new BreakdownValueDiscovery(properties.getBreakdown().getLimit());
            domain = memo.getOrDiscover(memoKey, () -> discovery.discover(query, relevant));
            if (domain.isEmpty()) {
                log.info("Funnel breakdown domain is empty, skipping evaluation rows={}", relevant.size());
                return EngineRun.skipped(domain);
            }
        }

        List<ActorPartition> partitions = new BreakdownAttributor(cohorts).partition(query, domain, rowsByActor);
        boolean[] duplicates = matcher.duplicateSteps();
        StepsCompletedAggregator aggregator = new StepsCompletedAggregator(
                query.stepCount(),
                new SequenceResolver(query.stepCount(), duplicates),
                new WindowEvaluator(query.window(), duplicates, query.exclusions()));
        List<ActorFunnelResult> results = executor.processAll(partitions, aggregator::evaluate);
        log.debug(
                "Funnel engine evaluated rows={} actors={} partitions={} breakdownValues={}",
                relevant.size(),
                rowsByActor.size(),
                partitions.size(),
                domain.values().size());
        return new EngineRun(domain, results, false);
    }
}
