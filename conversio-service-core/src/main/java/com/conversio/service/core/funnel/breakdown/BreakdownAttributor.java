package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.sequence.ActorPartition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits each actor's rows into the partitions the engine evaluates, assigning breakdown values according to the
 * attribution mode. Values outside the discovered domain are bucketed before partitioning.
 */
public class BreakdownAttributor {

    private final CohortMembership cohorts;

    public BreakdownAttributor(CohortMembership cohorts) {
        this.cohorts = cohorts;
    }

    /**
     * @param rowsByActor relevant rows per actor, each list in timestamp order
     */
    public List<ActorPartition> partition(
            FunnelQuery query, BreakdownDomain domain, Map<String, List<StepMatch>> rowsByActor) {
        List<ActorPartition> partitions = new ArrayList<>();
        FunnelBreakdown breakdown = query.breakdown();
        for (Map.Entry<String, List<StepMatch>> entry : rowsByActor.entrySet()) {
            String actorId = entry.getKey();
            List<StepMatch> rows = entry.getValue();
            if (breakdown == null) {
                partitions.add(new ActorPartition(actorId, null, rows));
                continue;
            }
            if (breakdown.type() == FunnelBreakdown.Type.COHORT) {
                cohortPartitions(actorId, rows, domain, partitions);
                continue;
            }
            switch (breakdown.attribution()) {
                case ALL_EVENTS -> allEventsPartitions(actorId, rows, breakdown, domain, partitions);
                case FIRST_TOUCH -> touchPartition(actorId, rows, breakdown, domain, partitions, true);
                case LAST_TOUCH -> touchPartition(actorId, rows, breakdown, domain, partitions, false);
                case STEP -> stepPartitions(actorId, rows, breakdown, domain, partitions);
            }
        }
        return partitions;
    }

    private void cohortPartitions(
            String actorId, List<StepMatch> rows, BreakdownDomain domain, List<ActorPartition> partitions) {
        for (String cohort : domain.values()) {
            long cohortId = Long.parseLong(cohort);
            if (cohortId == FunnelBreakdown.ALL_USERS_COHORT_ID || cohorts.isMember(cohortId, actorId)) {
                partitions.add(new ActorPartition(actorId, cohort, withValue(rows, cohort)));
            }
        }
    }

    private static void allEventsPartitions(
            String actorId,
            List<StepMatch> rows,
            FunnelBreakdown breakdown,
            BreakdownDomain domain,
            List<ActorPartition> partitions) {
        Map<String, List<StepMatch>> byValue = new LinkedHashMap<>();
        for (StepMatch row : rows) {
            String value = domain.bucket(BreakdownValueReader.read(row.event(), breakdown));
            byValue.computeIfAbsent(value, key -> new ArrayList<>()).add(row.withBreakdownValue(value));
        }
        byValue.forEach((value, valueRows) -> partitions.add(new ActorPartition(actorId, value, valueRows)));
    }

    private static void touchPartition(
            String actorId,
            List<StepMatch> rows,
            FunnelBreakdown breakdown,
            BreakdownDomain domain,
            List<ActorPartition> partitions,
            boolean first) {
        String empty = BreakdownValueReader.emptyValue(breakdown);
        String chosen = null;
        for (StepMatch row : rows) {
            if (!row.matchesAnyStep()) {
                continue;
            }
            String value = BreakdownValueReader.read(row.event(), breakdown);
            if (value.isEmpty() || value.equals(empty)) {
                continue;
            }
            chosen = value;
            if (first) {
                break;
            }
        }
        String value = domain.bucket(chosen == null ? empty : chosen);
        partitions.add(new ActorPartition(actorId, value, withValue(rows, value)));
    }

    private static void stepPartitions(
            String actorId,
            List<StepMatch> rows,
            FunnelBreakdown breakdown,
            BreakdownDomain domain,
            List<ActorPartition> partitions) {
        int step = breakdown.attributionStep() == null ? 0 : breakdown.attributionStep();
        Set<String> values = new LinkedHashSet<>();
        for (StepMatch row : rows) {
            if (row.matchesStep(step)) {
                values.add(domain.bucket(BreakdownValueReader.read(row.event(), breakdown)));
            }
        }
        for (String value : values) {
            partitions.add(new ActorPartition(actorId, value, withValue(rows, value)));
        }
    }

    private static List<StepMatch> withValue(List<StepMatch> rows, String value) {
        return rows.stream().map(row -> row.withBreakdownValue(value)).toList();
    }
}
