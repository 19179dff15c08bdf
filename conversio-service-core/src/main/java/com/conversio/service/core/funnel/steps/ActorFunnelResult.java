package com.conversio.service.core.funnel.steps;

import com.conversio.service.core.funnel.match.StepMatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one actor partition.
 *
 * @param conversionTimes seconds from step {@code i-1} to step {@code i}, indexed by {@code i}; {@code null} for
 *     step 0 and for steps not completed
 * @param matchedRows per step, the row that satisfied it in the first best anchor; {@code null} when not reached
 * @param anchors every anchor that survived exclusion, used for entrance-period trends
 */
public record ActorFunnelResult(
        String actorId,
        String breakdownValue,
        int stepsCompleted,
        List<Double> conversionTimes,
        Instant entrance,
        List<StepMatch> matchedRows,
        List<AnchorOutcome> anchors) {

    public ActorFunnelResult {
        conversionTimes = Collections.unmodifiableList(new ArrayList<>(conversionTimes));
        matchedRows = Collections.unmodifiableList(new ArrayList<>(matchedRows));
        anchors = List.copyOf(anchors);
    }

    public boolean reached(int step) {
        return stepsCompleted > step;
    }

    public Double conversionTime(int step) {
        return conversionTimes.get(step);
    }

    /** Seconds between reaching {@code fromStep} and {@code toStep}, or {@code null} when {@code toStep} was missed. */
    public Double conversionTimeBetween(int fromStep, int toStep) {
        if (!reached(toStep)) {
            return null;
        }
        double total = 0;
        for (int step = fromStep + 1; step <= toStep; step++) {
            total += conversionTimes.get(step);
        }
        return total;
    }

    /**
     * One result per actor: the partition that got furthest, the earliest listed one on ties. Breakdowns that
     * replicate an actor across values produce several partitions for the same actor.
     */
    public static List<ActorFunnelResult> bestPerActor(List<ActorFunnelResult> results) {
        Map<String, ActorFunnelResult> best = new LinkedHashMap<>();
        for (ActorFunnelResult result : results) {
            best.merge(
                    result.actorId(),
                    result,
                    (current, candidate) ->
                            candidate.stepsCompleted() > current.stepsCompleted() ? candidate : current);
        }
        return new ArrayList<>(best.values());
    }
}
