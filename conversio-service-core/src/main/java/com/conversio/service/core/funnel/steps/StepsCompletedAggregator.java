package com.conversio.service.core.funnel.steps;

import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.sequence.ActorPartition;
import com.conversio.service.core.funnel.sequence.ResolvedSequence;
import com.conversio.service.core.funnel.sequence.SequenceResolver;
import com.conversio.service.core.funnel.window.WindowEvaluator;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reduces a partition to the furthest step its actor reached. When several anchors reach the same furthest step
 * the per-step conversion times are averaged across them.
 */
public class StepsCompletedAggregator {

    private final int stepCount;
    private final SequenceResolver resolver;
    private final WindowEvaluator evaluator;

    public StepsCompletedAggregator(int stepCount, SequenceResolver resolver, WindowEvaluator evaluator) {
        this.stepCount = stepCount;
        this.resolver = resolver;
        this.evaluator = evaluator;
    }

    public ActorFunnelResult evaluate(ActorPartition partition) {
        List<StepMatch> rows = partition.rows();
        List<List<Instant>> exclusionTimes = evaluator.exclusionTimes(rows);
        List<AnchorOutcome> anchors = new ArrayList<>();
        int best = 0;
        for (ResolvedSequence sequence : resolver.resolve(rows)) {
            int steps = evaluator.stepsCompleted(sequence);
            if (evaluator.isExcluded(sequence, steps, exclusionTimes)) {
                continue;
            }
            anchors.add(new AnchorOutcome(sequence.latest(0), steps, sequence));
            best = Math.max(best, steps);
        }

        List<Double> conversionTimes = new ArrayList<>(Collections.nCopies(stepCount, (Double) null));
        List<StepMatch> matchedRows = new ArrayList<>(Collections.nCopies(stepCount, (StepMatch) null));
        Instant entrance = null;
        if (best > 0) {
            int finalBest = best;
            List<AnchorOutcome> tied = anchors.stream()
                    .filter(anchor -> anchor.stepsCompleted() == finalBest)
                    .toList();
            ResolvedSequence first = tied.get(0).sequence();
            entrance = first.latest(0);
            for (int step = 0; step < best; step++) {
                matchedRows.set(step, first.row(step));
            }
            for (int step = 1; step < best; step++) {
                double total = 0;
                for (AnchorOutcome anchor : tied) {
                    total += Duration.between(anchor.sequence().latest(step - 1), anchor.sequence().latest(step))
                            .getSeconds();
                }
                conversionTimes.set(step, total / tied.size());
            }
        }
        return new ActorFunnelResult(
                partition.actorId(),
                partition.breakdownValue(),
                best,
                conversionTimes,
                entrance,
                matchedRows,
                anchors);
    }
}
