package com.conversio.service.core.funnel.window;

import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelWindow;
import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.sequence.ResolvedSequence;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Applies the conversion window and the exclusion ranges to resolved step chains. */
public class WindowEvaluator {

    private final FunnelWindow window;
    private final boolean[] duplicateSteps;
    private final List<FunnelExclusion> exclusions;

    public WindowEvaluator(FunnelWindow window, boolean[] duplicateSteps, List<FunnelExclusion> exclusions) {
        this.window = window;
        this.duplicateSteps = duplicateSteps.clone();
        this.exclusions = List.copyOf(exclusions);
    }

    /** Number of steps completed in order and inside the window, counting the anchor. */
    public int stepsCompleted(ResolvedSequence sequence) {
        Instant entrance = sequence.latest(0);
        Instant windowEnd = window.end(entrance);
        int steps = 1;
        for (int step = 1; step < sequence.stepCount(); step++) {
            Instant current = sequence.latest(step);
            if (current == null) {
                break;
            }
            Instant previous = sequence.latest(step - 1);
            boolean ordered = duplicateSteps[step] ? previous.isBefore(current) : !current.isBefore(previous);
            if (!ordered || current.isAfter(windowEnd)) {
                break;
            }
            steps = step + 1;
        }
        return steps;
    }

    /**
     * Sorted timestamps of the rows matching each exclusion, indexed like the query's exclusions.
     *
     * @param rows partition rows in timestamp order
     */
    public List<List<Instant>> exclusionTimes(List<StepMatch> rows) {
        List<List<Instant>> times = new ArrayList<>(exclusions.size());
        for (int i = 0; i < exclusions.size(); i++) {
            List<Instant> matched = new ArrayList<>();
            for (StepMatch row : rows) {
                if (row.matchesExclusion(i)) {
                    matched.add(row.event().timestamp());
                }
            }
            times.add(matched);
        }
        return times;
    }

    /**
     * An anchor is excluded when an exclusion event falls strictly between {@code latest_from} and the bound:
     * {@code latest_to} when the chain reached it, the window end otherwise.
     */
    public boolean isExcluded(ResolvedSequence sequence, int stepsCompleted, List<List<Instant>> exclusionTimes) {
        for (int i = 0; i < exclusions.size(); i++) {
            FunnelExclusion exclusion = exclusions.get(i);
            int from = exclusion.fromStep();
            int to = exclusion.toStep();
            if (stepsCompleted <= from) {
                continue;
            }
            Instant latestFrom = sequence.latest(from);
            Instant bound = stepsCompleted > to ? sequence.latest(to) : window.end(latestFrom);
            if (anyStrictlyBetween(exclusionTimes.get(i), latestFrom, bound)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyStrictlyBetween(List<Instant> sorted, Instant lower, Instant upper) {
        int position = Collections.binarySearch(sorted, lower);
        int first;
        if (position >= 0) {
            first = position;
            while (first < sorted.size() && !sorted.get(first).isAfter(lower)) {
                first++;
            }
        } else {
            first = -position - 1;
        }
        return first < sorted.size() && sorted.get(first).isBefore(upper);
    }
}
