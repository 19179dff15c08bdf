package com.conversio.service.core.funnel.sequence;

import com.conversio.service.core.funnel.match.StepMatch;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves, for every step-0 row of a partition, the earliest row satisfying each later step.
 *
 * <p>Step {@code i} is searched from the row that satisfied step {@code i-1}. Rows sharing a timestamp form a tie
 * group: a regular step may be satisfied anywhere in the tie group of the previous row, a duplicate step only by a
 * strictly later row.
 */
public class SequenceResolver {

    private final int stepCount;
    private final boolean[] duplicateSteps;

    public SequenceResolver(int stepCount, boolean[] duplicateSteps) {
        this.stepCount = stepCount;
        this.duplicateSteps = duplicateSteps.clone();
    }

    public List<ResolvedSequence> resolve(List<StepMatch> rows) {
        int n = rows.size();
        int[] groupStart = new int[n];
        int[] groupEnd = new int[n];
        for (int r = 0; r < n; r++) {
            boolean tied = r > 0 && sameInstant(rows, r - 1, r);
            groupStart[r] = tied ? groupStart[r - 1] : r;
        }
        for (int r = n - 1; r >= 0; r--) {
            boolean tied = r < n - 1 && sameInstant(rows, r, r + 1);
            groupEnd[r] = tied ? groupEnd[r + 1] : r;
        }

        // next[i][r]: first row at or after r satisfying step i
        int[][] next = new int[stepCount][];
        for (int step = 1; step < stepCount; step++) {
            int[] inclusive = new int[n + 1];
            inclusive[n] = -1;
            for (int r = n - 1; r >= 0; r--) {
                inclusive[r] = rows.get(r).matchesStep(step) ? r : inclusive[r + 1];
            }
            next[step] = inclusive;
        }

        List<ResolvedSequence> sequences = new ArrayList<>();
        for (int anchor = 0; anchor < n; anchor++) {
            if (!rows.get(anchor).matchesStep(0)) {
                continue;
            }
            int[] indexes = new int[stepCount];
            Arrays.fill(indexes, -1);
            indexes[0] = anchor;
            int previous = anchor;
            for (int step = 1; step < stepCount; step++) {
                int from = duplicateSteps[step] ? groupEnd[previous] + 1 : groupStart[previous];
                int found = next[step][from];
                if (found < 0) {
                    break;
                }
                indexes[step] = found;
                previous = found;
            }
            sequences.add(new ResolvedSequence(rows, indexes));
        }
        return sequences;
    }

    private static boolean sameInstant(List<StepMatch> rows, int a, int b) {
        return rows.get(a).event().timestamp().equals(rows.get(b).event().timestamp());
    }
}
