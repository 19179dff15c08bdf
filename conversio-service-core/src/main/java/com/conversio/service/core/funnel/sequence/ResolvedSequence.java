package com.conversio.service.core.funnel.sequence;

import com.conversio.service.core.funnel.match.StepMatch;
import java.time.Instant;
import java.util.List;

/** Step chain followed from one step-0 anchor; an index of {@code -1} means the step was never reached. */
public record ResolvedSequence(List<StepMatch> rows, int[] indexes) {

    public int stepCount() {
        return indexes.length;
    }

    public Instant latest(int step) {
        int index = indexes[step];
        return index < 0 ? null : rows.get(index).event().timestamp();
    }

    public StepMatch row(int step) {
        int index = indexes[step];
        return index < 0 ? null : rows.get(index);
    }
}
