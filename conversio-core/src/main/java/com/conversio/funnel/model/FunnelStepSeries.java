package com.conversio.funnel.model;

import java.util.List;

/** Funnel steps for one breakdown value; {@code breakdownValue} is {@code null} without a breakdown. */
public record FunnelStepSeries(String breakdownValue, String breakdownLabel, List<FunnelStepResult> steps) {

    public FunnelStepSeries {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public long countAt(int order) {
        return steps.get(order).count();
    }
}
