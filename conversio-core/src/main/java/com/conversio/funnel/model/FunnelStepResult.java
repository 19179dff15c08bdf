package com.conversio.funnel.model;

import java.util.List;

/**
 * Aggregate row for one funnel step within one breakdown series.
 *
 * <p>{@code count} is sampling-corrected. Conversion times are seconds from the previous step and are {@code null}
 * for the first step or when nobody reached the step.
 */
public record FunnelStepResult(
        int order,
        String name,
        String customName,
        Long actionId,
        EntityKind type,
        long count,
        Double averageConversionTime,
        Double medianConversionTime,
        List<String> breakdown,
        String breakdownValue,
        List<String> actorIds) {

    public FunnelStepResult {
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
        actorIds = actorIds == null ? List.of() : List.copyOf(actorIds);
    }
}
