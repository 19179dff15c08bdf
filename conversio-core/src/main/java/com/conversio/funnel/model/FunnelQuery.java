package com.conversio.funnel.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Declarative funnel definition. Everything the engine computes is derived from one instance of this record;
 * two equal queries over the same events produce the same results.
 *
 * <p>{@code fromStep}/{@code toStep} select the conversion measured by trends and time-to-convert and default to
 * the first and last step. {@code samplingFactor} is the fraction of actors storage kept, or {@code null} when the
 * events were not sampled.
 */
@Builder(toBuilder = true)
public record FunnelQuery(
        List<FunnelStep> steps,
        List<FunnelExclusion> exclusions,
        FunnelWindow window,
        FunnelBreakdown breakdown,
        FunnelAggregation aggregation,
        Instant dateFrom,
        Instant dateTo,
        String timezone,
        FunnelInterval interval,
        Integer fromStep,
        Integer toStep,
        Double samplingFactor,
        Integer binCount,
        boolean includeRecordings) {

    public FunnelQuery {
        steps = steps == null ? List.of() : List.copyOf(steps);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        aggregation = aggregation == null ? FunnelAggregation.PERSONS : aggregation;
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
        interval = interval == null ? FunnelInterval.DAY : interval;
    }

    public int stepCount() {
        return steps.size();
    }

    public boolean hasBreakdown() {
        return breakdown != null;
    }

    public int resolvedFromStep() {
        return fromStep == null ? 0 : fromStep;
    }

    public int resolvedToStep() {
        return toStep == null ? steps.size() - 1 : toStep;
    }
}
