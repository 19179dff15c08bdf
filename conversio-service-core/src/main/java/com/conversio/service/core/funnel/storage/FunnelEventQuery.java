package com.conversio.service.core.funnel.storage;

import com.conversio.funnel.model.FunnelAggregation;
import java.time.Instant;
import java.util.Set;

/**
 * Rows a funnel needs from storage.
 *
 * @param eventNames names to push down, or {@code null} when any event may match
 * @param samplingFactor fraction of actors to keep, or {@code null} for all actors
 */
public record FunnelEventQuery(
        Set<String> eventNames, Instant dateFrom, Instant dateTo, FunnelAggregation aggregation, Double samplingFactor) {

    public FunnelEventQuery {
        eventNames = eventNames == null ? null : Set.copyOf(eventNames);
    }
}
