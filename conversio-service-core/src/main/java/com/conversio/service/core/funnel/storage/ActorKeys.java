package com.conversio.service.core.funnel.storage;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelAggregation;

public final class ActorKeys {

    private ActorKeys() {}

    /** Identity the funnel aggregates by, or {@code null} when the row has none. */
    public static String actorId(ActorEvent row, FunnelAggregation aggregation) {
        String id = switch (aggregation.target()) {
            case PERSON -> row.personId();
            case SESSION -> row.sessionId();
            case GROUP -> row.groups().get(aggregation.groupTypeIndex());
        };
        return id == null || id.isBlank() ? null : id;
    }
}
