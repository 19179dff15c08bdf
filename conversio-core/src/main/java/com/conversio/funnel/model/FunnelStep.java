package com.conversio.funnel.model;

import java.util.List;

/**
 * One stage of the funnel. Orders are contiguous from 0 in the owning {@link FunnelQuery}.
 */
public record FunnelStep(
        int order, EntityKind kind, String event, Long actionId, String customName, List<PropertyFilter> properties)
        implements FunnelEntity {

    public FunnelStep {
        kind = kind == null ? EntityKind.EVENTS : kind;
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static FunnelStep event(int order, String event, PropertyFilter... properties) {
        return new FunnelStep(order, EntityKind.EVENTS, event, null, null, List.of(properties));
    }

    public static FunnelStep action(int order, long actionId, PropertyFilter... properties) {
        return new FunnelStep(order, EntityKind.ACTIONS, null, actionId, null, List.of(properties));
    }
}
