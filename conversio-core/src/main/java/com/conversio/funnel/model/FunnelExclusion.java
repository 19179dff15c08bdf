package com.conversio.funnel.model;

import java.util.List;

/**
 * Event that invalidates a conversion attempt when it happens between {@code fromStep} and {@code toStep}.
 */
public record FunnelExclusion(
        EntityKind kind, String event, Long actionId, List<PropertyFilter> properties, Integer fromStep, Integer toStep)
        implements FunnelEntity {

    public FunnelExclusion {
        kind = kind == null ? EntityKind.EVENTS : kind;
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static FunnelExclusion event(String event, int fromStep, int toStep) {
        return new FunnelExclusion(EntityKind.EVENTS, event, null, List.of(), fromStep, toStep);
    }
}
