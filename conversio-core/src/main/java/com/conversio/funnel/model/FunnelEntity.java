package com.conversio.funnel.model;

import java.util.List;

/**
 * Anything that selects events for a funnel: a step or an exclusion.
 *
 * <p>An {@link EntityKind#EVENTS} entity with a {@code null} event matches every event.
 */
public interface FunnelEntity {

    EntityKind kind();

    String event();

    Long actionId();

    List<PropertyFilter> properties();
}
