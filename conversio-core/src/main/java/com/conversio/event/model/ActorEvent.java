package com.conversio.event.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * Event row as supplied by storage: who did what, when, with which properties.
 *
 * <p>{@code groups} maps a group type index to the group key the event belongs to; {@code groupProperties} holds
 * the properties of those groups under the same index.
 */
@Builder(toBuilder = true)
public record ActorEvent(
        String uuid,
        String event,
        Instant timestamp,
        String personId,
        String sessionId,
        String windowId,
        Map<Integer, String> groups,
        Map<String, Object> properties,
        Map<String, Object> personProperties,
        Map<Integer, Map<String, Object>> groupProperties) {

    public ActorEvent {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(timestamp, "timestamp");
        groups = unmodifiable(groups);
        properties = unmodifiable(properties);
        personProperties = unmodifiable(personProperties);
        groupProperties = unmodifiable(groupProperties);
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public Object personProperty(String key) {
        return personProperties.get(key);
    }

    public Object groupProperty(int groupTypeIndex, String key) {
        Map<String, Object> props = groupProperties.get(groupTypeIndex);
        return props == null ? null : props.get(key);
    }

    private static <K, V> Map<K, V> unmodifiable(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
