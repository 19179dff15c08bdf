package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Which entity is funneled: persons, groups of a given type, or sessions. */
public record FunnelAggregation(Target target, Integer groupTypeIndex) {

    public static final FunnelAggregation PERSONS = new FunnelAggregation(Target.PERSON, null);

    public FunnelAggregation {
        target = target == null ? Target.PERSON : target;
        if (target == Target.GROUP && groupTypeIndex == null) {
            throw new IllegalArgumentException("groupTypeIndex is required when aggregating by group");
        }
    }

    public enum Target {
        PERSON,
        GROUP,
        SESSION;

        @JsonCreator
        public static Target fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return PERSON;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "person", "persons" -> PERSON;
                case "group", "groups" -> GROUP;
                case "session", "sessions" -> SESSION;
                default -> throw new IllegalArgumentException("Unsupported aggregation target: " + value);
            };
        }
    }
}
