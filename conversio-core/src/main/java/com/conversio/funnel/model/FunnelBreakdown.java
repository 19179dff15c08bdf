package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Locale;

/**
 * Segmentation of funnel results by a property (or several), or by cohort membership.
 *
 * <p>For {@link Type#COHORT} the {@code cohorts} list holds the cohort ids to show, where
 * {@link #ALL_USERS_COHORT_ID} stands for every actor.
 */
public record FunnelBreakdown(
        Type type,
        List<String> properties,
        Integer groupTypeIndex,
        ValueType valueType,
        Attribution attribution,
        Integer attributionStep,
        Integer limit,
        List<Long> cohorts) {

    public static final long ALL_USERS_COHORT_ID = 0L;
    public static final String OTHER = "Other";
    public static final String MULTI_PROPERTY_SEPARATOR = "::";

    public FunnelBreakdown {
        type = type == null ? Type.EVENT : type;
        properties = properties == null ? List.of() : List.copyOf(properties);
        valueType = valueType == null ? ValueType.STRING : valueType;
        attribution = attribution == null ? Attribution.FIRST_TOUCH : attribution;
        cohorts = cohorts == null ? List.of() : List.copyOf(cohorts);
    }

    public static FunnelBreakdown event(String property, Attribution attribution) {
        return new FunnelBreakdown(Type.EVENT, List.of(property), null, null, attribution, null, null, null);
    }

    public static FunnelBreakdown cohorts(List<Long> cohortIds) {
        return new FunnelBreakdown(Type.COHORT, null, null, null, Attribution.ALL_EVENTS, null, null, cohortIds);
    }

    public FunnelBreakdown withLimit(int value) {
        return new FunnelBreakdown(
                type, properties, groupTypeIndex, valueType, attribution, attributionStep, value, cohorts);
    }

    public FunnelBreakdown withAttributionStep(int step) {
        return new FunnelBreakdown(
                type, properties, groupTypeIndex, valueType, Attribution.STEP, step, limit, cohorts);
    }

    @JsonIgnore
    public boolean isMultiProperty() {
        return properties.size() > 1;
    }

    public enum Type {
        EVENT,
        PERSON,
        GROUP,
        COHORT;

        @JsonCreator
        public static Type fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return EVENT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "event" -> EVENT;
                case "person" -> PERSON;
                case "group" -> GROUP;
                case "cohort" -> COHORT;
                default -> throw new IllegalArgumentException("Unsupported breakdown type: " + value);
            };
        }
    }

    public enum ValueType {
        STRING,
        NUMERIC,
        BOOLEAN,
        DATETIME;

        @JsonCreator
        public static ValueType fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return STRING;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "string" -> STRING;
                case "numeric", "number" -> NUMERIC;
                case "boolean" -> BOOLEAN;
                case "datetime" -> DATETIME;
                default -> throw new IllegalArgumentException("Unsupported breakdown value type: " + value);
            };
        }
    }

    public enum Attribution {
        ALL_EVENTS,
        FIRST_TOUCH,
        LAST_TOUCH,
        STEP;

        @JsonCreator
        public static Attribution fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return FIRST_TOUCH;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "all_events" -> ALL_EVENTS;
                case "first_touch" -> FIRST_TOUCH;
                case "last_touch" -> LAST_TOUCH;
                case "step" -> STEP;
                default -> throw new IllegalArgumentException("Unsupported breakdown attribution: " + value);
            };
        }
    }
}
