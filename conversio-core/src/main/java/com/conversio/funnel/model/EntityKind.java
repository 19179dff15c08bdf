package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Whether a funnel entity filters on a raw event name or on a saved action. */
public enum EntityKind {
    EVENTS,
    ACTIONS;

    @JsonCreator
    public static EntityKind fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return EVENTS;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "events", "event" -> EVENTS;
            case "actions", "action" -> ACTIONS;
            default -> throw new IllegalArgumentException("Unsupported entity kind: " + value);
        };
    }

    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
