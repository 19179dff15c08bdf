package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Entrance period granularity for funnel trends. */
public enum FunnelInterval {
    HOUR,
    DAY,
    WEEK,
    MONTH;

    @JsonCreator
    public static FunnelInterval fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "hour" -> HOUR;
            case "day" -> DAY;
            case "week" -> WEEK;
            case "month" -> MONTH;
            default -> throw new IllegalArgumentException("Unsupported funnel interval: " + value);
        };
    }
}
