package com.conversio.funnel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;

/** Conversion window applied between entering the funnel and completing any later step. */
public record FunnelWindow(int interval, Unit unit) {

    public static final FunnelWindow DEFAULT = new FunnelWindow(14, Unit.DAY);

    public FunnelWindow {
        if (interval <= 0) {
            throw new IllegalArgumentException("funnel window interval must be positive: " + interval);
        }
        unit = unit == null ? Unit.DAY : unit;
    }

    /** Parses {@code "<interval> <unit>"}, e.g. {@code "14 day"} or {@code "2 weeks"}. */
    public static FunnelWindow parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("funnel window cannot be null or empty");
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Unsupported funnel window format: " + value);
        }
        try {
            return new FunnelWindow(Integer.parseInt(parts[0]), Unit.fromConfigValue(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported funnel window format: " + value, e);
        }
    }

    /** Latest instant still inside the window opened at {@code start}. */
    public Instant end(Instant start) {
        ZonedDateTime utc = start.atZone(ZoneOffset.UTC);
        return switch (unit) {
            case SECOND -> start.plusSeconds(interval);
            case MINUTE -> start.plusSeconds(interval * 60L);
            case HOUR -> start.plusSeconds(interval * 3600L);
            case DAY -> utc.plusDays(interval).toInstant();
            case WEEK -> utc.plusWeeks(interval).toInstant();
            case MONTH -> utc.plusMonths(interval).toInstant();
        };
    }

    @Override
    public String toString() {
        return interval + " " + unit.name().toLowerCase(Locale.ROOT);
    }

    public enum Unit {
        SECOND,
        MINUTE,
        HOUR,
        DAY,
        WEEK,
        MONTH;

        @JsonCreator
        public static Unit fromConfigValue(String value) {
            if (value == null || value.isBlank()) {
                return DAY;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.endsWith("s")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            return switch (normalized) {
                case "second" -> SECOND;
                case "minute" -> MINUTE;
                case "hour" -> HOUR;
                case "day" -> DAY;
                case "week" -> WEEK;
                case "month" -> MONTH;
                default -> throw new IllegalArgumentException("Unsupported funnel window unit: " + value);
            };
        }
    }
}
