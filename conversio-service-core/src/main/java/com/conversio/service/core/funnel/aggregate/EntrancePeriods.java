package com.conversio.service.core.funnel.aggregate;

import com.conversio.funnel.model.FunnelInterval;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/** Truncates entrance timestamps to trend periods in the query's time zone. */
public class EntrancePeriods {

    private final FunnelInterval interval;
    private final ZoneId zone;
    private final DayOfWeek weekStart;

    public EntrancePeriods(FunnelInterval interval, ZoneId zone, DayOfWeek weekStart) {
        this.interval = interval;
        this.zone = zone;
        this.weekStart = weekStart;
    }

    public Instant truncate(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime truncated = switch (interval) {
            case HOUR -> local.truncatedTo(ChronoUnit.HOURS);
            case DAY -> local.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> local.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(weekStart));
            case MONTH -> local.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        };
        return truncated.toInstant();
    }

    /** Every period start from the period containing {@code from} up to {@code to}, inclusive. */
    public List<Instant> between(Instant from, Instant to) {
        List<Instant> periods = new ArrayList<>();
        ZonedDateTime cursor = truncate(from).atZone(zone);
        while (!cursor.toInstant().isAfter(to)) {
            periods.add(cursor.toInstant());
            cursor = switch (interval) {
                case HOUR -> cursor.plusHours(1);
                case DAY -> cursor.plusDays(1);
                case WEEK -> cursor.plusWeeks(1);
                case MONTH -> cursor.plusMonths(1);
            };
        }
        return periods;
    }
}
