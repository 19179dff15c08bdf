package com.conversio.funnel.model;

import java.math.BigDecimal;
import java.time.Instant;

/** Conversion between two steps for actors who entered the funnel during one period. */
public record FunnelTrendsPeriod(
        Instant periodStart, long reachedFromCount, long reachedToCount, BigDecimal conversionRate, String breakdownValue) {}
