package com.conversio.funnel.model;

import java.util.List;

/** Histogram of conversion times between {@code fromStep} and {@code toStep}. */
public record TimeToConvertResult(int fromStep, int toStep, Double averageConversionTime, List<Bin> bins) {

    public TimeToConvertResult {
        bins = bins == null ? List.of() : List.copyOf(bins);
    }

    public static TimeToConvertResult empty(int fromStep, int toStep) {
        return new TimeToConvertResult(fromStep, toStep, null, List.of());
    }

    public record Bin(long lowerBoundSeconds, long count) {}
}
