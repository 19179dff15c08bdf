package com.conversio.service.core.funnel.sampling;

/**
 * Scales aggregates computed over sampled actors back to population estimates. A {@code null} or non-positive
 * factor means the data was not sampled.
 */
public final class SamplingCorrector {

    private SamplingCorrector() {}

    public static double correct(double value, Double factor, AggregationMath math) {
        if (!isSampled(factor) || !math.additive()) {
            return value;
        }
        return Math.round(value / factor);
    }

    public static long correctCount(long count, Double factor) {
        return (long) correct(count, factor, AggregationMath.TOTAL);
    }

    public static double inverse(double value, Double factor) {
        return isSampled(factor) ? value * factor : value;
    }

    public static boolean isSampled(Double factor) {
        return factor != null && factor > 0;
    }
}
