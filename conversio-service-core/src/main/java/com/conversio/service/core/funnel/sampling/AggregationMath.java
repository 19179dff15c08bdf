package com.conversio.service.core.funnel.sampling;

/** How a value was aggregated; only additive results scale with the sampling factor. */
public enum AggregationMath {
    TOTAL(true),
    SUM(true),
    UNIQUE_ACTORS(true),
    AVG(false),
    MIN(false),
    MAX(false),
    MEDIAN(false),
    P90(false),
    P95(false),
    P99(false),
    ACTOR_RATIO(false);

    private final boolean additive;

    AggregationMath(boolean additive) {
        this.additive = additive;
    }

    public boolean additive() {
        return additive;
    }
}
