package com.conversio.service.core.funnel.aggregate;

import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.TimeToConvertResult;
import com.conversio.service.core.funnel.sampling.SamplingCorrector;
import com.conversio.service.core.funnel.steps.ActorFunnelResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Equal-width histogram of the time actors took to go from one step to another. Each actor counts once, with its
 * furthest partition when a breakdown split it.
 */
public class TimeToConvertAggregator {

    static final int MAX_BINS = 90;

    public TimeToConvertResult aggregate(FunnelQuery query, List<ActorFunnelResult> results) {
        int fromStep = query.resolvedFromStep();
        int toStep = query.resolvedToStep();
        List<Double> times = ActorFunnelResult.bestPerActor(results).stream()
                .map(result -> result.conversionTimeBetween(fromStep, toStep))
                .filter(Objects::nonNull)
                .toList();
        if (times.isEmpty()) {
            return TimeToConvertResult.empty(fromStep, toStep);
        }
        double min = times.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double max = times.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        int binCount = query.binCount() != null ? query.binCount() : defaultBinCount(times.size());
        long lower = (long) Math.floor(min);
        long width = Math.max(1L, (long) Math.ceil((max - lower) / binCount));

        long[] counts = new long[binCount];
        for (double time : times) {
            int bin = (int) Math.min(binCount - 1, (long) ((time - lower) / width));
            counts[bin]++;
        }
        List<TimeToConvertResult.Bin> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            bins.add(new TimeToConvertResult.Bin(
                    lower + i * width, SamplingCorrector.correctCount(counts[i], query.samplingFactor())));
        }
        return new TimeToConvertResult(fromStep, toStep, FunnelResultAggregator.average(times), bins);
    }

    static int defaultBinCount(int sampleSize) {
        int bins = (int) Math.ceil(Math.cbrt(sampleSize));
        return Math.max(1, Math.min(MAX_BINS, bins));
    }
}
