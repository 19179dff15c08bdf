package com.conversio.service.core.funnel.query;

import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.service.core.funnel.breakdown.AmbiguousBreakdownException;
import com.conversio.service.core.funnel.match.EntityComparison;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/** Rejects malformed funnel definitions before any rows are read. */
public final class FunnelQueryValidator {

    private FunnelQueryValidator() {}

    /**
     * @param conversionRange whether {@code fromStep}/{@code toStep} take part in the query (trends, time to convert)
     */
    public static void validate(FunnelQuery query, boolean conversionRange) {
        List<String> violations = new ArrayList<>();
        List<FunnelStep> steps = query.steps();
        int stepCount = steps.size();
        if (stepCount == 0) {
            throw new FunnelSpecValidationException("Funnel requires at least one step");
        }
        for (int i = 0; i < stepCount; i++) {
            if (steps.get(i).order() != i) {
                violations.add("Step orders must be contiguous from 0, found " + steps.get(i).order() + " at " + i);
                break;
            }
        }
        for (FunnelExclusion exclusion : query.exclusions()) {
            validateExclusion(exclusion, steps, violations);
        }
        validateBreakdown(query.breakdown(), stepCount, violations);
        if (conversionRange) {
            int from = query.resolvedFromStep();
            int to = query.resolvedToStep();
            if (from < 0 || from >= stepCount) {
                violations.add("fromStep " + from + " is outside the funnel");
            }
            if (to < 0 || to >= stepCount) {
                violations.add("toStep " + to + " is outside the funnel");
            }
            if (from >= to && stepCount > 1) {
                violations.add("fromStep must precede toStep");
            }
        }
        if (query.dateFrom() != null && query.dateTo() != null && query.dateFrom().isAfter(query.dateTo())) {
            violations.add("dateFrom must not be after dateTo");
        }
        if (query.samplingFactor() != null && (query.samplingFactor() <= 0 || query.samplingFactor() > 1)) {
            violations.add("samplingFactor must be in (0, 1]");
        }
        if (query.binCount() != null && query.binCount() < 1) {
            violations.add("binCount must be positive");
        }
        try {
            ZoneId.of(query.timezone());
        } catch (DateTimeException e) {
            violations.add("Unknown timezone " + query.timezone());
        }
        if (!violations.isEmpty()) {
            throw new FunnelSpecValidationException(violations);
        }
    }

    private static void validateExclusion(FunnelExclusion exclusion, List<FunnelStep> steps, List<String> violations) {
        Integer from = exclusion.fromStep();
        Integer to = exclusion.toStep();
        int last = steps.size() - 1;
        if (from == null || to == null) {
            violations.add("Exclusion requires fromStep and toStep");
            return;
        }
        if (from < 0 || from >= to || from >= last || to > last) {
            violations.add("Exclusion step range [" + from + ", " + to + "] is invalid for " + steps.size() + " steps");
            return;
        }
        for (int i = from; i <= to; i++) {
            FunnelStep step = steps.get(i);
            if (EntityComparison.isEqual(step, exclusion) || EntityComparison.isSuperset(exclusion, step)) {
                violations.add("Exclusion steps cannot contain an event that's part of funnel steps (step " + i + ")");
                return;
            }
        }
    }

    private static void validateBreakdown(FunnelBreakdown breakdown, int stepCount, List<String> violations) {
        if (breakdown == null) {
            return;
        }
        if (breakdown.type() != FunnelBreakdown.Type.COHORT) {
            if (breakdown.properties().isEmpty()) {
                violations.add("Breakdown requires at least one property");
            }
            if (breakdown.isMultiProperty() && breakdown.valueType() != FunnelBreakdown.ValueType.STRING) {
                throw new AmbiguousBreakdownException(breakdown.properties(), breakdown.valueType());
            }
        }
        if (breakdown.type() == FunnelBreakdown.Type.GROUP && breakdown.groupTypeIndex() == null) {
            violations.add("Group breakdown requires groupTypeIndex");
        }
        if (breakdown.limit() != null && breakdown.limit() < 1) {
            violations.add("Breakdown limit must be positive");
        }
        if (breakdown.attribution() == FunnelBreakdown.Attribution.STEP) {
            Integer step = breakdown.attributionStep();
            if (step == null || step < 0 || step >= stepCount) {
                violations.add("Breakdown attribution step " + step + " is outside the funnel");
            }
        }
    }
}
