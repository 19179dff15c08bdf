package com.conversio.service.core.funnel.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.funnel.model.PropertyFilter;
import com.conversio.service.core.funnel.breakdown.AmbiguousBreakdownException;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunnelQueryValidatorTest {

    private final List<FunnelStep> steps = List.of(
            FunnelStep.event(0, "sign up"), FunnelStep.event(1, "play movie"), FunnelStep.event(2, "buy"));

    @Test
    void acceptsWellFormedQuery() {
        FunnelQuery query = base().exclusions(List.of(FunnelExclusion.event("cancel", 0, 2)))
                .build();

        assertThatCode(() -> FunnelQueryValidator.validate(query, true)).doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingAndNonContiguousSteps() {
        assertThatThrownBy(() -> FunnelQueryValidator.validate(FunnelQuery.builder().build(), false))
                .isInstanceOf(FunnelSpecValidationException.class);
        FunnelQuery gap = FunnelQuery.builder()
                .steps(List.of(FunnelStep.event(0, "a"), FunnelStep.event(2, "b")))
                .build();
        assertThatThrownBy(() -> FunnelQueryValidator.validate(gap, false))
                .isInstanceOf(FunnelSpecValidationException.class)
                .hasMessageContaining("contiguous");
    }

    @Test
    void rejectsInvalidExclusionRanges() {
        for (FunnelExclusion exclusion : List.of(
                FunnelExclusion.event("cancel", 1, 1),
                FunnelExclusion.event("cancel", 2, 2),
                FunnelExclusion.event("cancel", 0, 3),
                new FunnelExclusion(null, "cancel", null, List.of(), null, 1))) {
            FunnelQuery query = base().exclusions(List.of(exclusion)).build();
            assertThatThrownBy(() -> FunnelQueryValidator.validate(query, false))
                    .as("exclusion %s", exclusion)
                    .isInstanceOf(FunnelSpecValidationException.class);
        }
    }

    @Test
    void rejectsExclusionOverlappingAStep() {
        FunnelQuery same = base().exclusions(List.of(FunnelExclusion.event("play movie", 0, 1)))
                .build();
        FunnelQuery broader = FunnelQuery.builder()
                .steps(List.of(
                        FunnelStep.event(0, "a"), FunnelStep.event(1, "b", PropertyFilter.exact("plan", "pro"))))
                .exclusions(List.of(FunnelExclusion.event("b", 0, 1)))
                .build();
        FunnelQuery outsideRange = base().exclusions(List.of(FunnelExclusion.event("buy", 0, 1)))
                .build();

        assertThatThrownBy(() -> FunnelQueryValidator.validate(same, false))
                .isInstanceOf(FunnelSpecValidationException.class);
        assertThatThrownBy(() -> FunnelQueryValidator.validate(broader, false))
                .isInstanceOf(FunnelSpecValidationException.class);
        assertThatCode(() -> FunnelQueryValidator.validate(outsideRange, false)).doesNotThrowAnyException();
    }

    @Test
    void rejectsBreakdownProblems() {
        FunnelQuery stepOutOfRange = base().breakdown(
                        FunnelBreakdown.event("$browser", null).withAttributionStep(3))
                .build();
        FunnelQuery ambiguous = base().breakdown(new FunnelBreakdown(
                        FunnelBreakdown.Type.PERSON,
                        List.of("age", "score"),
                        null,
                        FunnelBreakdown.ValueType.NUMERIC,
                        null,
                        null,
                        null,
                        null))
                .build();

        assertThatThrownBy(() -> FunnelQueryValidator.validate(stepOutOfRange, false))
                .isInstanceOf(FunnelSpecValidationException.class);
        assertThatThrownBy(() -> FunnelQueryValidator.validate(ambiguous, false))
                .isInstanceOf(AmbiguousBreakdownException.class);
    }

    @Test
    void collectsEveryViolation() {
        FunnelQuery query = base().samplingFactor(1.5).timezone("Mars/Olympus").fromStep(2).toStep(1)
                .build();

        assertThatThrownBy(() -> FunnelQueryValidator.validate(query, true))
                .isInstanceOfSatisfying(FunnelSpecValidationException.class, e -> assertThat(e.violations())
                        .hasSize(3));
    }

    private FunnelQuery.FunnelQueryBuilder base() {
        return FunnelQuery.builder().steps(steps);
    }
}
