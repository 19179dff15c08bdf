package com.conversio.service.core.funnel.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.funnel.model.PropertyFilter;
import com.conversio.service.core.funnel.query.FunnelSpecValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StepMatcherTest {

    @Test
    void flagsEveryMatchingStepAndExclusion() {
        FunnelQuery query = FunnelQuery.builder()
                .steps(List.of(
                        FunnelStep.event(0, "$pageview"),
                        FunnelStep.event(1, "$pageview", PropertyFilter.exact("$current_url", "/pricing")),
                        FunnelStep.event(2, "signup")))
                .exclusions(List.of(FunnelExclusion.event("$pageview", 1, 2)))
                .build();
        StepMatcher matcher = StepMatcher.compile(query, ActionLookup.none());

        StepMatch match = matcher.match(row("$pageview", Map.of("$current_url", "/pricing")));

        assertThat(match.matchesStep(0)).isTrue();
        assertThat(match.matchesStep(1)).isTrue();
        assertThat(match.matchesStep(2)).isFalse();
        assertThat(match.matchesExclusion(0)).isTrue();
        assertThat(matcher.match(row("other", Map.of())).isRelevant()).isFalse();
    }

    @Test
    void marksStepsRepeatingThePreviousPredicateAsDuplicates() {
        FunnelQuery query = FunnelQuery.builder()
                .steps(List.of(
                        FunnelStep.event(0, "$pageview", PropertyFilter.exact("$current_url", "/a")),
                        FunnelStep.event(1, "$pageview"),
                        FunnelStep.event(2, "$pageview", PropertyFilter.exact("$current_url", "/b")),
                        FunnelStep.event(3, "$pageview", PropertyFilter.exact("$current_url", "/b"))))
                .build();

        StepMatcher matcher = StepMatcher.compile(query, ActionLookup.none());

        assertThat(matcher.duplicateSteps()).containsExactly(false, true, false, true);
    }

    @Test
    void allEventsStepDisablesNamePushdown() {
        FunnelQuery named = FunnelQuery.builder()
                .steps(List.of(FunnelStep.event(0, "a"), FunnelStep.event(1, "b")))
                .build();
        FunnelQuery anything = FunnelQuery.builder()
                .steps(List.of(FunnelStep.event(0, "a"), FunnelStep.event(1, null)))
                .build();

        assertThat(StepMatcher.compile(named, ActionLookup.none()).eventNames()).containsExactlyInAnyOrder("a", "b");
        assertThat(StepMatcher.compile(anything, ActionLookup.none()).eventNames()).isNull();
    }

    @Test
    void unknownActionIsRejected() {
        FunnelQuery query = FunnelQuery.builder()
                .steps(List.of(FunnelStep.action(0, 42L)))
                .build();

        assertThatThrownBy(() -> StepMatcher.compile(query, ActionLookup.none()))
                .isInstanceOf(FunnelSpecValidationException.class)
                .hasMessageContaining("42");
    }

    private static ActorEvent row(String event, Map<String, Object> properties) {
        return ActorEvent.builder()
                .event(event)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .personId("p1")
                .properties(properties)
                .build();
    }
}
