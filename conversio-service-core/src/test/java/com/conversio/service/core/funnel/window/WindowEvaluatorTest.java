package com.conversio.service.core.funnel.window;

import static org.assertj.core.api.Assertions.assertThat;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelWindow;
import com.conversio.service.core.funnel.match.StepMatch;
import com.conversio.service.core.funnel.sequence.ResolvedSequence;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class WindowEvaluatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final FunnelWindow ONE_HOUR = new FunnelWindow(1, FunnelWindow.Unit.HOUR);

    @Test
    void countsStepsInsideWindowInOrder() {
        List<StepMatch> rows = rows(0, 1800, 3600, 3601);
        WindowEvaluator evaluator = new WindowEvaluator(ONE_HOUR, new boolean[4], List.of());

        assertThat(evaluator.stepsCompleted(new ResolvedSequence(rows, new int[] {0, 1, 2, 3})))
                .isEqualTo(3);
        assertThat(evaluator.stepsCompleted(new ResolvedSequence(rows, new int[] {0, 2, 1, 3})))
                .isEqualTo(2);
        assertThat(evaluator.stepsCompleted(new ResolvedSequence(rows, new int[] {0, -1, 2, 3})))
                .isEqualTo(1);
    }

    @Test
    void duplicateStepsRequireStrictlyLaterTimestamp() {
        List<StepMatch> rows = rows(0, 0);
        ResolvedSequence sequence = new ResolvedSequence(rows, new int[] {0, 1});

        assertThat(new WindowEvaluator(ONE_HOUR, new boolean[] {false, false}, List.of()).stepsCompleted(sequence))
                .isEqualTo(2);
        assertThat(new WindowEvaluator(ONE_HOUR, new boolean[] {false, true}, List.of()).stepsCompleted(sequence))
                .isEqualTo(1);
    }

    @Test
    void exclusionStrictlyBetweenStepsExcludesAnchor() {
        List<StepMatch> rows = new ArrayList<>(rows(0, 600));
        rows.add(1, exclusionRow(300));
        ResolvedSequence sequence = new ResolvedSequence(rows, new int[] {0, 2});
        WindowEvaluator evaluator =
                new WindowEvaluator(ONE_HOUR, new boolean[2], List.of(FunnelExclusion.event("cancel", 0, 1)));

        int steps = evaluator.stepsCompleted(sequence);

        assertThat(steps).isEqualTo(2);
        assertThat(evaluator.isExcluded(sequence, steps, evaluator.exclusionTimes(rows))).isTrue();
    }

    @Test
    void exclusionOnBoundaryOrAfterConversionIsIgnored() {
        List<StepMatch> rows = new ArrayList<>(rows(0, 600));
        rows.add(exclusionRow(600));
        rows.add(exclusionRow(900));
        ResolvedSequence sequence = new ResolvedSequence(rows, new int[] {0, 1});
        WindowEvaluator evaluator =
                new WindowEvaluator(ONE_HOUR, new boolean[2], List.of(FunnelExclusion.event("cancel", 0, 1)));

        assertThat(evaluator.isExcluded(sequence, 2, evaluator.exclusionTimes(rows))).isFalse();
    }

    @Test
    void unfinishedFunnelIsExcludedUntilWindowEnd() {
        List<StepMatch> rows = new ArrayList<>(rows(0));
        rows.add(exclusionRow(3000));
        ResolvedSequence sequence = new ResolvedSequence(rows, new int[] {0, -1});
        WindowEvaluator evaluator =
                new WindowEvaluator(ONE_HOUR, new boolean[2], List.of(FunnelExclusion.event("cancel", 0, 1)));

        assertThat(evaluator.isExcluded(sequence, 1, evaluator.exclusionTimes(rows))).isTrue();
    }

    private static List<StepMatch> rows(int... secondsAfterStart) {
        List<StepMatch> rows = new ArrayList<>();
        for (int i = 0; i < secondsAfterStart.length; i++) {
            BitSet steps = new BitSet();
            steps.set(i);
            rows.add(new StepMatch(event("step" + i, secondsAfterStart[i]), steps, new BitSet(), null));
        }
        return rows;
    }

    private static StepMatch exclusionRow(int secondsAfterStart) {
        BitSet exclusions = new BitSet();
        exclusions.set(0);
        return new StepMatch(event("cancel", secondsAfterStart), new BitSet(), exclusions, null);
    }

    private static ActorEvent event(String name, int secondsAfterStart) {
        return ActorEvent.builder()
                .event(name)
                .timestamp(T0.plusSeconds(secondsAfterStart))
                .personId("p1")
                .build();
    }
}
