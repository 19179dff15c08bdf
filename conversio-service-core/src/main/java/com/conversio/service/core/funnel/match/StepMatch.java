package com.conversio.service.core.funnel.match;

import com.conversio.event.model.ActorEvent;
import java.util.BitSet;

/** A storage row with the steps and exclusions it satisfies, plus its attributed breakdown value. */
public record StepMatch(ActorEvent event, BitSet steps, BitSet exclusions, String breakdownValue) {

    public StepMatch {
        steps = (BitSet) steps.clone();
        exclusions = (BitSet) exclusions.clone();
    }

    @Override
    public BitSet steps() {
        return (BitSet) steps.clone();
    }

    @Override
    public BitSet exclusions() {
        return (BitSet) exclusions.clone();
    }

    public boolean matchesStep(int step) {
        return steps.get(step);
    }

    public boolean matchesExclusion(int exclusion) {
        return exclusions.get(exclusion);
    }

    public boolean matchesAnyStep() {
        return !steps.isEmpty();
    }

    public boolean isRelevant() {
        return !steps.isEmpty() || !exclusions.isEmpty();
    }

    public StepMatch withBreakdownValue(String value) {
        return new StepMatch(event, steps, exclusions, value);
    }
}
