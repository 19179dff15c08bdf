package com.conversio.service.core.funnel.match;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.ActionDefinition;
import com.conversio.funnel.model.EntityKind;
import com.conversio.funnel.model.FunnelEntity;
import com.conversio.funnel.model.FunnelExclusion;
import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.service.core.funnel.query.FunnelSpecValidationException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Evaluates the step and exclusion predicates of one query against storage rows.
 *
 * <p>A step is a <em>duplicate</em> when its predicate equals, or selects a superset of, the previous step's
 * predicate. Such a step must be satisfied by a strictly later row than the one that satisfied the previous step.
 */
public final class StepMatcher {

    private final List<Predicate<ActorEvent>> stepPredicates;
    private final List<Predicate<ActorEvent>> exclusionPredicates;
    private final boolean[] duplicateSteps;
    private final Set<String> eventNames;

    private StepMatcher(
            List<Predicate<ActorEvent>> stepPredicates,
            List<Predicate<ActorEvent>> exclusionPredicates,
            boolean[] duplicateSteps,
            Set<String> eventNames) {
        this.stepPredicates = stepPredicates;
        this.exclusionPredicates = exclusionPredicates;
        this.duplicateSteps = duplicateSteps;
        this.eventNames = eventNames;
    }

    public static StepMatcher compile(FunnelQuery query, ActionLookup actions) {
        List<FunnelStep> steps = query.steps();
        List<Predicate<ActorEvent>> stepPredicates = new ArrayList<>(steps.size());
        Set<String> names = new LinkedHashSet<>();
        boolean allEvents = false;
        for (FunnelStep step : steps) {
            stepPredicates.add(predicate(step, actions));
            allEvents |= collectNames(step, actions, names);
        }
        List<Predicate<ActorEvent>> exclusionPredicates = new ArrayList<>(query.exclusions().size());
        for (FunnelExclusion exclusion : query.exclusions()) {
            exclusionPredicates.add(predicate(exclusion, actions));
            allEvents |= collectNames(exclusion, actions, names);
        }
        boolean[] duplicates = new boolean[steps.size()];
        for (int i = 1; i < steps.size(); i++) {
            FunnelStep current = steps.get(i);
            FunnelStep previous = steps.get(i - 1);
            duplicates[i] = EntityComparison.isEqual(current, previous) || EntityComparison.isSuperset(current, previous);
        }
        return new StepMatcher(
                List.copyOf(stepPredicates),
                List.copyOf(exclusionPredicates),
                duplicates,
                allEvents ? null : Collections.unmodifiableSet(names));
    }

    public StepMatch match(ActorEvent row) {
        BitSet steps = new BitSet(stepPredicates.size());
        for (int i = 0; i < stepPredicates.size(); i++) {
            if (stepPredicates.get(i).test(row)) {
                steps.set(i);
            }
        }
        BitSet exclusions = new BitSet(exclusionPredicates.size());
        for (int i = 0; i < exclusionPredicates.size(); i++) {
            if (exclusionPredicates.get(i).test(row)) {
                exclusions.set(i);
            }
        }
        return new StepMatch(row, steps, exclusions, null);
    }

    public boolean[] duplicateSteps() {
        return duplicateSteps.clone();
    }

    public int stepCount() {
        return stepPredicates.size();
    }

    /** Event names storage may filter on, or {@code null} when some entity targets all events. */
    public Set<String> eventNames() {
        return eventNames;
    }

    private static Predicate<ActorEvent> predicate(FunnelEntity entity, ActionLookup actions) {
        Predicate<ActorEvent> properties = PropertyMatcher.compileAll(entity.properties());
        if (entity.kind() == EntityKind.EVENTS) {
            String event = entity.event();
            return event == null ? properties : properties.and(row -> event.equals(row.event()));
        }
        ActionDefinition action = resolve(entity, actions);
        Predicate<ActorEvent> anyAlternative = row -> false;
        for (ActionDefinition.Alternative alternative : action.alternatives()) {
            Predicate<ActorEvent> alt = PropertyMatcher.compileAll(alternative.properties());
            if (alternative.event() != null) {
                String event = alternative.event();
                alt = alt.and(row -> event.equals(row.event()));
            }
            anyAlternative = anyAlternative.or(alt);
        }
        return anyAlternative.and(properties);
    }

    private static boolean collectNames(FunnelEntity entity, ActionLookup actions, Set<String> names) {
        if (entity.kind() == EntityKind.EVENTS) {
            if (entity.event() == null) {
                return true;
            }
            names.add(entity.event());
            return false;
        }
        boolean allEvents = false;
        for (ActionDefinition.Alternative alternative : resolve(entity, actions).alternatives()) {
            if (alternative.event() == null) {
                allEvents = true;
            } else {
                names.add(alternative.event());
            }
        }
        return allEvents;
    }

    private static ActionDefinition resolve(FunnelEntity entity, ActionLookup actions) {
        if (entity.actionId() == null) {
            throw new FunnelSpecValidationException("Action entity requires an actionId");
        }
        return actions.find(entity.actionId())
                .orElseThrow(() -> new FunnelSpecValidationException("Unknown action id " + entity.actionId()));
    }
}
