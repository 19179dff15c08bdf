package com.conversio.service.core.funnel.match;

import com.conversio.funnel.model.EntityKind;
import com.conversio.funnel.model.FunnelEntity;
import java.util.HashSet;
import java.util.Objects;

/** Structural comparison of step and exclusion predicates. */
public final class EntityComparison {

    private EntityComparison() {}

    public static boolean isEqual(FunnelEntity a, FunnelEntity b) {
        return sameTarget(a, b) && new HashSet<>(a.properties()).equals(new HashSet<>(b.properties()));
    }

    /**
     * True when every event {@code b} selects is also selected by {@code a}: same target (or {@code a} targets all
     * events) and {@code a}'s property filters are a subset of {@code b}'s.
     */
    public static boolean isSuperset(FunnelEntity a, FunnelEntity b) {
        boolean targetCovers = sameTarget(a, b)
                || (a.kind() == EntityKind.EVENTS && a.event() == null && b.kind() == EntityKind.EVENTS);
        return targetCovers && new HashSet<>(b.properties()).containsAll(a.properties());
    }

    private static boolean sameTarget(FunnelEntity a, FunnelEntity b) {
        if (a.kind() != b.kind()) {
            return false;
        }
        return a.kind() == EntityKind.ACTIONS
                ? Objects.equals(a.actionId(), b.actionId())
                : Objects.equals(a.event(), b.event());
    }
}
