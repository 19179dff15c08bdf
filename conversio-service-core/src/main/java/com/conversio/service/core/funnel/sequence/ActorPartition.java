package com.conversio.service.core.funnel.sequence;

import com.conversio.service.core.funnel.match.StepMatch;
import java.util.Comparator;
import java.util.List;

/**
 * Rows of one actor, or of one actor within one breakdown value, ordered by timestamp. A partition is evaluated in
 * isolation from every other partition.
 */
public record ActorPartition(String actorId, String breakdownValue, List<StepMatch> rows) {

    public static final Comparator<StepMatch> ROW_ORDER = Comparator.comparing(
                    (StepMatch row) -> row.event().timestamp())
            .thenComparing(row -> row.event().uuid(), Comparator.nullsFirst(Comparator.naturalOrder()));

    public ActorPartition {
        rows = rows.stream().sorted(ROW_ORDER).toList();
    }
}
