package com.conversio.service.core.funnel.breakdown;

import com.conversio.event.model.ActorEvent;
import com.conversio.funnel.model.FunnelBreakdown;
import com.conversio.service.core.funnel.match.PropertyMatcher;
import java.util.Collections;
import java.util.StringJoiner;

/** Reads the breakdown value of a row. Missing properties read as the empty string. */
public final class BreakdownValueReader {

    private BreakdownValueReader() {}

    public static String read(ActorEvent row, FunnelBreakdown breakdown) {
        if (!breakdown.isMultiProperty()) {
            return breakdown.properties().isEmpty() ? "" : readOne(row, breakdown, breakdown.properties().get(0));
        }
        StringJoiner joiner = new StringJoiner(FunnelBreakdown.MULTI_PROPERTY_SEPARATOR);
        for (String property : breakdown.properties()) {
            joiner.add(readOne(row, breakdown, property));
        }
        return joiner.toString();
    }

    /** Value used for actors with no non-empty value under first/last touch attribution. */
    public static String emptyValue(FunnelBreakdown breakdown) {
        return String.join(
                FunnelBreakdown.MULTI_PROPERTY_SEPARATOR,
                Collections.nCopies(Math.max(1, breakdown.properties().size()), ""));
    }

    private static String readOne(ActorEvent row, FunnelBreakdown breakdown, String property) {
        Object value = switch (breakdown.type()) {
            case EVENT -> row.property(property);
            case PERSON -> row.personProperty(property);
            case GROUP -> breakdown.groupTypeIndex() == null
                    ? null
                    : row.groupProperty(breakdown.groupTypeIndex(), property);
            case COHORT -> null;
        };
        return PropertyMatcher.normalize(value);
    }
}
