package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelBreakdown;
import java.util.List;

/**
 * Breakdown values kept for a query, most frequent first. When storage held more values than the limit allows
 * {@code hasOther} is set and every value outside the list is reported as {@link FunnelBreakdown#OTHER}.
 */
public record BreakdownDomain(List<String> values, boolean hasOther) {

    public static final BreakdownDomain EMPTY = new BreakdownDomain(List.of(), false);

    public BreakdownDomain {
        values = List.copyOf(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Maps a value outside the domain to {@code Other}, but only when the limit actually cut values off. */
    public String bucket(String value) {
        return hasOther && !values.contains(value) ? FunnelBreakdown.OTHER : value;
    }

    /** Position used to order result series; values outside the domain sort after {@code Other}. */
    public int rank(String value) {
        int index = values.indexOf(value);
        if (index >= 0) {
            return index;
        }
        return FunnelBreakdown.OTHER.equals(value) ? values.size() : values.size() + 1;
    }
}
