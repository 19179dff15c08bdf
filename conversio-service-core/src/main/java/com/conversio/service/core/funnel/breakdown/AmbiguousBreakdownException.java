package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelBreakdown;
import java.util.List;

/** Multi-property breakdowns only combine string values. */
public class AmbiguousBreakdownException extends IllegalArgumentException {
    private final List<String> properties;
    private final FunnelBreakdown.ValueType valueType;

    public AmbiguousBreakdownException(List<String> properties, FunnelBreakdown.ValueType valueType) {
        super("Cannot combine breakdown properties " + properties + " with value type " + valueType);
        this.properties = List.copyOf(properties);
        this.valueType = valueType;
    }

    public List<String> properties() {
        return properties;
    }

    public FunnelBreakdown.ValueType valueType() {
        return valueType;
    }
}
