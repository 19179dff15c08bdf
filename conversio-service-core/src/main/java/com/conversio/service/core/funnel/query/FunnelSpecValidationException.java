package com.conversio.service.core.funnel.query;

import java.util.List;

/** Funnel definition rejected before any event was read. */
public class FunnelSpecValidationException extends IllegalArgumentException {
    private final List<String> violations;

    public FunnelSpecValidationException(String violation) {
        this(List.of(violation));
    }

    public FunnelSpecValidationException(List<String> violations) {
        super("Invalid funnel definition: " + String.join("; ", violations));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
