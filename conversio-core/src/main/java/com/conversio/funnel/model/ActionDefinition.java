package com.conversio.funnel.model;

import java.util.List;

/** Saved action: an event matches when any alternative matches it. */
public record ActionDefinition(long id, String name, List<Alternative> alternatives) {

    public ActionDefinition {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public record Alternative(String event, List<PropertyFilter> properties) {
        public Alternative {
            properties = properties == null ? List.of() : List.copyOf(properties);
        }
    }
}
