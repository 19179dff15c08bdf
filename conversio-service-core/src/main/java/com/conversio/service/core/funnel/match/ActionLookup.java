package com.conversio.service.core.funnel.match;

import com.conversio.funnel.model.ActionDefinition;
import java.util.Optional;

/** Resolves saved actions referenced by funnel steps and exclusions. */
@FunctionalInterface
public interface ActionLookup {

    Optional<ActionDefinition> find(long actionId);

    static ActionLookup none() {
        return actionId -> Optional.empty();
    }
}
