package com.conversio.funnel.model;

import java.time.Instant;
import java.util.List;

/** One page of actors who reached, or dropped off before, a funnel step. */
public record FunnelActorsResult(List<Actor> actors, int limit, int offset, boolean hasMore) {

    public FunnelActorsResult {
        actors = actors == null ? List.of() : List.copyOf(actors);
    }

    /**
     * @param matchedEvents per step, the event that satisfied it; empty unless recordings were requested
     */
    public record Actor(String actorId, int stepsCompleted, String breakdownValue, List<MatchedEvent> matchedEvents) {
        public Actor {
            matchedEvents = matchedEvents == null ? List.of() : List.copyOf(matchedEvents);
        }
    }

    public record MatchedEvent(int step, String uuid, Instant timestamp, String sessionId, String windowId) {}
}
