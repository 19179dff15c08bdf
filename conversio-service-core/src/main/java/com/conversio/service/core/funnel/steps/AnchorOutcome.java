package com.conversio.service.core.funnel.steps;

import com.conversio.service.core.funnel.sequence.ResolvedSequence;
import java.time.Instant;

/** Steps completed from one non-excluded step-0 anchor. */
public record AnchorOutcome(Instant entrance, int stepsCompleted, ResolvedSequence sequence) {}
