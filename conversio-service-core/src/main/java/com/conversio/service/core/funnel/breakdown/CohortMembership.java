package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelBreakdown;

/** Answers cohort membership for cohort breakdowns. Cohort {@code 0} always contains every actor. */
public interface CohortMembership {

    boolean isMember(long cohortId, String actorId);

    default String name(long cohortId) {
        return cohortId == FunnelBreakdown.ALL_USERS_COHORT_ID ? "all users" : "Cohort " + cohortId;
    }

    static CohortMembership none() {
        return (cohortId, actorId) -> false;
    }
}
