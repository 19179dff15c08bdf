package com.conversio.service.core.funnel.query;

import com.conversio.funnel.model.FunnelQuery;
import com.conversio.funnel.model.FunnelStep;
import com.conversio.funnel.model.FunnelWindow;
import com.conversio.service.core.config.FunnelProperties;
import com.conversio.service.core.funnel.breakdown.CohortMembership;
import com.conversio.service.core.funnel.match.ActionLookup;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class FunnelTestSupport {

    static final Instant DAY_1 = Instant.parse("2024-01-01T00:00:00Z");
    static final Instant NOW = Instant.parse("2024-01-31T00:00:00Z");

    private static final FunnelPartitionExecutor EXECUTOR = startExecutor();

    private FunnelTestSupport() {}

    static Instant at(int day, int hour) {
        return at(day, hour, 0);
    }

    static Instant at(int day, int hour, int minute) {
        return DAY_1.plusSeconds((day - 1) * 86_400L + hour * 3_600L + minute * 60L);
    }

    static FunnelQueryService service(InMemoryFunnelEventSource source) {
        return service(source, ActionLookup.none(), CohortMembership.none());
    }

    static FunnelQueryService service(
            InMemoryFunnelEventSource source, ActionLookup actions, CohortMembership cohorts) {
        return service(source, actions, cohorts, new FunnelProperties());
    }

    static FunnelQueryService service(
            InMemoryFunnelEventSource source,
            ActionLookup actions,
            CohortMembership cohorts,
            FunnelProperties properties) {
        return service(source, actions, cohorts, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    static FunnelQueryService service(InMemoryFunnelEventSource source, Clock clock) {
        return service(source, ActionLookup.none(), CohortMembership.none(), new FunnelProperties(), clock);
    }

    private static FunnelQueryService service(
            InMemoryFunnelEventSource source,
            ActionLookup actions,
            CohortMembership cohorts,
            FunnelProperties properties,
            Clock clock) {
        FunnelEngine engine = new FunnelEngine(source, actions, cohorts, EXECUTOR, properties);
        return new FunnelQueryService(engine, properties, actions, cohorts, clock);
    }

    /** Sign up, play movie, buy over January with a seven day window. */
    static FunnelQuery.FunnelQueryBuilder movieFunnel() {
        return FunnelQuery.builder()
                .steps(List.of(
                        FunnelStep.event(0, "sign up"), FunnelStep.event(1, "play movie"), FunnelStep.event(2, "buy")))
                .window(new FunnelWindow(7, FunnelWindow.Unit.DAY))
                .dateFrom(DAY_1)
                .dateTo(NOW);
    }

    private static FunnelPartitionExecutor startExecutor() {
        FunnelPartitionExecutor executor = new FunnelPartitionExecutor(new FunnelProperties());
        executor.init(2, 3);
        return executor;
    }
}
