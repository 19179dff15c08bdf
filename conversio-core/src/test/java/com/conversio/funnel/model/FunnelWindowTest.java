package com.conversio.funnel.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class FunnelWindowTest {

    @Test
    void parsesIntervalAndUnit() {
        assertThat(FunnelWindow.parse("14 day")).isEqualTo(FunnelWindow.DEFAULT);
        assertThat(FunnelWindow.parse(" 2 Weeks ")).isEqualTo(new FunnelWindow(2, FunnelWindow.Unit.WEEK));
        assertThat(FunnelWindow.parse("90 minutes").toString()).isEqualTo("90 minute");
    }

    @Test
    void rejectsMalformedWindows() {
        assertThatThrownBy(() -> FunnelWindow.parse("fortnight")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FunnelWindow.parse("x day")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FunnelWindow.parse("3 decades")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FunnelWindow(0, FunnelWindow.Unit.DAY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void endUsesCalendarArithmeticForMonths() {
        Instant start = Instant.parse("2024-01-31T12:00:00Z");

        assertThat(new FunnelWindow(1, FunnelWindow.Unit.MONTH).end(start))
                .isEqualTo(Instant.parse("2024-02-29T12:00:00Z"));
        assertThat(new FunnelWindow(90, FunnelWindow.Unit.SECOND).end(start))
                .isEqualTo(Instant.parse("2024-01-31T12:01:30Z"));
        assertThat(new FunnelWindow(1, FunnelWindow.Unit.WEEK).end(start))
                .isEqualTo(Instant.parse("2024-02-07T12:00:00Z"));
    }
}
