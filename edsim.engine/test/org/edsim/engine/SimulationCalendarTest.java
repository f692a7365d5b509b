package org.edsim.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class SimulationCalendarTest {

    private final SimulationCalendar calendar = new SimulationCalendar(LocalDateTime.of(2025, 1, 6, 8, 0));

    @Test
    void mapsMinutesToDateTimes() {
        assertThat(calendar.toDateTime(0.0).getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(calendar.hourOfDay(90.0)).isEqualTo(9);
        assertThat(calendar.toDateTime(24 * 60.0).getDayOfWeek()).isEqualTo(DayOfWeek.TUESDAY);
    }

    @Test
    void nextHourBoundaryIsStrictlyAfter() {
        assertThat(calendar.nextHourBoundary(0.0)).isCloseTo(60.0, within(1e-9));
        assertThat(calendar.nextHourBoundary(59.5)).isCloseTo(60.0, within(1e-9));
        assertThat(calendar.nextHourBoundary(60.0)).isCloseTo(120.0, within(1e-9));
    }
}
