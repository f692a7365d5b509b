package org.edsim.engine;

import java.time.LocalDateTime;

/**
 * Maps simulated minutes to calendar date-times from the configured start.
 */
public class SimulationCalendar {

    private final LocalDateTime start;

    public SimulationCalendar(LocalDateTime start) {
        this.start = start;
    }

    public LocalDateTime toDateTime(double simMinutes) {
        return start.plusSeconds(Math.round(simMinutes * 60.0));
    }

    public int hourOfDay(double simMinutes) {
        return toDateTime(simMinutes).getHour();
    }

    /**
     * Simulated minute of the next wall-clock hour strictly after the given time.
     */
    public double nextHourBoundary(double simMinutes) {
        LocalDateTime t = toDateTime(simMinutes);
        double minuteOfHour = t.getMinute() + t.getSecond() / 60.0;
        double boundary = simMinutes + (60.0 - minuteOfHour);
        // rounding to whole seconds may leave us a hair before the current time
        return boundary <= simMinutes ? simMinutes + 60.0 : boundary;
    }

    public LocalDateTime getStart() {
        return start;
    }
}
