package org.edsim.model;

import java.time.DayOfWeek;

/**
 * Demand inputs in force for one hospital during one simulated hour,
 * with the combined multiplicative factor derived from them.
 */
public final class DemandContext {

    private final String hospitalId;
    private final double simTime;
    private final int hourOfDay;
    private final DayOfWeek dayOfWeek;
    private final boolean holiday;
    private final double temperature;
    private final double precipitation;
    private final double eventLoad;
    private final double factor;

    public DemandContext(String hospitalId, double simTime, int hourOfDay, DayOfWeek dayOfWeek,
                         boolean holiday, double temperature, double precipitation,
                         double eventLoad, double factor) {
        this.hospitalId = hospitalId;
        this.simTime = simTime;
        this.hourOfDay = hourOfDay;
        this.dayOfWeek = dayOfWeek;
        this.holiday = holiday;
        this.temperature = temperature;
        this.precipitation = precipitation;
        this.eventLoad = eventLoad;
        this.factor = factor;
    }

    public String getHospitalId() {
        return hospitalId;
    }

    public double getSimTime() {
        return simTime;
    }

    public int getHourOfDay() {
        return hourOfDay;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public boolean isWeekend() {
        return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY;
    }

    public boolean isHoliday() {
        return holiday;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getPrecipitation() {
        return precipitation;
    }

    public double getEventLoad() {
        return eventLoad;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String toString() {
        return String.format("Demand[%s, hour=%d, %s, temp=%.1f, rain=%.1f, event=%.2f, holiday=%b, factor=%.3f]",
                hospitalId, hourOfDay, dayOfWeek, temperature, precipitation, eventLoad, holiday, factor);
    }
}
