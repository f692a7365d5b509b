package org.edsim.demand;

import org.edsim.exceptions.InvalidInputException;

/**
 * External demand inputs for one hospital: temperature (Celsius),
 * precipitation (mm/h), event load (extra demand fraction from local
 * events, 0 = none) and the holiday flag.
 */
public final class DemandSignal {

    private final double temperature;
    private final double precipitation;
    private final double eventLoad;
    private final boolean holiday;

    public DemandSignal(double temperature, double precipitation, double eventLoad, boolean holiday) {
        this.temperature = temperature;
        this.precipitation = precipitation;
        this.eventLoad = eventLoad;
        this.holiday = holiday;
    }

    public void validate(String hospitalId) throws InvalidInputException {
        if (Double.isNaN(temperature) || temperature < -60.0 || temperature > 60.0) {
            throw new InvalidInputException("Temperature out of range: " + temperature, hospitalId, "demand");
        }
        if (!(precipitation >= 0.0) || Double.isInfinite(precipitation)) {
            throw new InvalidInputException("Precipitation must not be negative: " + precipitation, hospitalId, "demand");
        }
        if (!(eventLoad >= 0.0) || Double.isInfinite(eventLoad)) {
            throw new InvalidInputException("Event load must not be negative: " + eventLoad, hospitalId, "demand");
        }
    }

    public double getTemperature() { return temperature; }
    public double getPrecipitation() { return precipitation; }
    public double getEventLoad() { return eventLoad; }
    public boolean isHoliday() { return holiday; }

    @Override
    public String toString() {
        return String.format("DemandSignal[temp=%.1f, rain=%.1f, event=%.2f, holiday=%b]",
                temperature, precipitation, eventLoad, holiday);
    }
}
