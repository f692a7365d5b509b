package org.edsim.coordinator.incident;

import org.edsim.model.GeoLocation;

/**
 * What the incident allocator knows about a hospital when an incident comes in.
 */
public final class HospitalLoad {

    private final String hospitalId;
    private final GeoLocation location;
    private final double saturation;
    private final double meanWaitMinutes;

    public HospitalLoad(String hospitalId, GeoLocation location, double saturation, double meanWaitMinutes) {
        this.hospitalId = hospitalId;
        this.location = location;
        this.saturation = saturation;
        this.meanWaitMinutes = meanWaitMinutes;
    }

    public String getHospitalId() { return hospitalId; }
    public GeoLocation getLocation() { return location; }
    public double getSaturation() { return saturation; }
    public double getMeanWaitMinutes() { return meanWaitMinutes; }

    @Override
    public String toString() {
        return String.format("Load[%s sat=%.3f wait=%.1f]", hospitalId, saturation, meanWaitMinutes);
    }
}
