package org.edsim.model;

import org.edsim.exceptions.ConfigurationException;

/**
 * Static configuration of one emergency department. Immutable once loaded.
 */
public final class HospitalConfig {

    public static final int DEFAULT_MAX_DOCTORS_PER_ROOM = 4;

    private final String id;
    private final String name;
    private final int registrationDesks;
    private final int triageStations;
    private final int consultationRooms;
    private final int observationBeds;
    private final boolean elastic;
    private final double baseHourlyRate;
    private final GeoLocation location;
    private final int maxDoctorsPerRoom;

    public HospitalConfig(String id, String name, int registrationDesks, int triageStations,
                          int consultationRooms, int observationBeds, boolean elastic,
                          double baseHourlyRate, GeoLocation location) {
        this(id, name, registrationDesks, triageStations, consultationRooms, observationBeds,
                elastic, baseHourlyRate, location, DEFAULT_MAX_DOCTORS_PER_ROOM);
    }

    public HospitalConfig(String id, String name, int registrationDesks, int triageStations,
                          int consultationRooms, int observationBeds, boolean elastic,
                          double baseHourlyRate, GeoLocation location, int maxDoctorsPerRoom) {
        this.id = id;
        this.name = name;
        this.registrationDesks = registrationDesks;
        this.triageStations = triageStations;
        this.consultationRooms = consultationRooms;
        this.observationBeds = observationBeds;
        this.elastic = elastic;
        this.baseHourlyRate = baseHourlyRate;
        this.location = location;
        this.maxDoctorsPerRoom = maxDoctorsPerRoom;
    }

    /**
     * Rejects capacities below one, a non-positive arrival rate and an
     * invalid location. Zero consultation capacity would leave every
     * patient queued forever.
     */
    public void validate() throws ConfigurationException {
        if (id == null || id.trim().isEmpty()) {
            throw new ConfigurationException("Hospital id is required");
        }
        requirePositive(registrationDesks, "registrationDesks");
        requirePositive(triageStations, "triageStations");
        requirePositive(consultationRooms, "consultationRooms");
        requirePositive(observationBeds, "observationBeds");
        requirePositive(maxDoctorsPerRoom, "maxDoctorsPerRoom");
        if (!(baseHourlyRate > 0.0) || Double.isInfinite(baseHourlyRate)) {
            throw new ConfigurationException("Base arrival rate must be positive, got " + baseHourlyRate,
                    id, "baseHourlyRate");
        }
        if (location == null || !location.isValid()) {
            throw new ConfigurationException("Invalid location " + location, id, "location");
        }
    }

    private void requirePositive(int value, String setting) throws ConfigurationException {
        if (value < 1) {
            throw new ConfigurationException(setting + " must be at least 1, got " + value, id, setting);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getRegistrationDesks() {
        return registrationDesks;
    }

    public int getTriageStations() {
        return triageStations;
    }

    public int getConsultationRooms() {
        return consultationRooms;
    }

    public int getObservationBeds() {
        return observationBeds;
    }

    public boolean isElastic() {
        return elastic;
    }

    public double getBaseHourlyRate() {
        return baseHourlyRate;
    }

    public GeoLocation getLocation() {
        return location;
    }

    public int getMaxDoctorsPerRoom() {
        return maxDoctorsPerRoom;
    }

    @Override
    public String toString() {
        return String.format("Hospital[%s, desks=%d, triage=%d, rooms=%d, beds=%d, elastic=%b, rate=%.1f/h]",
                id, registrationDesks, triageStations, consultationRooms, observationBeds, elastic, baseHourlyRate);
    }
}
