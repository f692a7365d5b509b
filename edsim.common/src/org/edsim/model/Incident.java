package org.edsim.model;

import org.edsim.exceptions.InvalidInputException;

/**
 * An external incident whose victims are distributed across hospitals.
 */
public final class Incident {

    /** Largest victim count a single incident may carry. */
    public static final int MAX_PATIENTS = 1000;

    /** Longest incident, one simulated year. */
    public static final double MAX_DURATION_MINUTES = 365.0 * 24.0 * 60.0;

    private final String id;
    private final IncidentType type;
    private final GeoLocation location;
    private final int patientCount;
    private final double startTime;
    private final Double durationMinutes;
    private final double[] severityMix;

    public Incident(String id, IncidentType type, GeoLocation location, int patientCount,
                    double startTime, Double durationMinutes, double[] severityMix) {
        this.id = id;
        this.type = type;
        this.location = location;
        this.patientCount = patientCount;
        this.startTime = startTime;
        this.durationMinutes = durationMinutes;
        if (severityMix != null) {
            this.severityMix = severityMix.clone();
        } else {
            this.severityMix = type != null ? type.getSeverityMix() : null;
        }
    }

    /**
     * Checks the payload before it is accepted by the coordinator.
     */
    public void validate() throws InvalidInputException {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidInputException("Incident id is required", "incident");
        }
        if (type == null) {
            throw new InvalidInputException("Incident " + id + " has no type", "incident");
        }
        if (location == null || !location.isValid()) {
            throw new InvalidInputException("Incident " + id + " has invalid location " + location, "incident");
        }
        if (patientCount < 1 || patientCount > MAX_PATIENTS) {
            throw new InvalidInputException(String.format("Incident %s patient count must be in [1, %d], got %d",
                    id, MAX_PATIENTS, patientCount), "incident");
        }
        if (durationMinutes != null
                && !(durationMinutes >= 0.0 && durationMinutes <= MAX_DURATION_MINUTES)) {
            throw new InvalidInputException(String.format("Incident %s duration must be in [0, %.0f] minutes, got %s",
                    id, MAX_DURATION_MINUTES, durationMinutes), "incident");
        }
        if (Double.isNaN(startTime) || Double.isInfinite(startTime)) {
            throw new InvalidInputException("Incident " + id + " start time must be finite", "incident");
        }
        if (severityMix == null || severityMix.length != TriageLevel.values().length) {
            throw new InvalidInputException("Incident " + id + " severity mix must have "
                    + TriageLevel.values().length + " entries", "incident");
        }
        double total = 0.0;
        for (double w : severityMix) {
            if (w < 0.0 || Double.isNaN(w)) {
                throw new InvalidInputException("Incident " + id + " severity mix has a negative weight", "incident");
            }
            total += w;
        }
        if (total <= 0.0) {
            throw new InvalidInputException("Incident " + id + " severity mix sums to zero", "incident");
        }
    }

    public String getId() {
        return id;
    }

    public IncidentType getType() {
        return type;
    }

    public GeoLocation getLocation() {
        return location;
    }

    public int getPatientCount() {
        return patientCount;
    }

    public double getStartTime() {
        return startTime;
    }

    public Double getDurationMinutes() {
        return durationMinutes;
    }

    public double[] getSeverityMix() {
        return severityMix == null ? null : severityMix.clone();
    }

    /** A copy of this incident starting at the given simulated minute. */
    public Incident startingAt(double time) {
        return new Incident(id, type, location, patientCount, time, durationMinutes, severityMix);
    }

    @Override
    public String toString() {
        return String.format("Incident[%s, %s at %s, patients=%d, start=%.1f, duration=%s]",
                id, type, location, patientCount, startTime, durationMinutes);
    }
}
