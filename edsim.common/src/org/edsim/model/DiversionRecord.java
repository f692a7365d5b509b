package org.edsim.model;

/**
 * Immutable record of one inter-hospital redirection.
 */
public final class DiversionRecord {

    private final String patientId;
    private final String sourceHospitalId;
    private final String destinationHospitalId;
    private final TriageLevel triageLevel;
    private final DiversionReason reason;
    private final double timestamp;
    private final double transferMinutes;

    public DiversionRecord(String patientId, String sourceHospitalId, String destinationHospitalId,
                           TriageLevel triageLevel, DiversionReason reason, double timestamp,
                           double transferMinutes) {
        this.patientId = patientId;
        this.sourceHospitalId = sourceHospitalId;
        this.destinationHospitalId = destinationHospitalId;
        this.triageLevel = triageLevel;
        this.reason = reason;
        this.timestamp = timestamp;
        this.transferMinutes = transferMinutes;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getSourceHospitalId() {
        return sourceHospitalId;
    }

    public String getDestinationHospitalId() {
        return destinationHospitalId;
    }

    public TriageLevel getTriageLevel() {
        return triageLevel;
    }

    public DiversionReason getReason() {
        return reason;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public double getTransferMinutes() {
        return transferMinutes;
    }

    @Override
    public String toString() {
        return String.format("Diversion[%s %s -> %s, level=%s, reason=%s, t=%.1f, transfer=%.1f]",
                patientId, sourceHospitalId, destinationHospitalId, triageLevel, reason, timestamp, transferMinutes);
    }
}
