package org.edsim.model;

/**
 * Incident categories with their default victim count range, duration range
 * (hours) and triage level mix (indexed RED..BLUE).
 */
public enum IncidentType {

    MASS_CASUALTY("Multiple-vehicle collision", 15, 30, 2.0, 4.0,
            new double[] {0.20, 0.40, 0.30, 0.10, 0.00}),
    EPIDEMIC("Viral outbreak", 50, 100, 72.0, 168.0,
            new double[] {0.00, 0.05, 0.30, 0.50, 0.15}),
    LOCALIZED_EMERGENCY("Incident at a mass gathering", 20, 50, 4.0, 8.0,
            new double[] {0.05, 0.10, 0.30, 0.45, 0.10});

    private final String description;
    private final int minPatients;
    private final int maxPatients;
    private final double minDurationHours;
    private final double maxDurationHours;
    private final double[] severityMix;

    IncidentType(String description, int minPatients, int maxPatients,
                 double minDurationHours, double maxDurationHours, double[] severityMix) {
        this.description = description;
        this.minPatients = minPatients;
        this.maxPatients = maxPatients;
        this.minDurationHours = minDurationHours;
        this.maxDurationHours = maxDurationHours;
        this.severityMix = severityMix;
    }

    public String getDescription() {
        return description;
    }

    public int getMinPatients() {
        return minPatients;
    }

    public int getMaxPatients() {
        return maxPatients;
    }

    public double getMinDurationHours() {
        return minDurationHours;
    }

    public double getMaxDurationHours() {
        return maxDurationHours;
    }

    public double[] getSeverityMix() {
        return severityMix.clone();
    }

    /** Victims reach hospitals by ambulance rather than arriving over the incident duration. */
    public boolean isPointSource() {
        return this != EPIDEMIC;
    }
}
