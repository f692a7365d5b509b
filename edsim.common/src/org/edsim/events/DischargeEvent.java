package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.Outcome;
import org.edsim.model.TriageLevel;

/**
 * End of consultation. The outcome tells plain discharge from admission
 * to the observation ward.
 */
public final class DischargeEvent extends SimulationEvent {

    private final Outcome outcome;
    private final double serviceMinutes;
    private final double totalMinutes;

    public DischargeEvent(String hospitalId, String patientId, double timestamp, TriageLevel level,
                          Outcome outcome, double serviceMinutes, double totalMinutes) {
        super(EventKind.DISCHARGE, hospitalId, patientId, timestamp, level);
        this.outcome = outcome;
        this.serviceMinutes = serviceMinutes;
        this.totalMinutes = totalMinutes;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public double getServiceMinutes() {
        return serviceMinutes;
    }

    public double getTotalMinutes() {
        return totalMinutes;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("outcome", outcome)
            .put("service_minutes", serviceMinutes)
            .put("total_minutes", totalMinutes);
    }
}
