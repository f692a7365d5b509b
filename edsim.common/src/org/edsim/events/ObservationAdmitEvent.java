package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.TriageLevel;

public final class ObservationAdmitEvent extends SimulationEvent {

    private final int bed;
    private final double bedWaitMinutes;
    private final double stayMinutes;

    public ObservationAdmitEvent(String hospitalId, String patientId, double timestamp, TriageLevel level,
                                 int bed, double bedWaitMinutes, double stayMinutes) {
        super(EventKind.OBSERVATION_ADMIT, hospitalId, patientId, timestamp, level);
        this.bed = bed;
        this.bedWaitMinutes = bedWaitMinutes;
        this.stayMinutes = stayMinutes;
    }

    public int getBed() {
        return bed;
    }

    public double getBedWaitMinutes() {
        return bedWaitMinutes;
    }

    public double getStayMinutes() {
        return stayMinutes;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("bed", bed)
            .put("bed_wait_minutes", bedWaitMinutes)
            .put("stay_minutes", stayMinutes);
    }
}
