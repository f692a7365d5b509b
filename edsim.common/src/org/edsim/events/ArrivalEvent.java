package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.Patient;

public final class ArrivalEvent extends SimulationEvent {

    private final Patient patient;

    public ArrivalEvent(String hospitalId, Patient patient, double timestamp) {
        super(EventKind.ARRIVAL, hospitalId, patient.getId(), timestamp, null);
        this.patient = patient;
    }

    public Patient getPatient() {
        return patient;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("age", patient.getAge())
            .put("sex", patient.getSex())
            .put("condition", patient.getCondition())
            .put("source", patient.getSource())
            .put("incident_id", patient.getIncidentId());
    }
}
