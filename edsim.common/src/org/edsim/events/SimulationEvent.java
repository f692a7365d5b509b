package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.TriageLevel;
import org.json.simple.JSONObject;

/**
 * Base of all published events. Every event carries its kind, the hospital it
 * concerns, the simulated timestamp and, when applicable, the patient and the
 * triage level. Subclasses add their typed payload in {@link #writeFields}.
 */
public abstract class SimulationEvent {

    /** Hospital id used for events that concern the whole network. */
    public static final String SYSTEM = "SYSTEM";

    private final EventKind kind;
    private final String hospitalId;
    private final String patientId;
    private final double timestamp;
    private final TriageLevel triageLevel;

    protected SimulationEvent(EventKind kind, String hospitalId, String patientId,
                              double timestamp, TriageLevel triageLevel) {
        this.kind = kind;
        this.hospitalId = hospitalId;
        this.patientId = patientId;
        this.timestamp = timestamp;
        this.triageLevel = triageLevel;
    }

    protected abstract void writeFields(JsonEventBuilder json);

    public EventKind getKind() {
        return kind;
    }

    public String getHospitalId() {
        return hospitalId;
    }

    public String getPatientId() {
        return patientId;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public TriageLevel getTriageLevel() {
        return triageLevel;
    }

    public JSONObject toJSONObject() {
        JsonEventBuilder json = new JsonEventBuilder()
                .put("kind", kind)
                .put("hospital_id", hospitalId)
                .put("patient_id", patientId)
                .put("timestamp", timestamp)
                .put("triage_level", triageLevel);
        writeFields(json);
        return json.toJSONObject();
    }

    public String toJson() {
        return toJSONObject().toJSONString();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
