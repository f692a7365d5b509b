package org.edsim.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.edsim.json.JsonEventBuilder;
import org.edsim.model.Incident;

public final class IncidentEvent extends SimulationEvent {

    private final Incident incident;
    private final Map<String, Integer> allocation;

    private IncidentEvent(EventKind kind, Incident incident, Map<String, Integer> allocation, double timestamp) {
        super(kind, SYSTEM, null, timestamp, null);
        this.incident = incident;
        this.allocation = allocation == null
                ? Collections.<String, Integer>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(allocation));
    }

    public static IncidentEvent ingested(Incident incident, Map<String, Integer> allocation, double timestamp) {
        return new IncidentEvent(EventKind.INCIDENT_INGESTED, incident, allocation, timestamp);
    }

    public static IncidentEvent resolved(Incident incident, double timestamp) {
        return new IncidentEvent(EventKind.INCIDENT_RESOLVED, incident, null, timestamp);
    }

    public Incident getIncident() {
        return incident;
    }

    public Map<String, Integer> getAllocation() {
        return allocation;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("incident_id", incident.getId())
            .put("incident_type", incident.getType())
            .put("patients", incident.getPatientCount())
            .put("latitude", incident.getLocation().getLatitude(), 5)
            .put("longitude", incident.getLocation().getLongitude(), 5)
            .put("duration_minutes", incident.getDurationMinutes());
        if (!allocation.isEmpty()) {
            json.putCounts("allocation", allocation);
        }
    }
}
