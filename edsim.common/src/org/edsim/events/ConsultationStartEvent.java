package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.TriageLevel;

public final class ConsultationStartEvent extends SimulationEvent {

    private final int room;
    private final double waitMinutes;
    private final double roomSpeed;
    private final double plannedServiceMinutes;

    public ConsultationStartEvent(String hospitalId, String patientId, double timestamp, TriageLevel level,
                                  int room, double waitMinutes, double roomSpeed, double plannedServiceMinutes) {
        super(EventKind.CONSULTATION_START, hospitalId, patientId, timestamp, level);
        this.room = room;
        this.waitMinutes = waitMinutes;
        this.roomSpeed = roomSpeed;
        this.plannedServiceMinutes = plannedServiceMinutes;
    }

    public int getRoom() {
        return room;
    }

    public double getWaitMinutes() {
        return waitMinutes;
    }

    public double getRoomSpeed() {
        return roomSpeed;
    }

    public double getPlannedServiceMinutes() {
        return plannedServiceMinutes;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("room", room)
            .put("wait_minutes", waitMinutes)
            .put("room_speed", roomSpeed)
            .put("service_minutes", plannedServiceMinutes);
    }
}
