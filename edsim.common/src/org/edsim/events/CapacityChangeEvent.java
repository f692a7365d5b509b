package org.edsim.events;

import org.edsim.json.JsonEventBuilder;

/**
 * Doctors assigned to a consultation room of an elastic hospital changed.
 */
public final class CapacityChangeEvent extends SimulationEvent {

    private final int room;
    private final int previousDoctors;
    private final int doctors;

    public CapacityChangeEvent(String hospitalId, double timestamp, int room, int previousDoctors, int doctors) {
        super(EventKind.CAPACITY_CHANGE, hospitalId, null, timestamp, null);
        this.room = room;
        this.previousDoctors = previousDoctors;
        this.doctors = doctors;
    }

    public int getRoom() {
        return room;
    }

    public int getPreviousDoctors() {
        return previousDoctors;
    }

    public int getDoctors() {
        return doctors;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("room", room)
            .put("previous_doctors", previousDoctors)
            .put("doctors", doctors);
    }
}
