package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.TriageLevel;

/**
 * A consultation started later than the maximum recommended wait for the level.
 */
public final class SlaBreachEvent extends SimulationEvent {

    private final double waitMinutes;

    public SlaBreachEvent(String hospitalId, String patientId, double timestamp, TriageLevel level,
                          double waitMinutes) {
        super(EventKind.SLA_BREACH, hospitalId, patientId, timestamp, level);
        this.waitMinutes = waitMinutes;
    }

    public double getWaitMinutes() {
        return waitMinutes;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("wait_minutes", waitMinutes)
            .put("max_wait_minutes", (long) getTriageLevel().getMaxWaitMinutes());
    }
}
