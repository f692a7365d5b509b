package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.PresentingCondition;
import org.edsim.model.TriageLevel;

public final class TriageCompleteEvent extends SimulationEvent {

    private final PresentingCondition condition;
    private final double triageWaitMinutes;

    public TriageCompleteEvent(String hospitalId, String patientId, double timestamp,
                               TriageLevel level, PresentingCondition condition, double triageWaitMinutes) {
        super(EventKind.TRIAGE_COMPLETE, hospitalId, patientId, timestamp, level);
        this.condition = condition;
        this.triageWaitMinutes = triageWaitMinutes;
    }

    public PresentingCondition getCondition() {
        return condition;
    }

    public double getTriageWaitMinutes() {
        return triageWaitMinutes;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("condition", condition)
            .put("triage_wait_minutes", triageWaitMinutes);
    }
}
