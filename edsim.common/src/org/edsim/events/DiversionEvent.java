package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.edsim.model.DiversionRecord;

public final class DiversionEvent extends SimulationEvent {

    private final DiversionRecord record;

    public DiversionEvent(DiversionRecord record) {
        super(EventKind.DIVERSION, record.getSourceHospitalId(), record.getPatientId(),
                record.getTimestamp(), record.getTriageLevel());
        this.record = record;
    }

    public DiversionRecord getRecord() {
        return record;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("destination_hospital_id", record.getDestinationHospitalId())
            .put("reason", record.getReason())
            .put("transfer_minutes", record.getTransferMinutes());
    }
}
