package org.edsim.publish;

import org.apache.log4j.Logger;
import org.edsim.events.HospitalSnapshot;
import org.edsim.events.SimulationEvent;

/**
 * Writes every event and snapshot as one JSON line to the log4j category
 * {@code edsim.events}, whose appender is configured in log4j.properties.
 */
public class JsonLogEventSink implements EventSink {

    public static final String CATEGORY = "edsim.events";

    private final Logger eventLog;
    private final boolean includeSnapshots;

    public JsonLogEventSink(boolean includeSnapshots) {
        this(Logger.getLogger(CATEGORY), includeSnapshots);
    }

    JsonLogEventSink(Logger eventLog, boolean includeSnapshots) {
        this.eventLog = eventLog;
        this.includeSnapshots = includeSnapshots;
    }

    @Override
    public void write(SimulationEvent event) {
        eventLog.info(event.toJson());
    }

    @Override
    public void write(HospitalSnapshot snapshot) {
        if (includeSnapshots) {
            eventLog.info(snapshot.toJson());
        }
    }

    @Override
    public void close() {
        // appenders belong to log4j
    }
}
