package org.edsim.publish;

import org.edsim.events.HospitalSnapshot;
import org.edsim.events.SimulationEvent;

/**
 * Destination behind the asynchronous publisher. Called from the publisher's
 * worker thread only, one item at a time.
 */
public interface EventSink {

    void write(SimulationEvent event) throws Exception;

    void write(HospitalSnapshot snapshot) throws Exception;

    void close();
}
