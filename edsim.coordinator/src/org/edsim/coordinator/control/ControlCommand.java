package org.edsim.coordinator.control;

import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.exceptions.InvalidInputException;

/**
 * A runtime input submitted from any thread and applied on the simulation
 * thread when the coordinator drains its inbox.
 */
public interface ControlCommand {

    void apply(HospitalCoordinator coordinator) throws InvalidInputException;

    String describe();
}
