package org.edsim.coordinator.control;

import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.exceptions.InvalidInputException;

/**
 * Resolves one incident, or every active incident when no id is given.
 */
public class ClearIncidentsCommand implements ControlCommand {

    private final String incidentId;

    public ClearIncidentsCommand() {
        this(null);
    }

    public ClearIncidentsCommand(String incidentId) {
        this.incidentId = incidentId;
    }

    @Override
    public void apply(HospitalCoordinator coordinator) throws InvalidInputException {
        if (incidentId == null) {
            coordinator.clearIncidents();
        } else if (!coordinator.resolveIncident(incidentId)) {
            throw new InvalidInputException("No active incident " + incidentId, "incident");
        }
    }

    @Override
    public String describe() {
        return incidentId == null ? "clear all incidents" : "clear incident " + incidentId;
    }
}
