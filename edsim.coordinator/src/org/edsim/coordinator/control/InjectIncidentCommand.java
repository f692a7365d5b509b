package org.edsim.coordinator.control;

import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.model.Incident;

public class InjectIncidentCommand implements ControlCommand {

    private final Incident incident;

    public InjectIncidentCommand(Incident incident) {
        this.incident = incident;
    }

    @Override
    public void apply(HospitalCoordinator coordinator) throws InvalidInputException {
        if (incident == null) {
            throw new InvalidInputException("Missing incident payload", "incident");
        }
        coordinator.ingestIncident(incident);
    }

    @Override
    public String describe() {
        return "inject " + incident;
    }
}
