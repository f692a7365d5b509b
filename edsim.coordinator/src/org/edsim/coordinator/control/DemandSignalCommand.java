package org.edsim.coordinator.control;

import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.demand.DemandSignal;
import org.edsim.exceptions.InvalidInputException;

public class DemandSignalCommand implements ControlCommand {

    private final String hospitalId;
    private final DemandSignal signal;

    public DemandSignalCommand(String hospitalId, DemandSignal signal) {
        this.hospitalId = hospitalId;
        this.signal = signal;
    }

    @Override
    public void apply(HospitalCoordinator coordinator) throws InvalidInputException {
        coordinator.getContext().getDemandAggregator().applySignal(hospitalId, signal, coordinator.getContext().now());
    }

    @Override
    public String describe() {
        return "demand " + hospitalId + " " + signal;
    }
}
