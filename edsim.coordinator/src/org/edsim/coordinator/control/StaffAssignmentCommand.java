package org.edsim.coordinator.control;

import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.exceptions.InvalidInputException;

/**
 * Doctors for one consultation room, or for every room when {@code room} is {@link #ALL_ROOMS}.
 */
public class StaffAssignmentCommand implements ControlCommand {

    public static final int ALL_ROOMS = -1;

    private final String hospitalId;
    private final int room;
    private final int doctors;

    public StaffAssignmentCommand(String hospitalId, int room, int doctors) {
        this.hospitalId = hospitalId;
        this.room = room;
        this.doctors = doctors;
    }

    @Override
    public void apply(HospitalCoordinator coordinator) throws InvalidInputException {
        if (room == ALL_ROOMS) {
            coordinator.getStaffingController().assignDoctorsToAllRooms(hospitalId, doctors);
        } else {
            coordinator.getStaffingController().assignDoctors(hospitalId, room, doctors);
        }
    }

    @Override
    public String describe() {
        return String.format("staff %s room=%s doctors=%d", hospitalId, room == ALL_ROOMS ? "all" : room, doctors);
    }
}
