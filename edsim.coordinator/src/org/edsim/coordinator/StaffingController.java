package org.edsim.coordinator;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.engine.SimulationContext;
import org.edsim.events.CapacityChangeEvent;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.hospital.Hospital;
import org.edsim.places.ConsultationRoomPlace;

/**
 * Applies the elastic-capacity signal: the number of doctors working a
 * consultation room of an elastic hospital. The room's speed multiplier
 * equals its doctors, so two doctors halve the service time of the
 * consultations that start afterwards.
 *
 * Operator assignments set a room directly. Auto-scaling moves one doctor
 * per round between the rooms and a shared pool of spare doctors.
 */
public class StaffingController {

    private static final Logger logger = Logger.getLogger(StaffingController.class);

    private final SimulationContext context;
    private int availableDoctors;

    public StaffingController(SimulationContext context) {
        this.context = context;
        this.availableDoctors = context.getConfig().getDoctorPool();
    }

    /**
     * @return the doctors the room had before
     */
    public int assignDoctors(String hospitalId, int room, int doctors) throws InvalidInputException {
        Hospital hospital = requireElastic(hospitalId);
        ConsultationRoomPlace rooms = hospital.getConsultation();
        if (room < 0 || room >= rooms.getRoomCount()) {
            throw new InvalidInputException(String.format("Room %d does not exist (rooms: %d)",
                    room, rooms.getRoomCount()), hospitalId, "staffing");
        }
        int max = hospital.getConfig().getMaxDoctorsPerRoom();
        if (doctors < 1 || doctors > max) {
            throw new InvalidInputException(String.format("Doctors per room must be in [1, %d], got %d",
                    max, doctors), hospitalId, "staffing");
        }
        return apply(hospital, room, doctors, "STAFFING_CHANGE");
    }

    /** Same doctors for every room of the hospital. */
    public void assignDoctorsToAllRooms(String hospitalId, int doctors) throws InvalidInputException {
        Hospital hospital = requireElastic(hospitalId);
        for (int room = 0; room < hospital.getConsultation().getRoomCount(); room++) {
            assignDoctors(hospitalId, room, doctors);
        }
    }

    /**
     * One auto-scaling round for an elastic hospital. At or above the scale-up
     * threshold the first room below the per-room maximum takes a doctor from
     * the pool; at or below the scale-down threshold the first room with more
     * than one doctor returns one.
     *
     * @return +1 or -1 for the doctor moved, 0 if nothing changed
     */
    public int autoScale(Hospital hospital, double saturation) {
        if (!hospital.getConfig().isElastic()) {
            return 0;
        }
        SimulationConfig config = context.getConfig();
        ConsultationRoomPlace rooms = hospital.getConsultation();
        if (saturation >= config.getScaleUpThreshold()) {
            if (availableDoctors == 0) {
                logger.debug(String.format("AUTO_SCALE_EXHAUSTED: hospital=%s, saturation=%.3f",
                        hospital.getId(), saturation));
                return 0;
            }
            int max = hospital.getConfig().getMaxDoctorsPerRoom();
            for (int room = 0; room < rooms.getRoomCount(); room++) {
                int doctors = rooms.getDoctors(room);
                if (doctors < max) {
                    availableDoctors--;
                    apply(hospital, room, doctors + 1, "AUTO_SCALE_UP");
                    return 1;
                }
            }
        } else if (saturation <= config.getScaleDownThreshold()) {
            for (int room = 0; room < rooms.getRoomCount(); room++) {
                int doctors = rooms.getDoctors(room);
                if (doctors > 1) {
                    availableDoctors++;
                    apply(hospital, room, doctors - 1, "AUTO_SCALE_DOWN");
                    return -1;
                }
            }
        }
        return 0;
    }

    /** Spare doctors left for auto-scaling. */
    public int getAvailableDoctors() {
        return availableDoctors;
    }

    private int apply(Hospital hospital, int room, int doctors, String action) {
        int previous = hospital.getConsultation().setDoctors(room, doctors);
        if (previous != doctors) {
            context.getPublisher().publish(
                    new CapacityChangeEvent(hospital.getId(), context.now(), room, previous, doctors));
            logger.info(String.format("%s: hospital=%s, room=%d, doctors=%d->%d, pool=%d, t=%.2f",
                    action, hospital.getId(), room, previous, doctors, availableDoctors, context.now()));
        }
        return previous;
    }

    private Hospital requireElastic(String hospitalId) throws InvalidInputException {
        Hospital hospital = context.getHospital(hospitalId);
        if (hospital == null) {
            throw new InvalidInputException("Unknown hospital " + hospitalId, hospitalId, "staffing");
        }
        if (!hospital.getConfig().isElastic()) {
            throw new InvalidInputException("Hospital " + hospitalId + " does not accept elastic capacity",
                    hospitalId, "staffing");
        }
        return hospital;
    }
}
