package org.edsim.logger;

import java.util.concurrent.ConcurrentHashMap;
import org.apache.log4j.Logger;

/**
 * Simulation Event Logger
 *
 * Structured log of everything that happens at the resource places of a run:
 * - Place lifecycle (creation)
 * - Slot flow (request, acquire, release, cancellation)
 * - Marking changes (occupied slots per place, with the peak)
 * - Patient stage transitions
 *
 * One logger belongs to one simulation context, so concurrent runs in the
 * same JVM (tests) never share place state. Slot-level lines go to DEBUG;
 * lifecycle lines go to INFO.
 */
public class SimulationEventLogger {

    private static final Logger logger = Logger.getLogger(SimulationEventLogger.class);

    private final ConcurrentHashMap<String, PlaceState> placeStates = new ConcurrentHashMap<>();

    public SimulationEventLogger() {
        logger.debug("=== SIMULATION EVENT LOGGER INITIALIZED ===");
    }

    // ========== Place Lifecycle Events ==========

    public void logPlaceCreated(String placeId, String placeType, int capacity) {
        logger.info(String.format(
            "PLACE_CREATED: placeId=%s, type=%s, capacity=%d",
            placeId, placeType, capacity
        ));
        placeStates.put(placeId, new PlaceState(placeId, capacity));
    }

    // ========== Slot Flow Events ==========

    public void logSlotRequested(String placeId, String patientId, double time, int priority, int waiting) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format(
                "SLOT_REQUESTED: placeId=%s, patientId=%s, t=%.2f, priority=%d, waiting=%d",
                placeId, patientId, time, priority, waiting
            ));
        }
    }

    public void logSlotAcquired(String placeId, String patientId, double time, int slot, int marking, int capacity) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format(
                "SLOT_ACQUIRED: placeId=%s, patientId=%s, t=%.2f, slot=%d, M(P)=%d, capacity=%d",
                placeId, patientId, time, slot, marking, capacity
            ));
        }
        updateMarking(placeId, marking);
    }

    public void logSlotReleased(String placeId, String patientId, double time, int slot, int marking) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format(
                "SLOT_RELEASED: placeId=%s, patientId=%s, t=%.2f, slot=%d, M(P)=%d",
                placeId, patientId, time, slot, marking
            ));
        }
        updateMarking(placeId, marking);
    }

    public void logRequestCancelled(String placeId, String patientId, double time, int waiting) {
        logger.info(String.format(
            "REQUEST_CANCELLED: placeId=%s, patientId=%s, t=%.2f, waiting=%d",
            placeId, patientId, time, waiting
        ));
    }

    // ========== Capacity Events ==========

    public void logSlotSpeedChange(String placeId, int slot, double previous, double current, double time) {
        logger.info(String.format(
            "SLOT_SPEED_CHANGE: placeId=%s, slot=%d, t=%.2f, speed=%.1f->%.1f",
            placeId, slot, time, previous, current
        ));
    }

    // ========== Patient Events ==========

    public void logStageTransition(String patientId, String hospitalId, String from, String to, double time) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format(
                "STAGE_TRANSITION: patientId=%s, hospital=%s, t=%.2f, %s->%s",
                patientId, hospitalId, time, from, to
            ));
        }
    }

    private void updateMarking(String placeId, int marking) {
        PlaceState state = placeStates.get(placeId);
        if (state != null) {
            state.setMarking(marking);
        }
    }

    // ========== Query Methods ==========

    /**
     * @return the occupancy of a created place, or null if no place with that id was created
     */
    public PlaceState getPlaceState(String placeId) {
        return placeStates.get(placeId);
    }

    public static class PlaceState {
        private final String placeId;
        private final int capacity;
        private int marking;
        private int peakMarking;

        public PlaceState(String placeId, int capacity) {
            this.placeId = placeId;
            this.capacity = capacity;
        }

        public synchronized void setMarking(int marking) {
            this.marking = marking;
            if (marking > peakMarking) {
                peakMarking = marking;
            }
        }

        public String getPlaceId() { return placeId; }
        public int getCapacity() { return capacity; }
        public synchronized int getMarking() { return marking; }
        public synchronized int getPeakMarking() { return peakMarking; }

        public boolean isAtCapacity() { return getMarking() >= capacity; }

        @Override
        public String toString() {
            return String.format("Place[%s]: M=%d, peak=%d, capacity=%d",
                               placeId, getMarking(), getPeakMarking(), capacity);
        }
    }
}
