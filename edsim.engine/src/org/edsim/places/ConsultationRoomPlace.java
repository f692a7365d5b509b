package org.edsim.places;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.edsim.engine.EventScheduler;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.ResourceClass;

/**
 * Individually addressed consultation rooms.
 *
 * Waiters are served by priority (triage rank, lower first) and first come,
 * first served within a priority. A free room is always the lowest-index one.
 * Each room has a speed multiplier (doctors assigned, at least 1) that
 * divides the service time of consultations starting after it is set.
 */
public class ConsultationRoomPlace extends BaseResourcePlace {

    static final Comparator<SlotRequest> PRIORITY_ORDER = new Comparator<SlotRequest>() {
        @Override
        public int compare(SlotRequest a, SlotRequest b) {
            int byPriority = Integer.compare(a.getPriority(), b.getPriority());
            return byPriority != 0 ? byPriority : Long.compare(a.getSequence(), b.getSequence());
        }
    };

    private final PriorityQueue<SlotRequest> waiting = new PriorityQueue<>(PRIORITY_ORDER);
    private final int[] doctors;

    public ConsultationRoomPlace(String hospitalId, int rooms, EventScheduler scheduler,
                                 SimulationEventLogger eventLogger) {
        super(hospitalId, ResourceClass.CONSULTATION, rooms, scheduler, eventLogger);
        this.doctors = new int[rooms];
        for (int i = 0; i < rooms; i++) {
            doctors[i] = 1;
        }
    }

    @Override
    protected void enqueue(SlotRequest request) {
        waiting.add(request);
    }

    @Override
    protected SlotRequest pollNext() {
        return waiting.poll();
    }

    @Override
    protected boolean removeWaiting(SlotRequest request) {
        return waiting.remove(request);
    }

    @Override
    public int getQueueLength() {
        return waiting.size();
    }

    /** Waiting requests in service order. */
    public List<SlotRequest> getWaitingRequests() {
        List<SlotRequest> ordered = new ArrayList<>(waiting);
        Collections.sort(ordered, PRIORITY_ORDER);
        return ordered;
    }

    // ========== Room speed ==========

    /**
     * Assigns doctors to a room and returns the previous number.
     * Consultations already in progress keep the speed they started with.
     */
    public int setDoctors(int room, int count) {
        if (room < 0 || room >= capacity) {
            throw new IllegalArgumentException(String.format("%s has no room %d", placeId, room));
        }
        if (count < 1) {
            throw new IllegalArgumentException("A room needs at least one doctor, got " + count);
        }
        int previous = doctors[room];
        doctors[room] = count;
        eventLogger.logSlotSpeedChange(placeId, room, previous, count, scheduler.now());
        return previous;
    }

    public int getDoctors(int room) {
        return doctors[room];
    }

    public double getRoomSpeed(int room) {
        return doctors[room];
    }

    public int getRoomCount() {
        return capacity;
    }
}
