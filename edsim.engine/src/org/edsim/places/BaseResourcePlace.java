package org.edsim.places;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.edsim.engine.EventScheduler;
import org.edsim.exceptions.InvariantViolationException;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.Patient;
import org.edsim.model.ResourceClass;

/**
 * BaseResourcePlace - capacity-limited resource pool of one hospital
 *
 * PLACE SEMANTICS
 * ===============
 * Capacity: capacity(P) - number of slots
 * Marking:  M(P) - slots currently held
 * Invariant: 0 &lt;= M(P) &lt;= capacity(P) at all times, and a slot is held by at
 * most one patient.
 *
 * Slot flow:
 * 1. Patient requests a slot
 * 2. If a slot is free and nobody is waiting: grant at once
 * 3. Otherwise wait; the waiting discipline is up to the subclass
 * 4. On grant: M(P) := M(P) + 1, the listener resumes the patient at the
 *    current simulated time (as a zero-delay callback, so grants made at the
 *    same minute resume in grant order)
 * 5. On release: M(P) := M(P) - 1 and the next waiter, if any, is granted
 *
 * Every grant is matched by exactly one release; a second release, a release
 * of a slot held by someone else or a marking outside [0, capacity] raises
 * {@link InvariantViolationException}.
 */
public abstract class BaseResourcePlace {

    private static final Logger logger = Logger.getLogger(BaseResourcePlace.class);

    protected final SimulationEventLogger eventLogger;
    protected final EventScheduler scheduler;

    protected final String hospitalId;
    protected final String placeId;
    protected final ResourceClass resourceClass;
    protected final int capacity;

    protected int currentMarking;  // M(P)
    protected final SlotRequest[] holders;

    private long requestSequence;
    private long grantCount;
    private long releaseCount;
    private long cancelCount;

    protected BaseResourcePlace(String hospitalId, ResourceClass resourceClass, int capacity,
                                EventScheduler scheduler, SimulationEventLogger eventLogger) {
        if (capacity < 1) {
            throw new IllegalArgumentException(String.format(
                    "%s/%s capacity must be at least 1, got %d", hospitalId, resourceClass, capacity));
        }
        this.hospitalId = hospitalId;
        this.resourceClass = resourceClass;
        this.placeId = hospitalId + "/" + resourceClass.name();
        this.capacity = capacity;
        this.holders = new SlotRequest[capacity];
        this.scheduler = scheduler;
        this.eventLogger = eventLogger;
        eventLogger.logPlaceCreated(placeId, getClass().getSimpleName(), capacity);
    }

    // ========== Waiting discipline ==========

    protected abstract void enqueue(SlotRequest request);

    /** Next waiter to serve, removed from the waiting line; null when none. */
    protected abstract SlotRequest pollNext();

    protected abstract boolean removeWaiting(SlotRequest request);

    public abstract int getQueueLength();

    // ========== Slot flow ==========

    /**
     * Requests a slot for the patient. Lower priority values are served first
     * where the place honours priorities.
     */
    public SlotRequest request(Patient patient, int priority, SlotGrantListener listener) {
        SlotRequest request = new SlotRequest(requestSequence++, patient, priority, scheduler.now(), listener);
        eventLogger.logSlotRequested(placeId, patient.getId(), scheduler.now(), priority, getQueueLength());
        if (currentMarking < capacity && getQueueLength() == 0) {
            grant(request);
        } else {
            enqueue(request);
        }
        return request;
    }

    /**
     * Gives a granted slot back and hands it to the next waiter.
     */
    public void release(SlotRequest grant) {
        if (grant.getState() != SlotRequest.State.GRANTED) {
            throw new InvariantViolationException(placeId, String.format(
                    "release of a request in state %s (patient %s)", grant.getState(), grant.getPatient().getId()));
        }
        int slot = grant.getSlot();
        if (slot < 0 || slot >= capacity || holders[slot] != grant) {
            throw new InvariantViolationException(placeId, String.format(
                    "patient %s releases slot %d it does not hold", grant.getPatient().getId(), slot));
        }
        holders[slot] = null;
        currentMarking--;
        if (currentMarking < 0) {
            throw new InvariantViolationException(placeId, "negative marking " + currentMarking);
        }
        grant.released();
        releaseCount++;
        grant.getPatient().recordRelease(resourceClass);
        eventLogger.logSlotReleased(placeId, grant.getPatient().getId(), scheduler.now(), slot, currentMarking);
        onSlotReleased(slot);
        dispatch();
    }

    /**
     * Withdraws a request that is still waiting.
     *
     * @return true if the request was waiting and is now cancelled, false if
     *         it had already been granted (or finished)
     */
    public boolean cancel(SlotRequest request) {
        if (request.getState() != SlotRequest.State.WAITING) {
            return false;
        }
        if (!removeWaiting(request)) {
            throw new InvariantViolationException(placeId,
                    "waiting request of " + request.getPatient().getId() + " missing from the queue");
        }
        request.cancelled();
        cancelCount++;
        eventLogger.logRequestCancelled(placeId, request.getPatient().getId(), scheduler.now(), getQueueLength());
        return true;
    }

    private void dispatch() {
        while (currentMarking < capacity) {
            SlotRequest next = pollNext();
            if (next == null) {
                return;
            }
            grant(next);
        }
    }

    private void grant(final SlotRequest request) {
        int slot = selectFreeSlot();
        if (slot < 0 || currentMarking >= capacity) {
            throw new InvariantViolationException(placeId, String.format(
                    "grant with marking %d at capacity %d", currentMarking, capacity));
        }
        holders[slot] = request;
        currentMarking++;
        request.granted(slot, scheduler.now());
        grantCount++;
        request.getPatient().recordAcquire(resourceClass);
        eventLogger.logSlotAcquired(placeId, request.getPatient().getId(), scheduler.now(),
                slot, currentMarking, capacity);
        scheduler.schedule(0.0, placeId + " grant", new Runnable() {
            @Override
            public void run() {
                request.getListener().slotGranted(request);
            }
        });
    }

    /** Lowest-index free slot, or -1 when all are held. */
    protected int selectFreeSlot() {
        for (int i = 0; i < holders.length; i++) {
            if (holders[i] == null) {
                return i;
            }
        }
        return -1;
    }

    /** Hook for subclasses tracking per-slot state. */
    protected void onSlotReleased(int slot) {
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("SLOT_FREE: placeId=%s, slot=%d", placeId, slot));
        }
    }

    // ========== Query Methods ==========

    public String getPlaceId() { return placeId; }
    public String getHospitalId() { return hospitalId; }
    public ResourceClass getResourceClass() { return resourceClass; }
    public int getCapacity() { return capacity; }
    public int getMarking() { return currentMarking; }
    public boolean isAtCapacity() { return currentMarking >= capacity; }
    public double getOccupancy() { return (double) currentMarking / capacity; }
    public long getGrantCount() { return grantCount; }
    public long getReleaseCount() { return releaseCount; }
    public long getCancelCount() { return cancelCount; }

    public SlotRequest getHolder(int slot) {
        return holders[slot];
    }

    /** Patients currently holding a slot, in slot order. */
    public List<Patient> getHoldingPatients() {
        List<Patient> patients = new ArrayList<>();
        for (SlotRequest r : holders) {
            if (r != null) {
                patients.add(r.getPatient());
            }
        }
        return Collections.unmodifiableList(patients);
    }

    @Override
    public String toString() {
        return String.format("Place[%s]: M=%d, capacity=%d, waiting=%d", placeId, currentMarking, capacity, getQueueLength());
    }
}
