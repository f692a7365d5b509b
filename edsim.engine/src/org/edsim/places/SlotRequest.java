package org.edsim.places;

import org.edsim.model.Patient;

/**
 * A patient's claim on one slot of a resource place. Starts WAITING, becomes
 * GRANTED when a slot is assigned and RELEASED when it is given back, or
 * CANCELLED if it is withdrawn while still waiting.
 */
public final class SlotRequest {

    public enum State {
        WAITING,
        GRANTED,
        RELEASED,
        CANCELLED
    }

    private final long sequence;
    private final Patient patient;
    private final int priority;
    private final double requestTime;
    private final SlotGrantListener listener;

    private State state = State.WAITING;
    private int slot = -1;
    private double grantTime = Double.NaN;

    SlotRequest(long sequence, Patient patient, int priority, double requestTime, SlotGrantListener listener) {
        this.sequence = sequence;
        this.patient = patient;
        this.priority = priority;
        this.requestTime = requestTime;
        this.listener = listener;
    }

    void granted(int slot, double time) {
        this.slot = slot;
        this.grantTime = time;
        this.state = State.GRANTED;
    }

    void released() {
        this.state = State.RELEASED;
    }

    void cancelled() {
        this.state = State.CANCELLED;
    }

    SlotGrantListener getListener() {
        return listener;
    }

    public long getSequence() {
        return sequence;
    }

    public Patient getPatient() {
        return patient;
    }

    public int getPriority() {
        return priority;
    }

    public double getRequestTime() {
        return requestTime;
    }

    public State getState() {
        return state;
    }

    public int getSlot() {
        return slot;
    }

    public double getGrantTime() {
        return grantTime;
    }

    /** Minutes between the request and the grant; NaN while still waiting. */
    public double getWaitMinutes() {
        return grantTime - requestTime;
    }

    @Override
    public String toString() {
        return String.format("SlotRequest[#%d %s priority=%d %s slot=%d]",
                sequence, patient.getId(), priority, state, slot);
    }
}
