package org.edsim.exceptions;

/**
 * A broken internal invariant (double release, occupancy outside [0, capacity],
 * releasing a slot owned by another patient). Unchecked on purpose: it must
 * propagate out of the scheduler and abort the run.
 */
public class InvariantViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String placeId;

    public InvariantViolationException(String placeId, String message) {
        super(String.format("Invariant violated at %s: %s", placeId, message));
        this.placeId = placeId;
    }

    public String getPlaceId() {
        return placeId;
    }
}
