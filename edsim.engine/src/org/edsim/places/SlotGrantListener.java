package org.edsim.places;

/**
 * Resumes a patient once a slot has been granted.
 */
public interface SlotGrantListener {

    void slotGranted(SlotRequest grant);
}
