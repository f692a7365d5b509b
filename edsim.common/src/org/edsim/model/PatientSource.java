package org.edsim.model;

/**
 * How a patient reached the emergency department.
 */
public enum PatientSource {
    WALK_IN,
    INCIDENT,
    DIVERTED_IN
}
