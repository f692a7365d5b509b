package org.edsim.model;

/**
 * Capacity-limited resource pools of a hospital.
 */
public enum ResourceClass {
    REGISTRATION,
    TRIAGE,
    CONSULTATION,
    OBSERVATION
}
