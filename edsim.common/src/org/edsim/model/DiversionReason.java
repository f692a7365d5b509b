package org.edsim.model;

public enum DiversionReason {
    /** RED/ORANGE triaged at a non-reference hospital. */
    SEVERITY,
    /** Low-acuity patient shed from a critical hospital. */
    SATURATION,
    /** Low-acuity patient shed while an incident is active. */
    INCIDENT_OVERLOAD
}
