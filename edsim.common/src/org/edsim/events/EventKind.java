package org.edsim.events;

/**
 * Closed set of published event kinds.
 */
public enum EventKind {
    ARRIVAL,
    TRIAGE_COMPLETE,
    CONSULTATION_START,
    DISCHARGE,
    DIVERSION,
    OBSERVATION_ADMIT,
    SLA_BREACH,
    EMERGENCY_DECLARED,
    EMERGENCY_RETRACTED,
    INCIDENT_INGESTED,
    INCIDENT_RESOLVED,
    CAPACITY_CHANGE,
    QUEUE_ALERT
}
