package org.edsim.model;

/**
 * Stages of the per-patient state machine. Stages are entered in declaration
 * order except that DIVERTED can follow IN_TRIAGE or QUEUED_CONSULTATION.
 */
public enum PatientStage {
    ARRIVED,
    QUEUED_REGISTRATION,
    IN_REGISTRATION,
    QUEUED_TRIAGE,
    IN_TRIAGE,
    QUEUED_CONSULTATION,
    IN_CONSULTATION,
    DISCHARGED,
    ADMITTED_OBSERVATION,
    DIVERTED;

    public boolean isTerminal() {
        return this == DISCHARGED || this == ADMITTED_OBSERVATION || this == DIVERTED;
    }
}
