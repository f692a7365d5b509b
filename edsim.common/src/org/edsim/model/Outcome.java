package org.edsim.model;

public enum Outcome {
    IN_SYSTEM,
    DISCHARGED,
    ADMITTED_OBSERVATION,
    DIVERTED
}
