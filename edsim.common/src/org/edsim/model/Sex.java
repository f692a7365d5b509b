package org.edsim.model;

public enum Sex {
    FEMALE,
    MALE
}
