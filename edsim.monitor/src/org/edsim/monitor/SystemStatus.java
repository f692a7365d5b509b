package org.edsim.monitor;

/**
 * Network-wide status, from calmest to worst.
 */
public enum SystemStatus {
    NORMAL,
    ATTENTION,
    ALERT,
    CRITICAL
}
