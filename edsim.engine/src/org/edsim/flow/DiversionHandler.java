package org.edsim.flow;

import org.edsim.hospital.Hospital;
import org.edsim.model.DiversionReason;
import org.edsim.model.Patient;

/**
 * Receives patients that must continue at another hospital. The patient has
 * already released every slot at the origin when this is called.
 */
public interface DiversionHandler {

    void divert(Patient patient, Hospital origin, DiversionReason reason);
}
