package org.edsim.exceptions;

/**
 * Base exception for all simulation processing errors.
 * Carries the hospital the failure belongs to (if any) and an error code
 * so callers can tell configuration problems from rejected runtime input.
 */
public class SimulationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String hospitalId;
    private final String errorCode;

    public SimulationException(String message, String hospitalId, String errorCode) {
        super(message);
        this.hospitalId = hospitalId;
        this.errorCode = errorCode;
    }

    public SimulationException(String message, Throwable cause, String hospitalId, String errorCode) {
        super(message, cause);
        this.hospitalId = hospitalId;
        this.errorCode = errorCode;
    }

    public SimulationException(String message) {
        super(message);
        this.hospitalId = null;
        this.errorCode = "GENERAL_ERROR";
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
        this.hospitalId = null;
        this.errorCode = "GENERAL_ERROR";
    }

    public String getHospitalId() {
        return hospitalId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (hospitalId != null || errorCode != null) {
            sb.append(" [");
            if (hospitalId != null) {
                sb.append(hospitalId);
            }
            if (errorCode != null) {
                if (hospitalId != null) {
                    sb.append(" - ");
                }
                sb.append(errorCode);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
