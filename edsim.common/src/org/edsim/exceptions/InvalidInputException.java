package org.edsim.exceptions;

/**
 * Runtime input (demand signal, staffing update, incident payload) rejected at
 * the boundary. The run continues with the last-known-good values.
 */
public class InvalidInputException extends SimulationException {

    private static final long serialVersionUID = 1L;

    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final String inputType;

    public InvalidInputException(String message, String hospitalId, String inputType) {
        super(message, hospitalId, INVALID_INPUT);
        this.inputType = inputType;
    }

    public InvalidInputException(String message, String inputType) {
        this(message, null, inputType);
    }

    public String getInputType() {
        return inputType;
    }
}
