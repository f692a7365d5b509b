package org.edsim.exceptions;

/**
 * Raised while loading or validating the simulation configuration.
 * Always fatal: the clock must not start once one of these has been thrown.
 */
public class ConfigurationException extends SimulationException {

    private static final long serialVersionUID = 1L;

    public static final String CONFIG_ERROR = "CONFIG_ERROR";

    private final String setting;

    public ConfigurationException(String message) {
        super(message, null, CONFIG_ERROR);
        this.setting = null;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause, null, CONFIG_ERROR);
        this.setting = null;
    }

    public ConfigurationException(String message, String hospitalId, String setting) {
        super(message, hospitalId, CONFIG_ERROR);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }

    @Override
    public String toString() {
        String base = super.toString();
        return setting == null ? base : base + " (setting: " + setting + ")";
    }
}
