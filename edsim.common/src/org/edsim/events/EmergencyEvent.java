package org.edsim.events;

import org.edsim.json.JsonEventBuilder;

/**
 * Emergency declared or retracted, either for one hospital (saturation
 * crossing its thresholds) or for the whole network (active incidents).
 */
public final class EmergencyEvent extends SimulationEvent {

    private final double saturation;
    private final String cause;

    private EmergencyEvent(EventKind kind, String hospitalId, double timestamp, double saturation, String cause) {
        super(kind, hospitalId, null, timestamp, null);
        this.saturation = saturation;
        this.cause = cause;
    }

    public static EmergencyEvent declared(String hospitalId, double timestamp, double saturation, String cause) {
        return new EmergencyEvent(EventKind.EMERGENCY_DECLARED, hospitalId, timestamp, saturation, cause);
    }

    public static EmergencyEvent retracted(String hospitalId, double timestamp, double saturation, String cause) {
        return new EmergencyEvent(EventKind.EMERGENCY_RETRACTED, hospitalId, timestamp, saturation, cause);
    }

    public boolean isDeclared() {
        return getKind() == EventKind.EMERGENCY_DECLARED;
    }

    public double getSaturation() {
        return saturation;
    }

    public String getCause() {
        return cause;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("saturation", saturation)
            .put("cause", cause);
    }
}
