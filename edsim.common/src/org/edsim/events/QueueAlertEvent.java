package org.edsim.events;

import org.edsim.json.JsonEventBuilder;

public final class QueueAlertEvent extends SimulationEvent {

    private final int queueLength;
    private final double threshold;

    public QueueAlertEvent(String hospitalId, double timestamp, int queueLength, double threshold) {
        super(EventKind.QUEUE_ALERT, hospitalId, null, timestamp, null);
        this.queueLength = queueLength;
        this.threshold = threshold;
    }

    public int getQueueLength() {
        return queueLength;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    protected void writeFields(JsonEventBuilder json) {
        json.put("queue_length", queueLength)
            .put("threshold", threshold);
    }
}
