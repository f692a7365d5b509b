package org.edsim.engine;

/**
 * A callback due at a simulated minute. Ordered by time, then by the
 * sequence number assigned at scheduling, so equal timestamps run FIFO.
 */
public final class ScheduledEvent implements Comparable<ScheduledEvent> {

    private final double time;
    private final long sequence;
    private final String label;
    private final Runnable action;
    private boolean cancelled;

    ScheduledEvent(double time, long sequence, String label, Runnable action) {
        this.time = time;
        this.sequence = sequence;
        this.label = label;
        this.action = action;
    }

    public double getTime() {
        return time;
    }

    public long getSequence() {
        return sequence;
    }

    public String getLabel() {
        return label;
    }

    Runnable getAction() {
        return action;
    }

    /** The callback will be skipped when its time comes. */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public int compareTo(ScheduledEvent other) {
        int byTime = Double.compare(time, other.time);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return String.format("Scheduled[%s t=%.3f #%d%s]", label, time, sequence, cancelled ? " cancelled" : "");
    }
}
