package org.edsim.engine;

import java.util.PriorityQueue;

import org.apache.log4j.Logger;

/**
 * Discrete-event clock and scheduler.
 *
 * Simulated time is a monotonically non-decreasing number of minutes.
 * Callbacks run strictly in (time, insertion sequence) order on the caller's
 * thread. A positive time scale (simulated minutes per wall-clock second)
 * only delays execution so the run keeps pace with the wall clock; it never
 * changes the order in which callbacks fire.
 */
public class EventScheduler {

    private static final Logger logger = Logger.getLogger(EventScheduler.class);

    private final PriorityQueue<ScheduledEvent> queue = new PriorityQueue<>();
    private final double timeScale;

    private double now = 0.0;
    private long sequence = 0L;
    private long executed = 0L;
    private volatile boolean stopRequested;

    // pacing anchor
    private long wallAnchorNanos = -1L;
    private double simAnchor;

    public EventScheduler() {
        this(0.0);
    }

    public EventScheduler(double timeScale) {
        if (timeScale < 0.0 || Double.isNaN(timeScale)) {
            throw new IllegalArgumentException("Time scale must not be negative, got " + timeScale);
        }
        this.timeScale = timeScale;
    }

    // ========== Scheduling ==========

    /**
     * Schedules the action {@code delay} minutes from now.
     *
     * @throws IllegalArgumentException if the delay is negative or not a number
     */
    public ScheduledEvent schedule(double delay, String label, Runnable action) {
        if (!(delay >= 0.0) || Double.isInfinite(delay)) {
            throw new IllegalArgumentException(String.format("Invalid delay %s for '%s'", delay, label));
        }
        return enqueue(now + delay, label, action);
    }

    /**
     * Schedules the action at an absolute simulated minute, which must not be in the past.
     */
    public ScheduledEvent scheduleAt(double time, String label, Runnable action) {
        if (!(time >= now) || Double.isInfinite(time)) {
            throw new IllegalArgumentException(String.format(
                    "Cannot schedule '%s' at %.3f, clock is at %.3f", label, time, now));
        }
        return enqueue(time, label, action);
    }

    private ScheduledEvent enqueue(double time, String label, Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("No action for '" + label + "'");
        }
        ScheduledEvent event = new ScheduledEvent(time, sequence++, label, action);
        queue.add(event);
        return event;
    }

    // ========== Execution ==========

    /**
     * Runs the next pending callback, skipping cancelled ones.
     *
     * @return false when nothing was left to run
     */
    public boolean step() {
        ScheduledEvent next = pollLive();
        if (next == null) {
            return false;
        }
        fire(next);
        return true;
    }

    /**
     * Runs every callback due at or before {@code endTime}, then advances the
     * clock to {@code endTime}. Stops early if {@link #stop()} is called or
     * the thread is interrupted while pacing.
     */
    public void runUntil(double endTime) {
        if (endTime < now) {
            throw new IllegalArgumentException(String.format(
                    "End time %.3f is before the clock (%.3f)", endTime, now));
        }
        stopRequested = false;
        while (!stopRequested) {
            ScheduledEvent head = peekLive();
            if (head == null || head.getTime() > endTime) {
                break;
            }
            queue.poll();
            fire(head);
        }
        if (!stopRequested) {
            pace(endTime);
            now = Math.max(now, endTime);
        }
    }

    /** Asks a running {@link #runUntil(double)} to return after the current callback. */
    public void stop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    private void fire(ScheduledEvent event) {
        pace(event.getTime());
        now = event.getTime();
        executed++;
        event.getAction().run();
    }

    private ScheduledEvent peekLive() {
        ScheduledEvent head = queue.peek();
        while (head != null && head.isCancelled()) {
            queue.poll();
            head = queue.peek();
        }
        return head;
    }

    private ScheduledEvent pollLive() {
        ScheduledEvent head = peekLive();
        if (head != null) {
            queue.poll();
        }
        return head;
    }

    /**
     * Sleeps until the wall clock catches up with the given simulated time.
     */
    private void pace(double simTime) {
        if (timeScale <= 0.0) {
            return;
        }
        if (wallAnchorNanos < 0L) {
            wallAnchorNanos = System.nanoTime();
            simAnchor = now;
        }
        long targetNanos = wallAnchorNanos + (long) ((simTime - simAnchor) / timeScale * 1_000_000_000L);
        long sleepMillis = (targetNanos - System.nanoTime()) / 1_000_000L;
        if (sleepMillis <= 0L) {
            return;
        }
        try {
            Thread.sleep(sleepMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn(String.format("PACING_INTERRUPTED: t=%.2f, stopping run", now));
            stopRequested = true;
        }
    }

    // ========== Query Methods ==========

    public double now() {
        return now;
    }

    public int pendingEvents() {
        int live = 0;
        for (ScheduledEvent e : queue) {
            if (!e.isCancelled()) {
                live++;
            }
        }
        return live;
    }

    public long getExecutedCount() {
        return executed;
    }

    public double getTimeScale() {
        return timeScale;
    }
}
