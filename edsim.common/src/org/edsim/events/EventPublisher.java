package org.edsim.events;

/**
 * Outbound publication of events and snapshots.
 *
 * Implementations are fire-and-forget from the simulation thread's point of
 * view: they must not block and must not throw. Failures are handled and
 * counted inside the implementation.
 */
public interface EventPublisher {

    void publish(SimulationEvent event);

    void publish(HospitalSnapshot snapshot);

    /** Flushes what can be flushed and releases resources. Idempotent. */
    void close();
}
