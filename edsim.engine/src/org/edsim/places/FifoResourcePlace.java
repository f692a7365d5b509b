package org.edsim.places;

import java.util.ArrayDeque;
import java.util.Deque;

import org.edsim.engine.EventScheduler;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.ResourceClass;

/**
 * Pool of interchangeable slots served first come, first served.
 * Used for registration desks, triage stations and observation beds.
 */
public class FifoResourcePlace extends BaseResourcePlace {

    private final Deque<SlotRequest> waiting = new ArrayDeque<>();

    public FifoResourcePlace(String hospitalId, ResourceClass resourceClass, int capacity,
                             EventScheduler scheduler, SimulationEventLogger eventLogger) {
        super(hospitalId, resourceClass, capacity, scheduler, eventLogger);
    }

    @Override
    protected void enqueue(SlotRequest request) {
        waiting.addLast(request);
    }

    @Override
    protected SlotRequest pollNext() {
        return waiting.pollFirst();
    }

    @Override
    protected boolean removeWaiting(SlotRequest request) {
        return waiting.remove(request);
    }

    @Override
    public int getQueueLength() {
        return waiting.size();
    }
}
