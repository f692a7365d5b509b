package org.edsim.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronous in-memory publisher. Keeps every event and snapshot in
 * publication order; used by tests and for determinism checks.
 */
public class RecordingEventPublisher implements EventPublisher {

    private final List<SimulationEvent> events = new ArrayList<>();
    private final List<HospitalSnapshot> snapshots = new ArrayList<>();
    private volatile boolean closed;

    @Override
    public synchronized void publish(SimulationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void publish(HospitalSnapshot snapshot) {
        snapshots.add(snapshot);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized List<SimulationEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SimulationEvent> getEvents(EventKind kind) {
        List<SimulationEvent> matching = new ArrayList<>();
        for (SimulationEvent e : events) {
            if (e.getKind() == kind) {
                matching.add(e);
            }
        }
        return matching;
    }

    @SuppressWarnings("unchecked")
    public synchronized <T extends SimulationEvent> List<T> getEvents(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (SimulationEvent e : events) {
            if (type.isInstance(e)) {
                matching.add((T) e);
            }
        }
        return matching;
    }

    public synchronized int count(EventKind kind) {
        int n = 0;
        for (SimulationEvent e : events) {
            if (e.getKind() == kind) {
                n++;
            }
        }
        return n;
    }

    public synchronized List<HospitalSnapshot> getSnapshots() {
        return new ArrayList<>(snapshots);
    }

    public synchronized List<HospitalSnapshot> getSnapshots(String hospitalId) {
        List<HospitalSnapshot> matching = new ArrayList<>();
        for (HospitalSnapshot s : snapshots) {
            if (s.getHospitalId().equals(hospitalId)) {
                matching.add(s);
            }
        }
        return matching;
    }

    public synchronized void clear() {
        events.clear();
        snapshots.clear();
    }
}
