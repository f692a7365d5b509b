package org.edsim.coordinator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.edsim.model.DiversionReason;
import org.edsim.model.DiversionRecord;

/**
 * Running diversion counts: total, by reason, by origin and by destination.
 * Only the most recent records are kept; the counts cover the whole run.
 */
public class DiversionStatistics {

    public static final int DEFAULT_RECENT_CAPACITY = 1000;

    private final int recentCapacity;
    private final Deque<DiversionRecord> recent = new ArrayDeque<>();
    private final Map<DiversionReason, Integer> byReason = new EnumMap<>(DiversionReason.class);
    private final Map<String, Integer> byOrigin = new LinkedHashMap<>();
    private final Map<String, Integer> byDestination = new LinkedHashMap<>();
    private int total;

    public DiversionStatistics() {
        this(DEFAULT_RECENT_CAPACITY);
    }

    public DiversionStatistics(int recentCapacity) {
        if (recentCapacity < 1) {
            throw new IllegalArgumentException("Recent capacity must be at least 1, got " + recentCapacity);
        }
        this.recentCapacity = recentCapacity;
    }

    public void record(DiversionRecord record) {
        if (recent.size() == recentCapacity) {
            recent.removeFirst();
        }
        recent.addLast(record);
        total++;
        byReason.merge(record.getReason(), 1, Integer::sum);
        byOrigin.merge(record.getSourceHospitalId(), 1, Integer::sum);
        byDestination.merge(record.getDestinationHospitalId(), 1, Integer::sum);
    }

    public int getTotal() {
        return total;
    }

    public int count(DiversionReason reason) {
        return byReason.getOrDefault(reason, 0);
    }

    public int sentFrom(String hospitalId) {
        return byOrigin.getOrDefault(hospitalId, 0);
    }

    public int receivedBy(String hospitalId) {
        return byDestination.getOrDefault(hospitalId, 0);
    }

    public Map<DiversionReason, Integer> getByReason() {
        return Collections.unmodifiableMap(byReason);
    }

    public Map<String, Integer> getByOrigin() {
        return Collections.unmodifiableMap(byOrigin);
    }

    public Map<String, Integer> getByDestination() {
        return Collections.unmodifiableMap(byDestination);
    }

    /** The most recent records, oldest first. */
    public List<DiversionRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(recent));
    }
}
