package org.edsim.monitor;

import org.edsim.json.JsonEventBuilder;
import org.json.simple.JSONObject;

/**
 * Aggregate view of all hospitals at one sampling instant.
 */
public final class SystemSummary {

    private final double timestamp;
    private final double meanSaturation;
    private final int criticalCount;
    private final int saturatedCount;
    private final int totalQueued;
    private final SystemStatus status;

    public SystemSummary(double timestamp, double meanSaturation, int criticalCount, int saturatedCount,
                         int totalQueued, SystemStatus status) {
        this.timestamp = timestamp;
        this.meanSaturation = meanSaturation;
        this.criticalCount = criticalCount;
        this.saturatedCount = saturatedCount;
        this.totalQueued = totalQueued;
        this.status = status;
    }

    public double getTimestamp() { return timestamp; }
    public double getMeanSaturation() { return meanSaturation; }
    public int getCriticalCount() { return criticalCount; }
    public int getSaturatedCount() { return saturatedCount; }
    public int getTotalQueued() { return totalQueued; }
    public SystemStatus getStatus() { return status; }

    public JSONObject toJSONObject() {
        return new JsonEventBuilder()
                .put("timestamp", timestamp)
                .put("mean_saturation", meanSaturation)
                .put("critical_hospitals", criticalCount)
                .put("saturated_hospitals", saturatedCount)
                .put("total_queued", totalQueued)
                .put("status", status)
                .toJSONObject();
    }

    @Override
    public String toString() {
        return String.format("SystemSummary[t=%.1f, status=%s, meanSaturation=%.3f, critical=%d, saturated=%d, queued=%d]",
                timestamp, status, meanSaturation, criticalCount, saturatedCount, totalQueued);
    }
}
