package org.edsim.json;

import java.util.Map;
import org.json.simple.JSONObject;

/**
 * JSON Event Builder
 *
 * Small fluent wrapper over json-simple used to render published events and
 * hospital snapshots. Doubles are rounded to a fixed number of decimals so the
 * stream stays readable and stable across runs; nulls are omitted.
 *
 * Output Format:
 * ==============
 * {
 *   "kind": "CONSULTATION_START",
 *   "hospital_id": "chuac",
 *   "patient_id": "chuac-17",
 *   "timestamp": 125.25,
 *   "triage_level": "YELLOW",
 *   "room": 3,
 *   "wait_minutes": 12.4
 * }
 */
public class JsonEventBuilder {

    private static final int DEFAULT_DECIMALS = 3;

    private final JSONObject json;

    public JsonEventBuilder() {
        this.json = new JSONObject();
    }

    // ========== Builder Methods ==========

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, Enum<?> value) {
        if (value != null) {
            json.put(key, value.name());
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, long value) {
        json.put(key, value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, boolean value) {
        json.put(key, value);
        return this;
    }

    public JsonEventBuilder put(String key, double value) {
        return put(key, value, DEFAULT_DECIMALS);
    }

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return this;
        }
        double scale = Math.pow(10, decimals);
        json.put(key, Math.round(value * scale) / scale);
        return this;
    }

    @SuppressWarnings("unchecked")
    public JsonEventBuilder put(String key, Double value) {
        if (value != null) {
            put(key, value.doubleValue());
        }
        return this;
    }

    /** Nested object of integer counts, e.g. an incident allocation. */
    @SuppressWarnings("unchecked")
    public JsonEventBuilder putCounts(String key, Map<String, Integer> counts) {
        if (counts != null) {
            JSONObject nested = new JSONObject();
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                nested.put(e.getKey(), e.getValue().longValue());
            }
            json.put(key, nested);
        }
        return this;
    }

    // ========== Output ==========

    public JSONObject toJSONObject() {
        return json;
    }

    public String build() {
        return json.toJSONString();
    }

    @Override
    public String toString() {
        return build();
    }
}
