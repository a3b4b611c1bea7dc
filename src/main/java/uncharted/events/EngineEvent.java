package uncharted.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One state change, keyed by settlement.
 *
 * @param timestamp epoch millis of the simulated moment the change belongs to
 * @param data small payload of the fields relevant to this event type
 */
public record EngineEvent(EventType type, String settlementId, long timestamp, Map<String, Object> data) {

    public EngineEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (settlementId == null) {
            throw new IllegalArgumentException("Settlement id cannot be null");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Builder builder(EventType type, String settlementId, long timestamp) {
        return new Builder(type, settlementId, timestamp);
    }

    /**
     * Collects payload fields in insertion order.
     */
    public static final class Builder {
        private final EventType type;
        private final String settlementId;
        private final long timestamp;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(EventType type, String settlementId, long timestamp) {
            this.type = type;
            this.settlementId = settlementId;
            this.timestamp = timestamp;
        }

        public Builder with(String field, Object value) {
            data.put(field, value);
            return this;
        }

        public EngineEvent build() {
            return new EngineEvent(type, settlementId, timestamp, data);
        }
    }
}
