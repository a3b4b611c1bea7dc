package uncharted.events;

import java.util.List;

/**
 * Fire-and-forget outlet for engine events.
 * Implementations must not throw for a failed delivery; the state change the event describes
 * has already been committed and must stand.
 */
public interface EventPublisher {

    void publish(EngineEvent event);

    default void publishAll(List<EngineEvent> events) {
        for (EngineEvent event : events) {
            publish(event);
        }
    }
}
