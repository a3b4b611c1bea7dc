package uncharted.events;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans events out to registered listeners.
 * A listener that throws is logged and skipped; the remaining listeners still receive the event.
 */
public class EventBus implements EventPublisher {
    private static final Logger logger = Logger.getLogger(EventBus.class.getName());

    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();

    /**
     * Registers a listener for all events.
     *
     * @throws IllegalArgumentException if listener is null
     */
    public void registerListener(EventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    public void unregisterListener(EventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void publish(EngineEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        published.incrementAndGet();
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                deliveryFailures.incrementAndGet();
                logger.log(Level.WARNING, "Listener failed for " + event.type().wireName()
                    + " of settlement " + event.settlementId(), e);
            }
        }
    }

    public long publishedCount() {
        return published.get();
    }

    public long deliveryFailureCount() {
        return deliveryFailures.get();
    }
}
