package uncharted.construction;

import uncharted.clock.SystemClock;
import uncharted.events.EngineEvent;
import uncharted.events.EventPublisher;
import uncharted.repository.SettlementRepository;
import uncharted.settlement.ConstructionQueueEntry;
import uncharted.settlement.Settlement;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Player-facing construction commands. Each command loads the settlement, changes its queue,
 * saves it, and only then publishes the resulting events.
 */
public class ConstructionCommands {
    private static final Logger logger = Logger.getLogger(ConstructionCommands.class.getName());

    private final SettlementRepository repository;
    private final ConstructionQueue queue;
    private final EventPublisher publisher;
    private final SystemClock clock;

    public ConstructionCommands(SettlementRepository repository, ConstructionQueue queue,
                                EventPublisher publisher, SystemClock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("Repository cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("Queue cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("Publisher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.repository = repository;
        this.queue = queue;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException for an unknown settlement or structure type, or a full queue
     */
    public ConstructionQueueEntry build(String settlementId, String structureType, String tileId, boolean emergency) {
        Settlement settlement = load(settlementId);
        List<EngineEvent> events = new ArrayList<>();
        ConstructionQueueEntry entry = queue.enqueue(settlement, structureType, tileId, emergency, clock.now(), events);
        repository.save(settlement);
        publish(events);
        return entry;
    }

    /**
     * @return false if the settlement has no such entry; nothing is saved then
     */
    public boolean cancel(String settlementId, String entryId) {
        Settlement settlement = load(settlementId);
        List<EngineEvent> events = new ArrayList<>();
        if (!queue.cancel(settlement, entryId, clock.now(), events)) {
            return false;
        }
        repository.save(settlement);
        publish(events);
        return true;
    }

    private Settlement load(String settlementId) {
        return repository.findById(settlementId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown settlement: " + settlementId));
    }

    private void publish(List<EngineEvent> events) {
        try {
            publisher.publishAll(events);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to publish construction events", e);
        }
    }
}
