package uncharted.construction;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.Modifiers;
import uncharted.catalog.StructureDefinition;
import uncharted.config.EngineConfig;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.settlement.ConstructionQueueEntry;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * FIFO build queue of a settlement with a fixed number of parallel active slots.
 * <p>
 * Positions are always 1..n in queue order. Active entries hold the lowest positions because
 * promotion takes waiting entries from the front.
 */
public class ConstructionQueue {
    private static final Logger logger = Logger.getLogger(ConstructionQueue.class.getName());

    static final double MIN_TIME_MODIFIER = 0.1;
    static final double EMERGENCY_TIME_MODIFIER = 0.5;
    static final int PROGRESS_STEP = 10;

    private final GameCatalog catalog;
    private final EngineConfig config;

    public ConstructionQueue(GameCatalog catalog, EngineConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * Appends a build to the queue and starts it at once when a slot is free.
     *
     * @throws IllegalArgumentException for an unknown structure type or a full queue
     */
    public ConstructionQueueEntry enqueue(Settlement settlement, String structureType, String tileId,
                                          boolean emergency, long now, List<EngineEvent> events) {
        if (structureType == null || catalog.structure(structureType).isEmpty()) {
            throw new IllegalArgumentException("Unknown structure type: " + structureType);
        }
        List<ConstructionQueueEntry> queue = new ArrayList<>(settlement.getConstructionQueue());
        if (queue.size() >= config.maxQueueLength()) {
            throw new IllegalArgumentException("Construction queue of settlement " + settlement.getId()
                + " is full (" + config.maxQueueLength() + " entries)");
        }
        ConstructionQueueEntry entry = new ConstructionQueueEntry(UUID.randomUUID().toString(), settlement.getId(),
            structureType, tileId, emergency, now, null, null, queue.size() + 1, 0);
        queue.add(entry);
        settlement.setConstructionQueue(queue);
        logger.fine("Queued " + structureType + " at position " + entry.position() + " in settlement "
            + settlement.getId());

        promote(settlement, now, events);
        events.add(queueUpdated(settlement, now));
        return settlement.getConstructionQueue().stream()
            .filter(e -> e.id().equals(entry.id()))
            .findFirst()
            .orElse(entry);
    }

    /**
     * Removes an entry, active or waiting, and promotes the next one into the freed slot.
     *
     * @return false if the settlement has no entry with that id
     */
    public boolean cancel(Settlement settlement, String entryId, long now, List<EngineEvent> events) {
        List<ConstructionQueueEntry> queue = new ArrayList<>(settlement.getConstructionQueue());
        if (!queue.removeIf(e -> e.id().equals(entryId))) {
            return false;
        }
        settlement.setConstructionQueue(renumber(queue));
        logger.fine("Cancelled construction " + entryId + " in settlement " + settlement.getId());
        promote(settlement, now, events);
        events.add(queueUpdated(settlement, now));
        return true;
    }

    /**
     * Construction phase: completes finished builds, reports progress, promotes waiting entries.
     */
    public void process(Settlement settlement, long now, List<EngineEvent> events) {
        List<ConstructionQueueEntry> remaining = new ArrayList<>();
        boolean changed = false;

        for (ConstructionQueueEntry entry : settlement.getConstructionQueue()) {
            if (entry.active() && entry.completesAt() <= now) {
                complete(settlement, entry, events);
                changed = true;
                continue;
            }
            if (entry.active()) {
                // one event per pass, for the highest step reached since the last one announced
                int step = (int) progress(entry, now) / PROGRESS_STEP * PROGRESS_STEP;
                if (step > entry.reportedProgress()) {
                    events.add(EngineEvent.builder(EventType.CONSTRUCTION_PROGRESS, settlement.getId(), now)
                        .with("entryId", entry.id())
                        .with("structureType", entry.structureType())
                        .with("progress", step)
                        .with("completesAt", entry.completesAt())
                        .build());
                    entry = entry.withReportedProgress(step);
                }
            }
            remaining.add(entry);
        }

        settlement.setConstructionQueue(renumber(remaining));
        changed |= promote(settlement, now, events);
        if (changed) {
            events.add(queueUpdated(settlement, now));
        }
    }

    /**
     * Percent complete, 0..100. A build that takes no time is complete as soon as it starts.
     */
    public static double progress(ConstructionQueueEntry entry, long now) {
        if (!entry.active()) {
            return 0.0;
        }
        long total = entry.completesAt() - entry.startedAt();
        if (total <= 0) {
            return 100.0;
        }
        double percent = (now - entry.startedAt()) * 100.0 / total;
        return Math.max(0.0, Math.min(100.0, percent));
    }

    /**
     * Build time multiplier: {@code max(0.1, 1 - Σ "Construction Speed")}, halved for emergency builds.
     */
    public double timeModifier(Settlement settlement, boolean emergency) {
        double speed = 0.0;
        for (StructureInstance structure : settlement.standingStructures()) {
            speed += catalog.modifierOf(structure.type(), Modifiers.CONSTRUCTION_SPEED);
        }
        double modifier = Math.max(MIN_TIME_MODIFIER, 1.0 - speed);
        return emergency ? modifier * EMERGENCY_TIME_MODIFIER : modifier;
    }

    private boolean promote(Settlement settlement, long now, List<EngineEvent> events) {
        List<ConstructionQueueEntry> queue = new ArrayList<>(settlement.getConstructionQueue());
        long active = queue.stream().filter(ConstructionQueueEntry::active).count();
        boolean promoted = false;
        for (int i = 0; i < queue.size() && active < config.constructionSlots(); i++) {
            ConstructionQueueEntry entry = queue.get(i);
            if (entry.active()) {
                continue;
            }
            ConstructionQueueEntry started = start(settlement, entry, now);
            queue.set(i, started);
            active++;
            promoted = true;
            events.add(EngineEvent.builder(EventType.CONSTRUCTION_STARTED, settlement.getId(), now)
                .with("entryId", started.id())
                .with("structureType", started.structureType())
                .with("emergency", started.emergency())
                .with("completesAt", started.completesAt())
                .build());
        }
        settlement.setConstructionQueue(queue);
        return promoted;
    }

    private ConstructionQueueEntry start(Settlement settlement, ConstructionQueueEntry entry, long now) {
        long baseSeconds = catalog.structure(entry.structureType())
            .map(StructureDefinition::constructionSeconds)
            .orElse(0L);
        if (catalog.structure(entry.structureType()).isEmpty()) {
            logger.warning("No definition for " + entry.structureType() + " queued in settlement "
                + settlement.getId() + "; completing immediately");
        }
        long durationMillis = Math.round(baseSeconds * timeModifier(settlement, entry.emergency()) * 1000.0);
        return entry.started(now, now + durationMillis);
    }

    private void complete(Settlement settlement, ConstructionQueueEntry entry, List<EngineEvent> events) {
        StructureInstance built = StructureInstance.newlyBuilt(entry.id(), entry.structureType(), entry.tileId(),
            entry.completesAt());
        settlement.addStructure(built);
        logger.info("Completed " + entry.structureType() + " in settlement " + settlement.getId());
        events.add(EngineEvent.builder(EventType.CONSTRUCTION_COMPLETE, settlement.getId(), entry.completesAt())
            .with("entryId", entry.id())
            .with("structureId", built.id())
            .with("structureType", built.type())
            .build());
    }

    private static List<ConstructionQueueEntry> renumber(List<ConstructionQueueEntry> queue) {
        List<ConstructionQueueEntry> renumbered = new ArrayList<>(queue.size());
        for (int i = 0; i < queue.size(); i++) {
            renumbered.add(queue.get(i).withPosition(i + 1));
        }
        return renumbered;
    }

    private static EngineEvent queueUpdated(Settlement settlement, long now) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ConstructionQueueEntry entry : settlement.getConstructionQueue()) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("entryId", entry.id());
            view.put("structureType", entry.structureType());
            view.put("position", entry.position());
            view.put("active", entry.active());
            view.put("progress", progress(entry, now));
            entries.add(view);
        }
        return EngineEvent.builder(EventType.QUEUE_UPDATED, settlement.getId(), now)
            .with("queue", entries)
            .build();
    }
}
