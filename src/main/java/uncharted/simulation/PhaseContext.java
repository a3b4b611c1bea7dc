package uncharted.simulation;

import uncharted.events.EngineEvent;
import uncharted.settlement.ResourceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Everything a phase handler needs for one settlement in one pass. Events are collected here and
 * only published after the settlement has been saved.
 */
public final class PhaseContext {
    private final long now;
    private final PhaseSchedule schedule;
    private final Random random;
    private final List<EngineEvent> events = new ArrayList<>();
    private final Map<ResourceType, Double> waste = new EnumMap<>(ResourceType.class);

    public PhaseContext(long now, PhaseSchedule schedule, Random random) {
        if (schedule == null) {
            throw new IllegalArgumentException("Schedule cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        this.now = now;
        this.schedule = schedule;
        this.random = random;
    }

    public long now() {
        return now;
    }

    public PhaseSchedule schedule() {
        return schedule;
    }

    public Random random() {
        return random;
    }

    public void emit(EngineEvent event) {
        events.add(event);
    }

    /** Live list handed to the domain services, which append to it. */
    public List<EngineEvent> sink() {
        return events;
    }

    public List<EngineEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public void recordWaste(ResourceType resource, double amount) {
        if (amount > 0) {
            waste.merge(resource, amount, Double::sum);
        }
    }

    public Map<ResourceType, Double> waste() {
        return Collections.unmodifiableMap(waste);
    }
}
