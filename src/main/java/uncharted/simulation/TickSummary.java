package uncharted.simulation;

import uncharted.settlement.ResourceType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one orchestrator pass.
 *
 * @param ran false when the pass was refused because another one was in flight
 */
public record TickSummary(boolean ran,
                          Set<Phase> phases,
                          int processed,
                          int skipped,
                          int failed,
                          Map<ResourceType, Double> waste,
                          int events,
                          Duration elapsed) {

    public TickSummary {
        phases = phases.isEmpty() ? EnumSet.noneOf(Phase.class) : EnumSet.copyOf(phases);
        EnumMap<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(waste);
        waste = copy;
    }

    public static TickSummary busy() {
        return new TickSummary(false, Set.of(), 0, 0, 0, Map.of(), 0, Duration.ZERO);
    }

    public double totalWaste() {
        return waste.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Override
    public String toString() {
        if (!ran) {
            return "TickSummary{busy}";
        }
        return String.format("TickSummary{phases=%s, processed=%d, skipped=%d, failed=%d, waste=%.2f, events=%d, elapsed=%dms}",
            phases, processed, skipped, failed, totalWaste(), events, elapsed.toMillis());
    }
}
