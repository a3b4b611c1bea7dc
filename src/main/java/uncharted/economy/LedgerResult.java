package uncharted.economy;

import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;

import java.util.Map;

/**
 * Outcome of applying a delta to storage.
 *
 * @param storage the new storage, every amount within [0, capacity]
 * @param waste amount per resource that exceeded capacity and was discarded
 * @param shortfall amount per resource that consumption wanted but storage could not supply
 */
public record LedgerResult(Map<ResourceType, ResourceStock> storage,
                           Map<ResourceType, Double> waste,
                           Map<ResourceType, Double> shortfall) {

    public double wasteOf(ResourceType resource) {
        return waste.getOrDefault(resource, 0.0);
    }

    public double shortfallOf(ResourceType resource) {
        return shortfall.getOrDefault(resource, 0.0);
    }

    public double totalWaste() {
        return waste.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public boolean hasWaste() {
        return totalWaste() > 0.0;
    }
}
