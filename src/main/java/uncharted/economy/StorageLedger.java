package uncharted.economy;

import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Applies resource deltas to storage with capacity clamping and waste accounting.
 * <p>
 * For every resource: {@code raw = amount + delta}, {@code waste = max(0, raw - capacity)},
 * {@code amount' = clamp(raw, 0, capacity)}. The input map is never modified; the caller gets a
 * complete new storage map and persists it as a whole, so a settlement's resources either all
 * change or none do.
 */
public class StorageLedger {

    public LedgerResult apply(Map<ResourceType, ResourceStock> storage, ResourceDelta delta) {
        if (storage == null) {
            throw new IllegalArgumentException("Storage cannot be null");
        }
        if (delta == null) {
            throw new IllegalArgumentException("Delta cannot be null");
        }
        EnumMap<ResourceType, ResourceStock> updated = new EnumMap<>(ResourceType.class);
        EnumMap<ResourceType, Double> waste = new EnumMap<>(ResourceType.class);
        EnumMap<ResourceType, Double> shortfall = new EnumMap<>(ResourceType.class);

        for (ResourceType resource : ResourceType.values()) {
            ResourceStock stock = storage.get(resource);
            if (stock == null) {
                continue;
            }
            double raw = stock.amount() + delta.amount(resource);
            double capacity = stock.capacity();
            waste.put(resource, Math.max(0.0, raw - capacity));
            shortfall.put(resource, Math.max(0.0, -raw));
            updated.put(resource, stock.withAmount(clamp(raw, 0.0, capacity)));
        }
        return new LedgerResult(Collections.unmodifiableMap(updated),
            Collections.unmodifiableMap(waste),
            Collections.unmodifiableMap(shortfall));
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
