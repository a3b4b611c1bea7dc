package uncharted.economy;

import uncharted.settlement.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Signed per-resource amounts flowing into or out of storage. Absent resources count as zero.
 * Never persisted.
 */
public final class ResourceDelta {

    private static final ResourceDelta ZERO = new ResourceDelta(new EnumMap<>(ResourceType.class));

    private final EnumMap<ResourceType, Double> amounts;

    private ResourceDelta(EnumMap<ResourceType, Double> amounts) {
        this.amounts = amounts;
    }

    public static ResourceDelta zero() {
        return ZERO;
    }

    public static ResourceDelta of(Map<ResourceType, Double> amounts) {
        EnumMap<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        amounts.forEach((resource, amount) -> {
            if (amount != null && amount != 0.0) {
                copy.put(resource, amount);
            }
        });
        return new ResourceDelta(copy);
    }

    public static ResourceDelta of(ResourceType resource, double amount) {
        return of(Map.of(resource, amount));
    }

    public double amount(ResourceType resource) {
        return amounts.getOrDefault(resource, 0.0);
    }

    public ResourceDelta plus(ResourceDelta other) {
        EnumMap<ResourceType, Double> sum = new EnumMap<>(amounts);
        other.amounts.forEach((resource, amount) -> sum.merge(resource, amount, Double::sum));
        return of(sum);
    }

    public boolean isZero() {
        return amounts.isEmpty();
    }

    public Map<ResourceType, Double> asMap() {
        return Collections.unmodifiableMap(amounts);
    }

    /**
     * Accumulates a delta one contribution at a time.
     */
    public static final class Builder {
        private final EnumMap<ResourceType, Double> amounts = new EnumMap<>(ResourceType.class);

        public Builder add(ResourceType resource, double amount) {
            amounts.merge(resource, amount, Double::sum);
            return this;
        }

        public ResourceDelta build() {
            return of(amounts);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceDelta that)) return false;
        return amounts.equals(that.amounts);
    }

    @Override
    public int hashCode() {
        return amounts.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceDelta" + amounts;
    }
}
