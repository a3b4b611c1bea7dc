package uncharted.catalog;

import uncharted.disaster.DisasterType;
import uncharted.settlement.ResourceType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Production efficiency and disaster exposure of a biome.
 *
 * @param vulnerability multiplier on the per-check disaster chance
 */
public record BiomeProfile(Map<ResourceType, Double> efficiency,
                           double vulnerability,
                           List<DisasterType> highRisk,
                           List<DisasterType> moderateRisk,
                           List<DisasterType> lowRisk) {

    public BiomeProfile {
        if (vulnerability < 0) {
            throw new IllegalArgumentException("Biome vulnerability cannot be negative");
        }
        efficiency = efficiency == null ? Map.of() : Map.copyOf(efficiency);
        highRisk = highRisk == null ? List.of() : List.copyOf(highRisk);
        moderateRisk = moderateRisk == null ? List.of() : List.copyOf(moderateRisk);
        lowRisk = lowRisk == null ? List.of() : List.copyOf(lowRisk);
    }

    public Optional<Double> efficiencyFor(ResourceType resource) {
        return Optional.ofNullable(efficiency.get(resource));
    }

    public boolean disasterProne() {
        return !highRisk.isEmpty() || !moderateRisk.isEmpty() || !lowRisk.isEmpty();
    }
}
