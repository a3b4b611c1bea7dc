package uncharted.catalog;

import uncharted.settlement.ResourceType;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of {@code game-catalog.json}.
 */
public record CatalogDocument(double baseStorageCapacity,
                              int basePopulationCapacity,
                              double levelMultiplierBase,
                              Map<ResourceType, Double> consumptionPerCapitaPerHour,
                              Map<String, Map<ResourceType, Double>> baseRates,
                              List<StructureDefinition> structures,
                              Map<String, BiomeProfile> biomes,
                              Map<String, StaffingRequirement> staffing) {
}
