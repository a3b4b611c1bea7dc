package uncharted.catalog;

import uncharted.disaster.DisasterType;
import uncharted.settlement.ResourceType;

import java.util.Map;

/**
 * Static definition of a structure type.
 *
 * @param resistances damage reduction per disaster type name; "ALL" applies to any type and a
 *                    negative value makes the structure more fragile
 */
public record StructureDefinition(String type,
                                  StructureCategory category,
                                  int maxLevel,
                                  long constructionSeconds,
                                  Map<ResourceType, Double> cost,
                                  Map<String, Double> modifiers,
                                  Map<String, Double> resistances) {

    public static final String ALL_DISASTERS = "ALL";

    public StructureDefinition {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Structure type cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("Structure category cannot be null for " + type);
        }
        if (maxLevel < 1) {
            throw new IllegalArgumentException("maxLevel must be at least 1 for " + type);
        }
        if (constructionSeconds < 0) {
            throw new IllegalArgumentException("constructionSeconds cannot be negative for " + type);
        }
        cost = cost == null ? Map.of() : Map.copyOf(cost);
        modifiers = modifiers == null ? Map.of() : Map.copyOf(modifiers);
        resistances = resistances == null ? Map.of() : Map.copyOf(resistances);
    }

    public double modifier(String name) {
        return modifiers.getOrDefault(name, 0.0);
    }

    public double resistanceTo(DisasterType disasterType) {
        Double specific = resistances.get(disasterType.name());
        if (specific != null) {
            return specific;
        }
        return resistances.getOrDefault(ALL_DISASTERS, 0.0);
    }

    public boolean extractor() {
        return category == StructureCategory.EXTRACTOR;
    }
}
