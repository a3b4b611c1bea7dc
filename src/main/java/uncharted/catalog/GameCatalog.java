package uncharted.catalog;

import uncharted.settlement.ResourceType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only game configuration: structure definitions, production base rates, per-capita
 * consumption and biome profiles.
 * <p>
 * Lookups return {@link Optional} rather than throwing. A missing entry is a configuration gap
 * the calculators degrade around, not a reason to stop a tick.
 */
public final class GameCatalog {

    private final double baseStorageCapacity;
    private final int basePopulationCapacity;
    private final double levelMultiplierBase;
    private final Map<ResourceType, Double> consumptionPerCapitaPerHour;
    private final Map<String, Map<ResourceType, Double>> baseRates;
    private final Map<String, StructureDefinition> structures;
    private final Map<String, BiomeProfile> biomes;
    private final Map<String, StaffingRequirement> staffing;

    public GameCatalog(double baseStorageCapacity,
                       int basePopulationCapacity,
                       double levelMultiplierBase,
                       Map<ResourceType, Double> consumptionPerCapitaPerHour,
                       Map<String, Map<ResourceType, Double>> baseRates,
                       Collection<StructureDefinition> structures,
                       Map<String, BiomeProfile> biomes) {
        this(baseStorageCapacity, basePopulationCapacity, levelMultiplierBase, consumptionPerCapitaPerHour,
            baseRates, structures, biomes, null);
    }

    public GameCatalog(double baseStorageCapacity,
                       int basePopulationCapacity,
                       double levelMultiplierBase,
                       Map<ResourceType, Double> consumptionPerCapitaPerHour,
                       Map<String, Map<ResourceType, Double>> baseRates,
                       Collection<StructureDefinition> structures,
                       Map<String, BiomeProfile> biomes,
                       Map<String, StaffingRequirement> staffing) {
        if (baseStorageCapacity < 0) {
            throw new IllegalArgumentException("baseStorageCapacity cannot be negative");
        }
        if (basePopulationCapacity < 0) {
            throw new IllegalArgumentException("basePopulationCapacity cannot be negative");
        }
        if (levelMultiplierBase <= 0) {
            throw new IllegalArgumentException("levelMultiplierBase must be positive");
        }
        this.baseStorageCapacity = baseStorageCapacity;
        this.basePopulationCapacity = basePopulationCapacity;
        this.levelMultiplierBase = levelMultiplierBase;
        EnumMap<ResourceType, Double> consumption = new EnumMap<>(ResourceType.class);
        if (consumptionPerCapitaPerHour != null) {
            consumption.putAll(consumptionPerCapitaPerHour);
        }
        this.consumptionPerCapitaPerHour = consumption;
        this.baseRates = baseRates == null ? Map.of() : Map.copyOf(baseRates);
        Map<String, StructureDefinition> byType = new LinkedHashMap<>();
        if (structures != null) {
            for (StructureDefinition definition : structures) {
                if (byType.put(definition.type(), definition) != null) {
                    throw new IllegalArgumentException("Duplicate structure definition " + definition.type());
                }
            }
        }
        this.structures = byType;
        this.biomes = biomes == null ? Map.of() : Map.copyOf(biomes);
        this.staffing = staffing == null ? Map.of() : Map.copyOf(staffing);
    }

    public double baseStorageCapacity() {
        return baseStorageCapacity;
    }

    public int basePopulationCapacity() {
        return basePopulationCapacity;
    }

    /** Geometric production multiplier: {@code base^(level-1)}. */
    public double levelMultiplier(int level) {
        return Math.pow(levelMultiplierBase, Math.max(0, level - 1));
    }

    public double consumptionPerCapitaPerHour(ResourceType resource) {
        return consumptionPerCapitaPerHour.getOrDefault(resource, 0.0);
    }

    public Optional<StructureDefinition> structure(String type) {
        return Optional.ofNullable(structures.get(type));
    }

    public List<StructureDefinition> structures() {
        return List.copyOf(structures.values());
    }

    /** Base production per phase for an extractor type, keyed by the resource it yields. */
    public Optional<Map<ResourceType, Double>> baseRates(String extractorType) {
        return Optional.ofNullable(baseRates.get(extractorType));
    }

    public Optional<BiomeProfile> biome(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(biomes.get(name));
    }

    /** Staffing of a structure type; empty for passive structures that take no workers. */
    public Optional<StaffingRequirement> staffing(String structureType) {
        return Optional.ofNullable(staffing.get(structureType));
    }

    public double modifierOf(String structureType, String modifierName) {
        return structure(structureType).map(d -> d.modifier(modifierName)).orElse(0.0);
    }
}
