package uncharted.economy;

import uncharted.catalog.BiomeProfile;
import uncharted.catalog.GameCatalog;
import uncharted.catalog.StructureDefinition;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;
import uncharted.world.TerrainService;
import uncharted.world.TileInfo;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resource output of a settlement's extractors.
 * <p>
 * Each extractor contributes, per resource it has a base rate for:
 * <pre>
 *   baseRate × (quality / 100) × levelMultiplier × biomeEfficiency × effectiveness × staffing × hours
 * </pre>
 * where quality comes from the extractor's tile (or the settlement's own tile),
 * levelMultiplier is geometric in the structure level, effectiveness steps down with the
 * structure's health (see {@link #effectiveness(double)}) and staffing is the per-structure
 * multiplier handed in by the caller.
 * <p>
 * A missing structure definition, base rate, tile, biome, quality score or efficiency is a
 * configuration gap: that contribution is zero, a warning is logged, and the other extractors
 * are unaffected.
 */
public class ProductionCalculator {
    private static final Logger logger = Logger.getLogger(ProductionCalculator.class.getName());

    private final GameCatalog catalog;
    private final TerrainService terrain;

    public ProductionCalculator(GameCatalog catalog, TerrainService terrain) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (terrain == null) {
            throw new IllegalArgumentException("Terrain service cannot be null");
        }
        this.catalog = catalog;
        this.terrain = terrain;
    }

    public static double output(double baseRate, double quality, double levelMultiplier, double biomeEfficiency) {
        return baseRate * (quality / 100.0) * levelMultiplier * biomeEfficiency;
    }

    /**
     * Share of full output a structure delivers at the given health.
     */
    public static double effectiveness(double health) {
        if (health >= 95.0) {
            return 1.0;
        }
        if (health >= 80.0) {
            return 0.95;
        }
        if (health >= 60.0) {
            return 0.85;
        }
        if (health >= 40.0) {
            return 0.7;
        }
        if (health >= 20.0) {
            return 0.5;
        }
        if (health > 0.0) {
            return 0.1;
        }
        return 0.0;
    }

    public ResourceDelta calculate(Settlement settlement, double hours) {
        return calculate(settlement, hours, Map.of());
    }

    /**
     * @param multipliers extra output multiplier per structure id; structures not listed get 1.0
     */
    public ResourceDelta calculate(Settlement settlement, double hours, Map<String, Double> multipliers) {
        ResourceDelta.Builder production = ResourceDelta.builder();
        Map<String, Optional<TileInfo>> tiles = new HashMap<>();

        for (StructureInstance structure : settlement.standingStructures()) {
            Optional<StructureDefinition> definition = catalog.structure(structure.type());
            if (definition.isEmpty()) {
                logger.warning("Unknown structure type " + structure.type() + " (structure " + structure.id()
                    + ") in settlement " + settlement.getId());
                continue;
            }
            if (!definition.get().extractor()) {
                continue;
            }
            Optional<Map<ResourceType, Double>> rates = catalog.baseRates(structure.type());
            if (rates.isEmpty()) {
                logger.warning("No base rates for extractor " + structure.type() + " in settlement " + settlement.getId());
                continue;
            }
            String tileId = structure.tileId() != null ? structure.tileId() : settlement.getTileId();
            Optional<TileInfo> tile = tiles.computeIfAbsent(String.valueOf(tileId), k -> terrain.tile(tileId));
            if (tile.isEmpty()) {
                logger.warning("Tile " + tileId + " unavailable for extractor " + structure.id()
                    + " in settlement " + settlement.getId());
                continue;
            }
            Optional<BiomeProfile> biome = catalog.biome(tile.get().biome());
            if (biome.isEmpty()) {
                logger.warning("Unknown biome " + tile.get().biome() + " on tile " + tileId
                    + " for settlement " + settlement.getId());
                continue;
            }
            double levelMultiplier = catalog.levelMultiplier(structure.level());
            double scale = effectiveness(structure.health()) * multipliers.getOrDefault(structure.id(), 1.0) * hours;
            for (Map.Entry<ResourceType, Double> rate : rates.get().entrySet()) {
                ResourceType resource = rate.getKey();
                Optional<Double> quality = tile.get().qualityOf(resource);
                Optional<Double> efficiency = biome.get().efficiencyFor(resource);
                if (quality.isEmpty() || efficiency.isEmpty()) {
                    logger.warning("Missing " + (quality.isEmpty() ? "quality" : "efficiency") + " for " + resource
                        + " on tile " + tileId + " (" + tile.get().biome() + ") in settlement " + settlement.getId());
                    continue;
                }
                production.add(resource, output(rate.getValue(), quality.get(), levelMultiplier, efficiency.get()) * scale);
            }
        }
        return production.build();
    }
}
