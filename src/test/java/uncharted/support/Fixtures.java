package uncharted.support;

import uncharted.catalog.CatalogLoader;
import uncharted.catalog.GameCatalog;
import uncharted.settlement.PopulationState;
import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;
import uncharted.world.TileInfo;

import java.util.EnumMap;
import java.util.Map;

/**
 * Shared test data: the bundled catalog, a fully productive grassland tile and fresh settlements.
 */
public final class Fixtures {

    public static final String HOME_TILE = "tile-home";
    public static final long CREATED_AT = 1_700_000_000_000L;

    private static GameCatalog catalog;

    private Fixtures() {
    }

    public static synchronized GameCatalog catalog() {
        if (catalog == null) {
            catalog = new CatalogLoader().loadDefault();
        }
        return catalog;
    }

    public static TileInfo tile(String tileId, String biome, double quality) {
        Map<ResourceType, Double> qualities = new EnumMap<>(ResourceType.class);
        for (ResourceType resource : ResourceType.values()) {
            qualities.put(resource, quality);
        }
        return new TileInfo(tileId, biome, qualities, 6);
    }

    public static InMemoryTerrain grasslandTerrain() {
        InMemoryTerrain terrain = new InMemoryTerrain();
        terrain.put(tile(HOME_TILE, "GRASSLAND", 100.0));
        return terrain;
    }

    /**
     * A settlement on the home tile with 1000 capacity per resource and the given population.
     */
    public static Settlement settlement(String id, int population) {
        return Settlement.create(id, "player-" + id, HOME_TILE, CREATED_AT, 1000.0,
            PopulationState.initial(population, 10, CREATED_AT));
    }

    public static StructureInstance structure(String id, String type) {
        return StructureInstance.newlyBuilt(id, type, null, CREATED_AT);
    }

    public static void setAmount(Settlement settlement, ResourceType resource, double amount) {
        Map<ResourceType, ResourceStock> storage = new EnumMap<>(ResourceType.class);
        storage.putAll(settlement.getStorage());
        storage.put(resource, settlement.stock(resource).withAmount(amount));
        settlement.setStorage(storage);
    }
}
