package uncharted.economy;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.Modifiers;
import uncharted.catalog.StructureDefinition;
import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Storage capacity per resource: the catalog base, plus every standing structure's
 * "Storage Capacity" modifier, plus its per-resource modifier such as "Food Storage".
 */
public class StorageCapacityCalculator {

    private final GameCatalog catalog;

    public StorageCapacityCalculator(GameCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.catalog = catalog;
    }

    public Map<ResourceType, Double> capacities(Settlement settlement) {
        EnumMap<ResourceType, Double> capacities = new EnumMap<>(ResourceType.class);
        for (ResourceType resource : ResourceType.values()) {
            capacities.put(resource, catalog.baseStorageCapacity());
        }
        for (StructureInstance structure : settlement.standingStructures()) {
            Optional<StructureDefinition> definition = catalog.structure(structure.type());
            if (definition.isEmpty()) {
                continue;
            }
            double general = definition.get().modifier(Modifiers.STORAGE_CAPACITY);
            for (ResourceType resource : ResourceType.values()) {
                double specific = definition.get().modifier(Modifiers.storageOf(resource));
                capacities.merge(resource, general + specific, Double::sum);
            }
        }
        return capacities;
    }

    /**
     * Returns storage with refreshed capacities. Amounts are left as they are; the ledger
     * clamps any amount above a reduced capacity on its next apply.
     */
    public Map<ResourceType, ResourceStock> withCurrentCapacities(Settlement settlement) {
        Map<ResourceType, Double> capacities = capacities(settlement);
        EnumMap<ResourceType, ResourceStock> refreshed = new EnumMap<>(ResourceType.class);
        for (ResourceType resource : ResourceType.values()) {
            refreshed.put(resource, settlement.stock(resource).withCapacity(capacities.get(resource)));
        }
        return refreshed;
    }
}
