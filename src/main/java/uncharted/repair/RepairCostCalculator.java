package uncharted.repair;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.StructureDefinition;
import uncharted.disaster.DisasterEvent;
import uncharted.disaster.DisasterPhase;
import uncharted.disaster.DisasterType;
import uncharted.economy.ResourceDelta;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;

import java.util.Map;

/**
 * Resources needed to restore structure health after a disaster.
 * <pre>
 *   cost = structureCost × disasterMultiplier × (healthRestored / 10)
 * </pre>
 * Halved while the settlement is inside its aftermath discount window.
 */
public class RepairCostCalculator {

    static final double DEFAULT_MULTIPLIER = 0.25;
    static final double AFTERMATH_DISCOUNT = 0.5;

    private final GameCatalog catalog;

    public RepairCostCalculator(GameCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.catalog = catalog;
    }

    /**
     * @param cause the disaster that did the damage, or null for the default multiplier
     * @throws IllegalArgumentException if the structure type is unknown or the restored health is out of range
     */
    public ResourceDelta cost(Settlement settlement, String structureType, DisasterType cause,
                              double healthRestored, long now) {
        if (healthRestored < 0 || healthRestored > 100) {
            throw new IllegalArgumentException("Health restored must be within 0..100, got " + healthRestored);
        }
        StructureDefinition definition = catalog.structure(structureType)
            .orElseThrow(() -> new IllegalArgumentException("Unknown structure type: " + structureType));
        double multiplier = cause == null ? DEFAULT_MULTIPLIER : cause.repairCostMultiplier();
        double factor = multiplier * (healthRestored / 10.0);
        if (inDiscountWindow(settlement, now)) {
            factor *= AFTERMATH_DISCOUNT;
        }
        ResourceDelta.Builder cost = ResourceDelta.builder();
        for (Map.Entry<ResourceType, Double> entry : definition.cost().entrySet()) {
            cost.add(entry.getKey(), entry.getValue() * factor);
        }
        return cost.build();
    }

    public static boolean inDiscountWindow(Settlement settlement, long now) {
        DisasterEvent disaster = settlement.getActiveDisaster();
        return disaster != null
            && disaster.getPhase() == DisasterPhase.AFTERMATH
            && now < disaster.getAftermathEndsAt();
    }
}
