package uncharted.simulation;

import uncharted.economy.ConsumptionCalculator;
import uncharted.economy.LedgerResult;
import uncharted.economy.ProductionCalculator;
import uncharted.economy.ResourceDelta;
import uncharted.economy.StorageCapacityCalculator;
import uncharted.economy.StorageLedger;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.population.StaffingPlan;
import uncharted.population.StaffingPlanner;
import uncharted.settlement.ResourceStock;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hourly economy: refresh capacities, staff the structures, add production, subtract consumption,
 * clamp to capacity.
 */
public class ProductionPhaseHandler implements PhaseHandler {

    private final StorageCapacityCalculator capacityCalculator;
    private final ProductionCalculator productionCalculator;
    private final ConsumptionCalculator consumptionCalculator;
    private final StaffingPlanner staffingPlanner;
    private final StorageLedger ledger;
    private final double storageWarningThreshold;

    public ProductionPhaseHandler(StorageCapacityCalculator capacityCalculator,
                                  ProductionCalculator productionCalculator,
                                  ConsumptionCalculator consumptionCalculator,
                                  StaffingPlanner staffingPlanner,
                                  StorageLedger ledger,
                                  double storageWarningThreshold) {
        if (capacityCalculator == null || productionCalculator == null || consumptionCalculator == null
                || staffingPlanner == null || ledger == null) {
            throw new IllegalArgumentException("Economy calculators cannot be null");
        }
        this.capacityCalculator = capacityCalculator;
        this.productionCalculator = productionCalculator;
        this.consumptionCalculator = consumptionCalculator;
        this.staffingPlanner = staffingPlanner;
        this.ledger = ledger;
        this.storageWarningThreshold = storageWarningThreshold;
    }

    @Override
    public Phase phase() {
        return Phase.PRODUCTION;
    }

    @Override
    public void process(Settlement settlement, PhaseContext context) {
        double hours = context.schedule().periodHours();
        settlement.setStorage(capacityCalculator.withCurrentCapacities(settlement));

        int population = settlement.getPopulation() == null ? 0 : settlement.getPopulation().current();
        StaffingPlan staffing = staffingPlanner.assign(population, settlement.standingStructures());
        ResourceDelta production = productionCalculator.calculate(settlement, hours, staffing.bonuses());
        ResourceDelta consumption = consumptionCalculator.calculate(settlement.getPopulation(), hours);
        LedgerResult result = ledger.apply(settlement.getStorage(), production.plus(consumption));
        settlement.setStorage(result.storage());

        String id = settlement.getId();
        long now = context.now();
        context.emit(EngineEvent.builder(EventType.RESOURCE_TICK, id, now)
            .with("production", byKey(production.asMap()))
            .with("consumption", byKey(consumption.asMap()))
            .with("waste", byKey(result.waste()))
            .with("storage", amounts(result.storage()))
            .with("workersAssigned", staffing.assigned())
            .with("idle", staffing.idle())
            .with("understaffed", staffing.understaffed())
            .build());

        for (ResourceType resource : ResourceType.values()) {
            context.recordWaste(resource, result.wasteOf(resource));
        }
        if (result.hasWaste()) {
            context.emit(EngineEvent.builder(EventType.RESOURCE_WASTE, id, now)
                .with("waste", byKey(result.waste()))
                .with("total", result.totalWaste())
                .build());
        }
        for (Map.Entry<ResourceType, ResourceStock> entry : result.storage().entrySet()) {
            ResourceStock stock = entry.getValue();
            if (stock.capacity() > 0 && stock.fillRatio() > storageWarningThreshold) {
                context.emit(EngineEvent.builder(EventType.STORAGE_WARNING, id, now)
                    .with("resource", entry.getKey().key())
                    .with("amount", stock.amount())
                    .with("capacity", stock.capacity())
                    .with("fillPercent", Math.round(stock.fillRatio() * 100.0))
                    .build());
            }
        }
    }

    private static Map<String, Double> byKey(Map<ResourceType, Double> amounts) {
        Map<String, Double> keyed = new LinkedHashMap<>();
        for (ResourceType resource : ResourceType.values()) {
            Double amount = amounts.get(resource);
            if (amount != null && amount != 0.0) {
                keyed.put(resource.key(), amount);
            }
        }
        return keyed;
    }

    private static Map<String, Double> amounts(Map<ResourceType, ResourceStock> storage) {
        Map<String, Double> keyed = new LinkedHashMap<>();
        for (ResourceType resource : ResourceType.values()) {
            ResourceStock stock = storage.get(resource);
            if (stock != null) {
                keyed.put(resource.key(), stock.amount());
            }
        }
        return keyed;
    }
}
