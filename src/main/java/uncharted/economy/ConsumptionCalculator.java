package uncharted.economy;

import uncharted.catalog.GameCatalog;
import uncharted.settlement.PopulationState;
import uncharted.settlement.ResourceType;

/**
 * Resources drawn by the population: {@code current × perCapitaRate × hours}, as a negative delta.
 */
public class ConsumptionCalculator {

    private final GameCatalog catalog;

    public ConsumptionCalculator(GameCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.catalog = catalog;
    }

    /**
     * @param population may be null while population data is unavailable; the result is then zero
     * @param hours length of the period being consumed for
     */
    public ResourceDelta calculate(PopulationState population, double hours) {
        if (population == null || population.current() <= 0 || hours <= 0) {
            return ResourceDelta.zero();
        }
        ResourceDelta.Builder consumption = ResourceDelta.builder();
        for (ResourceType resource : ResourceType.values()) {
            double rate = catalog.consumptionPerCapitaPerHour(resource);
            if (rate > 0) {
                consumption.add(resource, -population.current() * rate * hours);
            }
        }
        return consumption.build();
    }
}
