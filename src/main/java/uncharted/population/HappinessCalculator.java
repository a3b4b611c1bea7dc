package uncharted.population;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.Modifiers;
import uncharted.catalog.StructureTypes;
import uncharted.disaster.DisasterEvent;
import uncharted.disaster.DisasterPhase;
import uncharted.disaster.PreparednessCalculator;
import uncharted.settlement.ResourceType;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

/**
 * Weighted happiness score of a settlement.
 * <pre>
 *   resource sufficiency 0.30   food and water on hand, in hours, against a 72 hour buffer
 *   housing quality      0.20   crowding, plus a bonus for proper houses
 *   preparedness         0.15   see {@link PreparednessCalculator}
 *   recent trauma        0.15   100 - severity while a disaster is hitting or just hit
 *   morale               0.15   sum of "Morale Boost" modifiers
 *   NPC relations        0.05   neutral
 * </pre>
 */
public class HappinessCalculator {

    static final double RESOURCE_WEIGHT = 0.30;
    static final double HOUSING_WEIGHT = 0.20;
    static final double PREPAREDNESS_WEIGHT = 0.15;
    static final double TRAUMA_WEIGHT = 0.15;
    static final double MORALE_WEIGHT = 0.15;
    static final double NPC_WEIGHT = 0.05;

    static final double BUFFER_HOURS = 72.0;
    static final double NEUTRAL_NPC_RELATIONS = 50.0;

    private final GameCatalog catalog;
    private final PreparednessCalculator preparednessCalculator;

    public HappinessCalculator(GameCatalog catalog, PreparednessCalculator preparednessCalculator) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (preparednessCalculator == null) {
            throw new IllegalArgumentException("Preparedness calculator cannot be null");
        }
        this.catalog = catalog;
        this.preparednessCalculator = preparednessCalculator;
    }

    public HappinessBreakdown calculate(Settlement settlement, int capacity) {
        int population = settlement.getPopulation() == null ? 0 : settlement.getPopulation().current();

        double resources = resourceSufficiency(settlement, population);
        double housing = housingQuality(settlement, population, capacity);
        double preparedness = preparednessCalculator.preparedness(settlement);
        double trauma = recentTrauma(settlement.getActiveDisaster());
        double morale = morale(settlement);

        double total = resources * RESOURCE_WEIGHT
            + housing * HOUSING_WEIGHT
            + preparedness * PREPAREDNESS_WEIGHT
            + trauma * TRAUMA_WEIGHT
            + morale * MORALE_WEIGHT
            + NEUTRAL_NPC_RELATIONS * NPC_WEIGHT;
        return new HappinessBreakdown(resources, housing, preparedness, trauma, morale, NEUTRAL_NPC_RELATIONS,
            clamp(total));
    }

    double resourceSufficiency(Settlement settlement, int population) {
        if (population <= 0) {
            return 100.0;
        }
        double food = bufferScore(settlement, ResourceType.FOOD, population);
        double water = bufferScore(settlement, ResourceType.WATER, population);
        return (food + water) / 2.0;
    }

    private double bufferScore(Settlement settlement, ResourceType resource, int population) {
        double perHour = population * catalog.consumptionPerCapitaPerHour(resource);
        if (perHour <= 0) {
            return 100.0;
        }
        double hours = settlement.stock(resource).amount() / perHour;
        return Math.min(100.0, hours / BUFFER_HOURS * 100.0);
    }

    static double housingQuality(Settlement settlement, int population, int capacity) {
        double score = 100.0;
        if (capacity <= 0) {
            score -= 30.0;
        } else {
            double crowding = (double) population / capacity;
            if (crowding > 0.9) {
                score -= 30.0;
            } else if (crowding > 0.75) {
                score -= 15.0;
            } else if (crowding < 0.5) {
                score += 10.0;
            }
        }
        if (settlement.hasStandingStructure(StructureTypes.HOUSE)) {
            score += 20.0;
        }
        return clamp(score);
    }

    static double recentTrauma(DisasterEvent disaster) {
        if (disaster == null) {
            return 100.0;
        }
        if (disaster.getPhase() == DisasterPhase.IMPACT || disaster.getPhase() == DisasterPhase.AFTERMATH) {
            return clamp(100.0 - disaster.getSeverity());
        }
        return 100.0;
    }

    double morale(Settlement settlement) {
        double morale = 0.0;
        for (StructureInstance structure : settlement.standingStructures()) {
            morale += catalog.modifierOf(structure.type(), Modifiers.MORALE_BOOST);
        }
        return clamp(morale);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
