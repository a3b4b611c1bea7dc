package uncharted.disaster;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.Modifiers;
import uncharted.catalog.StructureTypes;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

/**
 * Disaster preparedness score, 0..100.
 * <ul>
 *   <li>shelter coverage of the population: up to 30</li>
 *   <li>watchtower, meteorology station, seismology station: 5 each</li>
 *   <li>"Defense" modifiers: up to 30</li>
 *   <li>fortress: 30</li>
 *   <li>resilience: {@code resilience / 100 × 20}</li>
 * </ul>
 */
public class PreparednessCalculator {

    static final double SHELTER_WEIGHT = 30.0;
    static final double EARLY_WARNING_BONUS = 5.0;
    static final double DEFENSE_CAP = 30.0;
    static final double FORTRESS_BONUS = 30.0;
    static final double RESILIENCE_WEIGHT = 20.0;

    private final GameCatalog catalog;

    public PreparednessCalculator(GameCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        this.catalog = catalog;
    }

    public double preparedness(Settlement settlement) {
        int population = settlement.getPopulation() == null ? 0 : settlement.getPopulation().current();
        double shelterCapacity = shelterCapacity(settlement);
        double coverage;
        if (population > 0) {
            coverage = Math.min(1.0, shelterCapacity / population);
        } else {
            coverage = shelterCapacity > 0 ? 1.0 : 0.0;
        }
        double score = coverage * SHELTER_WEIGHT;

        for (String earlyWarning : new String[]{StructureTypes.WATCHTOWER,
                StructureTypes.METEOROLOGY_STATION, StructureTypes.SEISMOLOGY_STATION}) {
            if (settlement.hasStandingStructure(earlyWarning)) {
                score += EARLY_WARNING_BONUS;
            }
        }

        double defense = 0.0;
        for (StructureInstance structure : settlement.standingStructures()) {
            defense += catalog.modifierOf(structure.type(), Modifiers.DEFENSE);
        }
        score += Math.min(DEFENSE_CAP, defense);

        if (settlement.hasStandingStructure(StructureTypes.FORTRESS)) {
            score += FORTRESS_BONUS;
        }
        score += settlement.getResilience() / 100.0 * RESILIENCE_WEIGHT;
        return Math.min(100.0, score);
    }

    /**
     * Settlers that standing shelters can hold; each shelter level adds its "Shelter Capacity".
     */
    public double shelterCapacity(Settlement settlement) {
        double capacity = 0.0;
        for (StructureInstance structure : settlement.standingStructures()) {
            capacity += catalog.modifierOf(structure.type(), Modifiers.SHELTER_CAPACITY) * structure.level();
        }
        return capacity;
    }
}
