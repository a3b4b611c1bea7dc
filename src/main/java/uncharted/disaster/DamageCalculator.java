package uncharted.disaster;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.StructureDefinition;
import uncharted.catalog.StructureTypes;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.Optional;
import java.util.Random;

/**
 * Disaster damage and casualty formulas.
 * <pre>
 *   base       = max(0, severity - preparedness)
 *   net        = clamp(base × (1 + variance), 0, 100),  variance uniform in [-0.2, 0.2)
 *   structure  = net × (1 - resistance)
 *   casualties = unsheltered × net / 100 × typeMultiplier × (1 - hospitalSave)
 * </pre>
 */
public class DamageCalculator {

    public static final double MAX_VARIANCE = 0.2;

    static final double HOSPITAL_MIN_HEALTH = 20.0;
    static final double HOSPITAL_BASE_SAVE = 0.5;
    static final double HOSPITAL_SAVE_PER_LEVEL = 0.05;
    static final double HOSPITAL_MAX_SAVE = 0.75;

    private final GameCatalog catalog;
    private final PreparednessCalculator preparednessCalculator;

    public DamageCalculator(GameCatalog catalog, PreparednessCalculator preparednessCalculator) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (preparednessCalculator == null) {
            throw new IllegalArgumentException("Preparedness calculator cannot be null");
        }
        this.catalog = catalog;
        this.preparednessCalculator = preparednessCalculator;
    }

    public static double baseDamage(double severity, double preparedness) {
        return Math.max(0.0, severity - preparedness);
    }

    public DamagePlan plan(Settlement settlement, DisasterType type, int severity, Random random) {
        double preparedness = preparednessCalculator.preparedness(settlement);
        double base = baseDamage(severity, preparedness);
        double variance = (random.nextDouble() * 2.0 - 1.0) * MAX_VARIANCE;
        double net = Math.max(0.0, Math.min(100.0, base * (1.0 + variance)));
        return new DamagePlan(preparedness, base, variance, net, casualties(settlement, type, net));
    }

    /**
     * Health a structure loses from the given share of net damage. Negative resistance
     * amplifies the damage; the result is never negative.
     */
    public double structureDamage(StructureInstance structure, DisasterType type, double damage) {
        Optional<StructureDefinition> definition = catalog.structure(structure.type());
        double resistance = definition.map(d -> d.resistanceTo(type)).orElse(0.0);
        return Math.max(0.0, damage * (1.0 - resistance));
    }

    public int casualties(Settlement settlement, DisasterType type, double netDamage) {
        int population = settlement.getPopulation() == null ? 0 : settlement.getPopulation().current();
        if (population <= 0 || netDamage <= 0) {
            return 0;
        }
        double sheltered = Math.min(population, preparednessCalculator.shelterCapacity(settlement));
        double unsheltered = population - sheltered;
        double raw = unsheltered * (netDamage / 100.0) * type.casualtyMultiplier();
        double saved = hospitalSaveRate(settlement);
        return (int) Math.min(population, Math.floor(raw * (1.0 - saved)));
    }

    double hospitalSaveRate(Settlement settlement) {
        double best = 0.0;
        for (StructureInstance structure : settlement.standingStructures()) {
            if (StructureTypes.HOSPITAL.equals(structure.type()) && structure.health() > HOSPITAL_MIN_HEALTH) {
                double save = HOSPITAL_BASE_SAVE + HOSPITAL_SAVE_PER_LEVEL * (structure.level() - 1);
                best = Math.max(best, Math.min(HOSPITAL_MAX_SAVE, save));
            }
        }
        return best;
    }
}
