package uncharted.population;

import uncharted.catalog.GameCatalog;
import uncharted.catalog.Modifiers;
import uncharted.events.EngineEvent;
import uncharted.events.EventType;
import uncharted.settlement.PopulationState;
import uncharted.settlement.Settlement;
import uncharted.settlement.StructureInstance;

import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Hourly population update: housing overflow, band-driven growth or decline, and the random
 * immigration and emigration rolls.
 * <p>
 * Growth is fractional. The fraction of a settler that does not yet make a whole one is carried in
 * {@link PopulationState#growthProgress()} so slow growth still adds up over several phases.
 */
public class PopulationModel {
    private static final Logger logger = Logger.getLogger(PopulationModel.class.getName());

    public static final String NO_HOUSING = "no_housing";
    public static final String LOW_HAPPINESS = "low_happiness";
    public static final String EMIGRATION_RISK = "emigration_risk";

    static final double BASE_GROWTH_RATE = 0.02;
    static final double MAX_CATCH_UP_HOURS = 24.0;

    static final double IMMIGRATION_THRESHOLD = 75.0;
    static final double IMMIGRATION_BASE_CHANCE = 0.1;
    static final int IMMIGRATION_MIN = 2;
    static final int IMMIGRATION_MAX = 5;

    static final double EMIGRATION_THRESHOLD = 35.0;
    static final double EMIGRATION_BASE_CHANCE = 0.15;
    static final int EMIGRATION_MIN = 1;
    static final int EMIGRATION_MAX = 3;
    static final double EMIGRATION_MAX_SHARE = 0.2;
    static final double EMIGRATION_RISK_CHANCE = 0.1;

    private final GameCatalog catalog;
    private final HappinessCalculator happinessCalculator;

    public PopulationModel(GameCatalog catalog, HappinessCalculator happinessCalculator) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        if (happinessCalculator == null) {
            throw new IllegalArgumentException("Happiness calculator cannot be null");
        }
        this.catalog = catalog;
        this.happinessCalculator = happinessCalculator;
    }

    /**
     * Housing capacity: the catalog base plus every standing structure's "Population Capacity".
     */
    public int capacity(Settlement settlement) {
        double capacity = catalog.basePopulationCapacity();
        for (StructureInstance structure : settlement.standingStructures()) {
            capacity += catalog.modifierOf(structure.type(), Modifiers.POPULATION_CAPACITY);
        }
        return (int) Math.max(0, Math.floor(capacity));
    }

    /**
     * Runs one population phase for the settlement, replacing its population state.
     */
    public PopulationState update(Settlement settlement, long now, Random random, List<EngineEvent> events) {
        int capacity = capacity(settlement);
        if (settlement.getPopulation() == null) {
            logger.fine("Settlement " + settlement.getId() + " has no population state; starting empty");
            settlement.setPopulation(PopulationState.initial(0, capacity, now));
        }
        double happiness = happinessCalculator.calculate(settlement, capacity).total();
        return apply(settlement, happiness, capacity, now, random, events);
    }

    /**
     * Applies one population phase for an already computed happiness and capacity.
     */
    public PopulationState apply(Settlement settlement, double happiness, int capacity, long now, Random random,
                                 List<EngineEvent> events) {
        PopulationState previous = settlement.getPopulation() == null
            ? PopulationState.initial(0, capacity, now)
            : settlement.getPopulation();
        String id = settlement.getId();
        int current = previous.current();

        if (current > capacity) {
            int overflow = current - capacity;
            current = capacity;
            events.add(EngineEvent.builder(EventType.POPULATION_WARNING, id, now)
                .with("warning", NO_HOUSING)
                .with("homeless", overflow)
                .build());
            events.add(EngineEvent.builder(EventType.SETTLER_DEPARTED, id, now)
                .with("count", overflow)
                .with("reason", NO_HOUSING)
                .build());
        } else if (capacity == 0) {
            events.add(EngineEvent.builder(EventType.POPULATION_WARNING, id, now)
                .with("warning", NO_HOUSING)
                .with("homeless", 0)
                .build());
        }

        HappinessBand band = HappinessBand.of(happiness);
        double growthRate = growthRate(band, happiness, current, capacity);
        double hours = elapsedHours(previous, now);

        double progress = previous.growthProgress() + current * growthRate * hours;
        int whole = (int) progress;
        current += whole;
        progress -= whole;
        if (current >= capacity) {
            current = capacity;
            progress = Math.min(0.0, progress);
        }
        if (current <= 0) {
            current = 0;
            progress = Math.max(0.0, progress);
        }

        if (happiness >= IMMIGRATION_THRESHOLD && current < capacity) {
            double chance = immigrationChance(happiness, current, capacity);
            if (random.nextDouble() < chance) {
                int arrivals = IMMIGRATION_MIN + random.nextInt(IMMIGRATION_MAX - IMMIGRATION_MIN + 1);
                arrivals = Math.min(arrivals, capacity - current);
                current += arrivals;
                events.add(EngineEvent.builder(EventType.SETTLER_ARRIVED, id, now)
                    .with("count", arrivals)
                    .with("happiness", happiness)
                    .build());
            }
        }

        boolean emigrated = false;
        double emigrationChance = emigrationChance(happiness, current);
        if (emigrationChance > 0 && random.nextDouble() < emigrationChance) {
            int departures = EMIGRATION_MIN + random.nextInt(EMIGRATION_MAX - EMIGRATION_MIN + 1);
            departures = Math.min(departures, (int) Math.floor(current * EMIGRATION_MAX_SHARE));
            if (departures > 0) {
                current -= departures;
                emigrated = true;
                events.add(EngineEvent.builder(EventType.SETTLER_DEPARTED, id, now)
                    .with("count", departures)
                    .with("reason", "emigration")
                    .build());
            }
        }

        if (happiness < EMIGRATION_THRESHOLD) {
            events.add(EngineEvent.builder(EventType.POPULATION_WARNING, id, now)
                .with("warning", LOW_HAPPINESS)
                .with("happiness", happiness)
                .build());
        }
        if (emigrated || emigrationChance > EMIGRATION_RISK_CHANCE) {
            events.add(EngineEvent.builder(EventType.POPULATION_WARNING, id, now)
                .with("warning", EMIGRATION_RISK)
                .with("emigrationChance", emigrationChance)
                .build());
        }

        current = Math.max(0, Math.min(capacity, current));
        PopulationState next = new PopulationState(current, capacity, happiness, growthRate, band.status(),
            progress, now);
        settlement.setPopulation(next);

        if (current != previous.current()) {
            logger.fine("Settlement " + id + " population " + previous.current() + " -> " + current);
            events.add(EngineEvent.builder(EventType.POPULATION_GROWTH, id, now)
                .with("previous", previous.current())
                .with("current", current)
                .with("capacity", capacity)
                .with("happiness", happiness)
                .with("growthRate", growthRate)
                .with("status", band.status().label())
                .with("band", band.label())
                .build());
        }
        return next;
    }

    /**
     * Fraction of the population gained per hour; negative when declining.
     */
    public static double growthRate(HappinessBand band, double happiness, int current, int capacity) {
        double capacityFactor = capacity <= 0 ? 0.0 : Math.max(0.0, 1.0 - (double) current / capacity);
        switch (band) {
            case VERY_HAPPY:
                return BASE_GROWTH_RATE * (2.0 + (happiness - 80.0) / 10.0) * capacityFactor;
            case HAPPY:
                return BASE_GROWTH_RATE * (1.0 + (happiness - 60.0) / 20.0) * capacityFactor;
            case CONTENT:
                return 0.0;
            case UNHAPPY:
                return -BASE_GROWTH_RATE * (40.0 - happiness) / 40.0;
            case VERY_UNHAPPY:
            default:
                return -BASE_GROWTH_RATE * (0.5 + (20.0 - happiness) / 40.0);
        }
    }

    static double immigrationChance(double happiness, int current, int capacity) {
        if (capacity <= 0 || current >= capacity || happiness < IMMIGRATION_THRESHOLD) {
            return 0.0;
        }
        double happinessFactor = (happiness - IMMIGRATION_THRESHOLD) / (100.0 - IMMIGRATION_THRESHOLD);
        return IMMIGRATION_BASE_CHANCE * happinessFactor * (1.0 - (double) current / capacity);
    }

    static double emigrationChance(double happiness, int current) {
        if (current <= 1 || happiness > EMIGRATION_THRESHOLD) {
            return 0.0;
        }
        return EMIGRATION_BASE_CHANCE * (EMIGRATION_THRESHOLD - happiness) / EMIGRATION_THRESHOLD;
    }

    private static double elapsedHours(PopulationState previous, long now) {
        if (previous.lastUpdatedAt() <= 0 || now <= previous.lastUpdatedAt()) {
            return 1.0;
        }
        double hours = (now - previous.lastUpdatedAt()) / 3_600_000.0;
        return Math.min(MAX_CATCH_UP_HOURS, hours);
    }
}
