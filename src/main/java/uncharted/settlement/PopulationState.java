package uncharted.settlement;

/**
 * Population of a settlement as left by the last population phase.
 *
 * @param current settlers living in the settlement, 0..capacity
 * @param capacity housing capacity at the last update
 * @param happiness 0..100
 * @param growthRate fraction of the population gained (or lost, when negative) per hour
 * @param status band status derived from happiness
 * @param growthProgress fractional settlers carried over between population phases
 * @param lastUpdatedAt epoch millis of the last population phase
 */
public record PopulationState(int current,
                              int capacity,
                              double happiness,
                              double growthRate,
                              PopulationStatus status,
                              double growthProgress,
                              long lastUpdatedAt) {

    public static PopulationState initial(int current, int capacity, long now) {
        return new PopulationState(current, capacity, 50.0, 0.0, PopulationStatus.STABLE, 0.0, now);
    }

    public int remainingCapacity() {
        return Math.max(0, capacity - current);
    }
}
