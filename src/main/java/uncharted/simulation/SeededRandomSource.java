package uncharted.simulation;

import java.util.Random;

/**
 * Reproducible randomness: the same seed, settlement and second always give the same sequence,
 * whichever worker thread processes the settlement.
 */
public class SeededRandomSource implements RandomSource {

    private final long seed;

    public SeededRandomSource(long seed) {
        this.seed = seed;
    }

    @Override
    public Random forSettlement(String settlementId, long epochSecond) {
        long mixed = seed;
        mixed = 31 * mixed + settlementId.hashCode();
        mixed = 31 * mixed + Long.hashCode(epochSecond);
        return new Random(mixed);
    }

    public long seed() {
        return seed;
    }
}
