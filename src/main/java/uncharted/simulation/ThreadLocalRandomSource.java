package uncharted.simulation;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public Random forSettlement(String settlementId, long epochSecond) {
        return ThreadLocalRandom.current();
    }
}
