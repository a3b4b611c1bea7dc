package uncharted.simulation;

import java.util.Random;

/**
 * Supplies the randomness for one settlement in one pass.
 */
public interface RandomSource {

    Random forSettlement(String settlementId, long epochSecond);
}
