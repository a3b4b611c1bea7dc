package uncharted.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * In-memory storage for tests and local runs.
 * Failures can be injected with a probability drawn from a seeded Random, which keeps
 * failure scenarios reproducible.
 */
public class SimulatedStorage implements Storage {
    private static final Logger logger = Logger.getLogger(SimulatedStorage.class.getName());

    private final ConcurrentSkipListMap<BytesKey, VersionedValue> dataStore = new ConcurrentSkipListMap<>();
    private final Random random;
    private volatile double writeFailureProbability;
    private volatile double readFailureProbability;

    public SimulatedStorage(Random random) {
        this(random, 0.0, 0.0);
    }

    public SimulatedStorage(Random random, double writeFailureProbability, double readFailureProbability) {
        if (random == null) {
            throw new IllegalArgumentException("Random generator cannot be null");
        }
        validateProbability(writeFailureProbability);
        validateProbability(readFailureProbability);
        this.random = random;
        this.writeFailureProbability = writeFailureProbability;
        this.readFailureProbability = readFailureProbability;
    }

    private static void validateProbability(double probability) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Failure probability must be between 0.0 and 1.0");
        }
    }

    public void setWriteFailureProbability(double probability) {
        validateProbability(probability);
        this.writeFailureProbability = probability;
    }

    public void setReadFailureProbability(double probability) {
        validateProbability(probability);
        this.readFailureProbability = probability;
    }

    @Override
    public VersionedValue get(byte[] key) {
        BytesKey bytesKey = new BytesKey(key);
        if (shouldFail(readFailureProbability)) {
            logger.fine("Simulated read failure for " + bytesKey);
            throw new StorageException("Simulated read failure for " + bytesKey);
        }
        return dataStore.get(bytesKey);
    }

    @Override
    public void set(byte[] key, VersionedValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        BytesKey bytesKey = new BytesKey(key);
        if (shouldFail(writeFailureProbability)) {
            logger.fine("Simulated write failure for " + bytesKey);
            throw new StorageException("Simulated write failure for " + bytesKey);
        }
        dataStore.put(bytesKey, value);
    }

    @Override
    public synchronized void setAll(Map<BytesKey, VersionedValue> entries) {
        if (shouldFail(writeFailureProbability)) {
            throw new StorageException("Simulated batch write failure for " + entries.size() + " keys");
        }
        dataStore.putAll(entries);
    }

    @Override
    public void delete(byte[] key) {
        if (shouldFail(writeFailureProbability)) {
            throw new StorageException("Simulated delete failure for " + new BytesKey(key));
        }
        dataStore.remove(new BytesKey(key));
    }

    @Override
    public List<BytesKey> keysWithPrefix(byte[] prefix) {
        List<BytesKey> keys = new ArrayList<>();
        for (BytesKey key : dataStore.tailMap(new BytesKey(prefix), true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    public int size() {
        return dataStore.size();
    }

    private boolean shouldFail(double probability) {
        if (probability <= 0.0) {
            return false;
        }
        synchronized (random) {
            return random.nextDouble() < probability;
        }
    }
}
