package uncharted.repository;

import uncharted.codec.CodecException;
import uncharted.codec.JsonCodec;
import uncharted.settlement.Settlement;
import uncharted.storage.BytesKey;
import uncharted.storage.Storage;
import uncharted.storage.StorageException;
import uncharted.storage.VersionedValue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Stores each settlement as one JSON document under {@code settlement:<id>}.
 * <p>
 * A save is a single put of the whole aggregate, so storage, population, queue and disaster
 * state always change together. Saves are optimistic: the document version must still be the
 * one the caller loaded, which keeps a player command and a simulation phase from overwriting
 * each other. Version checks are serialized per settlement id only.
 */
public class StorageSettlementRepository implements SettlementRepository {
    private static final Logger logger = Logger.getLogger(StorageSettlementRepository.class.getName());

    static final String KEY_PREFIX = "settlement:";

    private final Storage storage;
    private final JsonCodec codec;
    private final SettlementValidator validator;
    private final ConcurrentHashMap<String, Object> saveLocks = new ConcurrentHashMap<>();

    public StorageSettlementRepository(Storage storage, JsonCodec codec) {
        this(storage, codec, new SettlementValidator());
    }

    public StorageSettlementRepository(Storage storage, JsonCodec codec, SettlementValidator validator) {
        if (storage == null) {
            throw new IllegalArgumentException("Storage cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("Validator cannot be null");
        }
        this.storage = storage;
        this.codec = codec;
        this.validator = validator;
    }

    @Override
    public Optional<Settlement> findById(String settlementId) {
        VersionedValue value;
        try {
            value = storage.get(key(settlementId));
        } catch (StorageException e) {
            throw new PersistenceException("Failed to read settlement " + settlementId, e);
        }
        if (value == null) {
            return Optional.empty();
        }
        Settlement settlement;
        try {
            settlement = codec.decode(value.value(), Settlement.class);
        } catch (CodecException e) {
            throw new ValidationException(settlementId, "document cannot be decoded", e);
        }
        if (settlement.getId() != null && !settlement.getId().equals(settlementId)) {
            throw new ValidationException(settlementId, List.of("document id " + settlement.getId() + " does not match key"));
        }
        validator.validate(settlement);
        settlement.setVersion(value.version());
        return Optional.of(settlement);
    }

    @Override
    public void save(Settlement settlement) {
        validator.validate(settlement);
        String id = settlement.getId();
        Object lock = saveLocks.computeIfAbsent(id, k -> new Object());
        synchronized (lock) {
            try {
                VersionedValue current = storage.get(key(id));
                long storedVersion = current == null ? 0L : current.version();
                if (storedVersion != settlement.getVersion()) {
                    throw new PersistenceException("Settlement " + id + " was modified concurrently (expected version "
                        + settlement.getVersion() + ", found " + storedVersion + ")");
                }
                long nextVersion = storedVersion + 1;
                settlement.setVersion(nextVersion);
                try {
                    storage.set(key(id), new VersionedValue(codec.encode(settlement), nextVersion));
                } catch (RuntimeException e) {
                    settlement.setVersion(storedVersion);
                    throw e;
                }
            } catch (StorageException | CodecException e) {
                throw new PersistenceException("Failed to write settlement " + id, e);
            }
        }
        logger.fine("Saved settlement " + id + " at version " + settlement.getVersion());
    }

    @Override
    public List<String> listIds() {
        try {
            return storage.keysWithPrefix(KEY_PREFIX.getBytes(StandardCharsets.UTF_8)).stream()
                .map(key -> key.toString().substring(KEY_PREFIX.length()))
                .toList();
        } catch (StorageException e) {
            throw new PersistenceException("Failed to list settlements", e);
        }
    }

    @Override
    public void delete(String settlementId) {
        try {
            storage.delete(key(settlementId));
        } catch (StorageException e) {
            throw new PersistenceException("Failed to delete settlement " + settlementId, e);
        }
        saveLocks.remove(settlementId);
    }

    private static byte[] key(String settlementId) {
        return BytesKey.of(KEY_PREFIX + settlementId).bytes();
    }
}
