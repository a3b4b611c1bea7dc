package uncharted.storage;

import java.util.List;
import java.util.Map;

/**
 * Interface for key-value storage operations used by the repositories.
 * Calls are synchronous: each settlement is processed on its own worker thread and a
 * write is short and atomic, so callers simply block until it completes.
 * Implementations must be safe for concurrent use from several workers.
 */
public interface Storage extends AutoCloseable {

    /**
     * Retrieves a value for the given key.
     *
     * @param key the key to retrieve
     * @return the versioned value, or null if not found
     * @throws StorageException if the read fails
     */
    VersionedValue get(byte[] key);

    /**
     * Stores a value for the given key.
     *
     * @param key the key to store
     * @param value the versioned value to store
     * @throws StorageException if the write fails; nothing is written in that case
     */
    void set(byte[] key, VersionedValue value);

    /**
     * Stores all given entries as one atomic write: either every entry is visible afterwards
     * or none is.
     *
     * @throws StorageException if the write fails
     */
    void setAll(Map<BytesKey, VersionedValue> entries);

    /**
     * Removes the value for the given key. Removing an absent key is not an error.
     */
    void delete(byte[] key);

    /**
     * Lists every key starting with the given prefix, in key order.
     */
    List<BytesKey> keysWithPrefix(byte[] prefix);

    @Override
    default void close() {
    }
}
