package uncharted.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Production storage backed by an embedded RocksDB database.
 * Values are stored as an 8-byte version followed by the document bytes.
 */
public class RocksDbStorage implements Storage {
    private static final Logger logger = Logger.getLogger(RocksDbStorage.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final String path;
    private final Options options;
    private final WriteOptions writeOptions;
    private final RocksDB db;

    public RocksDbStorage(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be null or blank");
        }
        this.path = path;
        File directory = new File(path);
        if (!directory.exists() && !directory.mkdirs()) {
            throw new StorageException("Could not create storage directory " + path);
        }
        this.options = new Options().setCreateIfMissing(true);
        this.writeOptions = new WriteOptions().setSync(true);
        try {
            this.db = RocksDB.open(options, path);
        } catch (RocksDBException e) {
            options.close();
            writeOptions.close();
            throw new StorageException("Failed to open RocksDB at " + path, e);
        }
        logger.info("Opened RocksDB storage at " + path);
    }

    @Override
    public VersionedValue get(byte[] key) {
        try {
            byte[] raw = db.get(key);
            return raw == null ? null : decodeValue(raw);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read key " + new BytesKey(key), e);
        }
    }

    @Override
    public void set(byte[] key, VersionedValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        try {
            db.put(writeOptions, key, encodeValue(value));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to write key " + new BytesKey(key), e);
        }
    }

    @Override
    public void setAll(Map<BytesKey, VersionedValue> entries) {
        try (WriteBatch batch = new WriteBatch()) {
            for (Map.Entry<BytesKey, VersionedValue> entry : entries.entrySet()) {
                batch.put(entry.getKey().bytes(), encodeValue(entry.getValue()));
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to write batch of " + entries.size() + " keys", e);
        }
    }

    @Override
    public void delete(byte[] key) {
        try {
            db.delete(writeOptions, key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to delete key " + new BytesKey(key), e);
        }
    }

    @Override
    public List<BytesKey> keysWithPrefix(byte[] prefix) {
        List<BytesKey> keys = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seek(prefix); iterator.isValid(); iterator.next()) {
                BytesKey key = new BytesKey(iterator.key());
                if (!key.startsWith(prefix)) {
                    break;
                }
                keys.add(key);
            }
        }
        return keys;
    }

    public String path() {
        return path;
    }

    @Override
    public void close() {
        db.close();
        writeOptions.close();
        options.close();
        logger.info("Closed RocksDB storage at " + path);
    }

    private static byte[] encodeValue(VersionedValue value) {
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES + value.value().length);
        buffer.putLong(value.version());
        buffer.put(value.value());
        return buffer.array();
    }

    private static VersionedValue decodeValue(byte[] raw) {
        if (raw.length < Long.BYTES) {
            throw new StorageException("Stored value is truncated (" + raw.length + " bytes)");
        }
        ByteBuffer buffer = ByteBuffer.wrap(raw);
        long version = buffer.getLong();
        byte[] value = new byte[raw.length - Long.BYTES];
        buffer.get(value);
        return new VersionedValue(value, version);
    }
}
