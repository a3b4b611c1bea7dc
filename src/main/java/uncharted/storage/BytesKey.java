package uncharted.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Content-compared wrapper around a byte[] key, ordered lexicographically (unsigned)
 * the same way RocksDB orders its keys.
 */
public record BytesKey(byte[] bytes) implements Comparable<BytesKey> {

    public BytesKey {
        if (bytes == null) {
            throw new IllegalArgumentException("Key bytes cannot be null");
        }
    }

    public static BytesKey of(String key) {
        return new BytesKey(key.getBytes(StandardCharsets.UTF_8));
    }

    public boolean startsWith(byte[] prefix) {
        if (prefix.length > bytes.length) {
            return false;
        }
        return Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    @Override
    public int compareTo(BytesKey other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytesKey that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
