package uncharted.storage;

import java.util.Arrays;

/**
 * A stored value together with the document version that produced it.
 * Versions start at 1 and grow by one on every successful save.
 */
public record VersionedValue(byte[] value, long version) {

    public VersionedValue {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionedValue that)) return false;
        return version == that.version && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(value) + Long.hashCode(version);
    }

    @Override
    public String toString() {
        return "VersionedValue{bytes=" + value.length + ", version=" + version + "}";
    }
}
