package uncharted.storage;

/**
 * Raised by a {@link Storage} implementation when a read or write cannot be completed.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
