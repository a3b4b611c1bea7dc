package uncharted.repository;

/**
 * A settlement could not be read from or written to the store. The settlement's persisted
 * state is unchanged when this is thrown from a save.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
