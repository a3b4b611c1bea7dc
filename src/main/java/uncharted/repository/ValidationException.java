package uncharted.repository;

import java.util.List;

/**
 * A settlement document is malformed: it failed to decode or broke one of the aggregate's
 * invariants.
 */
public class ValidationException extends RuntimeException {
    private final String settlementId;
    private final List<String> problems;

    public ValidationException(String settlementId, List<String> problems) {
        super("Settlement " + settlementId + " is invalid: " + String.join("; ", problems));
        this.settlementId = settlementId;
        this.problems = List.copyOf(problems);
    }

    public ValidationException(String settlementId, String problem, Throwable cause) {
        super("Settlement " + settlementId + " is invalid: " + problem, cause);
        this.settlementId = settlementId;
        this.problems = List.of(problem);
    }

    public String settlementId() {
        return settlementId;
    }

    public List<String> problems() {
        return problems;
    }
}
