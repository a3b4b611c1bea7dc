package uncharted.repository;

import uncharted.settlement.Settlement;

import java.util.List;
import java.util.Optional;

/**
 * Read/write-by-id access to settlement aggregates.
 * The engine never depends on how or where the aggregates are stored.
 */
public interface SettlementRepository {

    /**
     * Loads a settlement.
     *
     * @return a private copy of the settlement, or empty if no settlement has this id
     * @throws ValidationException if the stored document is malformed
     * @throws PersistenceException if the store cannot be read
     */
    Optional<Settlement> findById(String settlementId);

    /**
     * Writes the whole aggregate in one atomic operation and bumps its version.
     *
     * @throws ValidationException if the aggregate breaks an invariant; nothing is written
     * @throws PersistenceException if the write fails or the settlement changed since it was loaded
     */
    void save(Settlement settlement);

    /**
     * Lists the ids of all settlements, in id order.
     *
     * @throws PersistenceException if the store cannot be read
     */
    List<String> listIds();

    void delete(String settlementId);
}
