package votetally.api.repository;

import votetally.api.domain.TallyResult;
import votetally.api.domain.VoteRecord;

/**
 * Persistence for accepted votes. Implementations are chosen once at startup
 * and must be safe for concurrent use.
 */
public interface StorageBackend {

    /**
     * Persists one record as a new, distinct entry.
     *
     * @throws StorageException if the store is unreachable or rejects the record
     */
    void write(VoteRecord record);

    /**
     * Counts votes per choice. Includes every write that returned before this
     * call started.
     *
     * @throws StorageException if the store is unreachable
     */
    TallyResult tally();
}
