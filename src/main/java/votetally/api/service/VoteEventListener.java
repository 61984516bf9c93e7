package votetally.api.service;

import votetally.api.domain.VoteRecord;
import votetally.api.repository.StorageException;

/**
 * Called by {@link VoteService} after each submission or tally outcome.
 */
public interface VoteEventListener {

    void onAccepted(VoteRecord record);

    void onRejected(String reason);

    void onStorageFailure(String operation, StorageException failure);
}
