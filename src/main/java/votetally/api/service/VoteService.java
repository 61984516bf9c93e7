package votetally.api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import votetally.api.domain.TallyResult;
import votetally.api.domain.VoteRecord;
import votetally.api.repository.StorageBackend;
import votetally.api.repository.StorageException;

import java.time.Instant;
import java.util.List;

@Service
public class VoteService {

    private static final Logger log = LoggerFactory.getLogger(VoteService.class);

    private final StorageBackend storageBackend;
    private final VoterIdGenerator voterIdGenerator;
    private final VoteEventListener listener;
    private final List<String> options;
    private final boolean enforceOptions;

    public VoteService(
            StorageBackend storageBackend,
            VoterIdGenerator voterIdGenerator,
            VoteEventListener listener,
            @Value("${app.vote.options:Cats,Dogs}") List<String> options,
            @Value("${app.vote.enforce-options:false}") boolean enforceOptions
    ) {
        this.storageBackend = storageBackend;
        this.voterIdGenerator = voterIdGenerator;
        this.listener = listener;
        this.options = List.copyOf(options);
        this.enforceOptions = enforceOptions;
        log.info("Vote options: {} (enforced={})", this.options, enforceOptions);
    }

    /**
     * Records one vote under a freshly generated voter id. Every call appends a
     * new record, even for a repeated choice.
     *
     * @param vote the submitted choice, stored verbatim; {@code null} when the field was absent
     * @throws InvalidVoteException if the field is missing, or the choice is not an
     *                              allowed option while enforcement is on
     * @throws StorageException     if the backend fails; never retried here
     */
    public VoteRecord submitVote(String vote) {
        if (vote == null) {
            listener.onRejected("missing vote field");
            throw new InvalidVoteException("Missing required field: vote");
        }

        if (enforceOptions && !options.contains(vote)) {
            listener.onRejected("choice not allowed: " + vote);
            throw new InvalidVoteException("Vote must be one of " + options);
        }

        VoteRecord record = new VoteRecord(voterIdGenerator.next(), vote, Instant.now());
        try {
            storageBackend.write(record);
        } catch (StorageException e) {
            listener.onStorageFailure("write", e);
            throw e;
        }

        listener.onAccepted(record);
        return record;
    }

    public TallyResult getTally() {
        try {
            return storageBackend.tally();
        } catch (StorageException e) {
            listener.onStorageFailure("tally", e);
            throw e;
        }
    }
}
