package votetally.api.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import votetally.api.domain.VoteRecord;
import votetally.api.repository.StorageException;

@Component
public class MeteredVoteEventListener implements VoteEventListener {

    private static final Logger log = LoggerFactory.getLogger(MeteredVoteEventListener.class);

    private final Counter acceptedCounter;
    private final Counter rejectedCounter;
    private final MeterRegistry registry;

    public MeteredVoteEventListener(
            @Qualifier("votesAcceptedCounter") Counter acceptedCounter,
            @Qualifier("votesRejectedCounter") Counter rejectedCounter,
            MeterRegistry registry
    ) {
        this.acceptedCounter = acceptedCounter;
        this.rejectedCounter = rejectedCounter;
        this.registry = registry;
    }

    @Override
    public void onAccepted(VoteRecord record) {
        acceptedCounter.increment();
        log.info("Vote accepted: voterId={}, choice={}", record.voterId(), record.choice());
    }

    @Override
    public void onRejected(String reason) {
        rejectedCounter.increment();
        log.debug("Vote rejected: {}", reason);
    }

    @Override
    public void onStorageFailure(String operation, StorageException failure) {
        registry.counter("votetally.storage.failures",
                "operation", operation,
                "kind", failure.getKind().name().toLowerCase()).increment();
        log.error("Storage failure during {} ({}): {}", operation, failure.getKind(), failure.getMessage());
    }
}
