package votetally.api.domain;

import java.time.Instant;

/**
 * A single accepted vote. Never mutated once written.
 */
public record VoteRecord(
        String voterId,
        String choice,
        Instant createdAt
) {
}
