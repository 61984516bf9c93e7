package votetally.api.repository;

import com.fasterxml.jackson.annotation.JsonProperty;
import votetally.api.domain.VoteRecord;

/**
 * Message shape pushed onto the vote queue and read back by the drainer.
 */
public record QueuedVote(
        @JsonProperty("voter_id") String voterId,
        @JsonProperty("vote") String vote
) {
    public static QueuedVote from(VoteRecord record) {
        return new QueuedVote(record.voterId(), record.choice());
    }
}
