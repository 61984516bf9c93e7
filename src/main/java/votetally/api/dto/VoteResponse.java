package votetally.api.dto;

import votetally.api.domain.VoteRecord;

public record VoteResponse(
        String voterId,
        String choice
) {
    public static VoteResponse from(VoteRecord record) {
        return new VoteResponse(record.voterId(), record.choice());
    }
}
