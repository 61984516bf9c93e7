package votetally.api.client;

import org.springframework.lang.Nullable;
import votetally.api.dto.ApiError;

/**
 * The vote API answered with a non-2xx status that is not retried.
 */
public class VoteApiException extends RuntimeException {

    private final int status;
    private final ApiError error;

    public VoteApiException(int status, @Nullable ApiError error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    public int getStatus() {
        return status;
    }

    @Nullable
    public ApiError getError() {
        return error;
    }
}
