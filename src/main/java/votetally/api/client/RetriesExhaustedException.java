package votetally.api.client;

/**
 * Terminal failure of a {@link RetryingClient} call: every permitted attempt
 * failed with a retryable status or a connection error.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;
    private final Integer lastStatus;

    public RetriesExhaustedException(String request, int attempts, Integer lastStatus, Throwable cause) {
        super(request + " failed after " + attempts + " attempts"
                + (lastStatus != null ? " (last status " + lastStatus + ")" : ""), cause);
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Status of the final response, or {@code null} if the last attempt never got one.
     */
    public Integer getLastStatus() {
        return lastStatus;
    }
}
