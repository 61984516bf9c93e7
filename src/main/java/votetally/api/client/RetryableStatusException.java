package votetally.api.client;

import org.springframework.http.ResponseEntity;

/**
 * Signals a response whose status is worth another attempt. Only thrown
 * inside {@link RetryingClient}'s retry loop.
 */
class RetryableStatusException extends RuntimeException {

    private final transient ResponseEntity<String> response;

    RetryableStatusException(ResponseEntity<String> response) {
        super("Retryable status " + response.getStatusCode().value());
        this.response = response;
    }

    ResponseEntity<String> getResponse() {
        return response;
    }
}
