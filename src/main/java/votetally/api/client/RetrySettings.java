package votetally.api.client;

import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.Set;

/**
 * Retry policy for {@link RetryingClient}.
 *
 * @param maxAttempts       attempts allowed for retryable statuses, counting the first
 * @param connectRetries    retries allowed after connection failures, counted separately
 * @param initialBackoff    wait before the first retry; doubles on each further retry
 * @param maxBackoff        upper bound for a single wait
 * @param retryableStatuses statuses that trigger another attempt
 * @param retryableMethods  methods that may be retried at all
 */
public record RetrySettings(
        int maxAttempts,
        int connectRetries,
        Duration initialBackoff,
        Duration maxBackoff,
        Set<Integer> retryableStatuses,
        Set<HttpMethod> retryableMethods
) {
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    // POST is in the set on purpose: a retried submission may record a second vote.
    public static final Set<HttpMethod> DEFAULT_RETRYABLE_METHODS = Set.of(
            HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.PUT,
            HttpMethod.DELETE, HttpMethod.TRACE, HttpMethod.POST);

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (connectRetries < 0) {
            throw new IllegalArgumentException("connectRetries must not be negative: " + connectRetries);
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive: " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be below initialBackoff");
        }
        retryableStatuses = Set.copyOf(retryableStatuses);
        retryableMethods = Set.copyOf(retryableMethods);
    }

    public static RetrySettings defaults() {
        return new RetrySettings(
                10,
                10,
                Duration.ofMillis(300),
                Duration.ofSeconds(120),
                DEFAULT_RETRYABLE_STATUSES,
                DEFAULT_RETRYABLE_METHODS);
    }

    public RetrySettings withMaxAttempts(int maxAttempts) {
        return new RetrySettings(maxAttempts, connectRetries, initialBackoff, maxBackoff,
                retryableStatuses, retryableMethods);
    }

    public RetrySettings withConnectRetries(int connectRetries) {
        return new RetrySettings(maxAttempts, connectRetries, initialBackoff, maxBackoff,
                retryableStatuses, retryableMethods);
    }

    public boolean isRetryable(HttpMethod method) {
        return retryableMethods.contains(method);
    }

    public boolean isRetryable(int status) {
        return retryableStatuses.contains(status);
    }
}
