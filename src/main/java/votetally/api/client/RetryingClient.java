package votetally.api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP caller that re-issues a request while the server answers with a
 * retryable status or the connection fails, waiting with exponential backoff
 * in between. Attempts run one after another on the calling thread.
 *
 * <p>Status failures and connection failures draw on separate budgets: a call
 * gets {@link RetrySettings#maxAttempts()} attempts for retryable statuses and,
 * independently, {@link RetrySettings#connectRetries()} retries for connection
 * errors. Any other response is returned as is on the first attempt.
 *
 * <p>Requests are not made idempotent: a retried vote submission that reached
 * the server before failing is recorded again under a new voter id.
 */
public class RetryingClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingClient.class);

    private final RestClient restClient;
    private final RetrySettings settings;
    private final RetryTemplate retryTemplate;

    public RetryingClient(RestClient restClient, RetrySettings settings) {
        this(restClient, settings, new ThreadWaitSleeper());
    }

    public RetryingClient(RestClient restClient, RetrySettings settings, Sleeper sleeper) {
        this.restClient = restClient;
        this.settings = settings;
        this.retryTemplate = buildRetryTemplate(settings, sleeper);
    }

    public static RetryingClient create(String baseUrl, Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        RestClient restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
        return new RetryingClient(restClient, RetrySettings.defaults());
    }

    public ResponseEntity<String> get(String path) {
        return exchange(HttpMethod.GET, path, null, null);
    }

    public ResponseEntity<String> postForm(String path, MultiValueMap<String, String> form) {
        return exchange(HttpMethod.POST, path, form, MediaType.APPLICATION_FORM_URLENCODED);
    }

    /**
     * Sends the request until it succeeds or the retry budget runs out.
     *
     * @return the first response whose status is not retryable
     * @throws RetriesExhaustedException if every permitted attempt failed
     */
    public ResponseEntity<String> exchange(
            HttpMethod method,
            String path,
            @Nullable Object body,
            @Nullable MediaType contentType
    ) {
        if (!settings.isRetryable(method)) {
            return attempt(method, path, body, contentType, false);
        }

        String request = method + " " + path;
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retryTemplate.execute(context -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    log.debug("Retrying {} (attempt {}): {}", request, attempt,
                            context.getLastThrowable().getMessage());
                }
                return attempt(method, path, body, contentType, true);
            });
        } catch (RetryableStatusException e) {
            int status = e.getResponse().getStatusCode().value();
            log.warn("{} gave up after {} attempts, last status {}", request, attempts.get(), status);
            throw new RetriesExhaustedException(request, attempts.get(), status, e);
        } catch (ResourceAccessException e) {
            log.warn("{} gave up after {} attempts: {}", request, attempts.get(), e.getMessage());
            throw new RetriesExhaustedException(request, attempts.get(), null, e);
        }
    }

    private ResponseEntity<String> attempt(
            HttpMethod method,
            String path,
            @Nullable Object body,
            @Nullable MediaType contentType,
            boolean retryOnStatus
    ) {
        RestClient.RequestBodySpec call = restClient.method(method).uri(path);
        if (body != null) {
            if (contentType != null) {
                call.contentType(contentType);
            }
            call.body(body);
        }

        return call.exchange((req, response) -> {
            ResponseEntity<String> entity = ResponseEntity.status(response.getStatusCode())
                    .headers(response.getHeaders())
                    .body(response.bodyTo(String.class));
            if (retryOnStatus && settings.isRetryable(entity.getStatusCode().value())) {
                throw new RetryableStatusException(entity);
            }
            return entity;
        });
    }

    private static RetryTemplate buildRetryTemplate(RetrySettings settings, Sleeper sleeper) {
        Map<Class<? extends Throwable>, RetryPolicy> policies = new HashMap<>();
        policies.put(RetryableStatusException.class,
                new SimpleRetryPolicy(settings.maxAttempts(), Map.of(RetryableStatusException.class, true)));
        policies.put(ResourceAccessException.class, connectPolicy(settings.connectRetries()));

        ExceptionClassifierRetryPolicy retryPolicy = new ExceptionClassifierRetryPolicy();
        retryPolicy.setPolicyMap(policies);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(settings.initialBackoff().toMillis());
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(settings.maxBackoff().toMillis());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }

    private static RetryPolicy connectPolicy(int connectRetries) {
        if (connectRetries == 0) {
            return new NeverRetryPolicy();
        }
        return new SimpleRetryPolicy(connectRetries + 1, Map.of(ResourceAccessException.class, true));
    }
}
