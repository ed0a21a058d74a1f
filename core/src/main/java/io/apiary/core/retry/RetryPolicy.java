package io.apiary.core.retry;

import io.apiary.core.error.HttpStatusException;
import io.apiary.core.error.TransportException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Retry defaults for brokers with backoff enabled, and the factory that turns
 * {@link RetryOptions} into a Resilience4j {@link Retry}.
 *
 * <p>
 * Retried by default: HTTP 429 and 5xx, plus connect failures, read timeouts, write failures,
 * malformed responses and pool timeouts. Everything else, including other 4xx statuses and
 * validation errors, fails on the first attempt.
 *
 * <p>
 * Attempts are counted at the broker level. The JDK client itself resends an idempotent
 * request (GET) once when the connection drops before a response arrives, so three broker
 * attempts of a GET can open six connections. POSTs are never resent by the client.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public static final IntervalFunction DEFAULT_WAIT =
            ExponentialWait.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(10));

    public static final Predicate<Throwable> DEFAULT_RETRY_ON = RetryPolicy::isRetryable;

    private static final Set<TransportException.Kind> RETRYABLE_KINDS = EnumSet.of(
            TransportException.Kind.CONNECT,
            TransportException.Kind.READ_TIMEOUT,
            TransportException.Kind.WRITE,
            TransportException.Kind.PROTOCOL,
            TransportException.Kind.POOL_TIMEOUT);

    private static final int TOO_MANY_REQUESTS = 429;

    private RetryPolicy() {
        // utility class
    }

    /** The default retry predicate. Future wrappers are looked through. */
    public static boolean isRetryable(Throwable error) {
        Throwable actual = unwrap(error);
        if (actual instanceof HttpStatusException statusError) {
            int status = statusError.statusCode();
            return status == TOO_MANY_REQUESTS || (status >= 500 && status < 600);
        }
        if (actual instanceof TransportException transportError) {
            return RETRYABLE_KINDS.contains(transportError.kind());
        }
        return false;
    }

    /**
     * Builds a {@link Retry} for one call, filling every field not set in {@code options}
     * from the defaults.
     *
     * @param name    instance name, used in Resilience4j events
     * @param options per-call overrides; {@code null} means none
     */
    public static Retry forCall(String name, RetryOptions options) {
        RetryOptions effective = options == null ? RetryOptions.DEFAULTS : options;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(effective.maxAttempts() != null ? effective.maxAttempts() : DEFAULT_MAX_ATTEMPTS)
                .intervalFunction(effective.backoff() != null ? effective.backoff() : DEFAULT_WAIT)
                .retryOnException(effective.retryOn() != null ? effective.retryOn() : DEFAULT_RETRY_ON)
                .build();
        return Retry.of(name, config);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
