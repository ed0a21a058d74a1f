package io.apiary.core.retry;

import io.github.resilience4j.core.IntervalFunction;
import java.util.function.Predicate;

/**
 * Per-call overrides for the retry policy. Any field left {@code null} falls back to the
 * default from {@link RetryPolicy}.
 *
 * @param retryOn     decides whether a failure is retried
 * @param maxAttempts total attempts including the first one
 * @param backoff     delay before each retry, keyed by the attempt that just failed
 */
public record RetryOptions(Predicate<Throwable> retryOn, Integer maxAttempts, IntervalFunction backoff) {

    /** No overrides. */
    public static final RetryOptions DEFAULTS = new RetryOptions(null, null, null);

    public RetryOptions {
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RetryOptions}. */
    public static final class Builder {
        private Predicate<Throwable> retryOn;
        private Integer maxAttempts;
        private IntervalFunction backoff;

        Builder() {}

        public Builder retryOn(Predicate<Throwable> retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(IntervalFunction backoff) {
            this.backoff = backoff;
            return this;
        }

        public RetryOptions build() {
            return new RetryOptions(retryOn, maxAttempts, backoff);
        }
    }
}
