package io.apiary.core.retry;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;

/**
 * Clamped exponential backoff: the wait after attempt {@code n} is
 * {@code min(max(multiplier * 2^(n-1), min), max)}.
 *
 * <p>
 * With the defaults (multiplier 1s, min 2s, max 10s) the waits are 2s, 2s, 4s, 8s, 10s, 10s...
 */
public final class ExponentialWait implements IntervalFunction {

    private final long multiplierMillis;
    private final long minMillis;
    private final long maxMillis;

    private ExponentialWait(Duration multiplier, Duration min, Duration max) {
        if (multiplier.isNegative() || min.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Backoff min " + min + " exceeds max " + max);
        }
        this.multiplierMillis = multiplier.toMillis();
        this.minMillis = min.toMillis();
        this.maxMillis = max.toMillis();
    }

    public static ExponentialWait of(Duration multiplier, Duration min, Duration max) {
        return new ExponentialWait(multiplier, min, max);
    }

    @Override
    public Long apply(Integer attempt) {
        int exponent = Math.max(0, attempt - 1);
        double raw = multiplierMillis * Math.pow(2, exponent);
        double clamped = Math.min(Math.max(raw, minMillis), maxMillis);
        return (long) clamped;
    }
}
