package de.entwicklertraining.http.pipeline.backoff;

import de.entwicklertraining.http.pipeline.Response;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the wait after every failed attempt, bounded by a maximum interval.
 * <p>
 * The un-jittered wait is {@code min(maxInterval, baseInterval * 2^attemptNum)}. With jitter
 * enabled the wait is drawn uniformly from {@code [value/2, value)}, so the bound holds either way.
 * See <a href="https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/">Exponential Backoff And Jitter</a>.
 */
public final class ExponentialBackoff implements Backoff {

    private final long baseNanos;
    private final long maxNanos;
    private final boolean jitter;

    /**
     * Creates a new exponential backoff.
     *
     * @param baseInterval the wait after the first failed attempt
     * @param maxInterval the upper bound of every wait
     * @param jitter whether to randomise the wait
     * @throws IllegalArgumentException if an interval is negative
     */
    public ExponentialBackoff(Duration baseInterval, Duration maxInterval, boolean jitter) {
        Objects.requireNonNull(baseInterval, "baseInterval");
        Objects.requireNonNull(maxInterval, "maxInterval");
        if (baseInterval.isNegative() || maxInterval.isNegative()) {
            throw new IllegalArgumentException("Intervals must not be negative");
        }
        this.baseNanos = baseInterval.toNanos();
        this.maxNanos = maxInterval.toNanos();
        this.jitter = jitter;
    }

    @Override
    public Duration waitDuration(int attemptNum, Response response, Throwable error) {
        double exponent = Math.max(0, attemptNum);
        long value = (long) Math.min((double) maxNanos, baseNanos * Math.pow(2, exponent));
        if (!jitter) {
            return Duration.ofNanos(value);
        }
        long half = value / 2;
        if (half <= 0) {
            return Duration.ofNanos(value);
        }
        return Duration.ofNanos(half + ThreadLocalRandom.current().nextLong(half));
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{base=" + Duration.ofNanos(baseNanos)
                + ", max=" + Duration.ofNanos(maxNanos) + ", jitter=" + jitter + '}';
    }
}
