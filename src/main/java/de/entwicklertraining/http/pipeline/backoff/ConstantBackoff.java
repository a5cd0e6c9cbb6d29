package de.entwicklertraining.http.pipeline.backoff;

import de.entwicklertraining.http.pipeline.Response;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Waits the same interval after every failed attempt.
 * <p>
 * With jitter enabled the wait is drawn uniformly from {@code [interval/2, interval/2 + interval)}.
 */
public final class ConstantBackoff implements Backoff {

    private final long intervalNanos;
    private final boolean jitter;

    /**
     * Creates a new constant backoff.
     *
     * @param interval the wait between attempts
     * @param jitter whether to randomise the wait
     * @throws IllegalArgumentException if interval is negative
     */
    public ConstantBackoff(Duration interval, boolean jitter) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
        this.intervalNanos = interval.toNanos();
        this.jitter = jitter;
    }

    @Override
    public Duration waitDuration(int attemptNum, Response response, Throwable error) {
        if (!jitter || intervalNanos == 0) {
            return Duration.ofNanos(intervalNanos);
        }
        return Duration.ofNanos(intervalNanos / 2 + ThreadLocalRandom.current().nextLong(intervalNanos));
    }

    @Override
    public String toString() {
        return "ConstantBackoff{interval=" + Duration.ofNanos(intervalNanos) + ", jitter=" + jitter + '}';
    }
}
