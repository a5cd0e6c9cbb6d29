package de.entwicklertraining.http.pipeline.backoff;

import de.entwicklertraining.http.pipeline.Response;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits {@code fib(attemptNum) * interval}, where fib is the zero-indexed sequence 1, 1, 2, 3, 5, 8, ...
 * <p>
 * The fibonacci multiplier is clamped to {@code maxValue} when that is positive. No jitter is applied.
 * Without a ceiling the wait saturates at {@link Long#MAX_VALUE} nanoseconds instead of overflowing.
 */
public final class FibonacciBackoff implements Backoff {

    private final int maxValue;
    private final Duration interval;

    /**
     * Creates a new fibonacci backoff.
     *
     * @param maxValue ceiling of the multiplier, values &lt;= 0 mean no ceiling
     * @param interval the unit multiplied by the fibonacci number
     */
    public FibonacciBackoff(int maxValue, Duration interval) {
        this.maxValue = maxValue;
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    @Override
    public Duration waitDuration(int attemptNum, Response response, Throwable error) {
        long a = 0;
        long b = 1;
        for (int i = attemptNum; i >= 0; i--) {
            if (maxValue > 0 && b >= maxValue) {
                a = maxValue;
                break;
            }
            if (b > Long.MAX_VALUE - a) {
                // saturated, later numbers cannot grow any further
                a = b;
                break;
            }
            long next = a + b;
            a = b;
            b = next;
        }
        long unitNanos = interval.toNanos();
        if (unitNanos > 0 && a > Long.MAX_VALUE / unitNanos) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(a * unitNanos);
    }

    @Override
    public String toString() {
        return "FibonacciBackoff{maxValue=" + maxValue + ", interval=" + interval + '}';
    }
}
