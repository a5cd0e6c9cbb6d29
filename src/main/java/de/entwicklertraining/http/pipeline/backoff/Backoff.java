package de.entwicklertraining.http.pipeline.backoff;

import de.entwicklertraining.http.pipeline.Response;

import java.time.Duration;

/**
 * Computes how long a retrying request waits before its next attempt.
 * <p>
 * A backoff is called after a failed attempt with the zero-based number of that
 * attempt and the outcome it produced. Implementations are stateless apart from the
 * random source used for jitter and may be shared between concurrent requests.
 *
 * @see ConstantBackoff
 * @see ExponentialBackoff
 * @see FibonacciBackoff
 */
@FunctionalInterface
public interface Backoff {

    /**
     * Returns the duration to wait before retrying a request.
     *
     * @param attemptNum zero-based number of the attempt that just finished
     * @param response the response of that attempt, or null if it failed without one
     * @param error the error of that attempt, or null if it produced a response
     * @return the wait duration, never negative
     */
    Duration waitDuration(int attemptNum, Response response, Throwable error);

    /**
     * Creates a constant backoff.
     *
     * @param interval the wait between attempts
     * @param jitter whether to randomise the wait within [interval/2, interval/2 + interval)
     * @return a new constant backoff
     */
    static Backoff constant(Duration interval, boolean jitter) {
        return new ConstantBackoff(interval, jitter);
    }

    /**
     * Creates an exponential backoff bounded by maxInterval.
     *
     * @param baseInterval the wait after the first failed attempt
     * @param maxInterval the upper bound of every wait
     * @param jitter whether to randomise the wait within the upper half of the computed value
     * @return a new exponential backoff
     */
    static Backoff exponential(Duration baseInterval, Duration maxInterval, boolean jitter) {
        return new ExponentialBackoff(baseInterval, maxInterval, jitter);
    }

    /**
     * Creates a fibonacci backoff.
     *
     * @param maxValue ceiling of the fibonacci multiplier, values &lt;= 0 mean no ceiling
     * @param interval the unit multiplied by the fibonacci number
     * @return a new fibonacci backoff
     */
    static Backoff fibonacci(int maxValue, Duration interval) {
        return new FibonacciBackoff(maxValue, interval);
    }
}
