package de.entwicklertraining.http.pipeline.retry;

import de.entwicklertraining.http.pipeline.HttpPipelineClient;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.Response;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;

/**
 * Applies a {@link RetryConfig} to one call.
 * <p>
 * A retrier is stateless; the attempt counter belongs to the executing call and is
 * passed in on every decision.
 */
public final class Retrier {
    private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

    private static final RetryTrigger DEFAULT_TRIGGER = RetryTrigger.defaultTrigger();

    private final RetryConfig config;

    /**
     * Creates a retrier for the given configuration.
     *
     * @param config the retry configuration
     */
    public Retrier(RetryConfig config) {
        this.config = config;
    }

    /**
     * Gets the configuration this retrier applies.
     *
     * @return the retry configuration
     */
    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Makes the request body replayable before the first attempt.
     * <p>
     * A body without a supplier is read into memory once and replaced by an in-memory
     * copy, so every attempt sends identical bytes. Nothing happens if retry is disabled
     * ({@code maxAttempts == 0}), the request has no body or the body is already replayable.
     *
     * @param request the request about to be executed
     * @throws HttpPipelineClient.RequestPreparationException if the body cannot be read
     */
    public void prepareRequest(Request request) {
        if (config.getMaxAttempts() <= 0 || !request.hasBody() || request.getBodySupplier() != null) {
            return;
        }
        byte[] captured;
        try (InputStream body = request.getBody()) {
            captured = body.readAllBytes();
        } catch (IOException e) {
            throw new HttpPipelineClient.RequestPreparationException(
                    "Failed to capture request body for retry: " + e.getMessage(), e);
        }
        logger.debug("Captured {} byte request body of {} for replay", captured.length, request);
        request.setContent(captured);
    }

    /**
     * Decides whether another attempt should be made.
     *
     * @param context the cancellation context of the call
     * @param attemptNum zero-based number of the attempt that just finished
     * @param response the response of that attempt, or null
     * @param error the failure of that attempt, or null
     * @return true if the call should back off and try again
     */
    public boolean shouldRetry(CancellationContext context, int attemptNum, Response response, Throwable error) {
        if (context.isCancelled() || attemptNum >= config.getMaxAttempts()) {
            return false;
        }
        List<RetryTrigger> triggers = config.getTriggers();
        if (triggers.isEmpty()) {
            return DEFAULT_TRIGGER.test(response, error);
        }
        for (RetryTrigger trigger : triggers) {
            if (trigger.test(response, error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Computes the wait before the next attempt.
     *
     * @param attemptNum zero-based number of the attempt that just finished
     * @param response the response of that attempt, or null
     * @param error the failure of that attempt, or null
     * @return the wait duration
     */
    public Duration backoff(int attemptNum, Response response, Throwable error) {
        Duration wait = config.getBackoff().waitDuration(attemptNum, response, error);
        return wait == null || wait.isNegative() ? Duration.ZERO : wait;
    }
}
