package de.entwicklertraining.http.pipeline.retry;

import de.entwicklertraining.http.pipeline.backoff.Backoff;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable retry configuration of a request.
 * <p>
 * Example usage:
 * <pre>
 * RetryConfig config = RetryConfig.builder()
 *     .maxAttempts(5)
 *     .backoff(Backoff.constant(Duration.ofMillis(200), false))
 *     .trigger(RetryTrigger.serverErrors())
 *     .build();
 * request.enableRetry(config);
 * </pre>
 * <p>
 * {@code maxAttempts} counts retries, not attempts: a request with {@code maxAttempts = 3}
 * is sent at most four times.
 */
public final class RetryConfig {

    /** Default number of retries */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final RetryConfig DEFAULTS = builder().build();

    private final int maxAttempts;
    private final Backoff backoff;
    private final List<RetryTrigger> triggers;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoff = builder.backoff;
        this.triggers = Collections.unmodifiableList(new ArrayList<>(builder.triggers));
    }

    /**
     * Gets the default configuration: 3 retries, exponential backoff from 1s capped at 30s
     * with jitter, retrying transport failures and 429 responses.
     *
     * @return the default configuration
     */
    public static RetryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Gets the maximum number of retries after the first attempt.
     *
     * @return the retry count
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Gets the backoff strategy.
     *
     * @return the backoff
     */
    public Backoff getBackoff() {
        return backoff;
    }

    /**
     * Gets the configured triggers. An empty list means {@link RetryTrigger#defaultTrigger()}.
     *
     * @return the triggers
     */
    public List<RetryTrigger> getTriggers() {
        return triggers;
    }

    /**
     * Creates a new builder pre-populated with this configuration.
     *
     * @return a builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder().maxAttempts(maxAttempts).backoff(backoff);
        builder.triggers.addAll(triggers);
        return builder;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RetryConfig}.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Backoff backoff = Backoff.exponential(Duration.ofSeconds(1), Duration.ofSeconds(30), true);
        private final List<RetryTrigger> triggers = new ArrayList<>();

        private Builder() {}

        /**
         * Sets the maximum number of retries.
         *
         * @param maxAttempts the retry count (must be &gt;= 0)
         * @return this builder
         * @throws IllegalArgumentException if maxAttempts is negative
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the backoff strategy.
         *
         * @param backoff the backoff
         * @return this builder
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Adds a trigger. Triggers are or-combined.
         *
         * @param trigger the trigger
         * @return this builder
         */
        public Builder trigger(RetryTrigger trigger) {
            this.triggers.add(Objects.requireNonNull(trigger, "trigger"));
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable configuration
         */
        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
