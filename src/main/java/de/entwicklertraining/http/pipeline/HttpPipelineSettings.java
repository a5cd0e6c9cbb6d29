package de.entwicklertraining.http.pipeline;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of an {@link HttpPipelineClient} and the transport it creates.
 * This class provides a fluent builder API for configuration and sensible defaults for all settings.
 * <p>
 * Example usage:
 * <pre>
 * HttpPipelineSettings settings = HttpPipelineSettings.builder()
 *     .connectTimeout(Duration.ofSeconds(5))
 *     .requestTimeout(Duration.ofSeconds(30))
 *     .defaultHeader("User-Agent", "my-app/1.0")
 *     .transport(HttpPipelineSettings.TransportType.OKHTTP)
 *     .build();
 * HttpPipelineClient client = HttpPipelineClient.create(settings);
 * </pre>
 */
public final class HttpPipelineSettings {

    /**
     * The network stack a client sends requests with.
     */
    public enum TransportType {
        /** {@code java.net.http.HttpClient} */
        JDK,
        /** OkHttp, with full connection lifecycle tracing */
        OKHTTP
    }

    private static final HttpPipelineSettings DEFAULTS = builder().build();

    /** Maximum time to establish a connection */
    private final Duration connectTimeout;

    /** Maximum time for a single attempt, from sending until the response headers arrive */
    private final Duration requestTimeout;

    /** Whether redirects are followed by the transport */
    private final boolean followRedirects;

    /** Headers added to every request that does not set them itself */
    private final Map<String, String> defaultHeaders;

    private final TransportType transportType;

    private HttpPipelineSettings(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.followRedirects = builder.followRedirects;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.transportType = builder.transportType;
    }

    /**
     * Gets the default settings: 30s connect timeout, 120s request timeout, redirects
     * followed, no default headers, JDK transport.
     *
     * @return the default settings
     */
    public static HttpPipelineSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     *
     * @return a new Builder instance with current settings
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout)
                .followRedirects(followRedirects)
                .transport(transportType);
        defaultHeaders.forEach(builder::defaultHeader);
        return builder;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public TransportType getTransportType() {
        return transportType;
    }

    /**
     * Creates a new Builder instance with default settings.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for creating {@link HttpPipelineSettings} instances with a fluent API.
     */
    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(120);
        private boolean followRedirects = true;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private TransportType transportType = TransportType.JDK;

        /**
         * Creates a new Builder instance with default settings.
         */
        public Builder() {}

        /**
         * Sets the connect timeout.
         *
         * @param connectTimeout the timeout (must be positive)
         * @return this builder for method chaining
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Sets the per-attempt request timeout.
         *
         * @param requestTimeout the timeout (must be positive)
         * @return this builder for method chaining
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requirePositive(requestTimeout, "requestTimeout");
            return this;
        }

        /**
         * Enables or disables redirect following.
         *
         * @param followRedirects true to follow redirects
         * @return this builder for method chaining
         */
        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        /**
         * Adds a header that is sent with every request unless the request sets it.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder for method chaining
         */
        public Builder defaultHeader(String name, String value) {
            this.defaultHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Selects the network stack.
         *
         * @param transportType the transport
         * @return this builder for method chaining
         */
        public Builder transport(TransportType transportType) {
            this.transportType = Objects.requireNonNull(transportType, "transportType");
            return this;
        }

        /**
         * Builds the settings.
         *
         * @return a new immutable settings instance
         */
        public HttpPipelineSettings build() {
            return new HttpPipelineSettings(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return value;
        }
    }
}
