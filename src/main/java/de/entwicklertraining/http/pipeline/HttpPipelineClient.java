package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException;
import de.entwicklertraining.http.pipeline.gate.ConcurrencyGate;
import de.entwicklertraining.http.pipeline.gate.RateLimitGate;
import de.entwicklertraining.http.pipeline.gate.TokenBucket;
import de.entwicklertraining.http.pipeline.transport.HttpTransport;
import de.entwicklertraining.http.pipeline.transport.JdkHttpTransport;
import de.entwicklertraining.http.pipeline.transport.OkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * HTTP client that runs every request through admission gates, retry with backoff,
 * transparent gzip decoding and optional connection timing traces.
 * <p>
 * A client is safe for concurrent use. Gates registered on it (rate limiting, maximum
 * concurrency) are shared by all requests of the client.
 * <p>
 * Example usage:
 * <pre>
 * HttpPipelineClient client = HttpPipelineClient.create();
 * client.setMaxConcurrency(8);
 * client.enableRateLimiting(new TokenBucket(10, 10));
 *
 * try (Response response = client.get("https://httpbin.org/get",
 *         RequestHooks.enableRetry(),
 *         RequestHooks.enableClientTrace())) {
 *     System.out.println(response.text());
 *     response.traceInfo().ifPresent(info -&gt; System.out.println(info.toJson()));
 * }
 * </pre>
 * All verb shortcuts route through the client they are called on.
 */
public class HttpPipelineClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpPipelineClient.class);

    /** The settings for this client */
    protected final HttpPipelineSettings settings;

    /** The network stack requests are sent with */
    protected final HttpTransport transport;

    private final List<RequestHook> beforeRequestCallbacks = new CopyOnWriteArrayList<>();
    private final List<ResponseHook> afterResponseCallbacks = new CopyOnWriteArrayList<>();
    private final RequestExecutor executor;

    /**
     * Creates a client with the given settings and transport.
     *
     * @param settings the client settings
     * @param transport the network stack
     */
    public HttpPipelineClient(HttpPipelineSettings settings, HttpTransport transport) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = new RequestExecutor(transport, beforeRequestCallbacks, afterResponseCallbacks);
    }

    /**
     * Creates a client with default settings.
     *
     * @return a new client on the JDK transport
     */
    public static HttpPipelineClient create() {
        return create(HttpPipelineSettings.defaults());
    }

    /**
     * Creates a client with the transport selected in the settings.
     *
     * @param settings the client settings
     * @return a new client
     */
    public static HttpPipelineClient create(HttpPipelineSettings settings) {
        HttpTransport transport = switch (settings.getTransportType()) {
            case JDK -> new JdkHttpTransport(settings);
            case OKHTTP -> new OkHttpTransport(settings);
        };
        return new HttpPipelineClient(settings, transport);
    }

    /**
     * Creates a client on an explicit transport with default settings.
     *
     * @param transport the network stack
     * @return a new client
     */
    public static HttpPipelineClient create(HttpTransport transport) {
        return new HttpPipelineClient(HttpPipelineSettings.defaults(), transport);
    }

    public HttpPipelineSettings getSettings() {
        return settings;
    }

    public HttpTransport getTransport() {
        return transport;
    }

    /**
     * Appends hooks that run before every request, in registration order.
     *
     * @param callbacks the hooks
     */
    public void registerBeforeRequestCallbacks(RequestHook... callbacks) {
        beforeRequestCallbacks.addAll(Arrays.asList(callbacks));
    }

    /**
     * Appends hooks that run once every call has its final outcome, in registration order.
     *
     * @param callbacks the hooks
     */
    public void registerAfterResponseCallbacks(ResponseHook... callbacks) {
        afterResponseCallbacks.addAll(Arrays.asList(callbacks));
    }

    /**
     * Registers a paired callback on both sides of the pipeline.
     *
     * @param callback the callback
     */
    public void registerExchangeCallback(ExchangeCallback callback) {
        registerBeforeRequestCallbacks(callback);
        registerAfterResponseCallbacks(callback);
    }

    /**
     * Limits the rate of outgoing requests. Requests wait for a token before they are sent.
     *
     * @param bucket the shared token bucket
     */
    public void enableRateLimiting(TokenBucket bucket) {
        registerBeforeRequestCallbacks(new RateLimitGate(bucket));
    }

    /**
     * Limits the number of requests in flight. Requests wait for a free slot before they are sent.
     *
     * @param n the maximum number of concurrent requests
     */
    public void setMaxConcurrency(int n) {
        registerExchangeCallback(new ConcurrencyGate(n));
    }

    /**
     * Dumps every request and response to the given stream, like {@code curl -v}.
     *
     * @param out the dump sink
     * @param body whether bodies are dumped too
     */
    public void enableDebugging(OutputStream out, boolean body) {
        registerExchangeCallback(new DebugCallback(out, body));
    }

    /**
     * Makes a GET request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response get(String url, RequestHook... hooks) {
        return send(Request.METHOD_GET, url, hooks);
    }

    /**
     * Makes a HEAD request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response head(String url, RequestHook... hooks) {
        return send(Request.METHOD_HEAD, url, hooks);
    }

    /**
     * Makes a POST request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response post(String url, RequestHook... hooks) {
        return send(Request.METHOD_POST, url, hooks);
    }

    /**
     * Makes a PUT request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response put(String url, RequestHook... hooks) {
        return send(Request.METHOD_PUT, url, hooks);
    }

    /**
     * Makes a PATCH request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response patch(String url, RequestHook... hooks) {
        return send(Request.METHOD_PATCH, url, hooks);
    }

    /**
     * Makes a DELETE request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response delete(String url, RequestHook... hooks) {
        return send(Request.METHOD_DELETE, url, hooks);
    }

    /**
     * Makes an OPTIONS request.
     *
     * @param url the URL
     * @param hooks applied to the request in order before it is executed
     * @return the response
     */
    public Response options(String url, RequestHook... hooks) {
        return send(Request.METHOD_OPTIONS, url, hooks);
    }

    /**
     * Makes a request with any method.
     *
     * @param method the HTTP method
     * @param url the URL
     * @param hooks applied to the request in order before it is executed; the first
     *              failing hook aborts the call
     * @return the response
     * @throws RequestPreparationException if the URL is malformed or a hook fails
     */
    public Response send(String method, String url, RequestHook... hooks) {
        Request request = Request.newRequest(method, url);
        for (RequestHook hook : hooks) {
            try {
                hook.enter(request);
            } catch (HttpPipelineException | RequestCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RequestPreparationException("Request hook failed: " + e.getMessage(), e);
            }
        }
        return execute(request);
    }

    /**
     * Executes a prepared request. Default headers from the settings are added where the
     * request does not set them.
     *
     * @param request the request
     * @return the final response; read or close its body
     * @throws RequestPreparationException if a callback rejects the request or its body cannot be captured
     * @throws TransportException if the last attempt failed on the network
     * @throws StreamException if a body could not be read or decoded
     * @throws RequestCancelledException if the request's context fired
     */
    public Response execute(Request request) {
        settings.getDefaultHeaders().forEach((name, value) -> {
            if (request.getHeader(name).isEmpty()) {
                request.setHeader(name, value);
            }
        });
        logger.debug("Executing {}", request);
        return executor.execute(request);
    }

    // ---------------------------------------
    // Exceptions
    // ---------------------------------------

    /**
     * Root of the pipeline's exceptions.
     * <p>
     * Cancellation is reported separately with
     * {@link de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException}.
     * Non-2xx responses are not exceptions; they are returned as responses.
     */
    public static class HttpPipelineException extends RuntimeException {
        /**
         * Creates a new HttpPipelineException with the specified detail message.
         *
         * @param message the detail message
         */
        public HttpPipelineException(String message) {
            super(message);
        }

        /**
         * Creates a new HttpPipelineException with the specified detail message and cause.
         *
         * @param message the detail message
         * @param cause the cause
         */
        public HttpPipelineException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The request could not be prepared: malformed URL, a hook rejected it or its body
     * could not be captured for replay. Never retried.
     */
    public static class RequestPreparationException extends HttpPipelineException {
        public RequestPreparationException(String message) {
            super(message);
        }

        public RequestPreparationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The transport failed before a response arrived: network, DNS, TLS or timeout.
     * Retried by the default retry policy.
     */
    public static class TransportException extends HttpPipelineException {
        public TransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A request or response body could not be read, copied or decoded.
     */
    public static class StreamException extends HttpPipelineException {
        public StreamException(String message) {
            super(message);
        }

        public StreamException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
