package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.multipart.MultipartBody;
import de.entwicklertraining.http.pipeline.retry.RetryConfig;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable envelope of an outgoing HTTP request.
 * <p>
 * A request carries its method, URL, headers, an optional body, the cancellation
 * context observed by every blocking point of the pipeline and the optional retry
 * and trace configuration. Requests are not thread-safe; a request belongs to the
 * single {@link HttpPipelineClient#execute(Request)} call it is passed to.
 *
 * <p>Bodies come in two flavours:
 * <ul>
 *   <li>replayable bodies ({@link #setContent(byte[])}, {@link #setText(String)}) carry a
 *       {@link BodySupplier} that reproduces identical bytes for every retry attempt</li>
 *   <li>one-shot bodies ({@link #setBody(InputStream)}, {@link #setFiles(MultipartBody)}) are
 *       captured into memory before the first attempt when retry is enabled</li>
 * </ul>
 */
public class Request {

    /** HTTP GET */
    public static final String METHOD_GET = "GET";
    /** HTTP HEAD */
    public static final String METHOD_HEAD = "HEAD";
    /** HTTP POST */
    public static final String METHOD_POST = "POST";
    /** HTTP PUT */
    public static final String METHOD_PUT = "PUT";
    /** HTTP PATCH */
    public static final String METHOD_PATCH = "PATCH";
    /** HTTP DELETE */
    public static final String METHOD_DELETE = "DELETE";
    /** HTTP OPTIONS */
    public static final String METHOD_OPTIONS = "OPTIONS";

    /** The protocol requests are rendered with in dumps */
    public static final String PROTOCOL = "HTTP/1.1";

    private final String method;
    private final URI url;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private InputStream body;
    private BodySupplier bodySupplier;
    private long contentLength = -1;

    private CancellationContext context = CancellationContext.background();
    private RetryConfig retryConfig;
    private boolean clientTrace;

    /**
     * Produces a fresh stream with the same bytes on every call.
     */
    @FunctionalInterface
    public interface BodySupplier {
        /**
         * Opens a new copy of the body.
         *
         * @return a stream positioned at the first byte of the body
         * @throws IOException if the copy cannot be produced
         */
        InputStream open() throws IOException;
    }

    private Request(String method, URI url) {
        this.method = method;
        this.url = url;
    }

    /**
     * Creates a new request for the given method and URL.
     *
     * @param method the HTTP method, e.g. {@link #METHOD_GET}
     * @param url an absolute http or https URL
     * @return a new request without headers or body
     * @throws HttpPipelineClient.RequestPreparationException if the method is empty or the URL is malformed
     */
    public static Request newRequest(String method, String url) {
        if (method == null || method.isBlank()) {
            throw new HttpPipelineClient.RequestPreparationException("HTTP method cannot be null or empty");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (Exception e) {
            throw new HttpPipelineClient.RequestPreparationException("Malformed URL: " + url, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new HttpPipelineClient.RequestPreparationException("URL must be absolute: " + url);
        }
        String scheme = uri.getScheme().toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new HttpPipelineClient.RequestPreparationException("Unsupported protocol scheme: " + scheme);
        }
        return new Request(method.toUpperCase(), uri);
    }

    /**
     * Gets the HTTP method.
     *
     * @return the upper-case method name
     */
    public String getMethod() {
        return method;
    }

    /**
     * Gets the target URL.
     *
     * @return the absolute URL
     */
    public URI getUrl() {
        return url;
    }

    /**
     * Gets the path and query of the URL as sent on the request line.
     *
     * @return the request URI, "/" if the URL has no path
     */
    public String getRequestUri() {
        String path = url.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return url.getRawQuery() == null ? path : path + "?" + url.getRawQuery();
    }

    /**
     * Gets the value of the Host header derived from the URL.
     *
     * @return host and, if present, port
     */
    public String getHost() {
        return url.getPort() < 0 ? url.getHost() : url.getHost() + ":" + url.getPort();
    }

    /**
     * Sets a header, replacing any existing values.
     *
     * @param name the header name (case-insensitive)
     * @param value the header value
     */
    public void setHeader(String name, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(Objects.requireNonNull(value, "value"));
        headers.put(Objects.requireNonNull(name, "name"), values);
    }

    /**
     * Adds a header value, keeping existing values.
     *
     * @param name the header name (case-insensitive)
     * @param value the header value
     */
    public void addHeader(String name, String value) {
        headers.computeIfAbsent(Objects.requireNonNull(name, "name"), k -> new ArrayList<>())
                .add(Objects.requireNonNull(value, "value"));
    }

    /**
     * Removes a header.
     *
     * @param name the header name (case-insensitive)
     */
    public void removeHeader(String name) {
        headers.remove(name);
    }

    /**
     * Gets the first value of a header.
     *
     * @param name the header name (case-insensitive)
     * @return the first value, or empty if the header is not set
     */
    public Optional<String> getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Gets an unmodifiable view of all headers.
     *
     * @return header names mapped to their values
     */
    public Map<String, List<String>> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Sets the Content-Type header.
     *
     * @param contentType the media type
     */
    public void setContentType(String contentType) {
        setHeader("Content-Type", contentType);
    }

    /**
     * Sets a one-shot body. The stream is read once by the transport; if retry is
     * enabled it is captured into memory before the first attempt.
     *
     * @param body the body stream, or null for no body
     */
    public void setBody(InputStream body) {
        this.body = body;
        this.bodySupplier = null;
        this.contentLength = body == null ? 0 : -1;
    }

    /**
     * Sets a replayable in-memory body. An empty array means no body.
     *
     * @param content the body bytes
     */
    public void setContent(byte[] content) {
        if (content == null || content.length == 0) {
            this.body = null;
            this.bodySupplier = null;
            this.contentLength = 0;
            return;
        }
        this.body = new ByteArrayInputStream(content);
        this.bodySupplier = () -> new ByteArrayInputStream(content);
        this.contentLength = content.length;
    }

    /**
     * Sets a plain text body and the matching Content-Type header.
     *
     * @param text the body text, encoded as UTF-8
     */
    public void setText(String text) {
        setContent(text.getBytes(StandardCharsets.UTF_8));
        setContentType("text/plain; charset=utf-8");
    }

    /**
     * Sets a streamed multipart body and its Content-Type header.
     *
     * @param formData the multipart body
     */
    public void setFiles(MultipartBody formData) {
        setBody(formData);
        setContentType(formData.getContentType());
    }

    /**
     * Gets the current body stream.
     *
     * @return the body, or null if the request has none
     */
    public InputStream getBody() {
        return body;
    }

    /**
     * Checks if the request carries a body.
     *
     * @return true if a body is set
     */
    public boolean hasBody() {
        return body != null;
    }

    /**
     * Gets the function that reproduces the body for another attempt.
     *
     * @return the body supplier, or null if the body is one-shot or absent
     */
    public BodySupplier getBodySupplier() {
        return bodySupplier;
    }

    /**
     * Gets the body length in bytes.
     *
     * @return the length, or -1 if unknown
     */
    public long getContentLength() {
        return contentLength;
    }

    /**
     * Reopens the body through its supplier so the next attempt sends identical bytes.
     * Does nothing for requests without a replayable body.
     *
     * @throws IOException if the supplier fails
     */
    void rewindBody() throws IOException {
        if (bodySupplier != null) {
            body = bodySupplier.open();
        }
    }

    /**
     * Sets the cancellation context observed by every blocking point of the pipeline.
     *
     * @param context the context, never null
     */
    public void setContext(CancellationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Gets the cancellation context of this request.
     *
     * @return the context; {@link CancellationContext#background()} unless another was set
     */
    public CancellationContext getContext() {
        return context;
    }

    /**
     * Enables retry with the default configuration.
     */
    public void enableRetry() {
        enableRetry(RetryConfig.defaults());
    }

    /**
     * Enables retry with the given configuration.
     *
     * @param retryConfig the retry configuration
     */
    public void enableRetry(RetryConfig retryConfig) {
        this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
    }

    /**
     * Gets the retry configuration.
     *
     * @return the configuration, or empty if retry is not enabled
     */
    public Optional<RetryConfig> getRetryConfig() {
        return Optional.ofNullable(retryConfig);
    }

    /**
     * Enables connection timing traces for every attempt of this request.
     */
    public void enableClientTrace() {
        this.clientTrace = true;
    }

    /**
     * Checks if connection timing traces are enabled.
     *
     * @return true if every attempt is traced
     */
    public boolean isClientTraceEnabled() {
        return clientTrace;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
