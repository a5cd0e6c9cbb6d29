package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.trace.ClientTrace;
import de.entwicklertraining.http.pipeline.trace.TraceInfo;
import de.entwicklertraining.http.pipeline.transport.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The result of one request attempt.
 * <p>
 * A response owns a single-consumer body stream. The body must be fully read or
 * {@link #close() closed} before the response is dropped so the transport can reuse
 * the connection. The pipeline may replace the body with a decoding wrapper
 * (see {@link ResponseTranscoder}) or with a buffered copy (see {@link DebugCallback}).
 */
public class Response implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Response.class);

    private final Request request;
    private final int statusCode;
    private final String reasonPhrase;
    private final String protocol;
    private final Map<String, List<String>> headers;
    private final boolean bodyEmpty;
    private TrackedBody body;
    private ClientTrace clientTrace;

    /**
     * Wraps a transport result.
     *
     * @param request the request that produced this response
     * @param raw the transport's response
     */
    public Response(Request request, RawResponse raw) {
        this.request = request;
        this.statusCode = raw.statusCode();
        this.reasonPhrase = raw.reasonPhrase();
        this.protocol = raw.protocol();
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        raw.headers().forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.bodyEmpty = raw.body() == null
                || Request.METHOD_HEAD.equals(request.getMethod())
                || statusCode == 204 || statusCode == 304
                || "0".equals(getHeader("Content-Length").orElse(null));
        this.body = raw.body() == null ? null : new TrackedBody(raw.body());
    }

    /**
     * Gets the request that produced this response.
     *
     * @return the request
     */
    public Request getRequest() {
        return request;
    }

    /**
     * Gets the status code.
     *
     * @return the HTTP status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Gets the status line text, e.g. "200 OK".
     *
     * @return status code and reason phrase
     */
    public String getStatus() {
        return reasonPhrase == null || reasonPhrase.isEmpty()
                ? String.valueOf(statusCode)
                : statusCode + " " + reasonPhrase;
    }

    /**
     * Gets the protocol the response was received with.
     *
     * @return the protocol, e.g. "HTTP/1.1"
     */
    public String getProtocol() {
        return protocol;
    }

    /**
     * Checks for a 2xx status code.
     *
     * @return true if the status code is in [200, 300)
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Gets all response headers.
     *
     * @return an unmodifiable, case-insensitive map of header values
     */
    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * Gets the first value of a header.
     *
     * @param name the header name (case-insensitive)
     * @return the value, or empty if absent
     */
    public Optional<String> getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Gets the body stream.
     *
     * @return the body, or null if the transport delivered none
     */
    public InputStream getBody() {
        return body;
    }

    /**
     * Checks if the response carries a body worth decoding or reading.
     *
     * @return false for HEAD requests, 204/304 responses, zero Content-Length or a missing body
     */
    public boolean hasBody() {
        return body != null && !bodyEmpty;
    }

    /**
     * Replaces the body stream, e.g. with a decoding wrapper.
     *
     * @param newBody the new body
     */
    void setBody(InputStream newBody) {
        this.body = newBody == null ? null : new TrackedBody(newBody);
    }

    /**
     * Gets the body stream the current body wraps.
     *
     * @return the unwrapped body, or null
     */
    InputStream getUnwrappedBody() {
        return body == null ? null : body.delegate();
    }

    void setClientTrace(ClientTrace clientTrace) {
        this.clientTrace = clientTrace;
    }

    /**
     * Gets the connection timing breakdown of the attempt that produced this response.
     *
     * @return the trace info, or empty if client trace was not enabled
     */
    public Optional<TraceInfo> traceInfo() {
        return clientTrace == null ? Optional.empty() : Optional.of(clientTrace.traceInfo());
    }

    /**
     * Reads the body until EOF and closes it.
     *
     * @return the body bytes, empty if there is no body
     * @throws HttpPipelineClient.StreamException if reading fails
     */
    public byte[] content() {
        if (body == null) {
            return new byte[0];
        }
        try (InputStream in = body) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new HttpPipelineClient.StreamException("Failed to read response body", e);
        }
    }

    /**
     * Reads the body as UTF-8 text.
     *
     * @return the body text
     * @throws HttpPipelineClient.StreamException if reading fails
     */
    public String text() {
        return text(StandardCharsets.UTF_8);
    }

    /**
     * Reads the body as text in the given charset.
     *
     * @param charset the body's charset
     * @return the body text
     * @throws HttpPipelineClient.StreamException if reading fails
     */
    public String text(Charset charset) {
        return new String(content(), charset);
    }

    /**
     * Writes the body into a file, replacing any existing content.
     *
     * @param file the target file
     * @throws HttpPipelineClient.StreamException if reading or writing fails
     */
    public void saveFile(Path file) {
        try (OutputStream out = Files.newOutputStream(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            if (body != null) {
                try (InputStream in = body) {
                    in.transferTo(out);
                }
            }
        } catch (IOException e) {
            throw new HttpPipelineClient.StreamException("Failed to save response body to " + file, e);
        }
    }

    /**
     * Checks whether the body was already closed.
     *
     * @return true if the body is closed or absent
     */
    public boolean isBodyClosed() {
        return body == null || body.closed;
    }

    /**
     * Reads and discards the rest of the body, then closes it, so the connection can be reused.
     * Does nothing if the body was already closed.
     */
    void discard() {
        if (isBodyClosed()) {
            return;
        }
        try (InputStream in = body) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            logger.debug("Failed to drain response body of {}: {}", request, e.getMessage());
        }
    }

    /**
     * Closes the body without reading it.
     */
    @Override
    public void close() {
        if (body != null) {
            try {
                body.close();
            } catch (IOException e) {
                logger.debug("Failed to close response body of {}: {}", request, e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return protocol + " " + getStatus();
    }

    /**
     * Remembers whether the body was closed.
     */
    private static final class TrackedBody extends FilterInputStream {
        private volatile boolean closed;

        TrackedBody(InputStream in) {
            super(in);
        }

        InputStream delegate() {
            return in;
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
