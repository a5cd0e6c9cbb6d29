package de.entwicklertraining.http.pipeline.transport;

import de.entwicklertraining.http.pipeline.HttpPipelineSettings;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Transport over {@code java.net.http.HttpClient}.
 * <p>
 * The JDK client does not expose DNS, connect or TLS events, so traces of this transport
 * only carry the connection request, the end of the request body and the first response
 * byte. Use {@link OkHttpTransport} for a full breakdown.
 */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

    // set by the JDK client itself, rejected when set by the caller
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final HttpPipelineSettings settings;

    /**
     * Creates a transport with default settings.
     */
    public JdkHttpTransport() {
        this(HttpPipelineSettings.defaults());
    }

    /**
     * Creates a transport with the given settings.
     *
     * @param settings connect timeout, request timeout and redirect policy
     */
    public JdkHttpTransport(HttpPipelineSettings settings) {
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.getConnectTimeout())
                .followRedirects(settings.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public RawResponse execute(Request request, ConnectionLifecycleListener listener) throws IOException {
        CancellationContext context = request.getContext();
        context.throwIfCancelled();

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.getUrl())
                .timeout(settings.getRequestTimeout())
                .method(request.getMethod(), bodyPublisher(request, listener));
        request.getHeaders().forEach((name, values) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                logger.debug("Skipping header {} which is managed by the JDK client", name);
                return;
            }
            values.forEach(value -> builder.header(name, value));
        });

        listener.getConn(request.getHost());
        if (!request.hasBody()) {
            listener.wroteRequest();
        }
        HttpResponse.BodyHandler<InputStream> handler = responseInfo -> {
            listener.gotFirstResponseByte();
            return HttpResponse.BodyHandlers.ofInputStream().apply(responseInfo);
        };
        CompletableFuture<HttpResponse<InputStream>> future = httpClient.sendAsync(builder.build(), handler);

        HttpResponse<InputStream> response;
        try (CancellationContext.Registration ignored = context.onCancel(() -> future.cancel(true))) {
            response = future.get();
        } catch (CancellationException e) {
            throw context.isCancelled() ? context.toException() : e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + request);
        } catch (ExecutionException e) {
            context.throwIfCancelled();
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IOException("Request failed: " + cause, cause);
        }

        Map<String, List<String>> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            // HTTP/2 pseudo headers
            if (!name.startsWith(":")) {
                headers.put(name, values);
            }
        });
        return new RawResponse(
                response.statusCode(),
                RawResponse.standardReasonPhrase(response.statusCode()),
                response.version() == HttpClient.Version.HTTP_2 ? "HTTP/2.0" : "HTTP/1.1",
                headers,
                response.body());
    }

    private static HttpRequest.BodyPublisher bodyPublisher(Request request, ConnectionLifecycleListener listener) {
        if (!request.hasBody()) {
            return HttpRequest.BodyPublishers.noBody();
        }
        InputStream body = new WriteCompletionStream(request.getBody(), listener);
        HttpRequest.BodyPublisher publisher = HttpRequest.BodyPublishers.ofInputStream(() -> body);
        long length = request.getContentLength();
        return length > 0 ? HttpRequest.BodyPublishers.fromPublisher(publisher, length) : publisher;
    }

    /**
     * Reports {@link ConnectionLifecycleListener#wroteRequest()} once the body reaches EOF.
     */
    private static final class WriteCompletionStream extends FilterInputStream {
        private final ConnectionLifecycleListener listener;
        private boolean reported;

        WriteCompletionStream(InputStream in, ConnectionLifecycleListener listener) {
            super(in);
            this.listener = listener;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b < 0) {
                reportOnce();
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = super.read(b, off, len);
            if (n < 0) {
                reportOnce();
            }
            return n;
        }

        private void reportOnce() {
            if (!reported) {
                reported = true;
                listener.wroteRequest();
            }
        }
    }
}
