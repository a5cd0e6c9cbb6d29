package de.entwicklertraining.http.pipeline.transport;

import de.entwicklertraining.http.pipeline.HttpPipelineSettings;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;
import okhttp3.Call;
import okhttp3.Connection;
import okhttp3.EventListener;
import okhttp3.Handshake;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;
import okio.Okio;
import okio.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transport over OkHttp.
 * <p>
 * Every connection lifecycle event OkHttp reports is forwarded to the attempt's
 * {@link ConnectionLifecycleListener}, which travels with the OkHttp request as a tag.
 * A connection acquired without a connect in the same call counts as reused.
 * Requests are sent without OkHttp's own connection-failure retry; retrying is the
 * pipeline's job.
 */
public class OkHttpTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(OkHttpTransport.class);

    private static final Set<String> BODYLESS_METHODS = Set.of(Request.METHOD_GET, Request.METHOD_HEAD);
    private static final Set<String> BODY_REQUIRED_METHODS = Set.of(
            Request.METHOD_POST, Request.METHOD_PUT, Request.METHOD_PATCH, "PROPPATCH", "REPORT");

    private final OkHttpClient httpClient;

    /**
     * Creates a transport with default settings.
     */
    public OkHttpTransport() {
        this(HttpPipelineSettings.defaults());
    }

    /**
     * Creates a transport with the given settings.
     *
     * @param settings connect timeout, request timeout and redirect policy
     */
    public OkHttpTransport(HttpPipelineSettings settings) {
        this(new OkHttpClient.Builder()
                .connectTimeout(settings.getConnectTimeout())
                .readTimeout(settings.getRequestTimeout())
                .writeTimeout(settings.getRequestTimeout())
                .followRedirects(settings.isFollowRedirects())
                .followSslRedirects(settings.isFollowRedirects())
                .build());
    }

    /**
     * Creates a transport on top of an existing OkHttp client, sharing its connection pool.
     *
     * @param httpClient the client to derive from
     */
    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient.newBuilder()
                .retryOnConnectionFailure(false)
                .eventListenerFactory(call -> {
                    ConnectionLifecycleListener listener = call.request().tag(ConnectionLifecycleListener.class);
                    return listener == null || listener == ConnectionLifecycleListener.NONE
                            ? EventListener.NONE
                            : new LifecycleEventListener(listener);
                })
                .build();
    }

    @Override
    public RawResponse execute(Request request, ConnectionLifecycleListener listener) throws IOException {
        CancellationContext context = request.getContext();
        context.throwIfCancelled();

        okhttp3.Request.Builder builder = new okhttp3.Request.Builder()
                .url(request.getUrl().toString())
                .method(request.getMethod(), requestBody(request))
                .tag(ConnectionLifecycleListener.class, listener);
        request.getHeaders().forEach((name, values) -> values.forEach(value -> builder.addHeader(name, value)));

        Call call = httpClient.newCall(builder.build());
        Response response;
        try (CancellationContext.Registration ignored = context.onCancel(call::cancel)) {
            response = call.execute();
        } catch (IOException e) {
            context.throwIfCancelled();
            throw e;
        }

        ResponseBody body = response.body();
        Map<String, List<String>> headers = response.headers().toMultimap();
        return new RawResponse(
                response.code(),
                response.message().isEmpty() ? RawResponse.standardReasonPhrase(response.code()) : response.message(),
                protocolName(response.protocol()),
                headers,
                body == null ? null : body.byteStream());
    }

    @Override
    public void closeIdleConnections() {
        httpClient.connectionPool().evictAll();
    }

    private static RequestBody requestBody(Request request) {
        String method = request.getMethod();
        if (request.hasBody() && BODYLESS_METHODS.contains(method)) {
            // OkHttp refuses bodies on these methods
            logger.debug("Dropping request body of {} which OkHttp cannot send with {}", request, method);
            try {
                request.getBody().close();
            } catch (IOException e) {
                logger.debug("Failed to close dropped request body of {}: {}", request, e.getMessage());
            }
            return null;
        }
        if (!request.hasBody()) {
            return BODY_REQUIRED_METHODS.contains(method) ? RequestBody.create(new byte[0], (MediaType) null) : null;
        }
        return new StreamRequestBody(request.getBody(), request.getContentLength(), request.getBodySupplier() == null);
    }

    private static String protocolName(Protocol protocol) {
        return switch (protocol) {
            case HTTP_1_0 -> "HTTP/1.0";
            case HTTP_1_1 -> "HTTP/1.1";
            case HTTP_2, H2_PRIOR_KNOWLEDGE -> "HTTP/2.0";
            default -> protocol.toString().toUpperCase();
        };
    }

    /**
     * Streams the request's body stream into OkHttp's sink.
     */
    private static final class StreamRequestBody extends RequestBody {
        private final InputStream body;
        private final long contentLength;
        private final boolean oneShot;

        StreamRequestBody(InputStream body, long contentLength, boolean oneShot) {
            this.body = body;
            this.contentLength = contentLength;
            this.oneShot = oneShot;
        }

        @Override
        public MediaType contentType() {
            // Content-Type travels as a plain header
            return null;
        }

        @Override
        public long contentLength() {
            return contentLength;
        }

        @Override
        public boolean isOneShot() {
            return oneShot;
        }

        @Override
        public void writeTo(BufferedSink sink) throws IOException {
            try (Source source = Okio.source(body)) {
                sink.writeAll(source);
            }
        }
    }

    /**
     * Translates OkHttp's call events into lifecycle events.
     */
    private static final class LifecycleEventListener extends EventListener {
        private final ConnectionLifecycleListener listener;
        private boolean connected;

        LifecycleEventListener(ConnectionLifecycleListener listener) {
            this.listener = listener;
        }

        @Override
        public void callStart(Call call) {
            listener.getConn(call.request().url().host() + ":" + call.request().url().port());
        }

        @Override
        public void dnsStart(Call call, String domainName) {
            listener.dnsStart(domainName);
        }

        @Override
        public void dnsEnd(Call call, String domainName, List<InetAddress> inetAddressList) {
            listener.dnsDone();
        }

        @Override
        public void connectStart(Call call, InetSocketAddress inetSocketAddress, Proxy proxy) {
            connected = true;
            listener.connectStart();
        }

        @Override
        public void connectEnd(Call call, InetSocketAddress inetSocketAddress, Proxy proxy, Protocol protocol) {
            listener.connectDone();
        }

        @Override
        public void connectFailed(Call call, InetSocketAddress inetSocketAddress, Proxy proxy,
                                  Protocol protocol, IOException ioe) {
            listener.connectDone();
        }

        @Override
        public void secureConnectStart(Call call) {
            listener.tlsHandshakeStart();
        }

        @Override
        public void secureConnectEnd(Call call, Handshake handshake) {
            listener.tlsHandshakeDone();
        }

        @Override
        public void connectionAcquired(Call call, Connection connection) {
            boolean reused = !connected;
            listener.gotConn(reused, reused, Duration.ZERO);
        }

        @Override
        public void requestHeadersEnd(Call call, okhttp3.Request request) {
            if (request.body() == null) {
                listener.wroteRequest();
            }
        }

        @Override
        public void requestBodyEnd(Call call, long byteCount) {
            listener.wroteRequest();
        }

        @Override
        public void responseHeadersStart(Call call) {
            listener.gotFirstResponseByte();
        }
    }
}
