package de.entwicklertraining.http.pipeline.transport;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import de.entwicklertraining.http.pipeline.HttpPipelineClient;
import de.entwicklertraining.http.pipeline.HttpPipelineSettings;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.Response;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException;
import de.entwicklertraining.http.pipeline.trace.ClientTrace;
import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;
import de.entwicklertraining.http.pipeline.trace.TraceInfo;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static de.entwicklertraining.http.pipeline.RequestHooks.*;
import static org.junit.jupiter.api.Assertions.*;

class OkHttpTransportTest {

    private WireMockServer server;
    private ConnectionPool pool;
    private OkHttpTransport transport;
    private HttpPipelineClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        configureFor("localhost", server.port());

        pool = new ConnectionPool();
        transport = new OkHttpTransport(new OkHttpClient.Builder().connectionPool(pool).build());
        client = HttpPipelineClient.create(transport);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String url(String path) {
        return "http://localhost:" + server.port() + path;
    }

    @Test
    @DisplayName("A traced request reports a consistent timing breakdown")
    void testTracedRequest() {
        givenThat(get(urlEqualTo("/trace")).willReturn(ok("traced").withFixedDelay(50)));

        try (Response response = client.get(url("/trace"), enableClientTrace())) {
            assertEquals("traced", response.text());
            TraceInfo info = response.traceInfo().orElseThrow();

            assertFalse(info.connReused());
            assertTrue(info.totalTime().compareTo(info.serverTime()) >= 0, info.toString());
            assertTrue(info.serverTime().toMillis() >= 50, info.toString());
            assertTrue(info.totalTime().compareTo(info.connTime()) >= 0, info.toString());
            assertFalse(info.connTime().isNegative());
            assertEquals(Duration.ZERO, info.tlsHandshakeTime());
            assertEquals("HTTP/1.1", response.getProtocol());
        }
    }

    @Test
    @DisplayName("A second request reuses the pooled connection")
    void testConnectionReuse() {
        givenThat(get(urlEqualTo("/reuse")).willReturn(ok("again")));

        try (Response first = client.get(url("/reuse"), enableClientTrace())) {
            assertEquals("again", first.text());
            assertFalse(first.traceInfo().orElseThrow().connReused());
        }
        try (Response second = client.get(url("/reuse"), enableClientTrace())) {
            assertEquals("again", second.text());
            TraceInfo info = second.traceInfo().orElseThrow();
            assertTrue(info.connReused());
            assertEquals(Duration.ZERO, info.tcpConnTime());
        }
    }

    @Test
    void testCloseIdleConnections() throws IOException {
        givenThat(get(urlEqualTo("/idle")).willReturn(ok("idle")));

        RawResponse raw = transport.execute(Request.newRequest("GET", url("/idle")), ConnectionLifecycleListener.NONE);
        try (InputStream body = raw.body()) {
            assertEquals("idle", new String(body.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(1, pool.connectionCount());

        transport.closeIdleConnections();

        assertEquals(0, pool.connectionCount());
    }

    @Test
    void testRequestBodyAndHeaders() {
        givenThat(patch(urlEqualTo("/items/1")).willReturn(aResponse().withStatus(204)));

        try (Response response = client.patch(url("/items/1"),
                withContent("{\"name\":\"x\"}".getBytes(StandardCharsets.UTF_8)),
                withHeader("Content-Type", "application/json"))) {
            assertEquals(204, response.getStatusCode());
            assertFalse(response.hasBody());
        }

        verify(patchRequestedFor(urlEqualTo("/items/1"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(equalToJson("{\"name\":\"x\"}")));
    }

    @Test
    @DisplayName("An empty POST still sends a zero-length body")
    void testEmptyPost() {
        givenThat(post(urlEqualTo("/empty")).willReturn(ok()));

        client.post(url("/empty")).close();

        verify(postRequestedFor(urlEqualTo("/empty")).withHeader("Content-Length", equalTo("0")));
    }

    @Test
    @DisplayName("Cancelling the context aborts an in-flight call")
    @Timeout(10)
    void testCancellation() {
        givenThat(get(urlEqualTo("/hang")).willReturn(ok("never").withFixedDelay(5000)));
        CancellationContext context = CancellationContext.cancellable();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(context::cancel, 200, TimeUnit.MILLISECONDS);

            RequestCancelledException e = assertThrows(RequestCancelledException.class,
                    () -> client.get(url("/hang"), withContext(context)));
            assertEquals(RequestCancelledException.Reason.CANCELED, e.getReason());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void testTraceListenerReceivesEvents() throws IOException {
        givenThat(get(urlEqualTo("/events")).willReturn(ok("e")));
        ClientTrace trace = new ClientTrace();

        RawResponse raw = transport.execute(Request.newRequest("GET", url("/events")), trace);
        raw.body().close();
        trace.done();

        TraceInfo info = trace.traceInfo();
        assertTrue(info.totalTime().compareTo(info.tcpConnTime()) >= 0);
        assertFalse(info.totalTime().isZero());
    }

    @Test
    void testCreatedFromSettings() {
        givenThat(get(urlEqualTo("/settings")).willReturn(ok("s")));
        HttpPipelineClient fromSettings = HttpPipelineClient.create(HttpPipelineSettings.builder()
                .transport(HttpPipelineSettings.TransportType.OKHTTP)
                .build());

        assertInstanceOf(OkHttpTransport.class, fromSettings.getTransport());
        try (Response response = fromSettings.get(url("/settings"))) {
            assertEquals("s", response.text());
        }
    }

    @Test
    @DisplayName("A body on a GET is dropped and closed")
    void testBodyOnGetIsDropped() {
        givenThat(get(urlEqualTo("/drop")).willReturn(ok("kept")));
        AtomicBoolean closed = new AtomicBoolean();
        InputStream body = new ByteArrayInputStream("ignored".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
                closed.set(true);
                super.close();
            }
        };

        try (Response response = client.get(url("/drop"), withBody(body))) {
            assertEquals("kept", response.text());
        }

        assertTrue(closed.get());
        assertEquals("", findAll(getRequestedFor(urlEqualTo("/drop"))).get(0).getBodyAsString());
    }
}
