package de.entwicklertraining.http.pipeline;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import de.entwicklertraining.http.pipeline.backoff.Backoff;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException;
import de.entwicklertraining.http.pipeline.gate.TokenBucket;
import de.entwicklertraining.http.pipeline.multipart.MultipartBody;
import de.entwicklertraining.http.pipeline.multipart.MultipartFile;
import de.entwicklertraining.http.pipeline.retry.RetryConfig;
import de.entwicklertraining.http.pipeline.retry.RetryTrigger;
import de.entwicklertraining.http.pipeline.trace.TraceInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static de.entwicklertraining.http.pipeline.RequestHooks.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the client on the JDK transport against a local WireMock server.
 */
class HttpPipelineClientTest {

    private WireMockServer server;
    private HttpPipelineClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        configureFor("localhost", server.port());

        client = HttpPipelineClient.create(HttpPipelineSettings.builder()
                .connectTimeout(Duration.ofSeconds(5))
                .requestTimeout(Duration.ofSeconds(10))
                .defaultHeader("User-Agent", "http-pipeline-test")
                .build());
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

    private static RetryConfig fastRetry(int maxAttempts) {
        return RetryConfig.builder()
                .maxAttempts(maxAttempts)
                .backoff(Backoff.constant(Duration.ofMillis(10), false))
                .build();
    }

    @Test
    void testGet() {
        givenThat(get(urlPathEqualTo("/hello"))
                .willReturn(okForContentType("text/plain", "hello world")));

        try (Response response = client.get(url("/hello?lang=en"), withHeader("X-Trace", "abc"))) {
            assertEquals(200, response.getStatusCode());
            assertEquals("200 OK", response.getStatus());
            assertTrue(response.isSuccess());
            assertEquals("text/plain", response.getHeader("content-type").orElseThrow());
            assertEquals("hello world", response.text());
        }

        verify(getRequestedFor(urlEqualTo("/hello?lang=en"))
                .withHeader("X-Trace", equalTo("abc"))
                .withHeader("User-Agent", equalTo("http-pipeline-test")));
    }

    @Test
    @DisplayName("Every verb is sent with its own method")
    void testVerbRouting() {
        givenThat(any(urlPathEqualTo("/verbs")).willReturn(aResponse().withStatus(204)));

        client.post(url("/verbs"), withText("posted")).close();
        client.put(url("/verbs"), withText("put")).close();
        client.patch(url("/verbs"), withText("patched")).close();
        client.delete(url("/verbs")).close();
        client.options(url("/verbs")).close();
        try (Response head = client.head(url("/verbs"))) {
            assertFalse(head.hasBody());
        }

        verify(postRequestedFor(urlPathEqualTo("/verbs")).withRequestBody(equalTo("posted")));
        verify(putRequestedFor(urlPathEqualTo("/verbs")).withRequestBody(equalTo("put")));
        verify(patchRequestedFor(urlPathEqualTo("/verbs")).withRequestBody(equalTo("patched")));
        verify(deleteRequestedFor(urlPathEqualTo("/verbs")));
        verify(optionsRequestedFor(urlPathEqualTo("/verbs")));
        verify(headRequestedFor(urlPathEqualTo("/verbs")));
    }

    @Test
    @DisplayName("A 429 is retried until the server recovers")
    @Timeout(10)
    void testRetryOnTooManyRequests() {
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(429).withBody("slow down"))
                .willSetStateTo("second"));
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs("second")
                .willReturn(aResponse().withStatus(429))
                .willSetStateTo("recovered"));
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(ok("finally")));

        try (Response response = client.get(url("/flaky"), enableRetry(fastRetry(3)))) {
            assertEquals(200, response.getStatusCode());
            assertEquals("finally", response.text());
        }
        verify(3, getRequestedFor(urlEqualTo("/flaky")));
    }

    @Test
    @DisplayName("Server errors are returned as-is unless a trigger asks for a retry")
    @Timeout(10)
    void testServerErrorRetryIsOptIn() {
        givenThat(post(urlEqualTo("/broken")).willReturn(aResponse().withStatus(503)));

        try (Response response = client.post(url("/broken"), withText("payload"), enableRetry(fastRetry(3)))) {
            assertEquals(503, response.getStatusCode());
        }
        verify(1, postRequestedFor(urlEqualTo("/broken")));

        RetryConfig onServerErrors = fastRetry(2).toBuilder().trigger(RetryTrigger.serverErrors()).build();
        try (Response response = client.post(url("/broken"), withText("payload"), enableRetry(onServerErrors))) {
            assertEquals(503, response.getStatusCode());
        }
        verify(4, postRequestedFor(urlEqualTo("/broken")).withRequestBody(equalTo("payload")));
    }

    @Test
    @DisplayName("A streamed body is replayed byte for byte on every attempt")
    @Timeout(10)
    void testOneShotBodyIsReplayed() {
        givenThat(put(urlEqualTo("/replay")).willReturn(aResponse().withStatus(429)));

        byte[] payload = "stream me twice".getBytes(StandardCharsets.UTF_8);
        try (Response response = client.put(url("/replay"),
                withBody(new ByteArrayInputStream(payload)), enableRetry(fastRetry(1)))) {
            assertEquals(429, response.getStatusCode());
        }

        verify(2, putRequestedFor(urlEqualTo("/replay")).withRequestBody(equalTo("stream me twice")));
    }

    @Test
    void testGzipResponseIsDecoded() throws IOException {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write("{\"compressed\":true}".getBytes(StandardCharsets.UTF_8));
        }
        givenThat(get(urlEqualTo("/gzip")).willReturn(aResponse()
                .withHeader("Content-Encoding", "gzip")
                .withHeader("Content-Type", "application/json")
                .withBody(compressed.toByteArray())));

        try (Response response = client.get(url("/gzip"))) {
            assertEquals("{\"compressed\":true}", response.text());
        }
    }

    @Test
    @DisplayName("Multipart uploads arrive as parseable form data")
    @Timeout(10)
    void testMultipartUpload(@TempDir Path dir) throws IOException {
        givenThat(post(urlEqualTo("/upload")).willReturn(ok()));
        Path report = dir.resolve("report.csv");
        Files.writeString(report, "a,b\n1,2\n");

        MultipartBody body = new MultipartBody()
                .withFile("report", MultipartFile.open(report).withMime("text/csv"))
                .withField("owner", "ada");
        try (Response response = client.post(url("/upload"), withFiles(body))) {
            assertEquals(200, response.getStatusCode());
        }

        verify(postRequestedFor(urlEqualTo("/upload"))
                .withHeader("Content-Type", containing("multipart/form-data; boundary=" + body.getBoundary()))
                .withRequestBodyPart(aMultipart()
                        .withName("report")
                        .withHeader("Content-Type", equalTo("text/csv"))
                        .withBody(equalTo("a,b\n1,2\n"))
                        .build())
                .withRequestBodyPart(aMultipart()
                        .withName("owner")
                        .withBody(equalTo("ada"))
                        .build()));
    }

    @Test
    @DisplayName("A deadline aborts a slow request")
    @Timeout(10)
    void testDeadlineExceeded() {
        givenThat(get(urlEqualTo("/slow")).willReturn(ok("late").withFixedDelay(3000)));

        CancellationContext context = CancellationContext.withTimeout(Duration.ofMillis(200));
        RequestCancelledException e = assertThrows(RequestCancelledException.class,
                () -> client.get(url("/slow"), withContext(context)));

        assertTrue(e.isDeadlineExceeded());
    }

    @Test
    void testConnectionRefused() {
        int port = server.port();
        server.stop();

        assertThrows(HttpPipelineClient.TransportException.class,
                () -> client.get("http://localhost:" + port + "/gone"));
    }

    @Test
    void testMalformedUrl() {
        assertThrows(HttpPipelineClient.RequestPreparationException.class, () -> client.get("not a url"));
        assertThrows(HttpPipelineClient.RequestPreparationException.class, () -> client.get("ftp://localhost/x"));
    }

    @Test
    @DisplayName("Debugging dumps both sides of the exchange")
    void testDebugging() {
        givenThat(post(urlEqualTo("/debug")).willReturn(okForContentType("text/plain", "pong")));
        ByteArrayOutputStream dump = new ByteArrayOutputStream();
        client.enableDebugging(dump, true);

        try (Response response = client.post(url("/debug"), withText("ping"))) {
            assertEquals("pong", response.text());
        }

        String text = dump.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("> POST /debug HTTP/1.1\r\n> Host: localhost:" + server.port() + "\r\n"), text);
        assertTrue(text.contains(">\r\nping\r\n"), text);
        assertTrue(text.contains("< HTTP/1.1 200 OK\r\n"), text);
        assertTrue(text.contains("<\r\npong\r\n"), text);
    }

    @Test
    @DisplayName("Traced requests carry a timing breakdown")
    void testClientTrace() {
        givenThat(get(urlEqualTo("/traced")).willReturn(ok("t")));

        try (Response response = client.get(url("/traced"), enableClientTrace())) {
            TraceInfo info = response.traceInfo().orElseThrow();
            assertTrue(info.totalTime().compareTo(info.serverTime()) >= 0);
            assertFalse(info.serverTime().isNegative());
        }
        try (Response response = client.get(url("/traced"))) {
            assertTrue(response.traceInfo().isEmpty());
        }
    }

    @Test
    @DisplayName("The concurrency limit serializes requests")
    @Timeout(15)
    void testMaxConcurrency() throws Exception {
        givenThat(get(urlEqualTo("/limited")).willReturn(ok("x").withFixedDelay(200)));
        client.setMaxConcurrency(1);

        ExecutorService pool = Executors.newFixedThreadPool(3);
        long start = System.nanoTime();
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                results.add(pool.submit(() -> {
                    try (Response response = client.get(url("/limited"))) {
                        return response.getStatusCode();
                    }
                }));
            }
            for (Future<Integer> result : results) {
                assertEquals(200, result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 600);
    }

    @Test
    @Timeout(10)
    void testRateLimiting() {
        givenThat(get(urlEqualTo("/rate")).willReturn(ok()));
        client.enableRateLimiting(new TokenBucket(5, 1));

        long start = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            client.get(url("/rate")).close();
        }

        // one token up front, two refills at 200 ms each
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 350);
    }
}
