package de.entwicklertraining.http.pipeline.retry;

import de.entwicklertraining.http.pipeline.HttpPipelineClient;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.Response;
import de.entwicklertraining.http.pipeline.backoff.Backoff;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.transport.RawResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetrierTest {

    private static final CancellationContext LIVE = CancellationContext.background();

    private static Response response(int status) {
        Request request = Request.newRequest(Request.METHOD_GET, "http://example.test/");
        return new Response(request, new RawResponse(status, "", "HTTP/1.1", Map.of(), InputStream.nullInputStream()));
    }

    @Test
    @DisplayName("Default policy: errors and 429 are retried, 200 and 500 are not")
    void testDefaultPolicy() {
        Retrier retrier = new Retrier(RetryConfig.defaults());

        assertTrue(retrier.shouldRetry(LIVE, 0, response(429), null));
        assertTrue(retrier.shouldRetry(LIVE, 0, null, new IOException("reset")));
        assertFalse(retrier.shouldRetry(LIVE, 0, response(200), null));
        assertFalse(retrier.shouldRetry(LIVE, 0, response(500), null));
    }

    @Test
    void testAttemptBudget() {
        Retrier retrier = new Retrier(RetryConfig.builder().maxAttempts(2).build());

        assertTrue(retrier.shouldRetry(LIVE, 0, response(429), null));
        assertTrue(retrier.shouldRetry(LIVE, 1, response(429), null));
        assertFalse(retrier.shouldRetry(LIVE, 2, response(429), null));
    }

    @Test
    void testZeroAttemptsDisablesRetry() {
        Retrier retrier = new Retrier(RetryConfig.builder().maxAttempts(0).build());

        assertFalse(retrier.shouldRetry(LIVE, 0, null, new IOException("reset")));
    }

    @Test
    void testCancelledContextNeverRetries() {
        CancellationContext context = CancellationContext.cancellable();
        context.cancel();
        Retrier retrier = new Retrier(RetryConfig.defaults());

        assertFalse(retrier.shouldRetry(context, 0, null, new IOException("reset")));
    }

    @Test
    @DisplayName("Custom triggers replace the default policy and are or-combined")
    void testCustomTriggers() {
        Retrier retrier = new Retrier(RetryConfig.builder()
                .trigger(RetryTrigger.onStatus(502, 504))
                .trigger(RetryTrigger.onError())
                .build());

        assertTrue(retrier.shouldRetry(LIVE, 0, response(502), null));
        assertTrue(retrier.shouldRetry(LIVE, 0, response(504), null));
        assertTrue(retrier.shouldRetry(LIVE, 0, null, new IOException("reset")));
        assertFalse(retrier.shouldRetry(LIVE, 0, response(429), null));
    }

    @Test
    void testDefaultsMatchDocumentedConfiguration() {
        RetryConfig config = RetryConfig.defaults();

        assertEquals(3, config.getMaxAttempts());
        assertTrue(config.getTriggers().isEmpty());
        for (int i = 0; i < 10; i++) {
            Duration wait = config.getBackoff().waitDuration(10, null, null);
            assertTrue(wait.compareTo(Duration.ofSeconds(15)) >= 0 && wait.compareTo(Duration.ofSeconds(30)) <= 0);
        }
    }

    @Test
    void testNegativeBackoffIsClampedToZero() {
        Retrier retrier = new Retrier(RetryConfig.builder()
                .backoff((attemptNum, response, error) -> Duration.ofMillis(-5))
                .build());

        assertEquals(Duration.ZERO, retrier.backoff(0, null, null));
    }

    @Test
    @DisplayName("A one-shot body is captured into a replayable copy")
    void testPrepareRequestCapturesBody() throws IOException {
        Request request = Request.newRequest(Request.METHOD_POST, "http://example.test/");
        request.setBody(new ByteArrayInputStream("abc".getBytes(StandardCharsets.UTF_8)));
        assertNull(request.getBodySupplier());

        new Retrier(RetryConfig.defaults()).prepareRequest(request);

        assertNotNull(request.getBodySupplier());
        assertEquals(3, request.getContentLength());
        try (InputStream copy = request.getBodySupplier().open()) {
            assertEquals("abc", new String(copy.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void testPrepareRequestSkippedWhenRetryDisabled() {
        Request request = Request.newRequest(Request.METHOD_POST, "http://example.test/");
        InputStream body = new ByteArrayInputStream(new byte[]{1, 2, 3});
        request.setBody(body);

        new Retrier(RetryConfig.builder().maxAttempts(0).build()).prepareRequest(request);

        assertSame(body, request.getBody());
    }

    @Test
    void testPrepareRequestFailure() {
        Request request = Request.newRequest(Request.METHOD_POST, "http://example.test/");
        request.setBody(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("broken pipe");
            }
        });

        assertThrows(HttpPipelineClient.RequestPreparationException.class,
                () -> new Retrier(RetryConfig.defaults()).prepareRequest(request));
    }

    @Test
    void testNegativeMaxAttemptsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RetryConfig.builder().maxAttempts(-1));
        assertThrows(NullPointerException.class, () -> RetryConfig.builder().backoff((Backoff) null));
    }
}
