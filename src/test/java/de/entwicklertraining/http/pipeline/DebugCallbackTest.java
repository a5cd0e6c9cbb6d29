package de.entwicklertraining.http.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DebugCallbackTest {

    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
    }

    private String dump() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Request dump lists the request line, host and headers, then the body")
    void testRequestDump() throws IOException {
        Request request = Request.newRequest("POST", "http://example.com:8080/post?x=1");
        request.setText("hello");
        request.setHeader("Transfer-Encoding", "chunked");

        new DebugCallback(out, true).enter(request);

        assertEquals("> POST /post?x=1 HTTP/1.1\r\n"
                + "> Host: example.com:8080\r\n"
                + "> Content-Type: text/plain; charset=utf-8\r\n"
                + ">\r\n"
                + "hello\r\n", dump());
        try (InputStream body = request.getBody()) {
            assertEquals("hello", new String(body.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void testRequestDumpWithoutBody() {
        Request request = Request.newRequest("POST", "http://example.com/post");
        request.setText("secret");

        new DebugCallback(out, false).enter(request);

        assertFalse(dump().contains("secret"));
        assertTrue(dump().endsWith(">\r\n"));
    }

    @Test
    @DisplayName("Response dump keeps the body readable")
    void testResponseDump() {
        Request request = Request.newRequest("GET", "http://example.com/");
        Response response = new Response(request,
                ScriptedTransport.response(200, Map.of("Content-Type", List.of("application/json")), "{\"a\":1}"));

        new DebugCallback(out, true).exit(response, null);

        assertEquals("< HTTP/1.1 200 OK\r\n"
                + "< Content-Type: application/json\r\n"
                + "<\r\n"
                + "{\"a\":1}\r\n", dump());
        assertEquals("{\"a\":1}", response.text());
    }

    @Test
    void testErrorDump() {
        new DebugCallback(out, true).exit(null, new IOException("connection refused"));

        assertEquals("* ghttp [ERROR] connection refused\r\n", dump());
    }

    @Test
    @DisplayName("An unreadable request body is dumped as an error and aborts the request")
    void testUnreadableRequestBody() {
        Request request = Request.newRequest("PUT", "http://example.com/upload");
        request.setBody(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        });

        DebugCallback callback = new DebugCallback(out, true);

        assertThrows(HttpPipelineClient.StreamException.class, () -> callback.enter(request));
        assertTrue(dump().startsWith("> PUT /upload HTTP/1.1\r\n"));
        assertTrue(dump().endsWith("* ghttp [ERROR] disk gone\r\n"));
    }
}
