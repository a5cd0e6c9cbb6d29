package de.entwicklertraining.http.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes every request and response to an output stream, like {@code curl -v}.
 * <pre>
 * &gt; POST /post HTTP/1.1
 * &gt; Host: httpbin.org
 * &gt; Content-Type: text/plain; charset=utf-8
 * &gt;
 * hello
 * &lt; HTTP/1.1 200 OK
 * &lt; Content-Type: application/json
 * &lt;
 * </pre>
 * Failures are written as {@code * ghttp [ERROR] <message>}. Dumping a body reads it
 * completely and puts an in-memory copy back, so the exchange itself is unaffected.
 * Each dump is written to the stream in one piece, so concurrent requests do not interleave.
 */
public class DebugCallback implements ExchangeCallback {
    private static final Logger logger = LoggerFactory.getLogger(DebugCallback.class);

    private static final String CRLF = "\r\n";
    private static final String ERROR_PREFIX = "* ghttp [ERROR] ";
    private static final Set<String> EXCLUDED_REQUEST_HEADERS = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    static {
        EXCLUDED_REQUEST_HEADERS.add("Host");
        EXCLUDED_REQUEST_HEADERS.add("Transfer-Encoding");
        EXCLUDED_REQUEST_HEADERS.add("Trailer");
    }

    private final OutputStream out;
    private final boolean body;

    /**
     * Creates a debug callback.
     *
     * @param out the stream dumps are written to
     * @param body whether request and response bodies are dumped too
     */
    public DebugCallback(OutputStream out, boolean body) {
        this.out = Objects.requireNonNull(out, "out");
        this.body = body;
    }

    /**
     * Dumps the request.
     *
     * @throws HttpPipelineClient.StreamException if the request body cannot be read; the
     *         failure is dumped as well
     */
    @Override
    public void enter(Request request) {
        ByteArrayOutputStream dump = new ByteArrayOutputStream();
        try {
            dumpRequest(request, dump);
        } catch (IOException e) {
            writeLine(dump, ERROR_PREFIX + e.getMessage());
            flush(dump);
            throw new HttpPipelineClient.StreamException("Failed to dump request body of " + request, e);
        }
        flush(dump);
    }

    @Override
    public void exit(Response response, Throwable error) {
        ByteArrayOutputStream dump = new ByteArrayOutputStream();
        Throwable failure = error;
        if (failure == null && response != null) {
            try {
                dumpResponse(response, dump);
            } catch (IOException e) {
                failure = e;
            }
        }
        if (failure != null) {
            writeLine(dump, ERROR_PREFIX + failure.getMessage());
        }
        flush(dump);
    }

    private void dumpRequest(Request request, ByteArrayOutputStream dump) throws IOException {
        writeLine(dump, "> " + request.getMethod() + " " + request.getRequestUri() + " " + Request.PROTOCOL);
        writeLine(dump, "> Host: " + request.getHost());
        for (Map.Entry<String, List<String>> header : request.getHeaders().entrySet()) {
            if (EXCLUDED_REQUEST_HEADERS.contains(header.getKey())) {
                continue;
            }
            for (String value : header.getValue()) {
                writeLine(dump, "> " + header.getKey() + ": " + value);
            }
        }
        writeLine(dump, ">");
        if (body && request.hasBody()) {
            byte[] content;
            try (InputStream in = request.getBody()) {
                content = in.readAllBytes();
            }
            request.setContent(content);
            dump.write(content);
            writeLine(dump, "");
        }
    }

    private void dumpResponse(Response response, ByteArrayOutputStream dump) throws IOException {
        writeLine(dump, "< " + response.getProtocol() + " " + response.getStatus());
        for (Map.Entry<String, List<String>> header : response.getHeaders().entrySet()) {
            for (String value : header.getValue()) {
                writeLine(dump, "< " + header.getKey() + ": " + value);
            }
        }
        writeLine(dump, "<");
        if (body && response.hasBody() && !response.isBodyClosed()) {
            byte[] content;
            try (InputStream in = response.getBody()) {
                content = in.readAllBytes();
            }
            response.setBody(new ByteArrayInputStream(content));
            dump.write(content);
            writeLine(dump, "");
        }
    }

    private static void writeLine(ByteArrayOutputStream dump, String line) {
        dump.writeBytes((line + CRLF).getBytes(StandardCharsets.UTF_8));
    }

    private void flush(ByteArrayOutputStream dump) {
        synchronized (out) {
            try {
                dump.writeTo(out);
                out.flush();
            } catch (IOException e) {
                logger.warn("Failed to write debug dump: {}", e.getMessage());
            }
        }
    }
}
