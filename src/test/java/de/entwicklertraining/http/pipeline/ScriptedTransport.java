package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;
import de.entwicklertraining.http.pipeline.transport.HttpTransport;
import de.entwicklertraining.http.pipeline.transport.RawResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport fake that plays back a fixed script of outcomes and records what was sent.
 * The last step repeats once the script is exhausted.
 */
public class ScriptedTransport implements HttpTransport {

    /**
     * One scripted outcome.
     */
    @FunctionalInterface
    public interface Step {
        RawResponse respond(Request request, ConnectionLifecycleListener listener) throws IOException;
    }

    private final Deque<Step> steps = new ArrayDeque<>();
    private final List<String> sentBodies = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger idleCloses = new AtomicInteger();
    private Step last;

    public ScriptedTransport then(Step step) {
        steps.add(step);
        return this;
    }

    public ScriptedTransport thenStatus(int status) {
        return then((request, listener) -> response(status, Map.of(), "status " + status));
    }

    public ScriptedTransport thenFail(String message) {
        return then((request, listener) -> {
            throw new IOException(message);
        });
    }

    @Override
    public synchronized RawResponse execute(Request request, ConnectionLifecycleListener listener) throws IOException {
        calls.incrementAndGet();
        if (request.hasBody()) {
            try (InputStream body = request.getBody()) {
                sentBodies.add(new String(body.readAllBytes(), StandardCharsets.UTF_8));
            }
        } else {
            sentBodies.add(null);
        }
        Step step = steps.isEmpty() ? last : steps.poll();
        last = step;
        listener.getConn(request.getHost());
        listener.gotConn(false, false, null);
        listener.wroteRequest();
        listener.gotFirstResponseByte();
        return step.respond(request, listener);
    }

    @Override
    public void closeIdleConnections() {
        idleCloses.incrementAndGet();
    }

    public int calls() {
        return calls.get();
    }

    public int idleCloses() {
        return idleCloses.get();
    }

    public List<String> sentBodies() {
        return sentBodies;
    }

    public static RawResponse response(int status, Map<String, List<String>> headers, String body) {
        return response(status, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    public static RawResponse response(int status, Map<String, List<String>> headers, byte[] body) {
        return new RawResponse(status, RawResponse.standardReasonPhrase(status), "HTTP/1.1", headers,
                new ByteArrayInputStream(body));
    }
}
