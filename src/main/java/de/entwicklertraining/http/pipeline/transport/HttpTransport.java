package de.entwicklertraining.http.pipeline.transport;

import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;

import java.io.IOException;

/**
 * The network stack a client sends requests through.
 * <p>
 * A transport owns framing, TLS and connection pooling. It must be safe for concurrent
 * use, must send the request's current body stream as is, and must abort the exchange
 * with a {@link de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException}
 * as soon as the request's cancellation context fires.
 */
public interface HttpTransport {

    /**
     * Sends one attempt of a request.
     *
     * @param request the request to send
     * @param listener receives connection lifecycle events for this attempt
     * @return the response with its unread body
     * @throws IOException on network, DNS or TLS failure
     */
    RawResponse execute(Request request, ConnectionLifecycleListener listener) throws IOException;

    /**
     * Closes pooled connections that are not in use. Called once a call has its final outcome.
     */
    default void closeIdleConnections() {
    }
}
