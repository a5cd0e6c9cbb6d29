package de.entwicklertraining.http.pipeline.trace;

import java.time.Duration;

/**
 * Callbacks a transport invokes as an exchange moves through its connection lifecycle.
 * <p>
 * Transports call only the events they can observe; every method defaults to a no-op.
 * Calls may arrive on transport-owned threads.
 */
public interface ConnectionLifecycleListener {

    /** A listener that ignores every event. */
    ConnectionLifecycleListener NONE = new ConnectionLifecycleListener() { };

    /**
     * A connection is about to be requested from the transport.
     *
     * @param hostPort the target host and port
     */
    default void getConn(String hostPort) { }

    /**
     * A connection was obtained.
     *
     * @param reused whether the connection carried an earlier exchange
     * @param wasIdle whether the connection came from the idle pool
     * @param idleTime how long the connection was idle, zero if unknown
     */
    default void gotConn(boolean reused, boolean wasIdle, Duration idleTime) { }

    /**
     * DNS resolution started.
     *
     * @param host the host being resolved
     */
    default void dnsStart(String host) { }

    /** DNS resolution finished. */
    default void dnsDone() { }

    /** A TCP connect started. */
    default void connectStart() { }

    /** A TCP connect finished. */
    default void connectDone() { }

    /** A TLS handshake started. */
    default void tlsHandshakeStart() { }

    /** A TLS handshake finished. */
    default void tlsHandshakeDone() { }

    /** The request, including its body, was fully written. */
    default void wroteRequest() { }

    /** The first byte of the response arrived. */
    default void gotFirstResponseByte() { }
}
