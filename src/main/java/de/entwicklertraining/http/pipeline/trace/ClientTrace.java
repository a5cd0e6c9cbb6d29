package de.entwicklertraining.http.pipeline.trace;

import java.time.Duration;

/**
 * Records the connection lifecycle timestamps of one request attempt.
 * <p>
 * The executor creates one instance per traced attempt, hands it to the transport as
 * its {@link ConnectionLifecycleListener} and calls {@link #done()} when the attempt
 * returns. Timestamps come from {@link System#nanoTime()}; zero means "never fired".
 */
public final class ClientTrace implements ConnectionLifecycleListener {

    private final long start;
    private volatile long dnsStart;
    private volatile long dnsDone;
    private volatile long connStart;
    private volatile long connDone;
    private volatile long tlsHandshakeStart;
    private volatile long tlsHandshakeDone;
    private volatile long gotFirstResponseByte;
    private volatile long wroteRequest;
    private volatile long getConn;
    private volatile long gotConn;
    private volatile long end;
    private volatile boolean connReused;
    private volatile boolean connWasIdle;
    private volatile Duration connIdleTime = Duration.ZERO;

    /**
     * Starts a new trace at the current time.
     */
    public ClientTrace() {
        this.start = now();
    }

    private static long now() {
        // nanoTime may legitimately be 0; shift so 0 stays reserved for "not fired"
        long t = System.nanoTime();
        return t == 0 ? 1 : t;
    }

    @Override
    public void getConn(String hostPort) {
        getConn = now();
    }

    @Override
    public void gotConn(boolean reused, boolean wasIdle, Duration idleTime) {
        gotConn = now();
        connReused = reused;
        connWasIdle = wasIdle;
        connIdleTime = idleTime == null ? Duration.ZERO : idleTime;
    }

    @Override
    public void dnsStart(String host) {
        dnsStart = now();
    }

    @Override
    public void dnsDone() {
        dnsDone = now();
    }

    @Override
    public void connectStart() {
        connStart = now();
    }

    @Override
    public void connectDone() {
        connDone = now();
    }

    @Override
    public void tlsHandshakeStart() {
        tlsHandshakeStart = now();
    }

    @Override
    public void tlsHandshakeDone() {
        tlsHandshakeDone = now();
    }

    @Override
    public void wroteRequest() {
        wroteRequest = now();
    }

    @Override
    public void gotFirstResponseByte() {
        gotFirstResponseByte = now();
    }

    /**
     * Marks the end of the attempt.
     */
    public void done() {
        end = now();
    }

    /**
     * Builds the timing snapshot of this attempt.
     *
     * @return the trace info
     */
    public TraceInfo traceInfo() {
        return new TraceInfo(
                between(dnsStart, dnsDone),
                between(connStart, connDone),
                between(tlsHandshakeStart, tlsHandshakeDone),
                between(getConn, gotConn),
                between(wroteRequest, gotFirstResponseByte),
                between(gotFirstResponseByte, end),
                between(start, end),
                connReused,
                connWasIdle,
                connIdleTime);
    }

    private static Duration between(long from, long to) {
        if (from == 0 || to == 0 || to < from) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(to - from);
    }
}
