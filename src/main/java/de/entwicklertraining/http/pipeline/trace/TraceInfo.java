package de.entwicklertraining.http.pipeline.trace;

import org.json.JSONObject;

import java.time.Duration;

/**
 * Read-only timing breakdown of a traced request attempt.
 * <p>
 * Durations whose start or end event never fired are {@link Duration#ZERO}.
 *
 * @param dnsLookupTime time the transport took to resolve the host
 * @param tcpConnTime time the TCP connect took
 * @param tlsHandshakeTime time the TLS handshake took
 * @param connTime time it took to obtain a connection
 * @param serverTime time between the request being written and the first response byte
 * @param responseTime time between the first response byte and the end of the attempt
 * @param totalTime time the whole attempt took end-to-end
 * @param connReused whether the connection carried an earlier exchange
 * @param connWasIdle whether the connection came from the idle pool
 * @param connIdleTime how long the connection was idle, if it was
 */
public record TraceInfo(Duration dnsLookupTime,
                        Duration tcpConnTime,
                        Duration tlsHandshakeTime,
                        Duration connTime,
                        Duration serverTime,
                        Duration responseTime,
                        Duration totalTime,
                        boolean connReused,
                        boolean connWasIdle,
                        Duration connIdleTime) {

    /**
     * Renders this trace as JSON, durations in milliseconds.
     *
     * @return the JSON representation
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("dns_lookup_time", millis(dnsLookupTime));
        json.put("tcp_conn_time", millis(tcpConnTime));
        if (!tlsHandshakeTime.isZero()) {
            json.put("tls_handshake_time", millis(tlsHandshakeTime));
        }
        json.put("conn_time", millis(connTime));
        json.put("server_time", millis(serverTime));
        json.put("response_time", millis(responseTime));
        json.put("total_time", millis(totalTime));
        json.put("conn_reused", connReused);
        json.put("conn_was_idle", connWasIdle);
        json.put("conn_idle_time", millis(connIdleTime));
        return json;
    }

    private static double millis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }
}
