package de.entwicklertraining.http.pipeline.gate;

/**
 * Token bucket shared by every request of one client.
 * <p>
 * The bucket starts full. Tokens refill continuously at {@code ratePerSecond} up to
 * {@code burst}. {@link #tryAcquire()} never blocks; blocking and cancellation are the
 * caller's business (see {@link RateLimitGate}).
 */
public final class TokenBucket {
    private final double ratePerSecond;
    private final int burst;
    private double tokens;
    private long lastNs;

    /**
     * Creates a full bucket.
     *
     * @param ratePerSecond tokens added per second (must be &gt; 0)
     * @param burst bucket capacity (must be &gt;= 1)
     */
    public TokenBucket(double ratePerSecond, int burst) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be > 0");
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be >= 1");
        }
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.tokens = burst;
        this.lastNs = System.nanoTime();
    }

    /**
     * Takes one token if available.
     *
     * @return 0 if a token was taken, otherwise the nanoseconds until the next token is due
     */
    public synchronized long tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0;
        }
        long waitNs = (long) Math.ceil((1.0 - tokens) / ratePerSecond * 1_000_000_000L);
        return Math.max(1, waitNs);
    }

    /**
     * Gets the number of tokens currently in the bucket.
     *
     * @return the available tokens, possibly fractional
     */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public double getRatePerSecond() {
        return ratePerSecond;
    }

    public int getBurst() {
        return burst;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * ratePerSecond;
        if (add > 0) {
            tokens = Math.min(burst, tokens + add);
            lastNs = now;
        }
    }
}
