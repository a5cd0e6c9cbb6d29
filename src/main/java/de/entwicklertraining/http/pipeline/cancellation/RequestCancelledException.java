package de.entwicklertraining.http.pipeline.cancellation;

/**
 * Thrown when a request's {@link CancellationContext} fires while the request is
 * waiting at an admission gate, sleeping between retry attempts or talking to the
 * transport.
 * <p>
 * A cancellation is always terminal: the pipeline never retries after it.
 */
public class RequestCancelledException extends RuntimeException {

    /**
     * Why the context stopped.
     */
    public enum Reason {
        /** The context was cancelled explicitly via {@link CancellationContext#cancel()}. */
        CANCELED,
        /** The context's deadline passed. */
        DEADLINE_EXCEEDED
    }

    private final Reason reason;

    /**
     * Creates a new exception for the given reason.
     *
     * @param reason why the context stopped
     */
    public RequestCancelledException(Reason reason) {
        super(reason == Reason.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context canceled");
        this.reason = reason;
    }

    /**
     * Gets the reason the context stopped.
     *
     * @return the cancellation reason
     */
    public Reason getReason() {
        return reason;
    }

    /**
     * Checks whether the context stopped because its deadline passed.
     *
     * @return true for deadline expiry, false for explicit cancellation
     */
    public boolean isDeadlineExceeded() {
        return reason == Reason.DEADLINE_EXCEEDED;
    }
}
