package de.entwicklertraining.http.pipeline.gate;

import de.entwicklertraining.http.pipeline.HttpPipelineClient;
import de.entwicklertraining.http.pipeline.Request;
import de.entwicklertraining.http.pipeline.RequestHook;
import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;

import java.time.Duration;
import java.util.Objects;

/**
 * Admits a request once a token is available from the shared {@link TokenBucket}.
 * <p>
 * The wait observes the request's {@link CancellationContext}. A request whose context
 * fires before a token becomes available fails with the cancellation error and takes
 * no token.
 */
public final class RateLimitGate implements RequestHook {
    private final TokenBucket bucket;

    public RateLimitGate(TokenBucket bucket) {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    @Override
    public void enter(Request request) {
        CancellationContext context = request.getContext();
        while (true) {
            context.throwIfCancelled();
            long waitNs = bucket.tryAcquire();
            if (waitNs == 0) {
                return;
            }
            try {
                if (context.await(Duration.ofNanos(waitNs))) {
                    throw context.toException();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HttpPipelineClient.HttpPipelineException("Interrupted while waiting for rate limit", e);
            }
        }
    }

    public TokenBucket getBucket() {
        return bucket;
    }
}
