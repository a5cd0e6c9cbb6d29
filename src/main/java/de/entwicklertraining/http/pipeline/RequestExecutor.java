package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.cancellation.RequestCancelledException;
import de.entwicklertraining.http.pipeline.retry.Retrier;
import de.entwicklertraining.http.pipeline.trace.ClientTrace;
import de.entwicklertraining.http.pipeline.trace.ConnectionLifecycleListener;
import de.entwicklertraining.http.pipeline.transport.HttpTransport;
import de.entwicklertraining.http.pipeline.transport.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a request through the pipeline.
 * <p>
 * The sequence for one call is strictly:
 * <ol>
 *   <li>pre-request hooks in registration order, the first failure aborts the call</li>
 *   <li>if retry is enabled, the body is made replayable</li>
 *   <li>the attempt loop: trace start, transport call, trace stop, gzip unwrap, retry
 *       decision, then either the backoff wait or the end of the loop</li>
 *   <li>idle pooled connections are released</li>
 *   <li>post-response hooks in registration order, each seeing the final outcome</li>
 * </ol>
 * The request's {@link CancellationContext} is observed at every blocking point and
 * ends the call with a {@link RequestCancelledException} as soon as it fires.
 */
public final class RequestExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

    private final HttpTransport transport;
    private final List<RequestHook> beforeRequestCallbacks;
    private final List<ResponseHook> afterResponseCallbacks;

    /**
     * Creates an executor. The hook lists are read on every call, so hooks added to them
     * later take effect for later calls.
     *
     * @param transport the network stack
     * @param beforeRequestCallbacks hooks run before a request is sent
     * @param afterResponseCallbacks hooks run once a call has its final outcome
     */
    public RequestExecutor(HttpTransport transport,
                           List<RequestHook> beforeRequestCallbacks,
                           List<ResponseHook> afterResponseCallbacks) {
        this.transport = transport;
        this.beforeRequestCallbacks = beforeRequestCallbacks;
        this.afterResponseCallbacks = afterResponseCallbacks;
    }

    /**
     * Executes a request.
     *
     * @param request the request
     * @return the final response; its body must be read or closed by the caller
     * @throws HttpPipelineClient.RequestPreparationException if a hook rejects the request or its body cannot be captured
     * @throws HttpPipelineClient.TransportException if the last attempt failed on the network
     * @throws HttpPipelineClient.StreamException if a body could not be read or decoded
     * @throws RequestCancelledException if the request's context fired
     * @throws RuntimeException thrown by a transport, retry trigger or backoff; passed through
     *         unchanged once the post hooks have seen it
     */
    public Response execute(Request request) {
        onBeforeRequest(request);

        Response response = null;
        RuntimeException failure = null;
        try {
            Retrier retrier = request.getRetryConfig().map(Retrier::new).orElse(null);
            if (retrier != null) {
                retrier.prepareRequest(request);
            }
            response = doWithRetry(request, retrier);
        } catch (RuntimeException e) {
            // anything a transport, trigger or backoff throws still reaches the post hooks
            failure = e;
        }

        onAfterResponse(response, failure);
        if (failure != null) {
            throw failure;
        }
        return response;
    }

    private void onBeforeRequest(Request request) {
        List<ExchangeCallback> entered = new ArrayList<>();
        for (RequestHook callback : beforeRequestCallbacks) {
            try {
                callback.enter(request);
            } catch (RuntimeException e) {
                RuntimeException failure = asPreparationFailure(e);
                // release what was acquired, e.g. concurrency slots
                for (ExchangeCallback exchange : entered) {
                    exitQuietly(exchange, null, failure);
                }
                throw failure;
            }
            if (callback instanceof ExchangeCallback exchange) {
                entered.add(exchange);
            }
        }
    }

    private Response doWithRetry(Request request, Retrier retrier) {
        CancellationContext context = request.getContext();
        for (int attemptNum = 0; ; attemptNum++) {
            ClientTrace trace = request.isClientTraceEnabled() ? new ClientTrace() : null;
            Response response = null;
            RuntimeException error = null;
            logger.debug("Sending {} (attempt {})", request, attemptNum + 1);
            try {
                response = attempt(request, trace);
            } catch (HttpPipelineClient.HttpPipelineException | RequestCancelledException e) {
                error = e;
            } catch (RuntimeException e) {
                transport.closeIdleConnections();
                throw e;
            }

            boolean retry;
            Duration sleep;
            try {
                retry = retrier != null && retrier.shouldRetry(context, attemptNum, response, error);
                sleep = retry ? retrier.backoff(attemptNum, response, error) : Duration.ZERO;
            } catch (RuntimeException e) {
                if (response != null) {
                    response.close();
                }
                transport.closeIdleConnections();
                throw e;
            }
            if (!retry) {
                transport.closeIdleConnections();
                if (error != null) {
                    throw error;
                }
                return response;
            }

            if (response != null) {
                // lets the transport reuse the connection
                response.discard();
            }
            try {
                request.rewindBody();
            } catch (IOException e) {
                transport.closeIdleConnections();
                throw new HttpPipelineClient.StreamException("Failed to replay request body of " + request, e);
            }

            logger.debug("Retrying {} in {} ms after {}", request, sleep.toMillis(),
                    error != null ? error.getMessage() : response.getStatus());
            try {
                if (context.await(sleep)) {
                    transport.closeIdleConnections();
                    throw context.toException();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                transport.closeIdleConnections();
                throw new HttpPipelineClient.HttpPipelineException("Interrupted during backoff", e);
            }
        }
    }

    private Response attempt(Request request, ClientTrace trace) {
        ConnectionLifecycleListener listener = trace == null ? ConnectionLifecycleListener.NONE : trace;
        RawResponse raw;
        try {
            raw = transport.execute(request, listener);
        } catch (IOException e) {
            throw new HttpPipelineClient.TransportException(request + ": " + e.getMessage(), e);
        } finally {
            // the trace stops before the transcoder reads the gzip header
            if (trace != null) {
                trace.done();
            }
        }
        Response response = new Response(request, raw);
        response.setClientTrace(trace);
        return ResponseTranscoder.apply(response);
    }

    private void onAfterResponse(Response response, Throwable error) {
        for (ResponseHook callback : afterResponseCallbacks) {
            exitQuietly(callback, response, error);
        }
    }

    private static void exitQuietly(ResponseHook callback, Response response, Throwable error) {
        try {
            callback.exit(response, error);
        } catch (RuntimeException e) {
            logger.warn("After response callback {} failed: {}", callback, e.getMessage(), e);
        }
    }

    private static RuntimeException asPreparationFailure(RuntimeException e) {
        if (e instanceof HttpPipelineClient.HttpPipelineException || e instanceof RequestCancelledException) {
            return e;
        }
        return new HttpPipelineClient.RequestPreparationException("Request rejected by callback: " + e.getMessage(), e);
    }
}
