package de.entwicklertraining.http.pipeline;

/**
 * A paired callback that is entered before the request is sent and exited once
 * the call has a final outcome.
 * <p>
 * The pipeline guarantees that every callback whose {@link #enter(Request)} completed
 * normally is also exited exactly once for that call, including when a later
 * pre-request hook fails.
 */
public interface ExchangeCallback extends RequestHook, ResponseHook {
}
