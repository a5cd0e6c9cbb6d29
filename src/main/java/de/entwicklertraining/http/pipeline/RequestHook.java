package de.entwicklertraining.http.pipeline;

/**
 * A callback that runs before a request is sent.
 * <p>
 * Pre-request hooks run in registration order. A hook may mutate the request or
 * block until the request is admitted (see the admission gates). Throwing aborts
 * the call: no later hook runs and nothing is sent.
 */
@FunctionalInterface
public interface RequestHook {

    /**
     * Runs before the request is sent.
     *
     * @param request the request about to be sent
     */
    void enter(Request request);
}
