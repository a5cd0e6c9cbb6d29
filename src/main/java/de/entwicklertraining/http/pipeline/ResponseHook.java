package de.entwicklertraining.http.pipeline;

/**
 * A callback that runs after the retry loop has finished, whatever its outcome.
 * <p>
 * Post-response hooks cannot change the outcome of the call. Exceptions they throw
 * are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ResponseHook {

    /**
     * Runs once the call has a final outcome.
     *
     * @param response the final response, or null if the call failed
     * @param error the failure, or null if the call produced a response
     */
    void exit(Response response, Throwable error);
}
