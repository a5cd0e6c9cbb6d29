package de.entwicklertraining.http.pipeline.retry;

import de.entwicklertraining.http.pipeline.Response;

import java.util.Arrays;

/**
 * Decides whether the outcome of an attempt warrants another attempt.
 */
@FunctionalInterface
public interface RetryTrigger {

    /**
     * Tests the outcome of an attempt.
     *
     * @param response the response of the attempt, or null if it failed
     * @param error the failure of the attempt, or null if it produced a response
     * @return true to request another attempt
     */
    boolean test(Response response, Throwable error);

    /**
     * Retries transport failures and 429 responses. This is what a retry configuration
     * without triggers does.
     *
     * @return the default trigger
     */
    static RetryTrigger defaultTrigger() {
        return (response, error) -> error != null || (response != null && response.getStatusCode() == 429);
    }

    /**
     * Retries any 5xx response.
     *
     * @return a trigger for server errors
     */
    static RetryTrigger serverErrors() {
        return (response, error) -> response != null && response.getStatusCode() >= 500;
    }

    /**
     * Retries responses with one of the given status codes.
     *
     * @param statusCodes the status codes to retry
     * @return a trigger for the given status codes
     */
    static RetryTrigger onStatus(int... statusCodes) {
        int[] codes = statusCodes.clone();
        Arrays.sort(codes);
        return (response, error) -> response != null && Arrays.binarySearch(codes, response.getStatusCode()) >= 0;
    }

    /**
     * Retries any failed attempt.
     *
     * @return a trigger for transport failures
     */
    static RetryTrigger onError() {
        return (response, error) -> error != null;
    }
}
