package de.entwicklertraining.http.pipeline;

import de.entwicklertraining.http.pipeline.cancellation.CancellationContext;
import de.entwicklertraining.http.pipeline.multipart.MultipartBody;
import de.entwicklertraining.http.pipeline.retry.RetryConfig;

import java.io.InputStream;

/**
 * Ready-made {@link RequestHook}s for the client's verb shortcuts.
 * <pre>
 * Response response = client.post("https://httpbin.org/post",
 *     RequestHooks.withText("hello"),
 *     RequestHooks.enableRetry(),
 *     RequestHooks.withContext(CancellationContext.withTimeout(Duration.ofSeconds(10))));
 * </pre>
 */
public final class RequestHooks {

    private RequestHooks() {
    }

    public static RequestHook withHeader(String name, String value) {
        return request -> request.setHeader(name, value);
    }

    public static RequestHook withContext(CancellationContext context) {
        return request -> request.setContext(context);
    }

    public static RequestHook withBody(InputStream body) {
        return request -> request.setBody(body);
    }

    public static RequestHook withContent(byte[] content) {
        return request -> request.setContent(content);
    }

    public static RequestHook withText(String text) {
        return request -> request.setText(text);
    }

    public static RequestHook withFiles(MultipartBody formData) {
        return request -> request.setFiles(formData);
    }

    public static RequestHook enableRetry() {
        return Request::enableRetry;
    }

    public static RequestHook enableRetry(RetryConfig retryConfig) {
        return request -> request.enableRetry(retryConfig);
    }

    public static RequestHook enableClientTrace() {
        return Request::enableClientTrace;
    }
}
