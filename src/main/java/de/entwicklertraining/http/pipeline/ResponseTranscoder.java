package de.entwicklertraining.http.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Unwraps gzip-encoded response bodies.
 * <p>
 * A response declaring {@code Content-Encoding: gzip} (case-insensitive) with a non-empty
 * body gets its body replaced by a decoding stream. A body that is already a decoding
 * stream is left alone, so applying the transcoder twice is harmless.
 */
public final class ResponseTranscoder {
    private static final Logger logger = LoggerFactory.getLogger(ResponseTranscoder.class);

    private ResponseTranscoder() {
    }

    /**
     * Installs a gzip decoder on the response body if the response is gzip-encoded.
     *
     * @param response the response of an attempt
     * @return the same response
     * @throws HttpPipelineClient.StreamException if the gzip header cannot be read; the
     *         original body is closed before the exception is thrown
     */
    public static Response apply(Response response) {
        String encoding = response.getHeader("Content-Encoding").orElse("");
        if (!"gzip".equalsIgnoreCase(encoding.trim()) || !response.hasBody()) {
            return response;
        }
        InputStream original = response.getUnwrappedBody();
        if (original instanceof GZIPInputStream) {
            return response;
        }
        try {
            response.setBody(new GZIPInputStream(original));
        } catch (IOException e) {
            response.close();
            throw new HttpPipelineClient.StreamException(
                    "Failed to decode gzip response of " + response.getRequest() + ": " + e.getMessage(), e);
        }
        logger.debug("Decoding gzip response body of {}", response.getRequest());
        return response;
    }
}
