package de.entwicklertraining.http.pipeline.transport;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * What a transport hands back for one attempt, before the pipeline wraps it in a
 * {@link de.entwicklertraining.http.pipeline.Response}.
 *
 * @param statusCode the HTTP status code
 * @param reasonPhrase the status text, empty if the protocol carries none
 * @param protocol the protocol version, e.g. "HTTP/1.1"
 * @param headers the response headers
 * @param body the unread body, or null if there is none
 */
public record RawResponse(int statusCode, String reasonPhrase, String protocol,
                          Map<String, List<String>> headers, InputStream body) {

    /**
     * Gets the standard reason phrase for a status code.
     *
     * @param statusCode the status code
     * @return the reason phrase, empty for unknown codes
     */
    public static String standardReasonPhrase(int statusCode) {
        return switch (statusCode) {
            case 100 -> "Continue";
            case 101 -> "Switching Protocols";
            case 200 -> "OK";
            case 201 -> "Created";
            case 202 -> "Accepted";
            case 204 -> "No Content";
            case 206 -> "Partial Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 303 -> "See Other";
            case 304 -> "Not Modified";
            case 307 -> "Temporary Redirect";
            case 308 -> "Permanent Redirect";
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 408 -> "Request Timeout";
            case 409 -> "Conflict";
            case 410 -> "Gone";
            case 413 -> "Request Entity Too Large";
            case 415 -> "Unsupported Media Type";
            case 422 -> "Unprocessable Entity";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 501 -> "Not Implemented";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
    }
}
