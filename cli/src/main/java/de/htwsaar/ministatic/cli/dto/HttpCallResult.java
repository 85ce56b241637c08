package de.htwsaar.ministatic.cli.dto;

import java.util.Map;

/**
 * Result of an HTTP call: status code, response headers and body, or an error message
 * when no response arrived.
 */
public record HttpCallResult(Integer statusCode, Map<String, String> headers, String body, String error) {

    public HttpCallResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpCallResult http(int statusCode, Map<String, String> headers, String body) {
        return new HttpCallResult(statusCode, headers, body, null);
    }

    public static HttpCallResult ioError(String message) {
        return new HttpCallResult(null, null, null, message == null ? "io error" : message);
    }

    public boolean is2xx() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }
}
