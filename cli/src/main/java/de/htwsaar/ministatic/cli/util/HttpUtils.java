package de.htwsaar.ministatic.cli.util;

import de.htwsaar.ministatic.cli.dto.HttpCallResult;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class HttpUtils {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";
    static final String TOKEN_ENV = "MINISTATIC_ADMIN_TOKEN";
    static final String TOKEN_PROPERTY = "ministatic.admin.token";
    static final String DEFAULT_TOKEN = "secret-token";

    private HttpUtils() {}

    /**
     * Sendet einen Request und erfasst Status, Header und Body als String.
     * InterruptedException und IOException werden zu {@link HttpCallResult#ioError(String)}.
     */
    public static HttpCallResult sendForStringBody(HttpClient httpClient, HttpRequest request) {
        Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(request, "request");

        try {
            HttpResponse<String> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(resp.statusCode(), flatten(resp.headers().map()), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage());
        }
    }

    /**
     * Request-Builder für die Cache-Admin-API mit {@code X-Admin-Token}.
     *
     * @param uri   Ziel-URI
     * @param token Token; falls leer: Env {@value #TOKEN_ENV}, dann System-Property, dann Default
     * @return vorkonfigurierter Builder
     */
    public static HttpRequest.Builder newAdminRequestBuilder(URI uri, String token) {
        Objects.requireNonNull(uri, "uri");
        String effectiveToken = token;
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = System.getenv(TOKEN_ENV);
        }
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = System.getProperty(TOKEN_PROPERTY);
        }
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = DEFAULT_TOKEN;
        }
        return HttpRequest.newBuilder(uri).header(ADMIN_TOKEN_HEADER, effectiveToken);
    }

    // mehrfache Header werden kommasepariert zusammengefasst
    private static Map<String, String> flatten(Map<String, List<String>> headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (name != null && !name.startsWith(":")) flat.put(name.toLowerCase(Locale.ROOT), String.join(", ", values));
        });
        return flat;
    }
}
