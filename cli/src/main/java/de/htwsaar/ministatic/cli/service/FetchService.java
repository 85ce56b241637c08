package de.htwsaar.ministatic.cli.service;

import de.htwsaar.ministatic.cli.dto.HttpCallResult;
import de.htwsaar.ministatic.cli.util.HttpUtils;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;

/**
 * Ruft eine Datei vom Static-Server ab, optional als HEAD oder Conditional GET.
 */
public final class FetchService {

    private final HttpClient httpClient;
    private final Duration timeout;

    public FetchService(HttpClient httpClient, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * @param uri             vollständige Datei-URI
     * @param head            {@code true} für HEAD statt GET
     * @param ifNoneMatch     Wert für {@code If-None-Match} oder {@code null}
     * @param ifModifiedSince Wert für {@code If-Modified-Since} oder {@code null}
     * @return Ergebnis inkl. Headern
     */
    public HttpCallResult fetch(URI uri, boolean head, String ifNoneMatch, String ifModifiedSince) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(Objects.requireNonNull(uri, "uri")).timeout(timeout);
        if (head) {
            builder.method("HEAD", HttpRequest.BodyPublishers.noBody());
        } else {
            builder.GET();
        }
        if (ifNoneMatch != null && !ifNoneMatch.isBlank()) {
            builder.header("If-None-Match", ifNoneMatch.trim());
        }
        if (ifModifiedSince != null && !ifModifiedSince.isBlank()) {
            builder.header("If-Modified-Since", ifModifiedSince.trim());
        }
        return HttpUtils.sendForStringBody(httpClient, builder.build());
    }
}
