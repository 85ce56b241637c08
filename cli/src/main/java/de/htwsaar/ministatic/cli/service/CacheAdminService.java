package de.htwsaar.ministatic.cli.service;

import de.htwsaar.ministatic.cli.dto.HttpCallResult;
import de.htwsaar.ministatic.cli.util.HttpUtils;
import de.htwsaar.ministatic.cli.util.UriUtils;
import de.htwsaar.ministatic.common.dto.CacheStatsDto;
import de.htwsaar.ministatic.common.serialization.JacksonCodec;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Client der Cache-Admin-API {@code /api/static/cache}.
 */
public final class CacheAdminService {

    private static final String CACHE_API = "api/static/cache/";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String token;

    /**
     * @param httpClient HTTP-Client
     * @param timeout    Request-Timeout
     * @param token      Admin-Token ({@code null} = Env/Property/Default)
     */
    public CacheAdminService(HttpClient httpClient, Duration timeout, String token) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.token = token;
    }

    /**
     * Invalidiert den Eintrag eines Request-Pfads. Der Pfad wird unverändert übertragen.
     *
     * @throws IllegalArgumentException wenn sich aus dem Pfad keine gültige URI bilden lässt
     */
    public HttpCallResult invalidatePath(URI server, String path) {
        String p = path.startsWith("/") ? path : "/" + path;
        URI uri = UriUtils.withPath(server, "/" + CACHE_API + "files" + p)
                .orElseThrow(() -> new IllegalArgumentException("Invalid path: " + path));
        return delete(uri);
    }

    public HttpCallResult invalidatePrefix(URI server, String prefix) {
        String encoded = URLEncoder.encode(prefix, StandardCharsets.UTF_8);
        return delete(UriUtils.ensureTrailingSlash(server).resolve(CACHE_API + "prefix?value=" + encoded));
    }

    public HttpCallResult clearAll(URI server) {
        return delete(UriUtils.ensureTrailingSlash(server).resolve(CACHE_API + "all"));
    }

    /**
     * @return Rohantwort von {@code GET /stats}
     */
    public HttpCallResult stats(URI server, int windowSec) {
        URI uri = UriUtils.ensureTrailingSlash(server).resolve(CACHE_API + "stats?windowSec=" + Math.max(1, windowSec));
        HttpRequest request = HttpUtils.newAdminRequestBuilder(uri, token).timeout(timeout).GET().build();
        return HttpUtils.sendForStringBody(httpClient, request);
    }

    /**
     * Dekodiert die Antwort von {@link #stats(URI, int)}.
     *
     * @throws de.htwsaar.ministatic.common.serialization.MiniStaticSerializationException bei ungültigem JSON
     */
    public static CacheStatsDto parseStats(HttpCallResult result) {
        return JacksonCodec.fromJson(result.body(), CacheStatsDto.class);
    }

    private HttpCallResult delete(URI uri) {
        HttpRequest request = HttpUtils.newAdminRequestBuilder(uri, token).timeout(timeout).DELETE().build();
        return HttpUtils.sendForStringBody(httpClient, request);
    }
}
