package de.htwsaar.ministatic.core;

import de.htwsaar.ministatic.core.cache.CacheEntry;
import de.htwsaar.ministatic.core.cache.CacheStore;
import de.htwsaar.ministatic.core.http.HeaderNames;
import de.htwsaar.ministatic.core.http.HttpDates;
import de.htwsaar.ministatic.core.mime.ContentTypeResolver;
import de.htwsaar.ministatic.core.resolve.ResolvedFile;
import de.htwsaar.ministatic.core.resolve.RootLookup;
import de.htwsaar.ministatic.core.resolve.RootResolver;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Liefert Dateien aus einem oder mehreren Root-Verzeichnissen aus.
 *
 * <p>Ablauf pro Request: Pfadprüfung → Cache-Lookup → Root-Auflösung → Lesen/Transformieren
 * → MIME-Auflösung → Header-Aufbau → Conditional GET → Cache-Write-Back.</p>
 *
 * <p><b>Kein</b> Spring-Web-Typ hier; Adapter übersetzen {@link StaticRequest} und
 * {@link StaticFileResponse} in ihre Framework-Typen.</p>
 */
public final class StaticFileHandler {

    private static final Logger log = LoggerFactory.getLogger(StaticFileHandler.class);

    static final String NO_CACHE = "no-cache, no-store, must-revalidate";
    static final byte[] FORBIDDEN_BODY = "Forbidden".getBytes(StandardCharsets.UTF_8);

    private final HandlerConfig config;
    private final CacheStore cacheStore;
    private final RootResolver rootResolver;
    private final ContentTypeResolver contentTypes;
    private final Clock clock;

    /**
     * Erstellt den Handler mit Constructor Injection.
     *
     * @param config       Handler-Konfiguration
     * @param cacheStore   Response-Cache (wird auch bei deaktiviertem Cache für Invalidierung genutzt)
     * @param contentTypes MIME-Auflösung inkl. Sniffing
     * @param clock        Zeitquelle für {@code expires}
     */
    public StaticFileHandler(
            HandlerConfig config, CacheStore cacheStore, ContentTypeResolver contentTypes, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore must not be null");
        this.contentTypes = Objects.requireNonNull(contentTypes, "contentTypes must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.rootResolver = new RootResolver(config.roots());
    }

    public HandlerConfig config() {
        return config;
    }

    /**
     * Beantwortet einen Request.
     *
     * @param request eingehender Request
     * @param options Optionen für diesen Request
     * @return Antwort (200, 304, 403) oder leer, wenn der Handler den Request nicht übernimmt
     *         (andere Methode als GET/HEAD, Datei in keinem Root, Verzeichnis)
     * @throws IOException bei Dateisystemfehlern außer "nicht gefunden"
     */
    public Optional<StaticFileResponse> handle(StaticRequest request, RequestOptions options) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        RequestOptions opts = options != null ? options : RequestOptions.defaults();
        boolean head = request.isHead();
        if (!head && !request.isGet()) {
            return Optional.empty();
        }

        String requestPath = request.path();
        Optional<String> decoded = decode(requestPath);
        if (decoded.isEmpty() || isUnsafe(decoded.get())) {
            log.warn("Rejected unsafe path {}", requestPath);
            return Optional.of(forbidden());
        }
        String decodedPath = decoded.get();

        String cacheKey = opts.cacheKey(requestPath);
        if (config.cacheEnabled() && !isConditional(request)) {
            CacheEntry cached = cacheStore.get(cacheKey);
            if (cached != null) {
                log.debug("Cache hit for {}", cacheKey);
                return Optional.of(new StaticFileResponse(
                        200, cached.headers(), head ? null : cached.body(), CacheDecision.HIT));
            }
        }

        RootLookup lookup = rootResolver.resolve(decodedPath);
        if (lookup instanceof RootLookup.Failed failed) {
            throw failed.cause();
        }
        if (!(lookup instanceof RootLookup.Found found) || found.file().stat().directory()) {
            return Optional.empty();
        }
        ResolvedFile file = found.file();

        byte[] body = Files.readAllBytes(file.absolutePath());
        if (opts.transform() != null) {
            body = Objects.requireNonNull(
                    opts.transform().apply(file.absolutePath(), body), "transform must not return null");
        }

        Map<String, String> headers = buildHeaders(file, body, opts);

        if (!isModified(request, headers)) {
            Map<String, String> notModified = new LinkedHashMap<>();
            headers.forEach((name, value) -> {
                if (!name.toLowerCase(Locale.ROOT).startsWith("content")) notModified.put(name, value);
            });
            return Optional.of(new StaticFileResponse(304, notModified, null, CacheDecision.BYPASS));
        }

        if (!config.cacheEnabled()) {
            return Optional.of(new StaticFileResponse(200, headers, head ? null : body, CacheDecision.BYPASS));
        }
        cacheStore.put(cacheKey, new CacheEntry(headers, body));
        log.debug("Cached {} ({} bytes)", cacheKey, body.length);
        return Optional.of(new StaticFileResponse(200, headers, head ? null : body, CacheDecision.MISS));
    }

    /** Leert den gesamten Cache. */
    public void clearCache() {
        cacheStore.clear();
    }

    /**
     * Invalidiert einen Eintrag ohne Präfix.
     *
     * @param key Request-Pfad
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    public boolean clearCache(String key) {
        return clearCache(key, RequestOptions.defaults());
    }

    /**
     * Invalidiert den Eintrag {@code cachePrefix + key}; ohne Key wird alles geleert.
     *
     * @param key     Request-Pfad oder {@code null}
     * @param options liefert den Cache-Präfix
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    public boolean clearCache(String key, RequestOptions options) {
        if (key == null) {
            boolean hadEntries = cacheStore.size() > 0;
            cacheStore.clear();
            return hadEntries;
        }
        RequestOptions opts = options != null ? options : RequestOptions.defaults();
        return cacheStore.remove(opts.cacheKey(key));
    }

    /**
     * Invalidiert alle Einträge, deren Key mit {@code keyPrefix} beginnt (z. B. ein ganzer Mount-Point).
     *
     * @param keyPrefix Key-Präfix
     * @return Anzahl entfernter Einträge
     */
    public int clearCachePrefix(String keyPrefix) {
        return cacheStore.removeByPrefix(keyPrefix);
    }

    public int cacheSize() {
        return cacheStore.size();
    }

    private Map<String, String> buildHeaders(ResolvedFile file, byte[] body, RequestOptions opts) {
        long mtime = file.stat().lastModifiedMillis();
        Map<String, String> h = new LinkedHashMap<>();
        h.put(HeaderNames.CONTENT_TYPE, contentTypes.resolve(file.absolutePath().toString(), body));
        h.put(HeaderNames.CONTENT_LENGTH, String.valueOf(body.length));
        h.put(HeaderNames.LAST_MODIFIED, HttpDates.format(mtime));
        h.put(HeaderNames.CACHE_CONTROL,
                opts.nocache() ? NO_CACHE : "public, max-age=" + (config.maxAgeMillis() / 1000));
        h.put(HeaderNames.ETAG, "\"" + file.stat().size() + "-" + mtime + "\"");
        h.put(HeaderNames.EXPIRES, HttpDates.format(clock.millis()));
        String name = file.fileName();
        if (name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            h.put(HeaderNames.CONTENT_DISPOSITION, "attachment; filename=\"" + name + "\"");
        }
        return h;
    }

    private static boolean isModified(StaticRequest request, Map<String, String> headers) {
        String ifNoneMatch = request.header(HeaderNames.IF_NONE_MATCH);
        if (ifNoneMatch != null) {
            if (ifNoneMatch.equals(headers.get(HeaderNames.ETAG))) return false;
        }
        Optional<Long> since = HttpDates.parse(request.header(HeaderNames.IF_MODIFIED_SINCE));
        if (since.isPresent()) {
            Optional<Long> lastModified = HttpDates.parse(headers.get(HeaderNames.LAST_MODIFIED));
            if (lastModified.isPresent() && lastModified.get() <= since.get()) return false;
        }
        return true;
    }

    private static boolean isConditional(StaticRequest request) {
        return request.header(HeaderNames.IF_NONE_MATCH) != null
                || request.header(HeaderNames.IF_MODIFIED_SINCE) != null;
    }

    private static Optional<String> decode(String path) {
        try {
            return Optional.of(StringUtils.uriDecode(path, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** {@code ..} als Pfadsegment oder NUL-Zeichen. */
    static boolean isUnsafe(String decodedPath) {
        if (decodedPath.indexOf('\0') >= 0) return true;
        for (String segment : decodedPath.split("[/\\\\]")) {
            if ("..".equals(segment)) return true;
        }
        return false;
    }

    private static StaticFileResponse forbidden() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(HeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        h.put(HeaderNames.CONTENT_LENGTH, String.valueOf(FORBIDDEN_BODY.length));
        return new StaticFileResponse(403, h, FORBIDDEN_BODY.clone(), CacheDecision.BYPASS);
    }
}
