package de.htwsaar.ministatic.core;

/**
 * Optionen pro Request (nicht pro Handler).
 *
 * @param cachePrefix Präfix für den Cache-Key, trennt logische Mount-Points ({@code null} = "")
 * @param transform   optionale Body-Transformation
 * @param nocache     erzwingt {@code no-cache, no-store, must-revalidate} für diese Antwort
 */
public record RequestOptions(String cachePrefix, BodyTransform transform, boolean nocache) {

    private static final RequestOptions DEFAULTS = new RequestOptions("", null, false);

    public RequestOptions {
        cachePrefix = cachePrefix == null ? "" : cachePrefix;
    }

    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public RequestOptions withCachePrefix(String prefix) {
        return new RequestOptions(prefix, transform, nocache);
    }

    public RequestOptions withTransform(BodyTransform t) {
        return new RequestOptions(cachePrefix, t, nocache);
    }

    public RequestOptions withNocache(boolean value) {
        return new RequestOptions(cachePrefix, transform, value);
    }

    /** Cache-Key für einen (query-freien) Request-Pfad. */
    public String cacheKey(String requestPath) {
        return cachePrefix + requestPath;
    }
}
