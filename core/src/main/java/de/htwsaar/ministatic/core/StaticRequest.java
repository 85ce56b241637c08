package de.htwsaar.ministatic.core;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Framework-neutrale Sicht auf einen eingehenden Request.
 *
 * <p>Adapter (z. B. der Spring-Controller) bilden ihre Request-Objekte hierauf ab.</p>
 *
 * @param method  HTTP-Methode
 * @param url     Request-Target wie empfangen (percent-encoded, ggf. mit Query-String)
 * @param headers Request-Header; Lookup erfolgt case-insensitive
 */
public record StaticRequest(String method, String url, Map<String, String> headers) {

    public StaticRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) copy.putAll(headers);
        headers = Collections.unmodifiableMap(copy);
    }

    public static StaticRequest get(String url) {
        return new StaticRequest("GET", url, Map.of());
    }

    public static StaticRequest head(String url) {
        return new StaticRequest("HEAD", url, Map.of());
    }

    /** Kopie mit zusätzlichem Header. */
    public StaticRequest withHeader(String name, String value) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.put(name, value);
        return new StaticRequest(method, url, copy);
    }

    /** @return Header-Wert oder {@code null} */
    public String header(String name) {
        return headers.get(name);
    }

    public boolean isGet() {
        return "GET".equals(method.toUpperCase(Locale.ROOT));
    }

    public boolean isHead() {
        return "HEAD".equals(method.toUpperCase(Locale.ROOT));
    }

    /** Pfad ohne Query-String (noch percent-encoded). */
    public String path() {
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }
}
