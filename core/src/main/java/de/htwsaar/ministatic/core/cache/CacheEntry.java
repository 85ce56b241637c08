package de.htwsaar.ministatic.core.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unveränderlicher Cache-Eintrag: Header exakt wie an den Client gesendet plus Datei-Inhalt.
 *
 * @param headers Response-Header (Reihenfolge bleibt erhalten)
 * @param body    Body-Bytes
 */
public record CacheEntry(Map<String, String> headers, byte[] body) {

    public CacheEntry {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(body, "body must not be null");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body.clone();
    }

    /** @return Kopie der Body-Bytes */
    @Override
    public byte[] body() {
        return body.clone();
    }

    public int length() {
        return body.length;
    }
}
