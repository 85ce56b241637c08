package de.htwsaar.ministatic.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Vollständige Antwortbeschreibung des {@link StaticFileHandler}, frei von HTTP-Framework-Typen.
 *
 * @param status        HTTP-Statuscode (200, 304 oder 403)
 * @param headers       Header in Sende-Reihenfolge, Namen klein geschrieben
 * @param body          Body-Bytes (leer bei HEAD und 304)
 * @param cacheDecision HIT, MISS oder BYPASS
 */
public record StaticFileResponse(int status, Map<String, String> headers, byte[] body, CacheDecision cacheDecision) {

    private static final byte[] EMPTY = new byte[0];

    public StaticFileResponse {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(cacheDecision, "cacheDecision must not be null");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? EMPTY : body;
    }

    /** @return Header-Wert oder {@code null} */
    public String header(String name) {
        return headers.get(name);
    }

    public boolean hasBody() {
        return body.length > 0;
    }
}
