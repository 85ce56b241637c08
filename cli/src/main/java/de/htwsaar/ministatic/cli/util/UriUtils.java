package de.htwsaar.ministatic.cli.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * URI helpers for CLI input validation and normalization.
 */
public final class UriUtils {
    private UriUtils() {}

    public static URI ensureTrailingSlash(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String s = uri.toString();
        return URI.create(s.endsWith("/") ? s : s + "/");
    }

    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * Hängt einen Request-Pfad unverändert (nicht erneut kodiert) an die Server-URL.
     *
     * @param server Basis-URL, z. B. {@code http://localhost:8080}
     * @param path   Pfad, mit oder ohne führenden Slash; darf percent-encoded sein
     * @return vollständige URI oder leer, wenn das Ergebnis keine gültige URI ist
     */
    public static Optional<URI> withPath(URI server, String path) {
        Objects.requireNonNull(server, "server");
        if (path == null) return Optional.empty();
        String base = server.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        String p = path.startsWith("/") ? path : "/" + path;
        try {
            return Optional.of(new URI(base + p));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
