package de.htwsaar.ministatic.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unveränderliche Konfiguration des {@link StaticFileHandler}.
 *
 * <p>Wird einmalig beim Setup erzeugt. Die Roots werden in der angegebenen Reihenfolge
 * durchsucht; der erste existierende Treffer gewinnt.</p>
 *
 * @param roots        absolute, normalisierte Root-Verzeichnisse (nicht leer)
 * @param maxAgeMillis Browser-Cache-Lebensdauer für {@code Cache-Control} in ms
 * @param cacheEnabled {@code true}, wenn erfolgreiche Antworten im Speicher gecacht werden
 */
public record HandlerConfig(List<Path> roots, long maxAgeMillis, boolean cacheEnabled) {

    /** Standard-{@code maxAge}: ein julianisches Jahr in ms. */
    public static final long DEFAULT_MAX_AGE_MS = 31_557_600_000L;

    public HandlerConfig {
        Objects.requireNonNull(roots, "roots must not be null");
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("at least one root is required");
        }
        if (maxAgeMillis < 0) {
            throw new IllegalArgumentException("maxAgeMillis must not be negative");
        }
        roots = roots.stream().map(r -> r.toAbsolutePath().normalize()).toList();
    }

    /**
     * Konfiguration mit genau einem Root und Standardwerten (Cache aus).
     *
     * @param root Root-Verzeichnis
     * @return neue Konfiguration
     */
    public static HandlerConfig ofRoot(String root) {
        return builder().root(root).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder, der die Konfigurationsvarianten "root", "roots", "maxAge" und "cache"
     * (boolesch oder numerisch) abbildet.
     */
    public static final class Builder {
        private final List<String> roots = new ArrayList<>();
        private Long maxAgeMillis;
        private Long cacheMaxAgeMillis;
        private boolean cacheEnabled;

        private Builder() {}

        /** Setzt genau einen Root (ersetzt bisherige). */
        public Builder root(String root) {
            roots.clear();
            roots.add(Objects.requireNonNull(root, "root must not be null"));
            return this;
        }

        /** Setzt die geordnete Root-Liste (ersetzt bisherige). */
        public Builder roots(List<String> roots) {
            Objects.requireNonNull(roots, "roots must not be null");
            this.roots.clear();
            for (String r : roots) {
                if (r != null && !r.isBlank()) this.roots.add(r.trim());
            }
            return this;
        }

        /** Explizites {@code maxAge} in ms; hat Vorrang vor {@link #cache(long)}. */
        public Builder maxAge(long maxAgeMillis) {
            if (maxAgeMillis < 0) {
                throw new IllegalArgumentException("maxAge must not be negative: " + maxAgeMillis);
            }
            this.maxAgeMillis = maxAgeMillis;
            return this;
        }

        public Builder cache(boolean enabled) {
            this.cacheEnabled = enabled;
            this.cacheMaxAgeMillis = null;
            return this;
        }

        /**
         * Numerischer Cache-Wert: ein Wert ungleich 0 aktiviert den Cache und setzt
         * {@code maxAge}, sofern dieses nicht explizit gesetzt wurde.
         *
         * @throws IllegalArgumentException bei negativem Wert
         */
        public Builder cache(long maxAgeMillis) {
            if (maxAgeMillis < 0) {
                throw new IllegalArgumentException("numeric cache value must not be negative: " + maxAgeMillis);
            }
            this.cacheEnabled = maxAgeMillis != 0;
            this.cacheMaxAgeMillis = maxAgeMillis != 0 ? maxAgeMillis : null;
            return this;
        }

        public HandlerConfig build() {
            List<Path> paths = new ArrayList<>();
            if (roots.isEmpty()) {
                paths.add(Path.of(System.getProperty("user.dir")));
            } else {
                for (String r : roots) paths.add(Path.of(r));
            }
            long maxAge = maxAgeMillis != null
                    ? maxAgeMillis
                    : cacheMaxAgeMillis != null ? cacheMaxAgeMillis : DEFAULT_MAX_AGE_MS;
            return new HandlerConfig(paths, maxAge, cacheEnabled);
        }
    }
}
