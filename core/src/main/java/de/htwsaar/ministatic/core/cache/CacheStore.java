package de.htwsaar.ministatic.core.cache;

/**
 * Abstraktion des Response-Caches.
 * Implementierungen müssen parallele Lese- und Schreibzugriffe ohne halbfertige Einträge erlauben.
 */
public interface CacheStore {

    /**
     * @param key Cache-Schlüssel
     * @return Eintrag oder {@code null}
     */
    CacheEntry get(String key);

    /**
     * Speichert einen Eintrag; ein vorhandener Eintrag wird überschrieben.
     *
     * @param key   Cache-Schlüssel
     * @param entry zu cachender Eintrag
     */
    void put(String key, CacheEntry entry);

    /**
     * @param key Cache-Schlüssel
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    boolean remove(String key);

    /**
     * Entfernt alle Einträge, deren Schlüssel mit {@code prefix} beginnen.
     *
     * @param prefix Schlüssel-Präfix
     * @return Anzahl entfernter Einträge
     */
    int removeByPrefix(String prefix);

    /** Leert den gesamten Cache. */
    void clear();

    int size();
}
