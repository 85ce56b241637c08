package de.htwsaar.ministatic.core.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prozessweiter Cache-Store auf Basis einer {@link ConcurrentHashMap}.
 *
 * <p>Einträge leben, bis sie explizit invalidiert werden (kein TTL, keine Eviction).
 * Da {@link CacheEntry} unveränderlich ist, sehen Leser immer einen vollständigen Eintrag.</p>
 */
public final class InMemoryCacheStore implements CacheStore {

    private final Map<String, CacheEntry> map = new ConcurrentHashMap<>();

    @Override
    public CacheEntry get(String key) {
        if (key == null) return null;
        return map.get(key);
    }

    @Override
    public void put(String key, CacheEntry entry) {
        if (key == null || entry == null) return;
        map.put(key, entry);
    }

    @Override
    public boolean remove(String key) {
        if (key == null) return false;
        return map.remove(key) != null;
    }

    @Override
    public int removeByPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) return 0;
        int removed = 0;
        for (String k : map.keySet()) {
            if (k.startsWith(prefix) && map.remove(k) != null) removed++;
        }
        return removed;
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public int size() {
        return map.size();
    }
}
