package de.htwsaar.ministatic.common.dto;

/**
 * Momentaufnahme von Response-Cache und Request-Zählern eines Servers.
 */
public class CacheStatsDto {

    private long filesCached;
    private long totalRequests;
    private long requestsPerWindow;
    private int windowSeconds;
    private long cacheHits;
    private long cacheMisses;
    // zwischen 0 und 1
    private double cacheHitRatio;

    public CacheStatsDto() {}

    public CacheStatsDto(
            long filesCached,
            long totalRequests,
            long requestsPerWindow,
            int windowSeconds,
            long cacheHits,
            long cacheMisses,
            double cacheHitRatio) {
        this.filesCached = filesCached;
        this.totalRequests = totalRequests;
        this.requestsPerWindow = requestsPerWindow;
        this.windowSeconds = windowSeconds;
        this.cacheHits = cacheHits;
        this.cacheMisses = cacheMisses;
        this.cacheHitRatio = cacheHitRatio;
    }

    public long getFilesCached() {
        return filesCached;
    }

    public void setFilesCached(long filesCached) {
        this.filesCached = filesCached;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public void setTotalRequests(long totalRequests) {
        this.totalRequests = totalRequests;
    }

    public long getRequestsPerWindow() {
        return requestsPerWindow;
    }

    public void setRequestsPerWindow(long requestsPerWindow) {
        this.requestsPerWindow = requestsPerWindow;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public void setCacheHits(long cacheHits) {
        this.cacheHits = cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public void setCacheMisses(long cacheMisses) {
        this.cacheMisses = cacheMisses;
    }

    public double getCacheHitRatio() {
        return cacheHitRatio;
    }

    public void setCacheHitRatio(double cacheHitRatio) {
        this.cacheHitRatio = cacheHitRatio;
    }
}
