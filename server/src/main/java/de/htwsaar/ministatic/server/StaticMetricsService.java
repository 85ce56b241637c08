package de.htwsaar.ministatic.server;

import de.htwsaar.ministatic.common.dto.CacheStatsDto;
import de.htwsaar.ministatic.core.CacheDecision;
import java.time.Clock;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Erfasst Cache-Entscheidungen und Request-Raten des Servers.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz.</p>
 */
@Service
public class StaticMetricsService {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final Deque<Long> requestTimestampsMs = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    /**
     * @param clock Zeitquelle (in Tests verstellbar)
     */
    @Autowired
    public StaticMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Erfasst eine ausgelieferte Antwort.
     *
     * @param decision Cache-Entscheidung des Handlers; BYPASS zählt nur als Request
     */
    public void record(CacheDecision decision) {
        totalRequests.incrementAndGet();
        requestTimestampsMs.addLast(clock.millis());
        if (decision == CacheDecision.HIT) cacheHits.incrementAndGet();
        else if (decision == CacheDecision.MISS) cacheMisses.incrementAndGet();
    }

    /**
     * Momentaufnahme inklusive exakter Request-Zahl im Zeitfenster.
     *
     * @param windowSeconds Zeitfenster in Sekunden (mindestens 1)
     * @param filesCached   aktuelle Anzahl Cache-Einträge
     * @return Snapshot
     */
    public CacheStatsDto snapshot(int windowSeconds, long filesCached) {
        int safeWindow = Math.max(1, windowSeconds);
        purgeOldRequests(clock.millis(), safeWindow);

        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        double hitRatio = hits + misses == 0 ? 0.0 : (double) hits / (hits + misses);

        return new CacheStatsDto(
                Math.max(0, filesCached),
                totalRequests.get(),
                requestTimestampsMs.size(),
                safeWindow,
                hits,
                misses,
                hitRatio);
    }

    private void purgeOldRequests(long nowMs, int windowSeconds) {
        long threshold = nowMs - (windowSeconds * 1000L);
        while (true) {
            Long first = requestTimestampsMs.peekFirst();
            if (first == null || first >= threshold) {
                break;
            }
            requestTimestampsMs.pollFirst();
        }
    }
}
