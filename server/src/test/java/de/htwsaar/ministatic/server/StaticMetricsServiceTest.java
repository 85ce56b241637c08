package de.htwsaar.ministatic.server;

import static org.junit.jupiter.api.Assertions.assertEquals;

import de.htwsaar.ministatic.common.dto.CacheStatsDto;
import de.htwsaar.ministatic.core.CacheDecision;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

/** Tests für Hits/Misses und Requests pro Zeitfenster. */
class StaticMetricsServiceTest {

    @Test
    void shouldTrackDecisionsAndExactRequestsPerWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        StaticMetricsService service = new StaticMetricsService(clock);

        service.record(CacheDecision.MISS);
        clock.plusSeconds(5);
        service.record(CacheDecision.HIT);
        clock.plusSeconds(5);
        service.record(CacheDecision.HIT);
        service.record(CacheDecision.BYPASS);

        CacheStatsDto first = service.snapshot(60, 7);
        assertEquals(4, first.getTotalRequests());
        assertEquals(4, first.getRequestsPerWindow());
        assertEquals(2, first.getCacheHits());
        assertEquals(1, first.getCacheMisses());
        assertEquals(2.0 / 3.0, first.getCacheHitRatio(), 1e-9);
        assertEquals(7, first.getFilesCached());

        clock.plusSeconds(61);
        CacheStatsDto second = service.snapshot(60, 2);
        assertEquals(4, second.getTotalRequests());
        assertEquals(0, second.getRequestsPerWindow());
        assertEquals(2, second.getFilesCached());
    }

    @Test
    void emptyServiceHasZeroRatioAndClampedWindow() {
        StaticMetricsService service = new StaticMetricsService(Clock.systemUTC());

        CacheStatsDto snapshot = service.snapshot(0, -3);

        assertEquals(0.0, snapshot.getCacheHitRatio());
        assertEquals(1, snapshot.getWindowSeconds());
        assertEquals(0, snapshot.getFilesCached());
    }

    /** Verstellbare Uhr für deterministische Zeitfenster-Tests. */
    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant start) {
            this.current = start;
        }

        void plusSeconds(long seconds) {
            current = current.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }
}
