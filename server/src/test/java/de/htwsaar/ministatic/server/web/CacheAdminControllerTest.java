package de.htwsaar.ministatic.server.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.ministatic.core.CacheDecision;
import de.htwsaar.ministatic.core.HandlerConfig;
import de.htwsaar.ministatic.core.RequestOptions;
import de.htwsaar.ministatic.core.StaticFileHandler;
import de.htwsaar.ministatic.core.StaticRequest;
import de.htwsaar.ministatic.core.cache.InMemoryCacheStore;
import de.htwsaar.ministatic.core.mime.ContentTypeResolver;
import de.htwsaar.ministatic.server.StaticMetricsService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CacheAdminControllerTest {

    @TempDir
    Path root;

    private StaticFileHandler handler;
    private StaticMetricsService metrics;
    private MockMvc mvc;
    private final RequestOptions options = RequestOptions.defaults().withCachePrefix("site:");

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("css"));
        Files.writeString(root.resolve("css/a.css"), "a{}");
        Files.writeString(root.resolve("css/b.css"), "b{}");
        Files.writeString(root.resolve("app.js"), "go()");

        HandlerConfig config = HandlerConfig.builder().roots(List.of(root.toString())).cache(true).build();
        handler = new StaticFileHandler(config, new InMemoryCacheStore(), ContentTypeResolver.defaults(), Clock.systemUTC());
        metrics = new StaticMetricsService(Clock.systemUTC());
        mvc = MockMvcBuilders.standaloneSetup(new CacheAdminController(handler, options, metrics)).build();

        for (String p : List.of("/css/a.css", "/css/b.css", "/app.js")) {
            handler.handle(StaticRequest.get(p), options);
        }
    }

    @Test
    void invalidateSingleFileUsesMountPrefix() throws Exception {
        mvc.perform(delete("/api/static/cache/files/css/a.css"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("/css/a.css"))
                .andExpect(jsonPath("$.status").value("invalidated"));

        assertEquals(2, handler.cacheSize());

        mvc.perform(delete("/api/static/cache/files/css/a.css"))
                .andExpect(jsonPath("$.status").value("not in cache"));
    }

    @Test
    void invalidateSingleFileBehindContextPath() throws Exception {
        mvc.perform(delete("/app/api/static/cache/files/css/a.css").contextPath("/app"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("/css/a.css"))
                .andExpect(jsonPath("$.status").value("invalidated"));

        assertEquals(2, handler.cacheSize());
    }

    @Test
    void invalidatePrefixRemovesMatchingEntries() throws Exception {
        mvc.perform(delete("/api/static/cache/prefix").param("value", "/css/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidatedCount").value(2));

        assertEquals(1, handler.cacheSize());
    }

    @Test
    void clearAllEmptiesCache() throws Exception {
        mvc.perform(delete("/api/static/cache/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cache cleared"));

        assertEquals(0, handler.cacheSize());
    }

    @Test
    void statsReportEntriesAndDecisions() throws Exception {
        metrics.record(CacheDecision.HIT);
        metrics.record(CacheDecision.MISS);

        mvc.perform(get("/api/static/cache/stats").param("windowSec", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filesCached").value(3))
                .andExpect(jsonPath("$.cacheHits").value(1))
                .andExpect(jsonPath("$.cacheMisses").value(1))
                .andExpect(jsonPath("$.windowSeconds").value(30))
                .andExpect(jsonPath("$.cacheHitRatio").value(0.5));
    }
}
