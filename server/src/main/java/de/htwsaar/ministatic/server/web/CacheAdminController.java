package de.htwsaar.ministatic.server.web;

import de.htwsaar.ministatic.common.dto.CacheStatsDto;
import de.htwsaar.ministatic.core.RequestOptions;
import de.htwsaar.ministatic.core.StaticFileHandler;
import de.htwsaar.ministatic.server.StaticMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Cache-Invalidierung und Statistiken. Geschützt durch den Admin-Token-Filter.
 *
 * <ul>
 *   <li>DELETE /api/static/cache/files/{path}: einzelner Request-Pfad</li>
 *   <li>DELETE /api/static/cache/prefix?value=…: Pfad-Prefix</li>
 *   <li>DELETE /api/static/cache/all: gesamter Cache</li>
 *   <li>GET /api/static/cache/stats: Metriken-Snapshot</li>
 * </ul>
 */
@RestController
@RequestMapping(CacheAdminController.BASE_PATH)
public class CacheAdminController {

    static final String BASE_PATH = "/api/static/cache";
    private static final String FILES_PATH = BASE_PATH + "/files";

    private static final Logger log = LoggerFactory.getLogger(CacheAdminController.class);

    private final StaticFileHandler handler;
    private final RequestOptions options;
    private final StaticMetricsService metricsService;

    public CacheAdminController(StaticFileHandler handler, RequestOptions options, StaticMetricsService metricsService) {
        this.handler = handler;
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Invalidiert den Eintrag eines Request-Pfads.
     *
     * <p>Der Pfad wird roh (percent-encoded) aus der URI gelesen, da Cache-Keys
     * auf dem undekodierten Request-Pfad (ohne Context-Path) basieren.</p>
     *
     * @param request liefert den Rest-Pfad hinter {@code /files}
     * @return Status-Nachricht
     */
    @DeleteMapping("/files/**")
    public ResponseEntity<Map<String, String>> invalidateFile(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length() + FILES_PATH.length());
        boolean removed = handler.clearCache(path, options);
        log.info("Invalidated {} (removed={})", path, removed);
        return ResponseEntity.ok(Map.of("path", path, "status", removed ? "invalidated" : "not in cache"));
    }

    /**
     * @param value Pfad-Prefix, der Cache-Präfix des Mounts wird vorangestellt
     * @return Anzahl invalidierter Einträge
     */
    @DeleteMapping("/prefix")
    public ResponseEntity<Map<String, Object>> invalidateByPrefix(@RequestParam("value") String value) {
        int count = handler.clearCachePrefix(options.cacheKey(value));
        log.info("Invalidated {} entries with prefix {}", count, value);
        return ResponseEntity.ok(Map.of("prefix", value, "invalidatedCount", count));
    }

    @DeleteMapping("/all")
    public ResponseEntity<Map<String, String>> clearAll() {
        handler.clearCache();
        log.info("Cache cleared");
        return ResponseEntity.ok(Map.of("status", "cache cleared"));
    }

    /**
     * @param windowSec Zeitfenster in Sekunden für die Request-Rate (Standard: 60)
     * @return Metriken-Snapshot
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatsDto> stats(@RequestParam(value = "windowSec", defaultValue = "60") int windowSec) {
        return ResponseEntity.ok(metricsService.snapshot(windowSec, handler.cacheSize()));
    }
}
