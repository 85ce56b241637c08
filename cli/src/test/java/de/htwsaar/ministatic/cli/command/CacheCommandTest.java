package de.htwsaar.ministatic.cli.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.ministatic.cli.app.MiniStaticCliMain;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CacheCommandTest {

    private static final Map<String, String> JSON = Map.of("Content-Type", "application/json");

    private StubServer stub;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void start() throws Exception {
        stub = new StubServer();
    }

    @AfterEach
    void stop() {
        stub.close();
    }

    private int run(String... args) {
        return MiniStaticCliMain.run(args, new PrintWriter(out, true), new PrintWriter(err, true));
    }

    @Test
    void clearPathSendsDeleteWithToken() {
        stub.respond("/api/static/cache/files", 200, JSON, "{\"status\":\"invalidated\"}");

        int rc = run("cache", "clear", "-s", stub.baseUrl(), "--path", "/css/site.css", "--token", "t0k");

        assertEquals(0, rc);
        StubServer.Seen seen = stub.requests.get(0);
        assertEquals("DELETE", seen.method());
        assertEquals("/api/static/cache/files/css/site.css", seen.rawUri());
        assertEquals("t0k", seen.adminToken());
        assertTrue(out.toString().contains("invalidated"));
    }

    @Test
    void clearPrefixEncodesValue() {
        stub.respond("/api/static/cache/prefix", 200, JSON, "{\"invalidatedCount\":2}");

        int rc = run("cache", "clear", "-s", stub.baseUrl(), "--prefix", "/css/");

        assertEquals(0, rc);
        assertEquals("/api/static/cache/prefix?value=%2Fcss%2F", stub.requests.get(0).rawUri());
    }

    @Test
    void clearAllAndRejectedToken() {
        stub.respond("/api/static/cache/all", 403, Map.of(), "Invalid Admin Token");

        assertEquals(2, run("cache", "clear", "-s", stub.baseUrl(), "--all", "--token", "wrong"));
        assertTrue(err.toString().contains("HTTP 403"));
    }

    @Test
    void clearNeedsExactlyOneTarget() {
        assertEquals(1, run("cache", "clear", "-s", stub.baseUrl()));
        assertEquals(1, run("cache", "clear", "-s", stub.baseUrl(), "--all", "--prefix", "/x"));
    }

    @Test
    void statsAreDecodedAndPrinted() {
        stub.respond("/api/static/cache/stats", 200, JSON,
                "{\"filesCached\":3,\"totalRequests\":10,\"requestsPerWindow\":4,\"windowSeconds\":60,"
                        + "\"cacheHits\":6,\"cacheMisses\":4,\"cacheHitRatio\":0.6}");

        int rc = run("cache", "stats", "-s", stub.baseUrl());

        assertEquals(0, rc);
        assertEquals("/api/static/cache/stats?windowSec=60", stub.requests.get(0).rawUri());
        assertTrue(out.toString().contains("filesCached       : 3"));
        assertTrue(out.toString().contains("cacheHits         : 6"));
    }

    @Test
    void garbledStatsAreIoError() {
        stub.respond("/api/static/cache/stats", 200, JSON, "<html>proxy error</html>");

        assertEquals(5, run("cache", "stats", "-s", stub.baseUrl()));
    }
}
