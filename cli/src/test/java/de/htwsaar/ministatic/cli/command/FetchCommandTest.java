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

class FetchCommandTest {

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
    void printsStatusHeadersAndBody() {
        stub.respond("/hello.txt", 200, Map.of("ETag", "\"5-1\"", "X-Cache", "MISS"), "hello");

        int rc = run("fetch", "--server", stub.baseUrl(), "--path", "/hello.txt", "--show-body");

        assertEquals(0, rc);
        assertTrue(out.toString().contains("HTTP 200"));
        assertTrue(out.toString().contains("etag: \"5-1\""));
        assertTrue(out.toString().contains("hello"));
    }

    @Test
    void conditionalRequestSendsEtagAndTreatsNotModifiedAsSuccess() {
        stub.respond("/app.js", 304, Map.of("ETag", "\"4-2\""), "");

        int rc = run("fetch", "-s", stub.baseUrl(), "-p", "/app.js", "--if-none-match", "\"4-2\"");

        assertEquals(0, rc);
        assertEquals("\"4-2\"", stub.requests.get(0).ifNoneMatch());
        assertTrue(out.toString().contains("HTTP 304"));
    }

    @Test
    void headUsesHeadMethod() {
        stub.respond("/logo.png", 200, Map.of("Content-Type", "image/png"), "");

        int rc = run("fetch", "-s", stub.baseUrl(), "-p", "/logo.png", "--head");

        assertEquals(0, rc);
        assertEquals("HEAD", stub.requests.get(0).method());
    }

    @Test
    void statusCodesMapToExitCodes() {
        stub.respond("/missing.txt", 404, Map.of(), "Not Found");
        stub.respond("/secret", 403, Map.of(), "Forbidden");
        stub.respond("/broken", 500, Map.of(), "boom");

        assertEquals(3, run("fetch", "-s", stub.baseUrl(), "-p", "/missing.txt"));
        assertEquals(2, run("fetch", "-s", stub.baseUrl(), "-p", "/secret"));
        assertEquals(4, run("fetch", "-s", stub.baseUrl(), "-p", "/broken"));
    }

    @Test
    void invalidInputIsValidationError() {
        assertEquals(1, run("fetch", "-s", "ftp://example.org", "-p", "/x"));
        assertEquals(1, run("fetch", "-s", stub.baseUrl(), "-p", "/has space"));
        assertEquals(1, run("fetch", "-s", stub.baseUrl()));
    }

    @Test
    void unreachableServerIsIoError() {
        String url = stub.baseUrl();
        stub.close();

        assertEquals(5, run("fetch", "-s", url, "-p", "/x"));
    }
}
