package de.htwsaar.ministatic.cli.command;

import de.htwsaar.ministatic.cli.di.CliContext;
import de.htwsaar.ministatic.cli.dto.HttpCallResult;
import de.htwsaar.ministatic.cli.service.FetchService;
import de.htwsaar.ministatic.cli.util.ConsoleUtils;
import de.htwsaar.ministatic.cli.util.ExitCodes;
import de.htwsaar.ministatic.cli.util.UriUtils;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Ruft eine Datei ab und zeigt Status und Header (optional den Body).
 *
 * <p>Exit-Codes: 0 OK/304, 1 ungültige Eingabe, 2 HTTP 4xx, 3 HTTP 404, 4 HTTP 5xx, 5 I/O-Fehler.</p>
 */
@Command(
        name = "fetch",
        description = "Fetch a file and print status and headers",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  ministatic fetch --server http://localhost:8080 --path /index.html",
            "  ministatic fetch --server http://localhost:8080 --path /app.js --if-none-match '\"120-1700000000000\"'",
            "  ministatic fetch --server http://localhost:8080 --path /logo.png --head"
        })
public final class FetchCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(
            names = {"-s", "--server"},
            defaultValue = "http://localhost:8080",
            paramLabel = "URL",
            description = "Basis-URL des Servers")
    private String server;

    @Option(names = {"-p", "--path"}, required = true, paramLabel = "PATH", description = "Request-Pfad, z.B. /index.html")
    private String path;

    @Option(names = "--head", description = "HEAD statt GET senden")
    private boolean head;

    @Option(names = "--if-none-match", paramLabel = "ETAG", description = "Wert für If-None-Match")
    private String ifNoneMatch;

    @Option(names = "--if-modified-since", paramLabel = "DATE", description = "Wert für If-Modified-Since (RFC 1123)")
    private String ifModifiedSince;

    @Option(names = "--show-body", description = "Body ausgeben")
    private boolean showBody;

    public FetchCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> base = UriUtils.parseHttpUri(server);
        if (base.isEmpty()) {
            ConsoleUtils.error(ctx.err(), "[FETCH] Invalid server URL: %s", server);
            return ExitCodes.VALIDATION;
        }
        Optional<URI> target = UriUtils.withPath(base.get(), path);
        if (target.isEmpty()) {
            ConsoleUtils.error(ctx.err(), "[FETCH] Invalid path: %s", path);
            return ExitCodes.VALIDATION;
        }

        FetchService service = new FetchService(ctx.httpClient(), ctx.defaultRequestTimeout());
        HttpCallResult result = service.fetch(target.get(), head, ifNoneMatch, ifModifiedSince);

        if (result.statusCode() == null) {
            ConsoleUtils.error(ctx.err(), "[FETCH] Request failed: %s", result.error());
            return ExitCodes.IO_ERROR;
        }

        ConsoleUtils.info(ctx.out(), "HTTP %d %s", result.statusCode(), target.get());
        Map<String, String> sorted = new TreeMap<>(result.headers());
        sorted.forEach((name, value) -> ctx.out().printf("  %s: %s%n", name, value));
        if (showBody && result.body() != null && !result.body().isEmpty()) {
            ctx.out().println();
            ctx.out().println(result.body());
        }
        ctx.out().flush();
        return ExitCodes.forResult(result);
    }
}
