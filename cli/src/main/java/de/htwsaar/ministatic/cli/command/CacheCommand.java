package de.htwsaar.ministatic.cli.command;

import de.htwsaar.ministatic.cli.di.CliContext;
import de.htwsaar.ministatic.cli.dto.HttpCallResult;
import de.htwsaar.ministatic.cli.service.CacheAdminService;
import de.htwsaar.ministatic.cli.util.ConsoleUtils;
import de.htwsaar.ministatic.cli.util.ExitCodes;
import de.htwsaar.ministatic.cli.util.UriUtils;
import de.htwsaar.ministatic.common.dto.CacheStatsDto;
import de.htwsaar.ministatic.common.serialization.MiniStaticSerializationException;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Cache-Verwaltung eines laufenden Servers. Ohne Subcommand wird die Usage angezeigt.
 */
@Command(
        name = "cache",
        description = "Invalidate or inspect the server-side response cache",
        mixinStandardHelpOptions = true,
        subcommands = {CacheCommand.ClearCommand.class, CacheCommand.StatsCommand.class})
public final class CacheCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public CacheCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    /** Gemeinsame Optionen beider Subcommands. */
    public static class ServerOptions {
        @Option(
                names = {"-s", "--server"},
                defaultValue = "http://localhost:8080",
                paramLabel = "URL",
                description = "Basis-URL des Servers")
        String server;

        @Option(names = "--token", paramLabel = "TOKEN", description = "Admin-Token (sonst MINISTATIC_ADMIN_TOKEN)")
        String token;
    }

    /**
     * Invalidiert einen Pfad, einen Pfad-Prefix oder den ganzen Cache.
     */
    @Command(
            name = "clear",
            description = "Invalidate cache entries",
            mixinStandardHelpOptions = true,
            footerHeading = "%nBeispiele:%n",
            footer = {
                "  ministatic cache clear --path /css/site.css",
                "  ministatic cache clear --prefix /css/",
                "  ministatic cache clear --all --token secret-token"
            })
    public static final class ClearCommand implements Callable<Integer> {

        private final CliContext ctx;

        @Mixin
        private ServerOptions serverOptions;

        @ArgGroup(exclusive = true, multiplicity = "1")
        private Target target;

        public static class Target {
            @Option(names = {"-p", "--path"}, paramLabel = "PATH", description = "einzelner Request-Pfad")
            String path;

            @Option(names = "--prefix", paramLabel = "PREFIX", description = "alle Pfade mit diesem Prefix")
            String prefix;

            @Option(names = "--all", description = "gesamten Cache leeren")
            boolean all;
        }

        public ClearCommand(CliContext ctx) {
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Integer call() {
            Optional<URI> base = UriUtils.parseHttpUri(serverOptions.server);
            if (base.isEmpty()) {
                ConsoleUtils.error(ctx.err(), "[CACHE] Invalid server URL: %s", serverOptions.server);
                return ExitCodes.VALIDATION;
            }

            CacheAdminService service =
                    new CacheAdminService(ctx.httpClient(), ctx.defaultRequestTimeout(), serverOptions.token);
            HttpCallResult result;
            try {
                if (target.all) {
                    result = service.clearAll(base.get());
                } else if (target.prefix != null) {
                    result = service.invalidatePrefix(base.get(), target.prefix);
                } else {
                    result = service.invalidatePath(base.get(), target.path);
                }
            } catch (IllegalArgumentException ex) {
                ConsoleUtils.error(ctx.err(), "[CACHE] %s", ex.getMessage());
                return ExitCodes.VALIDATION;
            }

            return report(ctx, result);
        }
    }

    /**
     * Zeigt Cache-Einträge sowie Hit/Miss-Zähler des Servers.
     */
    @Command(name = "stats", description = "Show cache statistics", mixinStandardHelpOptions = true)
    public static final class StatsCommand implements Callable<Integer> {

        private final CliContext ctx;

        @Mixin
        private ServerOptions serverOptions;

        @Option(names = "--window-sec", defaultValue = "60", paramLabel = "SECONDS", description = "Zeitfenster (min. 1)")
        private int windowSec;

        public StatsCommand(CliContext ctx) {
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Integer call() {
            Optional<URI> base = UriUtils.parseHttpUri(serverOptions.server);
            if (base.isEmpty()) {
                ConsoleUtils.error(ctx.err(), "[CACHE] Invalid server URL: %s", serverOptions.server);
                return ExitCodes.VALIDATION;
            }

            CacheAdminService service =
                    new CacheAdminService(ctx.httpClient(), ctx.defaultRequestTimeout(), serverOptions.token);
            HttpCallResult result = service.stats(base.get(), windowSec);
            if (!result.is2xx()) {
                return report(ctx, result);
            }

            CacheStatsDto stats;
            try {
                stats = CacheAdminService.parseStats(result);
            } catch (MiniStaticSerializationException ex) {
                ConsoleUtils.error(ctx.err(), "[CACHE] Unreadable stats response: %s", ex.getMessage());
                return ExitCodes.IO_ERROR;
            }

            PrintWriter out = ctx.out();
            out.println("[CACHE] Stats");
            out.printf("  filesCached       : %d%n", stats.getFilesCached());
            out.printf("  totalRequests     : %d%n", stats.getTotalRequests());
            out.printf("  requestsPerWindow : %d (%ds)%n", stats.getRequestsPerWindow(), stats.getWindowSeconds());
            out.printf("  cacheHits         : %d%n", stats.getCacheHits());
            out.printf("  cacheMisses       : %d%n", stats.getCacheMisses());
            out.printf("  cacheHitRatio     : %.4f%n", stats.getCacheHitRatio());
            out.flush();
            return ExitCodes.OK;
        }
    }

    private static int report(CliContext ctx, HttpCallResult result) {
        if (result.statusCode() == null) {
            ConsoleUtils.error(ctx.err(), "[CACHE] Request failed: %s", result.error());
            return ExitCodes.IO_ERROR;
        }
        if (!result.is2xx()) {
            ConsoleUtils.error(ctx.err(), "[CACHE] HTTP %d %s", result.statusCode(), nullToEmpty(result.body()));
            return ExitCodes.forResult(result);
        }
        ConsoleUtils.info(ctx.out(), "[CACHE] %s", nullToEmpty(result.body()));
        return ExitCodes.OK;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
