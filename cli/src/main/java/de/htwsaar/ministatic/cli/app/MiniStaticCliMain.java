package de.htwsaar.ministatic.cli.app;

import de.htwsaar.ministatic.cli.command.RootCommand;
import de.htwsaar.ministatic.cli.di.CliContext;
import de.htwsaar.ministatic.cli.di.ContextFactory;
import de.htwsaar.ministatic.cli.util.ExitCodes;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import picocli.CommandLine;

/**
 * Einstiegspunkt der CLI: baut Kontext und Command-Baum und beendet den Prozess mit dem Exit-Code.
 */
public final class MiniStaticCliMain {

    private MiniStaticCliMain() {}

    public static void main(String[] args) {
        System.exit(run(args, new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8)));
    }

    /**
     * Führt einen Befehl aus, ohne den Prozess zu beenden.
     *
     * @param args Kommandozeilenargumente
     * @param out  Standardausgabe
     * @param err  Fehlerausgabe
     * @return Exit-Code
     */
    public static int run(String[] args, PrintWriter out, PrintWriter err) {
        CliContext ctx = new CliContext(
                out,
                err,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                Duration.ofSeconds(5));

        CommandLine cmd = new CommandLine(RootCommand.class, new ContextFactory(ctx));
        cmd.setOut(out);
        cmd.setErr(err);
        cmd.setParameterExceptionHandler((ex, ignored) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return ExitCodes.VALIDATION;
        });
        return cmd.execute(args);
    }
}
