package de.htwsaar.ministatic.cli.command;

import de.htwsaar.ministatic.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command der CLI. Ohne Subcommand wird die Usage angezeigt.
 */
@Command(
        name = "ministatic",
        description = "MiniStatic CLI: Dateien abrufen und den Server-Cache verwalten",
        mixinStandardHelpOptions = true,
        subcommands = {FetchCommand.class, CacheCommand.class, HelpCommand.class})
public final class RootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public RootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `ministatic help <command>`.");
        ctx.out().flush();
    }
}
