package de.htwsaar.miniota.cli.command.root;

import de.htwsaar.miniota.cli.command.ota.DownloadCommand;
import de.htwsaar.miniota.cli.command.ota.StatusCommand;
import de.htwsaar.miniota.cli.command.ota.VersionCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import java.net.URI;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Aufgaben:
 * - Definiert Name, Beschreibung und die globale Server-Option {@code -H/--host}.
 * - Registriert die Subcommands {@code version}, {@code status}, {@code download}.
 * - Zeigt ohne Subcommand die Usage.
 */
@Command(
        name = "miniota",
        description = "Mini-OTA CLI: firmware version check, server status and resumable download",
        mixinStandardHelpOptions = true,
        subcommands = {VersionCommand.class, StatusCommand.class, DownloadCommand.class, HelpCommand.class})
public final class MiniOtaRootCommand implements Runnable {

    public static final String DEFAULT_HOST = "http://localhost:5005";

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-H", "--host"},
            defaultValue = DEFAULT_HOST,
            paramLabel = "SERVER_URL",
            scope = ScopeType.INHERIT,
            description = "OTA server base URL (scheme://host:port), default: ${DEFAULT-VALUE}")
    private URI host;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext (Output, HTTP-Client, Timeouts)
     */
    public MiniOtaRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public CliContext ctx() {
        return ctx;
    }

    /** @return vom Benutzer gewählte Server-URL */
    public URI host() {
        return host;
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `miniota help <command>` für Details zu einem Befehl.");
        ctx.out().flush();
    }
}
