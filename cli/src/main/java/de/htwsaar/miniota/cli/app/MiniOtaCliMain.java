package de.htwsaar.miniota.cli.app;

import de.htwsaar.miniota.cli.command.root.MiniOtaRootCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.di.ContextFactory;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Mini-OTA CLI.
 *
 * <p>Initialisiert Ausgabekanäle und HTTP-Client, baut die Picocli-Command-Struktur
 * mit {@link ContextFactory} und beendet den Prozess mit dem Exit-Code des Befehls.
 */
public final class MiniOtaCliMain {

    private MiniOtaCliMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        PrintWriter err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);

        CliContext ctx = new CliContext(
                out,
                err,
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(5))
                        .build(),
                Duration.ofSeconds(30));

        return newCommandLine(ctx).execute(args);
    }

    /**
     * @param ctx CLI-Kontext
     * @return konfigurierte Command-Line, z. B. für Tests
     */
    public static CommandLine newCommandLine(CliContext ctx) {
        return new CommandLine(MiniOtaRootCommand.class, new ContextFactory(ctx))
                .setOut(ctx.out())
                .setErr(ctx.err());
    }
}
