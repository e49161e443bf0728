package de.htwsaar.miniota.cli.command.ota;

import de.htwsaar.miniota.cli.command.root.MiniOtaRootCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.dto.HttpCallResult;
import de.htwsaar.miniota.cli.util.ExitCodes;
import de.htwsaar.miniota.cli.util.UriUtils;
import java.net.URI;
import java.util.Optional;

/**
 * Gemeinsame Prüfungen und Fehlermeldungen der OTA-Subcommands.
 */
final class OtaCommandSupport {

    private OtaCommandSupport() {}

    /**
     * @return geprüfte Server-URL oder leer (Meldung wurde bereits ausgegeben)
     */
    static Optional<URI> baseUrl(MiniOtaRootCommand root, String tag) {
        String raw = root.host() == null ? "" : root.host().toString();
        Optional<URI> uri = UriUtils.parseHttpUri(raw);
        if (uri.isEmpty()) {
            CliContext ctx = root.ctx();
            ctx.err().printf("[%s] Invalid --host (expected http(s)://host:port): %s%n", tag, raw);
            ctx.err().flush();
        }
        return uri;
    }

    /**
     * Meldet einen fehlgeschlagenen Aufruf und liefert den passenden Exit-Code.
     */
    static int reportFailure(CliContext ctx, String tag, String what, HttpCallResult result) {
        if (result.error() != null) {
            ctx.err().printf("[%s] %s failed: %s%n", tag, what, result.error());
            ctx.err().flush();
            return ExitCodes.IO_ERROR;
        }
        int sc = result.statusCode();
        ctx.err().printf("[%s] %s rejected (HTTP %d)%n", tag, what, sc);
        ctx.err().flush();
        return ExitCodes.forHttpStatus(sc);
    }
}
