package de.htwsaar.miniota.cli.command.ota;

import de.htwsaar.miniota.cli.command.root.MiniOtaRootCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.dto.HttpCallResult;
import de.htwsaar.miniota.cli.util.ExitCodes;
import de.htwsaar.miniota.common.serialization.JacksonCodec;
import de.htwsaar.miniota.common.serialization.MiniOtaSerializationException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Zeigt den Serverstatus ({@code GET /status}) formatiert an.
 */
@Command(
        name = "status",
        description = "Show server health, active connections and firmware availability",
        mixinStandardHelpOptions = true)
public final class StatusCommand implements Callable<Integer> {

    private final CliContext ctx;

    @ParentCommand
    private MiniOtaRootCommand root;

    public StatusCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> base = OtaCommandSupport.baseUrl(root, "STATUS");
        if (base.isEmpty()) {
            return ExitCodes.VALIDATION;
        }

        HttpCallResult result = ctx.otaClient().status(base.get());
        if (!result.is2xx()) {
            return OtaCommandSupport.reportFailure(ctx, "STATUS", "Status request", result);
        }

        try {
            ctx.out().println(JacksonCodec.toPrettyJson(result.body()));
        } catch (MiniOtaSerializationException e) {
            ctx.out().println(result.body());
        }
        ctx.out().flush();
        return ExitCodes.OK;
    }
}
