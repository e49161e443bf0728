package de.htwsaar.miniota.cli.command.ota;

import de.htwsaar.miniota.cli.command.root.MiniOtaRootCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.dto.HttpCallResult;
import de.htwsaar.miniota.cli.util.DownloadValidator;
import de.htwsaar.miniota.cli.util.ExitCodes;
import de.htwsaar.miniota.common.dto.VersionInfoDto;
import de.htwsaar.miniota.common.serialization.JacksonCodec;
import de.htwsaar.miniota.common.serialization.MiniOtaSerializationException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Fragt die aktuelle Firmware-Version ab und vergleicht sie optional mit dem
 * Digest auf dem Gerät.
 */
@Command(
        name = "version",
        description = "Show the firmware version offered by the server",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  miniota version -H http://192.168.4.1:5005",
            "  miniota version --current d41d8cd98f00b204e9800998ecf8427e"
        })
public final class VersionCommand implements Callable<Integer> {

    static final String UP_TO_DATE = "UP_TO_DATE";
    static final String UPDATE_AVAILABLE = "UPDATE_AVAILABLE";

    private final CliContext ctx;

    @ParentCommand
    private MiniOtaRootCommand root;

    @Option(
            names = {"--current"},
            paramLabel = "DIGEST",
            description = "Digest of the firmware currently installed; exit code 10 if the server offers another one")
    private String current;

    public VersionCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> base = OtaCommandSupport.baseUrl(root, "VERSION");
        if (base.isEmpty()) {
            return ExitCodes.VALIDATION;
        }
        String currentDigest = null;
        if (current != null) {
            try {
                currentDigest = DownloadValidator.normalizeDigest(current);
            } catch (IllegalArgumentException e) {
                ctx.err().printf("[VERSION] %s%n", e.getMessage());
                ctx.err().flush();
                return ExitCodes.VALIDATION;
            }
        }

        HttpCallResult result = ctx.otaClient().version(base.get());
        if (!result.is2xx()) {
            return OtaCommandSupport.reportFailure(ctx, "VERSION", "Version request", result);
        }

        VersionInfoDto version;
        try {
            version = JacksonCodec.fromJson(result.body(), VersionInfoDto.class);
        } catch (MiniOtaSerializationException e) {
            ctx.err().printf("[VERSION] Invalid server response: %s%n", e.getMessage());
            ctx.err().flush();
            return ExitCodes.IO_ERROR;
        }

        ctx.out().printf("version:  %s%n", version.version());
        ctx.out().printf("size:     %d bytes%n", version.size());
        ctx.out().printf("filename: %s%n", version.filename());

        if (currentDigest == null) {
            ctx.out().flush();
            return ExitCodes.OK;
        }
        boolean upToDate = currentDigest.equalsIgnoreCase(version.version());
        ctx.out().println(upToDate ? UP_TO_DATE : UPDATE_AVAILABLE);
        ctx.out().flush();
        return upToDate ? ExitCodes.OK : ExitCodes.UPDATE_AVAILABLE;
    }
}
