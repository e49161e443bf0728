package de.htwsaar.miniota.cli.command.ota;

import de.htwsaar.miniota.cli.command.root.MiniOtaRootCommand;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.dto.DownloadResult;
import de.htwsaar.miniota.cli.util.DownloadValidator;
import de.htwsaar.miniota.cli.util.ExitCodes;
import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Lädt die Firmware herunter und prüft Größe und Digest gegen {@code /version}.
 *
 * <p>HTTP-Flow:
 * <ul>
 *   <li>GET /version → erwartete Größe und Digest</li>
 *   <li>GET /update (ggf. mit {@code Range}) → {@code <out>.part}</li>
 *   <li>Verifikation, dann atomarer Move auf {@code <out>}</li>
 * </ul>
 */
@Command(
        name = "download",
        description = "Download the firmware (resumable) and verify its digest",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  miniota download -o ./firmware.bin",
            "  miniota download -o ./firmware.bin --resume",
            "  miniota download -o ./firmware.bin --chunk-size 65536 --overwrite -H http://192.168.4.1:5005"
        })
public final class DownloadCommand implements Callable<Integer> {

    private final CliContext ctx;

    @ParentCommand
    private MiniOtaRootCommand root;

    @Option(
            names = {"-o", "--out"},
            required = true,
            paramLabel = "OUT_FILE",
            description = "Local output file path")
    private Path out;

    @Option(
            names = {"--resume"},
            defaultValue = "false",
            description = "Continue an interrupted download from OUT_FILE.part")
    private boolean resume;

    @Option(
            names = {"--overwrite"},
            defaultValue = "false",
            description = "Overwrite existing local file")
    private boolean overwrite;

    @Option(
            names = {"--chunk-size"},
            defaultValue = "0",
            paramLabel = "BYTES",
            description = "Download in range requests of this size (0 = single request)")
    private long chunkSize;

    public DownloadCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Optional<URI> base = OtaCommandSupport.baseUrl(root, "DOWNLOAD");
        if (base.isEmpty()) {
            return ExitCodes.VALIDATION;
        }
        try {
            DownloadValidator.validateOutputPath(out, overwrite);
            DownloadValidator.validateChunkSize(chunkSize);
        } catch (IllegalArgumentException e) {
            ctx.err().printf("[DOWNLOAD] %s%n", e.getMessage());
            ctx.err().flush();
            return ExitCodes.VALIDATION;
        }

        DownloadResult result = ctx.downloadService().download(base.get(), out, resume, overwrite, chunkSize);

        if (result.integrityFailure()) {
            ctx.err().printf("[DOWNLOAD] Integrity check failed: %s%n", result.error());
            ctx.err().flush();
            return ExitCodes.INTEGRITY;
        }
        if (result.error() != null) {
            ctx.err().printf("[DOWNLOAD] Download failed: %s%n", result.error());
            ctx.err().flush();
            return ExitCodes.IO_ERROR;
        }
        if (!result.isOk()) {
            int sc = result.statusCode();
            ctx.err().printf("[DOWNLOAD] Request rejected (HTTP %d)%n", sc);
            ctx.err().flush();
            return ExitCodes.forHttpStatus(sc);
        }

        if (result.resumedFrom() > 0) {
            ctx.out().printf("[DOWNLOAD] Resumed at byte %d%n", result.resumedFrom());
        }
        ctx.out().printf(
                "[DOWNLOAD] Firmware -> %s (%d bytes, digest %s)%n", out, result.bytesWritten(), result.digest());
        ctx.out().flush();
        return ExitCodes.OK;
    }
}
