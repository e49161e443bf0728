package de.htwsaar.miniota.e2e;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.miniota.cli.app.MiniOtaCliMain;
import de.htwsaar.miniota.cli.di.CliContext;
import de.htwsaar.miniota.cli.dto.DownloadResult;
import de.htwsaar.miniota.cli.service.FirmwareDownloadService;
import de.htwsaar.miniota.cli.util.ExitCodes;
import de.htwsaar.miniota.common.util.DigestUtil;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Gerätesicht: Version prüfen, Firmware laden, Download unterbrechen und fortsetzen.
 */
class FirmwareDownloadFlowTest extends AbstractE2E {

    @TempDir
    Path work;

    private final FirmwareDownloadService downloads =
            new FirmwareDownloadService(CLIENT, Duration.ofSeconds(10));

    @Test
    void fullDownload_shouldMatchServerDigest() throws Exception {
        byte[] data = pattern(300_000, 7);
        publishFirmware(data);
        Path out = work.resolve("fw.bin");

        DownloadResult result = downloads.download(baseUrl, out, false, false, 0);

        assertTrue(result.isOk(), () -> "Fehler: " + result.error());
        assertEquals(DigestUtil.hex("MD5", data), result.digest());
        assertArrayEquals(data, Files.readAllBytes(out));
    }

    @Test
    void interruptedDownload_shouldResumeFromPartFile() throws Exception {
        byte[] data = pattern(120_000, 11);
        publishFirmware(data);
        Path out = work.resolve("fw.bin");
        Files.write(FirmwareDownloadService.partFileFor(out), Arrays.copyOfRange(data, 0, 45_000));

        DownloadResult result = downloads.download(baseUrl, out, true, false, 0);

        assertTrue(result.isOk(), () -> "Fehler: " + result.error());
        assertEquals(206, result.statusCode());
        assertEquals(45_000, result.resumedFrom());
        assertEquals(75_000, result.bytesWritten());
        assertArrayEquals(data, Files.readAllBytes(out));
    }

    @Test
    void chunkedDownload_shouldReassembleFirmware() throws Exception {
        byte[] data = pattern(100_001, 3);
        publishFirmware(data);
        Path out = work.resolve("fw.bin");

        DownloadResult result = downloads.download(baseUrl, out, false, false, 16_384);

        assertTrue(result.isOk(), () -> "Fehler: " + result.error());
        assertArrayEquals(data, Files.readAllBytes(out));
    }

    @Test
    void cli_shouldReportUpdateAvailabilityAndDownload() throws Exception {
        byte[] data = pattern(10_000, 5);
        publishFirmware(data);
        StringWriter out = new StringWriter();
        CliContext ctx = new CliContext(
                new PrintWriter(out, true), new PrintWriter(new StringWriter(), true), CLIENT, Duration.ofSeconds(10));
        String host = baseUrl.toString();
        Path target = work.resolve("cli.bin");

        int stale = MiniOtaCliMain.newCommandLine(ctx)
                .execute("-H", host, "version", "--current", "d41d8cd98f00b204e9800998ecf8427e");
        int download = MiniOtaCliMain.newCommandLine(ctx).execute("-H", host, "download", "-o", target.toString());
        int current = MiniOtaCliMain.newCommandLine(ctx)
                .execute("-H", host, "version", "--current", DigestUtil.hex("MD5", Files.readAllBytes(target)));

        assertEquals(ExitCodes.UPDATE_AVAILABLE, stale);
        assertEquals(ExitCodes.OK, download);
        assertEquals(ExitCodes.OK, current);
        assertTrue(out.toString().contains("UP_TO_DATE"));
    }
}
