package de.htwsaar.miniota.cli.service;

import de.htwsaar.miniota.cli.dto.DownloadResult;
import de.htwsaar.miniota.cli.dto.HttpCallResult;
import de.htwsaar.miniota.cli.util.UriUtils;
import de.htwsaar.miniota.common.dto.VersionInfoDto;
import de.htwsaar.miniota.common.serialization.JacksonCodec;
import de.htwsaar.miniota.common.serialization.MiniOtaSerializationException;
import de.htwsaar.miniota.common.util.DigestUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Lädt die Firmware vom OTA-Server, optional fortsetzbar und in Blöcken.
 *
 * <p>Ablauf:
 * <ol>
 *   <li>GET {@code /version}: erwartete Größe und Digest</li>
 *   <li>GET {@code /update} in eine {@code .part}-Datei, bei Fortsetzung mit
 *       {@code Range: bytes=<vorhanden>-}</li>
 *   <li>Größe und Digest prüfen, dann atomar auf den Zielpfad verschieben</li>
 * </ol>
 *
 * <p>Bei Integritätsfehlern wird die {@code .part}-Datei gelöscht.
 */
public final class FirmwareDownloadService {

    public static final String UPDATE_PATH = "/update";
    public static final String PART_SUFFIX = ".part";

    private static final int BUFFER_SIZE = 8 * 1024;

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final OtaClientService otaClient;
    private final String digestAlgorithm;

    public FirmwareDownloadService(HttpClient httpClient, Duration requestTimeout) {
        this(httpClient, requestTimeout, DigestUtil.DEFAULT_ALGORITHM);
    }

    public FirmwareDownloadService(HttpClient httpClient, Duration requestTimeout, String digestAlgorithm) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.otaClient = new OtaClientService(httpClient, requestTimeout);
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
    }

    /**
     * @param out Zielpfad der Firmware
     * @return Pfad der Zwischendatei ({@code <out>.part})
     */
    public static Path partFileFor(Path out) {
        return out.resolveSibling(out.getFileName().toString() + PART_SUFFIX);
    }

    /**
     * Lädt die Firmware herunter.
     *
     * @param baseUrl   Server-Basis-URL
     * @param out       Zielpfad
     * @param resume    vorhandene {@code .part}-Datei fortsetzen
     * @param overwrite bestehende Zieldatei ersetzen
     * @param chunkSize Bytes pro Range-Request, 0 = Rest in einem Request
     * @return Ergebnis inkl. Status, Bytes und Digest oder Fehler
     */
    public DownloadResult download(URI baseUrl, Path out, boolean resume, boolean overwrite, long chunkSize) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(out, "out");

        HttpCallResult versionCall = otaClient.version(baseUrl);
        if (versionCall.error() != null) {
            return DownloadResult.ioError("version request failed: " + versionCall.error());
        }
        if (!versionCall.is2xx()) {
            return DownloadResult.httpError(versionCall.statusCode());
        }
        VersionInfoDto version;
        try {
            version = JacksonCodec.fromJson(versionCall.body(), VersionInfoDto.class);
        } catch (MiniOtaSerializationException e) {
            return DownloadResult.ioError("invalid /version response: " + e.getMessage());
        }

        Path part = partFileFor(out);
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            long have = 0;
            if (Files.exists(part)) {
                have = resume ? Files.size(part) : 0;
                if (!resume || have > version.size()) {
                    Files.delete(part);
                    have = 0;
                }
            }
            long resumedFrom = have;

            int lastStatus = 200;
            URI updateUri = UriUtils.endpoint(baseUrl, UPDATE_PATH);
            if (have == 0) {
                Files.write(part, new byte[0]);
            }
            while (have < version.size()) {
                long end = chunkSize > 0 ? Math.min(version.size() - 1, have + chunkSize - 1) : version.size() - 1;
                Optional<String> range = have > 0 || chunkSize > 0
                        ? Optional.of("bytes=" + have + "-" + end)
                        : Optional.empty();

                HttpResponse<InputStream> resp = send(updateUri, range);
                int sc = resp.statusCode();
                lastStatus = sc;
                long written;
                try (InputStream body = resp.body()) {
                    if (sc == 206 && range.isPresent()) {
                        long start = contentRangeStart(resp).orElse(-1L);
                        if (start != have) {
                            drain(body);
                            return DownloadResult.ioError("unexpected Content-Range start " + start + ", expected " + have);
                        }
                        written = append(body, part);
                    } else if (sc == 200) {
                        // voller Body: vorhandene Teile verwerfen
                        have = 0;
                        Files.write(part, new byte[0]);
                        written = append(body, part);
                    } else {
                        drain(body);
                        return DownloadResult.httpError(sc);
                    }
                }
                if (written == 0) {
                    return DownloadResult.ioError("server sent no data at offset " + have);
                }
                have += written;
            }

            long actualSize = Files.size(part);
            if (actualSize != version.size()) {
                Files.deleteIfExists(part);
                return DownloadResult.integrityError(
                        "size mismatch: expected " + version.size() + " bytes, got " + actualSize);
            }
            String digest = DigestUtil.hex(digestAlgorithm, part);
            if (!digest.equalsIgnoreCase(version.version())) {
                Files.deleteIfExists(part);
                return DownloadResult.integrityError(
                        digestAlgorithm + " mismatch: expected " + version.version() + ", got " + digest);
            }

            moveIntoPlace(part, out, overwrite);
            return DownloadResult.ok(lastStatus, actualSize - resumedFrom, resumedFrom, digest);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DownloadResult.ioError("interrupted");
        } catch (IOException e) {
            return DownloadResult.ioError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private HttpResponse<InputStream> send(URI uri, Optional<String> range) throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET();
        range.ifPresent(r -> b.header("Range", r));
        return httpClient.send(b.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * @return Start-Offset aus {@code Content-Range: bytes <start>-<end>/<size>}
     */
    static Optional<Long> contentRangeStart(HttpResponse<?> resp) {
        return resp.headers().firstValue("Content-Range").flatMap(FirmwareDownloadService::parseContentRangeStart);
    }

    static Optional<Long> parseContentRangeStart(String value) {
        String v = value.trim();
        if (!v.startsWith("bytes ")) return Optional.empty();
        int dash = v.indexOf('-');
        if (dash < 0) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(v.substring("bytes ".length(), dash).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static long append(InputStream in, Path part) throws IOException {
        long total = 0;
        byte[] buf = new byte[BUFFER_SIZE];
        try (OutputStream os = Files.newOutputStream(part, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                os.write(buf, 0, n);
                total += n;
            }
        }
        return total;
    }

    private static void moveIntoPlace(Path part, Path out, boolean overwrite) throws IOException {
        if (Files.exists(out) && !overwrite) {
            throw new IOException("output file exists: " + out);
        }
        try {
            Files.move(part, out, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, out, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void drain(InputStream in) throws IOException {
        byte[] buf = new byte[BUFFER_SIZE];
        while (in.read(buf) != -1) {
            // discard
        }
    }
}
