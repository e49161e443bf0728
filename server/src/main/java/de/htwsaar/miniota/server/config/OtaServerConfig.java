package de.htwsaar.miniota.server.config;

import de.htwsaar.miniota.common.util.DigestUtil;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Unveränderliche Laufzeit-Konfiguration des OTA-Servers.
 *
 * <p>Wird einmal beim Start aus den Properties ({@code ota.*}) erzeugt und validiert.</p>
 *
 * @param host            Bind-Adresse (z. B. {@code 0.0.0.0})
 * @param port            TCP-Port (0 = ephemerer Port)
 * @param backlog         Listen-Backlog des Server-Sockets
 * @param firmwareDir     Verzeichnis der Firmware-Datei
 * @param firmwareFile    Dateiname der Firmware (ohne Pfadanteile)
 * @param maxConnections  maximale Anzahl gleichzeitig bedienter Verbindungen
 * @param digestAlgorithm {@link java.security.MessageDigest}-Algorithmus für {@code /version}
 * @param socketTimeout   Lese-Timeout pro Verbindung
 * @param stallTimeout    maximale Dauer eines blockierten Schreibvorgangs (0 = aus)
 * @param shutdownGrace   Wartezeit auf laufende Transfers beim Stoppen
 */
public record OtaServerConfig(
        String host,
        int port,
        int backlog,
        Path firmwareDir,
        String firmwareFile,
        int maxConnections,
        String digestAlgorithm,
        Duration socketTimeout,
        Duration stallTimeout,
        Duration shutdownGrace) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 5005;
    public static final int DEFAULT_BACKLOG = 50;
    public static final String DEFAULT_FIRMWARE_DIR = "./firmware";
    public static final String DEFAULT_FIRMWARE_FILE = "firmware.bin";
    public static final int DEFAULT_MAX_CONNECTIONS = 50;

    public OtaServerConfig {
        Objects.requireNonNull(firmwareDir, "firmwareDir must not be null");
        Objects.requireNonNull(socketTimeout, "socketTimeout must not be null");
        Objects.requireNonNull(stallTimeout, "stallTimeout must not be null");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
        host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("ota.port must be between 0 and 65535, was " + port);
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("ota.backlog must be >= 1, was " + backlog);
        }
        if (firmwareFile == null || firmwareFile.isBlank()) {
            throw new IllegalArgumentException("ota.firmware-file must not be blank");
        }
        firmwareFile = firmwareFile.trim();
        if (firmwareFile.contains("/") || firmwareFile.contains("\\") || firmwareFile.equals("..")) {
            throw new IllegalArgumentException("ota.firmware-file must be a plain file name: " + firmwareFile);
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("ota.max-connections must be >= 1, was " + maxConnections);
        }
        if (!DigestUtil.isSupported(digestAlgorithm)) {
            throw new IllegalArgumentException("ota.digest-algorithm not supported: " + digestAlgorithm);
        }
        if (socketTimeout.isNegative() || stallTimeout.isNegative() || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("ota timeouts must not be negative");
        }
    }

    /**
     * Standardkonfiguration mit eigenem Firmware-Verzeichnis (nützlich für Tests).
     *
     * @param firmwareDir Firmware-Verzeichnis
     * @return Konfiguration mit den Default-Werten
     */
    public static OtaServerConfig defaults(Path firmwareDir) {
        return new OtaServerConfig(
                DEFAULT_HOST,
                DEFAULT_PORT,
                DEFAULT_BACKLOG,
                firmwareDir,
                DEFAULT_FIRMWARE_FILE,
                DEFAULT_MAX_CONNECTIONS,
                DigestUtil.DEFAULT_ALGORITHM,
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                Duration.ofSeconds(5));
    }

    public OtaServerConfig withHostAndPort(String newHost, int newPort) {
        return new OtaServerConfig(newHost, newPort, backlog, firmwareDir, firmwareFile, maxConnections,
                digestAlgorithm, socketTimeout, stallTimeout, shutdownGrace);
    }

    public OtaServerConfig withMaxConnections(int newMaxConnections) {
        return new OtaServerConfig(host, port, backlog, firmwareDir, firmwareFile, newMaxConnections,
                digestAlgorithm, socketTimeout, stallTimeout, shutdownGrace);
    }

    public OtaServerConfig withTimeouts(Duration newSocketTimeout, Duration newStallTimeout) {
        return new OtaServerConfig(host, port, backlog, firmwareDir, firmwareFile, maxConnections,
                digestAlgorithm, newSocketTimeout, newStallTimeout, shutdownGrace);
    }
}
