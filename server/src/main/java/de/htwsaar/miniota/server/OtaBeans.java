package de.htwsaar.miniota.server;

import de.htwsaar.miniota.common.logging.TraceIdSupport;
import de.htwsaar.miniota.server.admission.AdmissionController;
import de.htwsaar.miniota.server.config.OtaServerConfig;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import de.htwsaar.miniota.server.net.OtaServer;
import de.htwsaar.miniota.server.transfer.ArtifactStreamer;
import de.htwsaar.miniota.server.transfer.RangeRequestParser;
import de.htwsaar.miniota.server.web.RequestRouter;
import de.htwsaar.miniota.server.web.StatusEndpoint;
import de.htwsaar.miniota.server.web.UpdateEndpoint;
import de.htwsaar.miniota.server.web.VersionEndpoint;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung der OTA-Komponenten.
 *
 * <p>Schichtung: OtaServer → RequestRouter → Endpoints → Cache/Streamer → Dateisystem</p>
 */
@Configuration
public class OtaBeans {

    /**
     * Systemuhr für Zeitstempel in {@code /version} und {@code /status}.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Liest und validiert die Server-Konfiguration.
     *
     * @param host             Bind-Adresse (Standard: 0.0.0.0)
     * @param port             TCP-Port (Standard: 5005)
     * @param backlog          Listen-Backlog (Standard: 50)
     * @param firmwareDir      Firmware-Verzeichnis (Standard: ./firmware)
     * @param firmwareFile     Firmware-Dateiname (Standard: firmware.bin)
     * @param maxConnections   gleichzeitige Verbindungen (Standard: 50)
     * @param digestAlgorithm  Digest-Algorithmus (Standard: MD5)
     * @param socketTimeoutMs  Lese-Timeout in ms (Standard: 30000)
     * @param stallTimeoutMs   Schreib-Stall-Timeout in ms (Standard: 60000, 0 = aus)
     * @param shutdownGraceMs  Wartezeit beim Stoppen in ms (Standard: 5000)
     * @return unveränderliche Konfiguration
     */
    @Bean
    public OtaServerConfig otaServerConfig(
            @Value("${ota.host:0.0.0.0}") String host,
            @Value("${ota.port:5005}") int port,
            @Value("${ota.backlog:50}") int backlog,
            @Value("${ota.firmware-dir:./firmware}") String firmwareDir,
            @Value("${ota.firmware-file:firmware.bin}") String firmwareFile,
            @Value("${ota.max-connections:50}") int maxConnections,
            @Value("${ota.digest-algorithm:MD5}") String digestAlgorithm,
            @Value("${ota.socket-timeout-ms:30000}") long socketTimeoutMs,
            @Value("${ota.stall-timeout-ms:60000}") long stallTimeoutMs,
            @Value("${ota.shutdown-grace-ms:5000}") long shutdownGraceMs) {
        return new OtaServerConfig(
                host,
                port,
                backlog,
                Path.of(firmwareDir),
                firmwareFile,
                maxConnections,
                digestAlgorithm,
                Duration.ofMillis(socketTimeoutMs),
                Duration.ofMillis(stallTimeoutMs),
                Duration.ofMillis(shutdownGraceMs));
    }

    @Bean
    public FirmwareStore firmwareStore(OtaServerConfig config) {
        return new FirmwareStore(config.firmwareDir(), config.firmwareFile());
    }

    @Bean
    public FirmwareMetadataCache firmwareMetadataCache(OtaServerConfig config) {
        return new FirmwareMetadataCache(config.digestAlgorithm());
    }

    @Bean
    public AdmissionController admissionController(OtaServerConfig config) {
        return new AdmissionController(config.maxConnections());
    }

    @Bean
    public RangeRequestParser rangeRequestParser() {
        return new RangeRequestParser();
    }

    @Bean
    public ArtifactStreamer artifactStreamer() {
        return new ArtifactStreamer();
    }

    /**
     * Routing-Tabelle: {@code /version}, {@code /update}, {@code /status}.
     */
    @Bean
    public RequestRouter requestRouter(
            FirmwareStore store,
            FirmwareMetadataCache cache,
            AdmissionController admission,
            RangeRequestParser rangeParser,
            ArtifactStreamer streamer,
            Clock clock) {
        return new RequestRouter(List.of(
                new VersionEndpoint(store, cache, clock),
                new UpdateEndpoint(store, rangeParser, streamer),
                new StatusEndpoint(store, cache, admission, clock)));
    }

    @Bean
    public OtaServer otaServer(
            OtaServerConfig config,
            AdmissionController admission,
            RequestRouter router,
            TraceIdSupport traceIdSupport) {
        return new OtaServer(config, admission, router, traceIdSupport);
    }

    @Bean
    public OtaServerLifecycle otaServerLifecycle(
            OtaServerConfig config, FirmwareStore store, FirmwareMetadataCache cache, RequestRouter router,
            OtaServer server) {
        return new OtaServerLifecycle(config, store, cache, router, server);
    }
}
