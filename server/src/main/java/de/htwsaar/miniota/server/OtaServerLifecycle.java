package de.htwsaar.miniota.server;

import de.htwsaar.miniota.server.config.OtaServerConfig;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import de.htwsaar.miniota.server.net.OtaServer;
import de.htwsaar.miniota.server.web.RequestRouter;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Startet und stoppt den {@link OtaServer} mit dem Spring-Kontext.
 *
 * <p>Beim Start wird das Firmware-Verzeichnis angelegt und der Digest vorberechnet.</p>
 */
public class OtaServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OtaServerLifecycle.class);

    private final OtaServerConfig config;
    private final FirmwareStore store;
    private final FirmwareMetadataCache cache;
    private final RequestRouter router;
    private final OtaServer server;

    public OtaServerLifecycle(
            OtaServerConfig config,
            FirmwareStore store,
            FirmwareMetadataCache cache,
            RequestRouter router,
            OtaServer server) {
        this.config = config;
        this.store = store;
        this.cache = cache;
        this.router = router;
        this.server = server;
    }

    @Override
    public void start() {
        try {
            store.ensureDirectory();
            cache.warmUp(store.artifactPath());
            server.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to start OTA server on port " + config.port(), e);
        }
        log.info("Firmware: {}", store.artifactPath());
        log.info("Digest algorithm: {}", cache.algorithm());
        log.info(
                "Timeouts: read {} ms, stall {} ms",
                config.socketTimeout().toMillis(),
                config.stallTimeout().toMillis());
        for (String path : router.paths()) {
            log.info("Endpoint: GET http://{}:{}{}", config.host(), server.localPort(), path);
        }
    }

    @Override
    public void stop() {
        server.stop();
    }

    @Override
    public boolean isRunning() {
        return server.isRunning();
    }
}
