package de.htwsaar.miniota.server.web;

import de.htwsaar.miniota.common.dto.VersionInfoDto;
import de.htwsaar.miniota.server.firmware.FirmwareMetadata;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import java.io.IOException;
import java.time.Clock;
import org.springframework.http.HttpStatus;

/**
 * {@code GET /version}: Digest, Größe und Name der aktuellen Firmware.
 */
public class VersionEndpoint implements Endpoint {

    public static final String PATH = "/version";

    private final FirmwareStore store;
    private final FirmwareMetadataCache cache;
    private final Clock clock;

    public VersionEndpoint(FirmwareStore store, FirmwareMetadataCache cache, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public void get(OtaExchange exchange) throws IOException {
        FirmwareMetadata metadata = cache.get(store.artifactPath());
        exchange.sendJson(
                HttpStatus.OK,
                new VersionInfoDto(
                        metadata.digest(),
                        metadata.size(),
                        store.fileName(),
                        clock.instant().getEpochSecond()));
    }
}
