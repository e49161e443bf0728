package de.htwsaar.miniota.server.web;

import de.htwsaar.miniota.common.dto.ServerStatusDto;
import de.htwsaar.miniota.server.admission.AdmissionController;
import de.htwsaar.miniota.server.firmware.FirmwareMetadata;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import de.htwsaar.miniota.server.firmware.FirmwareNotFoundException;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import java.io.IOException;
import java.time.Clock;
import org.springframework.http.HttpStatus;

/**
 * {@code GET /status}: Serverzustand, aktive Verbindungen und Firmware-Infos.
 *
 * <p>Antwortet immer mit 200. {@code active_threads} zählt die laufende
 * {@code /status}-Verbindung mit.</p>
 */
public class StatusEndpoint implements Endpoint {

    public static final String PATH = "/status";

    private final FirmwareStore store;
    private final FirmwareMetadataCache cache;
    private final AdmissionController admission;
    private final Clock clock;

    public StatusEndpoint(
            FirmwareStore store, FirmwareMetadataCache cache, AdmissionController admission, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.admission = admission;
        this.clock = clock;
    }

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public void get(OtaExchange exchange) throws IOException {
        int active = admission.activeConnections();
        long now = clock.instant().getEpochSecond();

        ServerStatusDto status;
        if (store.isAvailable()) {
            try {
                FirmwareMetadata metadata = cache.get(store.artifactPath());
                status = ServerStatusDto.withFirmware(active, now, metadata.digest(), metadata.size());
            } catch (FirmwareNotFoundException e) {
                // zwischen Prüfung und Hashing gelöscht
                status = ServerStatusDto.withoutFirmware(active, now);
            }
        } else {
            status = ServerStatusDto.withoutFirmware(active, now);
        }
        exchange.sendJson(HttpStatus.OK, status);
    }
}
