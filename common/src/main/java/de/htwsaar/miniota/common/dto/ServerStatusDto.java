package de.htwsaar.miniota.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Antwort von {@code GET /status}.
 *
 * <p>{@code firmware_md5} und {@code firmware_size} fehlen im JSON, solange keine
 * Firmware-Datei vorhanden ist.</p>
 *
 * @param status            immer {@code "running"}
 * @param activeThreads     aktuell bediente Verbindungen
 * @param firmwareAvailable ob die Firmware-Datei existiert
 * @param timestamp         Serverzeit bei Antwort-Erzeugung (Unix-Sekunden)
 * @param firmwareMd5       Digest der Firmware oder {@code null}
 * @param firmwareSize      Größe der Firmware oder {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "active_threads", "firmware_available", "timestamp", "firmware_md5", "firmware_size"})
public record ServerStatusDto(
        @JsonProperty("status") String status,
        @JsonProperty("active_threads") int activeThreads,
        @JsonProperty("firmware_available") boolean firmwareAvailable,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("firmware_md5") String firmwareMd5,
        @JsonProperty("firmware_size") Long firmwareSize) {

    public static final String RUNNING = "running";

    public static ServerStatusDto withoutFirmware(int activeThreads, long timestamp) {
        return new ServerStatusDto(RUNNING, activeThreads, false, timestamp, null, null);
    }

    public static ServerStatusDto withFirmware(int activeThreads, long timestamp, String digest, long size) {
        return new ServerStatusDto(RUNNING, activeThreads, true, timestamp, digest, size);
    }
}
