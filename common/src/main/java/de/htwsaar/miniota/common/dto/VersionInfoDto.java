package de.htwsaar.miniota.common.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Antwort von {@code GET /version}.
 *
 * @param version   Hex-Digest der aktuellen Firmware
 * @param size      Größe der Firmware in Bytes
 * @param filename  Dateiname der Firmware
 * @param timestamp Serverzeit bei Antwort-Erzeugung (Unix-Sekunden)
 */
@JsonPropertyOrder({"version", "size", "filename", "timestamp"})
public record VersionInfoDto(String version, long size, String filename, long timestamp) {}
