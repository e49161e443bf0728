package de.htwsaar.miniota.server.firmware;

/**
 * Digest und Größe der Firmware, wie sie {@code /version} und {@code /status} melden.
 *
 * @param digest Hex-Digest des Inhalts
 * @param size   Größe in Bytes
 */
public record FirmwareMetadata(String digest, long size) {}
