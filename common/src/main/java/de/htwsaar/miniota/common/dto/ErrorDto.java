package de.htwsaar.miniota.common.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Fehlerkörper für 4xx/5xx-Antworten des OTA-Servers.
 *
 * @param status HTTP-Statuscode
 * @param error  kurze Fehlerbeschreibung
 */
@JsonPropertyOrder({"status", "error"})
public record ErrorDto(int status, String error) {}
