package de.htwsaar.miniota.server.http;

/**
 * Request-Zeile oder Header nicht lesbar. Wird auf {@code 400 Bad Request} gemappt.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
