package de.htwsaar.miniota.cli.dto;

/**
 * Ergebnis eines HTTP-Aufrufs gegen den OTA-Server.
 *
 * @param statusCode HTTP-Status oder {@code null} bei I/O-Fehler
 * @param body       Antwortkörper als Text
 * @param error      Fehlertext bei I/O-Problemen
 */
public record HttpCallResult(Integer statusCode, String body, String error) {

    public static HttpCallResult http(int statusCode, String body) {
        return new HttpCallResult(statusCode, body, null);
    }

    public static HttpCallResult ioError(String message) {
        return new HttpCallResult(null, null, message == null ? "io error" : message);
    }

    public boolean is2xx() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }

    public boolean is4xx() {
        return statusCode != null && statusCode >= 400 && statusCode < 500;
    }
}
