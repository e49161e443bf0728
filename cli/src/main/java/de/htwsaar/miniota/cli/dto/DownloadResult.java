package de.htwsaar.miniota.cli.dto;

/**
 * Ergebnis eines Firmware-Downloads.
 *
 * @param statusCode       letzter HTTP-Status (nur bei HTTP-Antwort)
 * @param bytesWritten     in diesem Lauf geschriebene Bytes
 * @param resumedFrom      Offset, ab dem fortgesetzt wurde (0 = frischer Download)
 * @param digest           verifizierter Digest (nur bei Erfolg)
 * @param error            Fehlertext bei I/O- oder Integritätsproblemen
 * @param integrityFailure {@code true} wenn Größe oder Digest nicht zu {@code /version} passen
 */
public record DownloadResult(
        Integer statusCode, long bytesWritten, long resumedFrom, String digest, String error, boolean integrityFailure) {

    public static DownloadResult ok(int statusCode, long bytesWritten, long resumedFrom, String digest) {
        return new DownloadResult(statusCode, bytesWritten, resumedFrom, digest, null, false);
    }

    public static DownloadResult httpError(int statusCode) {
        return new DownloadResult(statusCode, 0L, 0L, null, null, false);
    }

    public static DownloadResult ioError(String message) {
        return new DownloadResult(null, 0L, 0L, null, message == null ? "io error" : message, false);
    }

    public static DownloadResult integrityError(String message) {
        return new DownloadResult(null, 0L, 0L, null, message, true);
    }

    public boolean isOk() {
        return error == null && statusCode != null && statusCode >= 200 && statusCode < 300;
    }
}
