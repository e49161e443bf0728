package de.htwsaar.miniota.server.transfer;

/**
 * Ergebnis eines Transfers.
 *
 * @param bytesWritten  an den Sink übergebene Bytes
 * @param expected      Länge des angeforderten Bereichs
 * @param clientAborted {@code true} wenn das Schreiben zum Client scheiterte
 */
public record TransferResult(long bytesWritten, long expected, boolean clientAborted) {

    static TransferResult completed(long bytes) {
        return new TransferResult(bytes, bytes, false);
    }

    static TransferResult aborted(long bytesWritten, long expected) {
        return new TransferResult(bytesWritten, expected, true);
    }

    /** @return {@code true} wenn der ganze Bereich geschrieben wurde */
    public boolean complete() {
        return !clientAborted && bytesWritten == expected;
    }
}
