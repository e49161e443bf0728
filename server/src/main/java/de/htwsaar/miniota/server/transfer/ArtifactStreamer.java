package de.htwsaar.miniota.server.transfer;

import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schreibt einen Byte-Bereich der Firmware blockweise an den Client.
 *
 * <p>Der Speicherbedarf ist unabhängig von der Dateigröße auf einen Block begrenzt.
 * Die Response-Header müssen vorher geschrieben sein.</p>
 */
public class ArtifactStreamer {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStreamer.class);

    public static final int DEFAULT_CHUNK_SIZE = 8 * 1024;

    private final int chunkSize;

    public ArtifactStreamer() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public ArtifactStreamer(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, was " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Überträgt {@code range} aus {@code path} nach {@code sink}.
     *
     * <p>Scheitert das Schreiben (Client getrennt, Watchdog), endet der Transfer ohne
     * Exception; das Ergebnis ist dann unvollständig.</p>
     *
     * @param path  Firmware-Datei
     * @param range zu sendender Bereich
     * @param sink  Body-Stream der Antwort
     * @return geschriebene und erwartete Bytes
     * @throws IOException wenn die Firmware nicht gelesen werden kann oder vorzeitig endet
     */
    public TransferResult stream(Path path, ByteRange range, OutputStream sink) throws IOException {
        long expected = range.length();
        long sent = 0;
        if (expected == 0) {
            return TransferResult.completed(0);
        }

        byte[] buf = new byte[(int) Math.min(chunkSize, expected)];
        ByteBuffer buffer = ByteBuffer.wrap(buf);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(range.start());
            while (sent < expected) {
                buffer.clear();
                buffer.limit((int) Math.min(buf.length, expected - sent));
                int n = channel.read(buffer);
                if (n < 0) {
                    throw new EOFException("Firmware ended after " + (range.start() + sent) + " bytes, expected "
                            + (range.end() + 1));
                }
                try {
                    sink.write(buf, 0, n);
                } catch (IOException e) {
                    log.info("Client disconnected after {} of {} bytes: {}", sent, expected, e.getMessage());
                    return TransferResult.aborted(sent, expected);
                }
                sent += n;
            }
        }

        try {
            sink.flush();
        } catch (IOException e) {
            log.info("Client disconnected before final flush ({} bytes written): {}", sent, e.getMessage());
            return TransferResult.aborted(sent, expected);
        }
        return TransferResult.completed(sent);
    }
}
