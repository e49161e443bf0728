package de.htwsaar.miniota.server.net;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Socket-Ausgabestrom, der festhält, seit wann ein Schreibvorgang blockiert.
 *
 * <p>Wird vom {@link StalledTransferWatchdog} abgefragt.</p>
 */
public class ProgressTrackingOutputStream extends FilterOutputStream {

    private final AtomicLong bytesWritten = new AtomicLong();
    private volatile boolean writing;
    private volatile long writeStartedNanos;

    public ProgressTrackingOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        begin();
        try {
            out.write(b);
            bytesWritten.incrementAndGet();
        } finally {
            writing = false;
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        begin();
        try {
            out.write(b, off, len);
            bytesWritten.addAndGet(len);
        } finally {
            writing = false;
        }
    }

    @Override
    public void flush() throws IOException {
        begin();
        try {
            out.flush();
        } finally {
            writing = false;
        }
    }

    /**
     * @param nowNanos aktueller {@link System#nanoTime()}-Wert
     * @return wie lange der laufende Schreibvorgang schon blockiert; 0 wenn keiner läuft
     */
    public long blockedForNanos(long nowNanos) {
        if (!writing) {
            return 0;
        }
        return Math.max(0, nowNanos - writeStartedNanos);
    }

    public long bytesWritten() {
        return bytesWritten.get();
    }

    private void begin() {
        writeStartedNanos = System.nanoTime();
        writing = true;
    }
}
