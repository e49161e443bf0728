package de.htwsaar.miniota.server.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Erlaubnis, eine Verbindung zu bedienen.
 *
 * <p>Gedacht für try-with-resources; {@link #close()} gibt den Slot genau einmal frei,
 * weitere Aufrufe sind wirkungslos.</p>
 */
public final class ConnectionSlot implements AutoCloseable {

    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConnectionSlot(Runnable release) {
        this.release = release;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
