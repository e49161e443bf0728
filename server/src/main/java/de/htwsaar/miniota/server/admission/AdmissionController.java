package de.htwsaar.miniota.server.admission;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Harte Obergrenze für gleichzeitig bediente Verbindungen.
 *
 * <p>Nicht blockierend: ist kein Platz frei, wird sofort abgelehnt. Es gibt keine
 * Warteschlange; der Aufrufer schließt die Verbindung, ohne sie zu lesen.</p>
 */
public class AdmissionController {

    private final int maxConnections;
    private final Semaphore permits;
    private final AtomicLong rejected = new AtomicLong();

    public AdmissionController(int maxConnections) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1, was " + maxConnections);
        }
        this.maxConnections = maxConnections;
        this.permits = new Semaphore(maxConnections);
    }

    /**
     * Versucht, einen Slot zu reservieren.
     *
     * @return Slot, der per {@link ConnectionSlot#close()} zurückgegeben wird, oder leer bei Ablehnung
     */
    public Optional<ConnectionSlot> tryAcquire() {
        if (!permits.tryAcquire()) {
            rejected.incrementAndGet();
            return Optional.empty();
        }
        return Optional.of(new ConnectionSlot(permits::release));
    }

    /** @return Anzahl aktuell vergebener Slots */
    public int activeConnections() {
        return maxConnections - permits.availablePermits();
    }

    public int maxConnections() {
        return maxConnections;
    }

    /** @return Anzahl abgelehnter Verbindungen seit Start */
    public long rejectedConnections() {
        return rejected.get();
    }
}
