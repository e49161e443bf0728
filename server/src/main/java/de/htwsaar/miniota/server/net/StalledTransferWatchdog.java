package de.htwsaar.miniota.server.net;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Schließt Verbindungen, deren Schreibvorgang länger als das Stall-Timeout blockiert.
 *
 * <p>Gegenstück zum Socket-Lese-Timeout: ein Client, der nichts mehr abnimmt, belegt
 * seinen Slot höchstens {@code stallTimeout} lang. Ein Timeout von 0 schaltet die
 * Überwachung ab.</p>
 */
public class StalledTransferWatchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StalledTransferWatchdog.class);

    private static final long MIN_CHECK_INTERVAL_MS = 50;
    private static final long MAX_CHECK_INTERVAL_MS = 1000;

    private final long stallTimeoutNanos;
    private final Map<Registration, Boolean> watched = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public StalledTransferWatchdog(Duration stallTimeout) {
        this.stallTimeoutNanos = stallTimeout.toNanos();
        if (stallTimeoutNanos <= 0) {
            this.scheduler = null;
            return;
        }
        CustomizableThreadFactory threads = new CustomizableThreadFactory("ota-stall-watchdog-");
        threads.setDaemon(true);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threads);
        long interval = Math.max(
                MIN_CHECK_INTERVAL_MS, Math.min(MAX_CHECK_INTERVAL_MS, stallTimeout.toMillis() / 4));
        scheduler.scheduleWithFixedDelay(() -> check(System.nanoTime()), interval, interval, TimeUnit.MILLISECONDS);
    }

    public boolean isEnabled() {
        return scheduler != null;
    }

    /**
     * Überwacht {@code stream}; bei Stillstand wird {@code connection} geschlossen.
     *
     * @param stream     Ausgabestrom der Verbindung
     * @param connection zu schließende Ressource (Socket)
     * @param client     Client-Adresse für das Log
     * @return Registrierung; {@link Registration#close()} beendet die Überwachung
     */
    public Registration watch(ProgressTrackingOutputStream stream, Closeable connection, String client) {
        Registration registration = new Registration(stream, connection, client);
        if (isEnabled()) {
            watched.put(registration, Boolean.TRUE);
        }
        return registration;
    }

    /** @return Anzahl der aktuell überwachten Verbindungen */
    public int watchedCount() {
        return watched.size();
    }

    /**
     * Ein Prüfdurchlauf.
     *
     * @param nowNanos aktueller {@link System#nanoTime()}-Wert
     * @return Anzahl der geschlossenen Verbindungen
     */
    int check(long nowNanos) {
        int closed = 0;
        for (Registration r : watched.keySet()) {
            long blocked = r.stream.blockedForNanos(nowNanos);
            if (blocked > stallTimeoutNanos) {
                log.warn(
                        "Closing stalled connection {}: write blocked for {} ms after {} bytes",
                        r.client,
                        TimeUnit.NANOSECONDS.toMillis(blocked),
                        r.stream.bytesWritten());
                watched.remove(r);
                try {
                    r.connection.close();
                } catch (IOException e) {
                    log.warn("Failed to close stalled connection {}: {}", r.client, e.getMessage());
                }
                closed++;
            }
        }
        return closed;
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        watched.clear();
    }

    /**
     * Überwachung einer Verbindung.
     */
    public final class Registration implements AutoCloseable {

        private final ProgressTrackingOutputStream stream;
        private final Closeable connection;
        private final String client;

        private Registration(ProgressTrackingOutputStream stream, Closeable connection, String client) {
            this.stream = stream;
            this.connection = connection;
            this.client = client;
        }

        @Override
        public void close() {
            watched.remove(this);
        }
    }
}
