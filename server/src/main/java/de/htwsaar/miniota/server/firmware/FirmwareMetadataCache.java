package de.htwsaar.miniota.server.firmware;

import de.htwsaar.miniota.common.util.DigestUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache für Digest und Größe der Firmware.
 *
 * <p>Ein Eintrag ist genau dann gültig, wenn der gespeicherte Änderungszeitpunkt dem
 * aktuellen der Datei entspricht. Andernfalls wird der Digest blockweise neu berechnet,
 * bevor irgendein Aufrufer den Eintrag liest.</p>
 *
 * <p>Prüfen, Neuberechnen und Ersetzen laufen unter einem einzigen Lock pro Instanz.
 * Wartende Aufrufer blockieren, bis eine laufende Berechnung fertig ist; sie sehen danach
 * entweder den alten oder den neuen Digest, nie einen halben.</p>
 */
public class FirmwareMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(FirmwareMetadataCache.class);

    private final String algorithm;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong recomputations = new AtomicLong();

    /** Nur unter {@link #lock} schreiben. */
    private volatile CachedDigest cached;

    /**
     * @param algorithm {@link java.security.MessageDigest}-Algorithmus, z. B. {@code MD5}
     */
    public FirmwareMetadataCache(String algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        DigestUtil.newDigest(algorithm);
    }

    /**
     * Liefert Digest und Größe der Datei, bei Bedarf neu berechnet.
     *
     * @param path Pfad der Firmware
     * @return aktueller Digest und Größe
     * @throws FirmwareNotFoundException wenn die Datei nicht existiert
     * @throws UncheckedIOException wenn die Datei nicht gelesen werden kann
     */
    public FirmwareMetadata get(Path path) {
        lock.lock();
        try {
            FirmwareArtifact artifact = FirmwareArtifact.read(path);
            CachedDigest current = cached;
            if (current != null && current.isValidFor(artifact)) {
                log.debug("Digest cache hit for {}", artifact.path());
                return current.toMetadata();
            }

            log.info("Calculating {} (cache miss or file changed) for {}", algorithm, artifact.path());
            long started = System.nanoTime();
            String digest = computeDigest(artifact.path());
            CachedDigest next = new CachedDigest(artifact.path(), digest, artifact.size(), artifact.lastModified());
            cached = next;
            recomputations.incrementAndGet();
            log.info(
                    "{} cached: {} ({} bytes, {} ms)",
                    algorithm,
                    digest,
                    artifact.size(),
                    (System.nanoTime() - started) / 1_000_000);
            return next.toMetadata();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Berechnet den Digest beim Serverstart vor, falls die Firmware vorhanden ist.
     *
     * @param path Pfad der Firmware
     * @return {@code true} wenn ein Digest berechnet wurde
     */
    public boolean warmUp(Path path) {
        try {
            FirmwareMetadata metadata = get(path);
            log.info("Firmware digest pre-calculated: {}", metadata.digest());
            return true;
        } catch (FirmwareNotFoundException e) {
            log.warn("Firmware file not found: {} - place the firmware image there to enable updates", e.getPath());
            return false;
        }
    }

    /**
     * Letzter berechneter Wert, ohne die Datei anzufassen.
     *
     * @return zuletzt gecachte Metadaten oder leer
     */
    public Optional<FirmwareMetadata> peek() {
        CachedDigest current = cached;
        return current == null ? Optional.empty() : Optional.of(current.toMetadata());
    }

    /** @return Anzahl der bisher durchgeführten Digest-Berechnungen */
    public long recomputations() {
        return recomputations.get();
    }

    public String algorithm() {
        return algorithm;
    }

    private String computeDigest(Path path) {
        try {
            return DigestUtil.hex(algorithm, path);
        } catch (NoSuchFileException e) {
            throw new FirmwareNotFoundException(path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to hash " + path, e);
        }
    }

    /**
     * Interner Cache-Eintrag; verlässt diese Klasse nur als {@link FirmwareMetadata}.
     */
    private record CachedDigest(Path path, String digest, long size, FileTime mtime) {

        boolean isValidFor(FirmwareArtifact artifact) {
            return path.equals(artifact.path()) && mtime.equals(artifact.lastModified());
        }

        FirmwareMetadata toMetadata() {
            return new FirmwareMetadata(digest, size);
        }
    }
}
