package de.htwsaar.miniota.server.firmware;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Momentaufnahme der Firmware-Datei auf der Platte.
 *
 * <p>Die Datei kann sich zwischen zwei Requests ändern; jede Verwendung liest deshalb
 * eine neue Momentaufnahme über {@link #read(Path)}.</p>
 *
 * @param path         absoluter Pfad
 * @param size         Größe in Bytes
 * @param lastModified Änderungszeitpunkt
 */
public record FirmwareArtifact(Path path, long size, FileTime lastModified) {

    public FirmwareArtifact {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
    }

    /**
     * Liest Größe und Änderungszeitpunkt der Datei.
     *
     * @param path Pfad der Firmware
     * @return aktuelle Momentaufnahme
     * @throws FirmwareNotFoundException wenn die Datei fehlt oder keine reguläre Datei ist
     * @throws UncheckedIOException bei sonstigen I/O-Fehlern
     */
    public static FirmwareArtifact read(Path path) {
        Path absolute = path.toAbsolutePath();
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            throw new FirmwareNotFoundException(absolute, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read attributes of " + absolute, e);
        }
        if (!attrs.isRegularFile()) {
            throw new FirmwareNotFoundException(absolute);
        }
        return new FirmwareArtifact(absolute, attrs.size(), attrs.lastModifiedTime());
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
