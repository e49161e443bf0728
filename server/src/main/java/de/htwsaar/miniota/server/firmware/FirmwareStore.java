package de.htwsaar.miniota.server.firmware;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ort der ausgelieferten Firmware: Verzeichnis plus Dateiname.
 *
 * <p>Hält selbst keinen Zustand über den Inhalt; alle Angaben werden bei Bedarf
 * frisch von der Platte gelesen.</p>
 */
public class FirmwareStore {

    private static final Logger log = LoggerFactory.getLogger(FirmwareStore.class);

    private final Path directory;
    private final String fileName;

    public FirmwareStore(Path directory, String fileName) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath();
        this.fileName = Objects.requireNonNull(fileName, "fileName must not be null");
    }

    /**
     * Legt das Firmware-Verzeichnis an, falls es fehlt.
     *
     * @return {@code true} wenn das Verzeichnis neu angelegt wurde
     * @throws IOException wenn das Verzeichnis nicht angelegt werden kann
     */
    public boolean ensureDirectory() throws IOException {
        if (Files.isDirectory(directory)) {
            return false;
        }
        Files.createDirectories(directory);
        log.info("Created firmware directory: {}", directory);
        return true;
    }

    /** @return Pfad der Firmware-Datei */
    public Path artifactPath() {
        return directory.resolve(fileName);
    }

    public String fileName() {
        return fileName;
    }

    /** @return {@code true} wenn die Firmware als reguläre Datei existiert */
    public boolean isAvailable() {
        return Files.isRegularFile(artifactPath());
    }

    /**
     * @return aktuelle Momentaufnahme der Firmware
     * @throws FirmwareNotFoundException wenn die Datei fehlt
     */
    public FirmwareArtifact snapshot() {
        return FirmwareArtifact.read(artifactPath());
    }
}
