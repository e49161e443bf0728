package de.htwsaar.miniota.server.firmware;

import java.nio.file.Path;

/**
 * Die Firmware-Datei existiert nicht (oder ist keine reguläre Datei).
 * Wird im Router auf {@code 404 Not Found} gemappt.
 */
public class FirmwareNotFoundException extends RuntimeException {

    private final transient Path path;

    public FirmwareNotFoundException(Path path) {
        super("Firmware not found: " + path);
        this.path = path;
    }

    public FirmwareNotFoundException(Path path, Throwable cause) {
        super("Firmware not found: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
