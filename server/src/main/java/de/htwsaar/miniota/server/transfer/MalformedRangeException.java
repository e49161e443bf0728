package de.htwsaar.miniota.server.transfer;

/**
 * {@code Range}-Header nicht parsebar oder außerhalb der Datei.
 * Wird im Router auf {@code 416 Range Not Satisfiable} gemappt.
 */
public class MalformedRangeException extends RuntimeException {

    private final long artifactSize;

    public MalformedRangeException(String message, long artifactSize) {
        super(message);
        this.artifactSize = artifactSize;
    }

    /** @return Größe der Firmware, für {@code Content-Range: bytes *}{@code /<size>} */
    public long getArtifactSize() {
        return artifactSize;
    }
}
