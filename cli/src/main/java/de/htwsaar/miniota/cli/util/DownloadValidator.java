package de.htwsaar.miniota.cli.util;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prüft CLI-Eingaben für Downloads, bevor ein Request abgesetzt wird.
 */
public final class DownloadValidator {

    private DownloadValidator() {}

    public static void validateOutputPath(Path outputPath, boolean overwrite) {
        if (outputPath == null || outputPath.toString().isBlank()) {
            throw new IllegalArgumentException("Output-Pfad darf nicht leer sein.");
        }
        if (outputPath.getFileName() == null) {
            throw new IllegalArgumentException("Output-Pfad braucht einen Dateinamen.");
        }
        if (Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output-Pfad darf kein Verzeichnis sein.");
        }
        if (Files.exists(outputPath) && !overwrite) {
            throw new IllegalArgumentException(
                    "Output-Datei existiert bereits. Verwende --overwrite, um sie zu ersetzen.");
        }
    }

    /**
     * @param chunkSize gewünschte Blockgröße, 0 = ganze Datei in einem Request
     * @return geprüfte Blockgröße
     */
    public static long validateChunkSize(long chunkSize) {
        if (chunkSize < 0) {
            throw new IllegalArgumentException("--chunk-size darf nicht negativ sein.");
        }
        return chunkSize;
    }

    /**
     * @param digest erwarteter Hex-Digest
     * @return Digest in Kleinbuchstaben
     */
    public static String normalizeDigest(String digest) {
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("Digest darf nicht leer sein.");
        }
        String d = digest.trim().toLowerCase();
        if (!d.matches("[0-9a-f]+")) {
            throw new IllegalArgumentException("Digest muss hexadezimal sein: " + digest);
        }
        return d;
    }
}
