package de.htwsaar.miniota.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hex-Digests über Byte-Arrays und Dateien.
 *
 * <p>Dateien werden blockweise gelesen, sodass auch große Firmware-Images
 * nie vollständig im Speicher liegen.</p>
 */
public final class DigestUtil {

    /** Standard-Algorithmus; entspricht dem Sketch-MD5, den die Geräte selbst melden. */
    public static final String DEFAULT_ALGORITHM = "MD5";

    /** Blockgröße beim Hashen von Dateien. */
    public static final int FILE_CHUNK_SIZE = 4 * 1024;

    private DigestUtil() {}

    public static String hex(String algorithm, byte[] data) {
        MessageDigest md = newDigest(algorithm);
        return toHex(md.digest(data));
    }

    /**
     * Berechnet den Digest einer Datei in Blöcken von {@link #FILE_CHUNK_SIZE} Bytes.
     *
     * @param algorithm Name des {@link MessageDigest}-Algorithmus, z. B. {@code MD5}
     * @param file zu hashende Datei
     * @return Digest als Hex-String in Kleinbuchstaben
     * @throws IOException falls die Datei nicht gelesen werden kann
     */
    public static String hex(String algorithm, Path file) throws IOException {
        MessageDigest md = newDigest(algorithm);
        byte[] buf = new byte[FILE_CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                md.update(buf, 0, n);
            }
        }
        return toHex(md.digest());
    }

    /**
     * Prüft, ob die JVM den Algorithmus kennt.
     *
     * @param algorithm Algorithmus-Name
     * @return {@code true} wenn {@link MessageDigest#getInstance(String)} ihn liefert
     */
    public static boolean isSupported(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) return false;
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
        }
    }

    public static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute " + algorithm, e);
        }
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
