package de.htwsaar.miniota.server.transfer;

/**
 * Inklusives Byte-Intervall {@code [start, end]} innerhalb der Firmware.
 *
 * <p>Einzige Ausnahme von {@code start <= end}: der volle Bereich einer leeren Datei,
 * {@code (0, -1)} mit Länge 0.</p>
 *
 * @param start erster Offset (inklusive)
 * @param end   letzter Offset (inklusive)
 */
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0 || end < start - 1) {
            throw new IllegalArgumentException("invalid byte range " + start + "-" + end);
        }
    }

    /**
     * @param size Dateigröße in Bytes
     * @return Bereich über die ganze Datei
     */
    public static ByteRange full(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative, was " + size);
        }
        return new ByteRange(0, size - 1);
    }

    /** @return Anzahl Bytes im Bereich */
    public long length() {
        return end - start + 1;
    }

    /**
     * @param size Gesamtgröße der Datei
     * @return Wert für den {@code Content-Range}-Header, z. B. {@code bytes 0-99/1000}
     */
    public String toContentRange(long size) {
        return "bytes " + start + "-" + end + "/" + size;
    }
}
