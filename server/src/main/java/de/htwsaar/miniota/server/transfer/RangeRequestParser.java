package de.htwsaar.miniota.server.transfer;

/**
 * Übersetzt einen optionalen {@code Range}-Header in einen {@link ByteRange}.
 *
 * <p>Unterstützt genau eine Angabe der Form {@code bytes=<start>-<end>}; beide Grenzen
 * sind optional. {@code bytes=-N} liefert die letzten {@code N} Bytes. Mehrere Bereiche
 * werden abgelehnt.</p>
 */
public class RangeRequestParser {

    private static final String UNIT_PREFIX = "bytes=";

    /**
     * @param header Wert des {@code Range}-Headers
     * @return {@code true} wenn der Header vorhanden und nicht leer ist (Antwort 206 statt 200)
     */
    public static boolean isRangeRequest(String header) {
        return header != null && !header.isBlank();
    }

    /**
     * @param header Wert des {@code Range}-Headers oder {@code null}
     * @param size   Größe der Firmware in Bytes
     * @return angeforderter Bereich; ohne Header die ganze Datei
     * @throws MalformedRangeException bei ungültiger Syntax oder Bereich außerhalb der Datei
     */
    public ByteRange parse(String header, long size) {
        if (!isRangeRequest(header)) {
            return ByteRange.full(size);
        }

        String value = header.trim();
        if (value.length() < UNIT_PREFIX.length()
                || !value.regionMatches(true, 0, UNIT_PREFIX, 0, UNIT_PREFIX.length())) {
            throw new MalformedRangeException("unsupported range unit: " + value, size);
        }
        String spec = value.substring(UNIT_PREFIX.length()).trim();
        if (spec.indexOf(',') >= 0) {
            throw new MalformedRangeException("multiple ranges are not supported: " + value, size);
        }
        int dash = spec.indexOf('-');
        if (dash < 0) {
            throw new MalformedRangeException("missing '-' in range: " + value, size);
        }
        if (size == 0) {
            throw new MalformedRangeException("range requested on empty firmware", size);
        }

        String startPart = spec.substring(0, dash).trim();
        String endPart = spec.substring(dash + 1).trim();

        if (startPart.isEmpty() && endPart.isEmpty()) {
            throw new MalformedRangeException("range without bounds: " + value, size);
        }

        if (startPart.isEmpty()) {
            long suffix = parseBound(endPart, value, size);
            if (suffix == 0) {
                throw new MalformedRangeException("empty suffix range: " + value, size);
            }
            return new ByteRange(Math.max(0, size - suffix), size - 1);
        }

        long start = parseBound(startPart, value, size);
        long end = endPart.isEmpty() ? size - 1 : parseBound(endPart, value, size);
        if (start > end) {
            throw new MalformedRangeException("range start after end: " + value, size);
        }
        if (end >= size) {
            throw new MalformedRangeException("range end beyond firmware size " + size + ": " + value, size);
        }
        return new ByteRange(start, end);
    }

    private static long parseBound(String raw, String header, long size) {
        long v;
        try {
            v = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRangeException("not a number in range: " + header, size);
        }
        if (v < 0) {
            throw new MalformedRangeException("negative offset in range: " + header, size);
        }
        return v;
    }
}
