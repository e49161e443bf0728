package de.htwsaar.miniota.server.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import org.springframework.http.HttpHeaders;

/**
 * Liest Request-Zeile und Header eines HTTP/1.x-Requests.
 *
 * <p>Zeilen werden als ISO-8859-1 gelesen; CRLF und LF werden als Zeilenende akzeptiert.
 * Zeilenlänge und Anzahl der Header sind begrenzt.</p>
 */
public class HttpRequestReader {

    public static final int DEFAULT_MAX_LINE_LENGTH = 8 * 1024;
    public static final int DEFAULT_MAX_HEADERS = 100;

    private static final int MAX_LEADING_EMPTY_LINES = 8;

    private final int maxLineLength;
    private final int maxHeaders;

    public HttpRequestReader() {
        this(DEFAULT_MAX_LINE_LENGTH, DEFAULT_MAX_HEADERS);
    }

    public HttpRequestReader(int maxLineLength, int maxHeaders) {
        this.maxLineLength = maxLineLength;
        this.maxHeaders = maxHeaders;
    }

    /**
     * @param in Eingabestrom der Verbindung (idealerweise gepuffert)
     * @return Request oder leer, wenn der Client vor dem ersten Byte geschlossen hat
     * @throws BadRequestException bei ungültiger Syntax oder überschrittenen Limits
     * @throws IOException bei Lesefehlern oder Timeout
     */
    public Optional<OtaRequest> read(InputStream in) throws IOException {
        String requestLine = readLine(in);
        int emptyLines = 0;
        while (requestLine != null && requestLine.isEmpty()) {
            if (++emptyLines > MAX_LEADING_EMPTY_LINES) {
                throw new BadRequestException("Too many empty lines before request line");
            }
            requestLine = readLine(in);
        }
        if (requestLine == null) {
            return Optional.empty();
        }

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new BadRequestException("Malformed request line: " + requestLine);
        }
        String method = parts[0];
        String target = parts[1];
        String version = parts[2];
        if (!isToken(method)) {
            throw new BadRequestException("Malformed method: " + method);
        }
        if (!version.startsWith("HTTP/1.")) {
            throw new BadRequestException("Unsupported protocol version: " + version);
        }

        HttpHeaders headers = new HttpHeaders();
        int count = 0;
        while (true) {
            String line = readLine(in);
            if (line == null) {
                throw new BadRequestException("Unexpected end of stream in headers");
            }
            if (line.isEmpty()) {
                break;
            }
            if (++count > maxHeaders) {
                throw new BadRequestException("Too many headers");
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new BadRequestException("Malformed header line: " + line);
            }
            String name = line.substring(0, colon);
            if (!isToken(name)) {
                throw new BadRequestException("Malformed header name: " + name);
            }
            headers.add(name, line.substring(colon + 1).trim());
        }

        return Optional.of(new OtaRequest(method, target, pathOf(target), version, headers));
    }

    /**
     * Reduziert ein Request-Target auf den Pfad: Query und Fragment fallen weg,
     * die absolute Form ({@code http://host/path}) wird auf {@code /path} gekürzt.
     *
     * @param target Request-Target
     * @return Pfad, mindestens {@code /}
     */
    static String pathOf(String target) {
        String p = target;
        int scheme = p.indexOf("://");
        if (scheme > 0 && p.charAt(0) != '/') {
            int slash = p.indexOf('/', scheme + 3);
            p = slash < 0 ? "/" : p.substring(slash);
        }
        int cut = p.length();
        int q = p.indexOf('?');
        if (q >= 0) cut = q;
        int h = p.indexOf('#');
        if (h >= 0 && h < cut) cut = h;
        p = p.substring(0, cut);
        return p.isEmpty() ? "/" : p;
    }

    /**
     * @return Zeile ohne Zeilenende, oder {@code null} bei EOF vor dem ersten Zeichen
     */
    private String readLine(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                int len = sb.length();
                if (len > 0 && sb.charAt(len - 1) == '\r') {
                    sb.setLength(len - 1);
                }
                return sb.toString();
            }
            if (sb.length() >= maxLineLength) {
                throw new BadRequestException("Request line or header exceeds " + maxLineLength + " bytes");
            }
            sb.append((char) b);
        }
        if (sb.length() == 0) {
            return null;
        }
        throw new BadRequestException("Unexpected end of stream in line");
    }

    private static boolean isToken(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c >= 127 || "()<>@,;:\\\"/[]?={}".indexOf(c) >= 0) {
                return false;
            }
        }
        return !s.isEmpty();
    }
}
