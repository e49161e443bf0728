package de.htwsaar.miniota.server.http;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

/**
 * Schreibt genau eine HTTP/1.1-Antwort auf eine Verbindung.
 *
 * <p>Nach {@link #writeHead(HttpStatus, HttpHeaders)} ist die Antwort festgeschrieben;
 * Statuscode und Header lassen sich dann nicht mehr ändern.</p>
 */
public class HttpResponseWriter {

    private static final byte[] CRLF = {'\r', '\n'};

    private final OutputStream out;
    private final HttpHeaders defaultHeaders;
    private HttpStatus status;

    /**
     * @param raw            Ausgabestrom der Verbindung
     * @param defaultHeaders Header, die jede Antwort trägt (falls nicht überschrieben)
     */
    public HttpResponseWriter(OutputStream raw, HttpHeaders defaultHeaders) {
        this.out = new BufferedOutputStream(Objects.requireNonNull(raw, "raw must not be null"), 8 * 1024);
        this.defaultHeaders = defaultHeaders == null ? new HttpHeaders() : defaultHeaders;
    }

    /**
     * Schreibt Statuszeile und Header.
     *
     * @param status  Statuscode
     * @param headers Header dieser Antwort
     * @return Body-Stream; nach dem Body {@link #flush()} aufrufen
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     * @throws IllegalStateException wenn bereits ein Kopf geschrieben wurde
     */
    public OutputStream writeHead(HttpStatus status, HttpHeaders headers) throws IOException {
        if (this.status != null) {
            throw new IllegalStateException("Response already committed with " + this.status.value());
        }
        Objects.requireNonNull(status, "status must not be null");

        StringBuilder head = new StringBuilder(256);
        head.append("HTTP/1.1 ")
                .append(status.value())
                .append(' ')
                .append(status.getReasonPhrase())
                .append("\r\n");
        HttpHeaders own = headers == null ? new HttpHeaders() : headers;
        for (Map.Entry<String, List<String>> e : defaultHeaders.entrySet()) {
            if (!own.containsKey(e.getKey())) {
                appendHeader(head, e.getKey(), e.getValue());
            }
        }
        for (Map.Entry<String, List<String>> e : own.entrySet()) {
            appendHeader(head, e.getKey(), e.getValue());
        }
        this.status = status;
        out.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        out.write(CRLF);
        return out;
    }

    /**
     * Schreibt eine vollständige Antwort mit festem Body.
     *
     * @param status  Statuscode
     * @param headers Header ohne {@code Content-Length}
     * @param body    Body (darf leer sein)
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public void send(HttpStatus status, HttpHeaders headers, byte[] body) throws IOException {
        HttpHeaders h = headers == null ? new HttpHeaders() : headers;
        byte[] payload = body == null ? new byte[0] : body;
        h.setContentLength(payload.length);
        writeHead(status, h).write(payload);
        flush();
    }

    public boolean isCommitted() {
        return status != null;
    }

    /** @return geschriebener Status oder {@code null} */
    public HttpStatus status() {
        return status;
    }

    public void flush() throws IOException {
        out.flush();
    }

    private static void appendHeader(StringBuilder head, String name, List<String> values) {
        for (String v : values) {
            if (v.indexOf('\r') >= 0 || v.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Header value must not contain line breaks: " + name);
            }
            head.append(name).append(": ").append(v).append("\r\n");
        }
    }
}
