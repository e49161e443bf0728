package de.htwsaar.miniota.server.web;

import de.htwsaar.miniota.common.dto.ErrorDto;
import de.htwsaar.miniota.common.serialization.JacksonCodec;
import de.htwsaar.miniota.server.http.HttpResponseWriter;
import de.htwsaar.miniota.server.http.OtaRequest;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * Ein Request zusammen mit dem Kanal für seine Antwort.
 */
public class OtaExchange {

    private final OtaRequest request;
    private final HttpResponseWriter writer;
    private final String client;

    public OtaExchange(OtaRequest request, HttpResponseWriter writer, String client) {
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.client = client;
    }

    public OtaRequest request() {
        return request;
    }

    /** @return Client-Adresse {@code ip:port} */
    public String client() {
        return client;
    }

    /**
     * Sendet {@code body} als JSON mit {@code Cache-Control: no-cache}.
     *
     * @param status Statuscode
     * @param body   zu serialisierender Wert
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public void sendJson(HttpStatus status, Object body) throws IOException {
        writeJson(writer, status, new HttpHeaders(), body);
    }

    /**
     * Sendet einen {@link ErrorDto}-Body.
     *
     * @param status Fehlerstatus
     * @param error  kurze Beschreibung
     * @param extra  zusätzliche Header oder {@code null}
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public void sendError(HttpStatus status, String error, HttpHeaders extra) throws IOException {
        writeJson(writer, status, extra == null ? new HttpHeaders() : extra, new ErrorDto(status.value(), error));
    }

    /**
     * Schreibt Statuszeile und Header und gibt den Body-Stream zurück.
     *
     * @param status  Statuscode
     * @param headers Header inkl. {@code Content-Length}
     * @return Body-Stream
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public OutputStream beginBody(HttpStatus status, HttpHeaders headers) throws IOException {
        return writer.writeHead(status, headers);
    }

    public boolean isCommitted() {
        return writer.isCommitted();
    }

    static void writeJson(HttpResponseWriter writer, HttpStatus status, HttpHeaders headers, Object body)
            throws IOException {
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setCacheControl(CacheControl.noCache());
        writer.send(status, headers, JacksonCodec.toJsonBytes(body));
    }
}
