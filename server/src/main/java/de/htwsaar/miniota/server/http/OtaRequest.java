package de.htwsaar.miniota.server.http;

import java.util.Objects;
import org.springframework.http.HttpHeaders;

/**
 * Gelesener HTTP-Request-Kopf. Ein Body wird nie gelesen.
 *
 * @param method  HTTP-Methode, z. B. {@code GET}
 * @param target  Request-Target wie gesendet, z. B. {@code /version?x=1}
 * @param path    Pfad ohne Query und Fragment, z. B. {@code /version}
 * @param version Protokollversion, z. B. {@code HTTP/1.1}
 * @param headers Header (Namen case-insensitiv)
 */
public record OtaRequest(String method, String target, String path, String version, HttpHeaders headers) {

    public OtaRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(version, "version must not be null");
        headers = headers == null ? new HttpHeaders() : headers;
    }

    /**
     * @param name Header-Name
     * @return erster Wert oder {@code null}
     */
    public String header(String name) {
        return headers.getFirst(name);
    }
}
