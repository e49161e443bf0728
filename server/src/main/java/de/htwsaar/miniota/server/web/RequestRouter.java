package de.htwsaar.miniota.server.web;

import de.htwsaar.miniota.common.dto.ErrorDto;
import de.htwsaar.miniota.server.firmware.FirmwareNotFoundException;
import de.htwsaar.miniota.server.http.BadRequestException;
import de.htwsaar.miniota.server.http.HttpResponseWriter;
import de.htwsaar.miniota.server.http.OtaRequest;
import de.htwsaar.miniota.server.transfer.MalformedRangeException;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

/**
 * Ordnet GET-Requests per exaktem Pfad einem {@link Endpoint} zu.
 *
 * <p>Alle fachlichen Fehler werden hier auf HTTP-Status gemappt:</p>
 * <ul>
 *   <li>{@link FirmwareNotFoundException} → 404</li>
 *   <li>{@link MalformedRangeException} → 416 mit {@code Content-Range: bytes *}{@code /<size>}</li>
 *   <li>{@link BadRequestException} → 400</li>
 *   <li>jede andere {@link RuntimeException} → 500</li>
 * </ul>
 *
 * <p>Ist die Antwort bereits festgeschrieben, wird nur geloggt; die Verbindung wird
 * anschließend vom Aufrufer geschlossen.</p>
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final String NOT_FOUND = "Not Found";
    static final String FIRMWARE_NOT_FOUND = "Firmware not found";
    static final String RANGE_NOT_SATISFIABLE = "Range Not Satisfiable";
    static final String INTERNAL_ERROR = "Internal Server Error";

    private final Map<String, Endpoint> endpoints;

    public RequestRouter(List<Endpoint> endpoints) {
        Map<String, Endpoint> map = new LinkedHashMap<>();
        for (Endpoint e : endpoints) {
            if (map.putIfAbsent(e.path(), e) != null) {
                throw new IllegalArgumentException("Duplicate endpoint path: " + e.path());
            }
        }
        this.endpoints = Collections.unmodifiableMap(map);
    }

    /** @return registrierte Pfade in Registrierungsreihenfolge */
    public Set<String> paths() {
        return endpoints.keySet();
    }

    /**
     * Beantwortet einen Request.
     *
     * @param exchange Request und Antwortkanal
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public void route(OtaExchange exchange) throws IOException {
        OtaRequest request = exchange.request();
        Endpoint endpoint = "GET".equals(request.method()) ? endpoints.get(request.path()) : null;
        if (endpoint == null) {
            log.info("No route for {} {}", request.method(), request.path());
            exchange.sendError(HttpStatus.NOT_FOUND, NOT_FOUND, null);
            return;
        }

        try {
            endpoint.get(exchange);
        } catch (FirmwareNotFoundException e) {
            log.info("Firmware not found: {}", e.getPath());
            fail(exchange, HttpStatus.NOT_FOUND, FIRMWARE_NOT_FOUND, null);
        } catch (MalformedRangeException e) {
            log.info("Range not satisfiable: {}", e.getMessage());
            HttpHeaders h = new HttpHeaders();
            h.set(HttpHeaders.CONTENT_RANGE, "bytes */" + e.getArtifactSize());
            fail(exchange, HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE, RANGE_NOT_SATISFIABLE, h);
        } catch (BadRequestException e) {
            log.info("Bad request: {}", e.getMessage());
            fail(exchange, HttpStatus.BAD_REQUEST, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Error serving {} {} for {}", request.method(), request.path(), exchange.client(), e);
            fail(exchange, HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, null);
        }
    }

    /**
     * Antwortet auf einen Request, der nicht gelesen werden konnte.
     *
     * @param writer Antwortkanal
     * @param reason Grund für den Client
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    public void respondBadRequest(HttpResponseWriter writer, String reason) throws IOException {
        OtaExchange.writeJson(writer, HttpStatus.BAD_REQUEST, new HttpHeaders(),
                new ErrorDto(HttpStatus.BAD_REQUEST.value(), reason));
    }

    private void fail(OtaExchange exchange, HttpStatus status, String error, HttpHeaders headers)
            throws IOException {
        if (exchange.isCommitted()) {
            log.warn("Response already committed, cannot send {}; closing connection", status.value());
            return;
        }
        exchange.sendError(status, error, headers);
    }
}
