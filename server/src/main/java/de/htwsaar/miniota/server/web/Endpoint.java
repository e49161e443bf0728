package de.htwsaar.miniota.server.web;

import java.io.IOException;

/**
 * Ein GET-Endpunkt des OTA-Servers.
 */
public interface Endpoint {

    /** @return exakter Pfad, z. B. {@code /version} */
    String path();

    /**
     * Beantwortet einen GET-Request.
     *
     * <p>Fachliche Fehler werden als Exception geworfen und vom {@link RequestRouter}
     * auf HTTP-Status gemappt.</p>
     *
     * @param exchange Request und Antwortkanal
     * @throws IOException wenn die Verbindung nicht beschreibbar ist
     */
    void get(OtaExchange exchange) throws IOException;
}
