package de.htwsaar.miniota.cli.service;

import de.htwsaar.miniota.cli.dto.HttpCallResult;
import de.htwsaar.miniota.cli.util.UriUtils;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Einfache JSON-Abfragen gegen den OTA-Server ({@code /version}, {@code /status}).
 */
public final class OtaClientService {

    public static final String VERSION_PATH = "/version";
    public static final String STATUS_PATH = "/status";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public OtaClientService(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public HttpCallResult version(URI baseUrl) {
        return get(UriUtils.endpoint(baseUrl, VERSION_PATH));
    }

    public HttpCallResult status(URI baseUrl) {
        return get(UriUtils.endpoint(baseUrl, STATUS_PATH));
    }

    private HttpCallResult get(URI uri) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
