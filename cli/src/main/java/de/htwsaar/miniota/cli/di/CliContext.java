package de.htwsaar.miniota.cli.di;

import de.htwsaar.miniota.cli.service.FirmwareDownloadService;
import de.htwsaar.miniota.cli.service.OtaClientService;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Laufzeit-Kontext der OTA-Commands: Ausgabekanäle plus ein geteilter {@link HttpClient}.
 *
 * <p>Die OTA-Services werden pro Aufruf aus dem Kontext gebaut, damit Tests den
 * Kontext mit eigenem Client und Timeout austauschen können.
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public CliContext(PrintWriter out, PrintWriter err, HttpClient httpClient, Duration requestTimeout) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        this.requestTimeout = requestTimeout;
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /** Client für {@code /version} und {@code /status}. */
    public OtaClientService otaClient() {
        return new OtaClientService(httpClient, requestTimeout);
    }

    public FirmwareDownloadService downloadService() {
        return new FirmwareDownloadService(httpClient, requestTimeout);
    }
}
