package de.htwsaar.miniota.server.net;

import de.htwsaar.miniota.common.logging.TraceIdSupport;
import de.htwsaar.miniota.server.admission.ConnectionSlot;
import de.htwsaar.miniota.server.http.BadRequestException;
import de.htwsaar.miniota.server.http.HttpRequestReader;
import de.htwsaar.miniota.server.http.HttpResponseWriter;
import de.htwsaar.miniota.server.http.OtaRequest;
import de.htwsaar.miniota.server.web.OtaExchange;
import de.htwsaar.miniota.server.web.RequestRouter;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * Bedient genau einen Request auf einer angenommenen Verbindung.
 *
 * <p>Ablauf: Timeout setzen, Request lesen, routen, flushen, Socket schließen, Slot
 * freigeben. Jede Antwort trägt {@code Connection: close}.</p>
 */
class ConnectionHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    static final String SERVER_HEADER = "MiniOTA";

    private static final int LINGER_MS = 1000;
    private static final int MAX_DRAIN_BYTES = 64 * 1024;

    private final Socket socket;
    private final ConnectionSlot slot;
    private final RequestRouter router;
    private final HttpRequestReader requestReader;
    private final TraceIdSupport traceIdSupport;
    private final StalledTransferWatchdog watchdog;
    private final Duration socketTimeout;

    ConnectionHandler(
            Socket socket,
            ConnectionSlot slot,
            RequestRouter router,
            HttpRequestReader requestReader,
            TraceIdSupport traceIdSupport,
            StalledTransferWatchdog watchdog,
            Duration socketTimeout) {
        this.socket = socket;
        this.slot = slot;
        this.router = router;
        this.requestReader = requestReader;
        this.traceIdSupport = traceIdSupport;
        this.watchdog = watchdog;
        this.socketTimeout = socketTimeout;
    }

    @Override
    public void run() {
        String client = describe(socket.getRemoteSocketAddress());
        Thread thread = Thread.currentThread();
        String workerName = thread.getName();
        thread.setName("OTA-" + client);

        // Schließreihenfolge: Socket, Slot, MDC
        try (TraceIdSupport.Scope scope = traceIdSupport.open(client);
                ConnectionSlot s = slot;
                Socket sock = socket) {
            serve(sock, scope, client);
        } catch (SocketTimeoutException e) {
            log.info("Read timeout after {} ms, closing connection", socketTimeout.toMillis());
        } catch (IOException e) {
            log.warn("Connection ended with I/O error: {}", e.toString());
        } catch (RuntimeException e) {
            log.error("Unexpected error on connection {}", client, e);
        } finally {
            thread.setName(workerName);
        }
    }

    private void serve(Socket sock, TraceIdSupport.Scope scope, String client) throws IOException {
        sock.setSoTimeout((int) Math.min(Integer.MAX_VALUE, socketTimeout.toMillis()));
        sock.setTcpNoDelay(true);

        InputStream in = new BufferedInputStream(sock.getInputStream());
        ProgressTrackingOutputStream out = new ProgressTrackingOutputStream(sock.getOutputStream());

        Optional<OtaRequest> read;
        try {
            read = requestReader.read(in);
        } catch (BadRequestException e) {
            log.info("Bad request: {}", e.getMessage());
            HttpResponseWriter writer = new HttpResponseWriter(out, defaultHeaders(scope.traceId()));
            router.respondBadRequest(writer, e.getMessage());
            finish(sock, in);
            return;
        }
        if (read.isEmpty()) {
            log.debug("Client closed connection before sending a request");
            return;
        }

        OtaRequest request = read.get();
        String incomingTraceId = request.header(TraceIdSupport.TRACE_ID_HEADER);
        if (incomingTraceId != null && !incomingTraceId.isBlank() && !scope.adopt(incomingTraceId)) {
            log.debug("Ignoring invalid {} header", TraceIdSupport.TRACE_ID_HEADER);
        }
        log.info("{} {}", request.method(), request.target());

        HttpResponseWriter writer = new HttpResponseWriter(out, defaultHeaders(scope.traceId()));
        try (StalledTransferWatchdog.Registration ignored = watchdog.watch(out, sock, client)) {
            router.route(new OtaExchange(request, writer, client));
            writer.flush();
        }
        finish(sock, in);
        log.info(
                "{} {} -> {} ({} bytes sent)",
                request.method(),
                request.path(),
                writer.status() == null ? "-" : writer.status().value(),
                out.bytesWritten());
    }

    private static HttpHeaders defaultHeaders(String traceId) {
        HttpHeaders h = new HttpHeaders();
        h.setConnection("close");
        h.set(HttpHeaders.SERVER, SERVER_HEADER);
        h.set(TraceIdSupport.TRACE_ID_HEADER, traceId);
        return h;
    }

    /**
     * Signalisiert dem Client das Antwortende und liest ungelesene Request-Reste, damit
     * das Schließen keinen Reset auslöst, bevor der Client die Antwort gelesen hat.
     */
    private static void finish(Socket sock, InputStream in) {
        try {
            sock.shutdownOutput();
            sock.setSoTimeout(LINGER_MS);
            byte[] buf = new byte[1024];
            int drained = 0;
            int n;
            while (drained < MAX_DRAIN_BYTES && (n = in.read(buf)) != -1) {
                drained += n;
            }
        } catch (IOException e) {
            log.debug("Lingering close ended early: {}", e.getMessage());
        }
    }

    static String describe(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            String host = inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
            return host + ":" + inet.getPort();
        }
        return String.valueOf(address);
    }
}
