package de.htwsaar.miniota.server.net;

import de.htwsaar.miniota.common.logging.TraceIdSupport;
import de.htwsaar.miniota.server.admission.AdmissionController;
import de.htwsaar.miniota.server.admission.ConnectionSlot;
import de.htwsaar.miniota.server.config.OtaServerConfig;
import de.htwsaar.miniota.server.http.HttpRequestReader;
import de.htwsaar.miniota.server.web.RequestRouter;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * TCP-Server des OTA-Dienstes.
 *
 * <p>Ein eigener Thread nimmt Verbindungen an. Jede Verbindung braucht einen Slot vom
 * {@link AdmissionController}; ohne Slot wird sie sofort geschlossen, ohne einen Byte zu
 * lesen. Mit Slot bedient ein Worker genau einen Request.</p>
 */
public class OtaServer {

    private static final Logger log = LoggerFactory.getLogger(OtaServer.class);

    private static final long ACCEPTOR_JOIN_MS = 1000;

    private final OtaServerConfig config;
    private final AdmissionController admission;
    private final RequestRouter router;
    private final TraceIdSupport traceIdSupport;
    private final HttpRequestReader requestReader = new HttpRequestReader();
    private final Set<Socket> liveSockets = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private StalledTransferWatchdog watchdog;
    private Thread acceptor;
    private volatile boolean running;

    public OtaServer(
            OtaServerConfig config,
            AdmissionController admission,
            RequestRouter router,
            TraceIdSupport traceIdSupport) {
        this.config = config;
        this.admission = admission;
        this.router = router;
        this.traceIdSupport = traceIdSupport;
    }

    /**
     * Bindet den Server-Socket und startet den Acceptor-Thread.
     *
     * @throws IOException wenn der Port nicht gebunden werden kann
     * @throws IllegalStateException wenn der Server bereits läuft
     */
    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("OTA server already running");
        }
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(config.host(), config.port()), config.backlog());
        } catch (IOException e) {
            ss.close();
            throw e;
        }
        serverSocket = ss;
        workers = Executors.newCachedThreadPool(new CustomizableThreadFactory("ota-worker-"));
        watchdog = new StalledTransferWatchdog(config.stallTimeout());
        acceptor = new Thread(this::acceptLoop, "ota-acceptor");
        running = true;
        acceptor.start();
        log.info(
                "OTA server listening on {}:{} (max {} connections)",
                config.host(),
                ss.getLocalPort(),
                admission.maxConnections());
    }

    /**
     * Schließt den Server-Socket, wartet auf laufende Transfers und beendet die Worker.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Shutting down OTA server ({} active connections)", admission.activeConnections());
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Failed to close server socket: {}", e.getMessage());
        }

        try {
            acceptor.join(ACCEPTOR_JOIN_MS);
            workers.shutdown();
            if (!workers.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Closing {} connections still active after shutdown grace", liveSockets.size());
                liveSockets.forEach(OtaServer::closeSocket);
                workers.shutdownNow();
                workers.awaitTermination(ACCEPTOR_JOIN_MS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            liveSockets.forEach(OtaServer::closeSocket);
            workers.shutdownNow();
        } finally {
            watchdog.close();
        }
        log.info("OTA server stopped ({} connections still active)", admission.activeConnections());
    }

    public boolean isRunning() {
        return running;
    }

    /** @return tatsächlich gebundener Port oder -1, solange nicht gestartet */
    public synchronized int localPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!ss.isClosed()) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch (IOException e) {
                if (ss.isClosed()) {
                    break;
                }
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            dispatch(socket);
        }
        log.debug("Acceptor stopped");
    }

    private void dispatch(Socket socket) {
        Optional<ConnectionSlot> slot = admission.tryAcquire();
        if (slot.isEmpty()) {
            log.info(
                    "Connection from {} rejected: {} of {} slots in use",
                    ConnectionHandler.describe(socket.getRemoteSocketAddress()),
                    admission.activeConnections(),
                    admission.maxConnections());
            closeSocket(socket);
            return;
        }

        ConnectionHandler handler = new ConnectionHandler(
                socket, slot.get(), router, requestReader, traceIdSupport, watchdog, config.socketTimeout());
        liveSockets.add(socket);
        try {
            workers.execute(() -> {
                try {
                    handler.run();
                } finally {
                    liveSockets.remove(socket);
                }
            });
        } catch (RejectedExecutionException e) {
            log.info("Worker pool shut down, dropping connection");
            liveSockets.remove(socket);
            closeSocket(socket);
            slot.get().close();
        }
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Closing socket failed: {}", e.getMessage());
        }
    }
}
