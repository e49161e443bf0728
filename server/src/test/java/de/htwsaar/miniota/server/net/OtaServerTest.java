package de.htwsaar.miniota.server.net;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.miniota.common.logging.TraceIdSupport;
import de.htwsaar.miniota.server.RawResponse;
import de.htwsaar.miniota.server.admission.AdmissionController;
import de.htwsaar.miniota.server.config.OtaServerConfig;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import de.htwsaar.miniota.server.firmware.FirmwareStore;
import de.htwsaar.miniota.server.transfer.ArtifactStreamer;
import de.htwsaar.miniota.server.transfer.RangeRequestParser;
import de.htwsaar.miniota.server.web.RequestRouter;
import de.htwsaar.miniota.server.web.StatusEndpoint;
import de.htwsaar.miniota.server.web.UpdateEndpoint;
import de.htwsaar.miniota.server.web.VersionEndpoint;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;

class OtaServerTest {

    @TempDir
    Path dir;

    private OtaServer server;
    private AdmissionController admission;
    private final List<Socket> openSockets = new ArrayList<>();

    @AfterEach
    void tearDown() throws IOException {
        for (Socket s : openSockets) {
            s.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void rangeRequest_shouldReturnPartialContent() throws Exception {
        byte[] data = firmware(1000);
        start(5, Duration.ofSeconds(5));

        RawResponse r = get("/update", "Range: bytes=0-99");

        assertEquals(206, r.status());
        assertEquals("100", r.header(HttpHeaders.CONTENT_LENGTH));
        assertEquals("bytes 0-99/1000", r.header(HttpHeaders.CONTENT_RANGE));
        assertEquals("close", r.header(HttpHeaders.CONNECTION));
        assertArrayEquals(Arrays.copyOfRange(data, 0, 100), r.body());
    }

    @Test
    void chunkedDownload_shouldEqualFullDownload() throws Exception {
        firmware(10_000);
        start(5, Duration.ofSeconds(5));

        byte[] full = get("/update").body();
        ByteArrayOutputStream chunks = new ByteArrayOutputStream();
        for (int start = 0; start < full.length; start += 3000) {
            int end = Math.min(full.length, start + 3000) - 1;
            RawResponse part = get("/update", "Range: bytes=" + start + "-" + end);
            assertEquals(206, part.status());
            chunks.write(part.body());
        }

        assertEquals(10_000, full.length);
        assertArrayEquals(full, chunks.toByteArray());
    }

    @Test
    void missingFirmware_shouldYield404ButStatusStaysAvailable() throws Exception {
        start(5, Duration.ofSeconds(5));

        assertEquals(404, get("/version").status());
        assertEquals(404, get("/update").status());
        RawResponse status = get("/status");
        assertEquals(200, status.status());
        assertTrue(status.bodyText().contains("\"firmware_available\":false"));
    }

    @Test
    void invalidRangeAndUnknownRoutes_shouldBeRejected() throws Exception {
        firmware(1000);
        start(5, Duration.ofSeconds(5));

        RawResponse range = get("/update", "Range: bytes=900-100");
        assertEquals(416, range.status());
        assertEquals("bytes */1000", range.header(HttpHeaders.CONTENT_RANGE));

        assertEquals(404, get("/firmware.bin").status());
        assertEquals(404, exchange("POST /update HTTP/1.1\r\nContent-Length: 0\r\n\r\n").status());
        assertEquals(400, exchange("NONSENSE\r\n\r\n").status());
    }

    @Test
    void traceId_shouldBeEchoed() throws Exception {
        start(5, Duration.ofSeconds(5));

        RawResponse given = get("/status", "X-Trace-Id: device-42");
        RawResponse generated = get("/status");

        assertEquals("device-42", given.header(TraceIdSupport.TRACE_ID_HEADER));
        assertNotNull(generated.header(TraceIdSupport.TRACE_ID_HEADER));
    }

    @Test
    void traceIdWithCarriageReturn_shouldBeReplacedAndStillAnswered() throws Exception {
        start(5, Duration.ofSeconds(5));

        RawResponse r = exchange("GET /status HTTP/1.1\r\nHost: test\r\nX-Trace-Id: a\rb\r\n\r\n");

        assertEquals(200, r.status());
        String echoed = r.header(TraceIdSupport.TRACE_ID_HEADER);
        assertNotNull(echoed);
        assertNotEquals("a\rb", echoed);
        assertTrue(TraceIdSupport.isValidTraceId(echoed));
        assertTrue(r.bodyText().contains("\"status\""));
    }

    @Test
    void connectionsBeyondLimit_shouldBeClosedWithoutResponse() throws Exception {
        firmware(100);
        start(2, Duration.ofSeconds(10));

        openSockets.add(connect());
        openSockets.add(connect());
        awaitTrue(() -> admission.activeConnections() == 2);

        try (Socket third = connect()) {
            assertTrue(readsEndOfStream(third), "dritte Verbindung muss ohne Antwort geschlossen werden");
        }
        assertTrue(admission.rejectedConnections() >= 1);

        for (Socket s : openSockets) {
            s.close();
        }
        openSockets.clear();
        awaitTrue(() -> admission.activeConnections() == 0);
        assertEquals(200, get("/status").status(), "Slots müssen nach dem Schließen wieder frei sein");
    }

    @Test
    void idleClient_shouldBeDroppedAfterReadTimeout() throws Exception {
        start(1, Duration.ofMillis(300));

        try (Socket idle = connect()) {
            assertTrue(readsEndOfStream(idle));
        }
        awaitTrue(() -> admission.activeConnections() == 0);
    }

    @Test
    void stop_shouldReleasePortAndReportState() throws Exception {
        start(5, Duration.ofSeconds(5));
        assertTrue(server.isRunning());
        assertTrue(server.localPort() > 0);

        server.stop();

        assertFalse(server.isRunning());
        assertThrows(IOException.class, this::connect);
    }

    private void start(int maxConnections, Duration socketTimeout) throws IOException {
        OtaServerConfig config = OtaServerConfig.defaults(dir)
                .withHostAndPort("127.0.0.1", 0)
                .withMaxConnections(maxConnections)
                .withTimeouts(socketTimeout, Duration.ofSeconds(5));
        Clock clock = Clock.systemUTC();
        FirmwareStore store = new FirmwareStore(config.firmwareDir(), config.firmwareFile());
        FirmwareMetadataCache cache = new FirmwareMetadataCache(config.digestAlgorithm());
        admission = new AdmissionController(config.maxConnections());
        RequestRouter router = new RequestRouter(List.of(
                new VersionEndpoint(store, cache, clock),
                new UpdateEndpoint(store, new RangeRequestParser(), new ArtifactStreamer()),
                new StatusEndpoint(store, cache, admission, clock)));
        server = new OtaServer(config, admission, router, new TraceIdSupport());
        server.start();
    }

    private byte[] firmware(int size) throws IOException {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i * 7);
        }
        Files.write(dir.resolve("firmware.bin"), data);
        return data;
    }

    private Socket connect() throws IOException {
        Socket s = new Socket("127.0.0.1", server.localPort());
        s.setSoTimeout(5_000);
        return s;
    }

    private RawResponse get(String path, String... headers) throws IOException {
        StringBuilder req = new StringBuilder("GET ").append(path).append(" HTTP/1.1\r\nHost: test\r\n");
        for (String h : headers) {
            req.append(h).append("\r\n");
        }
        return exchange(req.append("\r\n").toString());
    }

    private RawResponse exchange(String rawRequest) throws IOException {
        try (Socket s = connect()) {
            s.getOutputStream().write(rawRequest.getBytes(StandardCharsets.ISO_8859_1));
            s.getOutputStream().flush();
            return RawResponse.parse(s.getInputStream().readAllBytes());
        }
    }

    private static boolean readsEndOfStream(Socket socket) throws IOException {
        InputStream in = socket.getInputStream();
        try {
            return in.read() == -1;
        } catch (SocketException e) {
            // Reset statt FIN ist ebenfalls ein Schließen
            return true;
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Bedingung nicht innerhalb von 5 s erfüllt");
            }
            Thread.sleep(20);
        }
    }
}
