package de.htwsaar.miniota.e2e;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.htwsaar.miniota.common.util.DigestUtil;
import de.htwsaar.miniota.server.admission.AdmissionController;
import de.htwsaar.miniota.server.firmware.FirmwareMetadataCache;
import java.net.Socket;
import java.net.SocketException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Serververhalten über echte Verbindungen: Status, Digest-Cache und Verbindungsgrenze.
 */
class ServerBehaviourTest extends AbstractE2E {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void replacedFirmware_shouldBeHashedAgainExactlyOnce() throws Exception {
        FirmwareMetadataCache cache = bean(FirmwareMetadataCache.class);
        byte[] v1 = pattern(64_000, 17);
        publishFirmware(v1);

        assertEquals(DigestUtil.hex("MD5", v1), version().get("version").asText());
        long afterFirst = cache.recomputations();
        assertEquals(DigestUtil.hex("MD5", v1), version().get("version").asText());
        assertEquals(afterFirst, cache.recomputations(), "unveränderte Firmware darf nicht neu gehasht werden");

        byte[] v2 = pattern(32_000, 19);
        publishFirmware(v2);

        JsonNode updated = version();
        assertEquals(DigestUtil.hex("MD5", v2), updated.get("version").asText());
        assertEquals(32_000, updated.get("size").asLong());
        assertEquals(afterFirst + 1, cache.recomputations());
    }

    @Test
    void status_shouldReflectFirmwareAndActiveConnections() throws Exception {
        byte[] data = pattern(1_000, 23);
        publishFirmware(data);

        HttpResponse<String> resp = get("/status");
        JsonNode status = JSON.readTree(resp.body());

        assertEquals(200, resp.statusCode());
        assertEquals("no-cache", resp.headers().firstValue("Cache-Control").orElse(""));
        assertEquals("running", status.get("status").asText());
        assertTrue(status.get("firmware_available").asBoolean());
        assertEquals(DigestUtil.hex("MD5", data), status.get("firmware_md5").asText());
        assertTrue(status.get("active_threads").asInt() >= 1);
        assertTrue(status.get("active_threads").asInt() <= MAX_CONNECTIONS);
    }

    @Test
    void removedFirmware_shouldYield404() throws Exception {
        publishFirmware(pattern(10, 1));
        Files.delete(firmwareDir.resolve("firmware.bin"));

        assertEquals(404, get("/version").statusCode());
        assertEquals(404, get("/update").statusCode());
        assertTrue(get("/status").body().contains("\"firmware_available\":false"));
    }

    @Test
    void connectionsBeyondLimit_shouldBeDroppedAndSlotsReturned() throws Exception {
        AdmissionController admission = bean(AdmissionController.class);
        awaitActive(admission, 0);
        long rejectedBefore = admission.rejectedConnections();
        List<Socket> held = new ArrayList<>();
        try {
            for (int i = 0; i < MAX_CONNECTIONS; i++) {
                held.add(new Socket("127.0.0.1", port));
            }
            awaitActive(admission, MAX_CONNECTIONS);

            try (Socket extra = new Socket("127.0.0.1", port)) {
                extra.setSoTimeout(5_000);
                int first;
                try {
                    first = extra.getInputStream().read();
                } catch (SocketException e) {
                    first = -1;
                }
                assertEquals(-1, first, "Verbindung über dem Limit wird ohne Antwort geschlossen");
            }
            assertTrue(admission.rejectedConnections() > rejectedBefore);
        } finally {
            for (Socket s : held) {
                s.close();
            }
        }
        awaitActive(admission, 0);
        assertEquals(200, get("/status").statusCode());
    }

    private static JsonNode version() throws Exception {
        HttpResponse<String> resp = get("/version");
        assertEquals(200, resp.statusCode());
        return JSON.readTree(resp.body());
    }

    private static HttpResponse<String> get(String path) throws Exception {
        return CLIENT.send(
                HttpRequest.newBuilder(baseUrl.resolve(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private static void awaitActive(AdmissionController admission, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (admission.activeConnections() != expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("activeConnections blieb bei " + admission.activeConnections() + ", erwartet " + expected);
            }
            Thread.sleep(20);
        }
    }
}
