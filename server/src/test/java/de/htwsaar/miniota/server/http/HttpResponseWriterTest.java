package de.htwsaar.miniota.server.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

class HttpResponseWriterTest {

    @Test
    void send_shouldWriteStatusLineHeadersAndBody() throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        HttpHeaders defaults = new HttpHeaders();
        defaults.setConnection("close");
        HttpResponseWriter writer = new HttpResponseWriter(raw, defaults);

        writer.send(HttpStatus.PARTIAL_CONTENT, new HttpHeaders(), "hi".getBytes(StandardCharsets.US_ASCII));

        String out = raw.toString(StandardCharsets.ISO_8859_1);
        assertTrue(out.startsWith("HTTP/1.1 206 Partial Content\r\n"), out);
        assertTrue(out.contains("Connection: close\r\n"));
        assertTrue(out.contains("Content-Length: 2\r\n"));
        assertTrue(out.endsWith("\r\n\r\nhi"));
        assertTrue(writer.isCommitted());
        assertEquals(HttpStatus.PARTIAL_CONTENT, writer.status());
    }

    @Test
    void ownHeaders_shouldOverrideDefaults() throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        HttpHeaders defaults = new HttpHeaders();
        defaults.set("Server", "default");
        HttpHeaders own = new HttpHeaders();
        own.set("Server", "custom");

        new HttpResponseWriter(raw, defaults).send(HttpStatus.OK, own, null);

        String out = raw.toString(StandardCharsets.ISO_8859_1);
        assertTrue(out.contains("Server: custom\r\n"));
        assertFalse(out.contains("default"));
    }

    @Test
    void secondHead_shouldBeRejected() throws IOException {
        HttpResponseWriter writer = new HttpResponseWriter(new ByteArrayOutputStream(), null);
        writer.writeHead(HttpStatus.OK, null);

        assertThrows(IllegalStateException.class, () -> writer.writeHead(HttpStatus.NOT_FOUND, null));
    }

    @Test
    void headerInjection_shouldBeRejected() {
        HttpResponseWriter writer = new HttpResponseWriter(new ByteArrayOutputStream(), null);
        HttpHeaders h = new HttpHeaders();
        h.set("X-Evil", "a\r\nSet-Cookie: x");

        assertThrows(IllegalArgumentException.class, () -> writer.writeHead(HttpStatus.OK, h));
    }
}
