package de.htwsaar.miniota.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Unit-Tests für {@link TraceIdSupport}.
 */
class TraceIdSupportTest {

    @AfterEach
    void cleanupMdcAfterTest() {
        MDC.clear();
    }

    @Test
    void shouldGenerateUuidAndStoreClientInMdc() {
        TraceIdSupport support = new TraceIdSupport();

        try (TraceIdSupport.Scope scope = support.open("10.0.0.7:40000")) {
            assertValidUuid(scope.traceId());
            assertEquals(scope.traceId(), MDC.get(TraceIdSupport.TRACE_ID_KEY));
            assertEquals("10.0.0.7:40000", MDC.get(TraceIdSupport.CLIENT_KEY));
        }

        assertMdcIsEmpty();
    }

    /**
     * Wenn ein Client bereits eine Trace-ID mitsendet, muss sie unverändert genutzt werden.
     */
    @Test
    void shouldAdoptIncomingTraceId() {
        TraceIdSupport support = new TraceIdSupport(() -> "generated");

        try (TraceIdSupport.Scope scope = support.open("client")) {
            assertTrue(scope.adopt("device-trace-123"));
            assertEquals("device-trace-123", scope.traceId());
            assertEquals("device-trace-123", MDC.get(TraceIdSupport.TRACE_ID_KEY));
        }

        assertMdcIsEmpty();
    }

    /**
     * Leere oder reine Whitespace-Header sind fachlich äquivalent zu "nicht gesetzt".
     */
    @Test
    void shouldKeepGeneratedIdWhenIncomingIsBlank() {
        TraceIdSupport support = new TraceIdSupport(() -> "generated");

        try (TraceIdSupport.Scope scope = support.open(null)) {
            scope.adopt("   ");
            scope.adopt(null);
            assertEquals("generated", MDC.get(TraceIdSupport.TRACE_ID_KEY));
            assertNull(MDC.get(TraceIdSupport.CLIENT_KEY));
        }
    }

    /**
     * Die Trace-ID wird in jeden Response-Header zurückgespiegelt; Steuerzeichen dürfen
     * deshalb nie übernommen werden.
     */
    @Test
    void shouldRejectTraceIdWithControlOrSeparatorCharacters() {
        TraceIdSupport support = new TraceIdSupport(() -> "generated");

        try (TraceIdSupport.Scope scope = support.open("client")) {
            assertFalse(scope.adopt("a\rb"));
            assertFalse(scope.adopt("a\nX-Injected: 1"));
            assertFalse(scope.adopt("with space"));
            assertFalse(scope.adopt("x".repeat(TraceIdSupport.MAX_TRACE_ID_LENGTH + 1)));

            assertEquals("generated", scope.traceId());
            assertEquals("generated", MDC.get(TraceIdSupport.TRACE_ID_KEY));

            assertTrue(scope.adopt("x".repeat(TraceIdSupport.MAX_TRACE_ID_LENGTH)));
        }
    }

    @Test
    void isValidTraceId_shouldAcceptUuidsAndTokens() {
        assertTrue(TraceIdSupport.isValidTraceId(UUID.randomUUID().toString()));
        assertTrue(TraceIdSupport.isValidTraceId("device-42_boot.1"));
        assertFalse(TraceIdSupport.isValidTraceId(null));
        assertFalse(TraceIdSupport.isValidTraceId(""));
        assertFalse(TraceIdSupport.isValidTraceId("tab\tid"));
    }

    @Test
    void shouldOverwriteStaleMdcValue() {
        MDC.put(TraceIdSupport.TRACE_ID_KEY, "stale-trace-id");
        TraceIdSupport support = new TraceIdSupport();

        try (TraceIdSupport.Scope scope = support.open("client")) {
            String current = MDC.get(TraceIdSupport.TRACE_ID_KEY);
            assertNotNull(current);
            assertFalse("stale-trace-id".equals(current));
        }

        assertMdcIsEmpty();
    }

    /**
     * Auch im Fehlerfall muss der MDC-Eintrag beim Schließen des Scopes entfernt werden.
     */
    @Test
    void shouldClearMdcWhenBodyThrows() {
        TraceIdSupport support = new TraceIdSupport();

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> {
            try (TraceIdSupport.Scope ignored = support.open("client")) {
                throw new RuntimeException("boom");
            }
        });

        assertEquals("boom", thrown.getMessage());
        assertMdcIsEmpty();
    }

    /**
     * Konstante Namen sind Teil des Vertrages zu Logback-Pattern und HTTP-Headern.
     */
    @Test
    void shouldExposeStableContractConstants() {
        assertEquals("traceId", TraceIdSupport.TRACE_ID_KEY);
        assertEquals("client", TraceIdSupport.CLIENT_KEY);
        assertEquals("X-Trace-Id", TraceIdSupport.TRACE_ID_HEADER);
    }

    private static void assertValidUuid(String maybeUuid) {
        assertNotNull(maybeUuid);
        assertFalse(maybeUuid.isBlank());
        assertNotNull(UUID.fromString(maybeUuid));
    }

    private static void assertMdcIsEmpty() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        if (context == null) {
            return;
        }
        assertTrue(context.isEmpty());
    }
}
