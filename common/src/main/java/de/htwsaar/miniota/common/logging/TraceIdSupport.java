package de.htwsaar.miniota.common.logging;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.MDC;

/**
 * Erzeugung und Verwaltung einer Trace-ID pro Verbindung.
 *
 * <p>Beim Annehmen einer Verbindung wird eine Trace-ID erzeugt und zusammen mit der
 * Client-Adresse im MDC abgelegt, sodass sie automatisch in allen Logeinträgen enthalten
 * ist. Sendet der Client einen {@value #TRACE_ID_HEADER}-Header, wird dessen Wert
 * übernommen, sobald der Request gelesen wurde.</p>
 */
public class TraceIdSupport {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** Schlüsselname der Client-Adresse im Logging-Kontext */
    public static final String CLIENT_KEY = "client";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    /** Maximale Länge einer übernommenen Trace-ID */
    public static final int MAX_TRACE_ID_LENGTH = 128;

    // HTTP-Token-Zeichen (RFC 7230); alles andere landet nicht im Response-Header
    private static final Pattern TRACE_ID_PATTERN =
            Pattern.compile("[A-Za-z0-9!#$%&'*+.^_`|~-]{1," + MAX_TRACE_ID_LENGTH + "}");

    private final Supplier<String> idGenerator;

    public TraceIdSupport() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * Erstellt den Support mit eigenem ID-Generator (nützlich für Tests).
     *
     * @param idGenerator liefert neue Trace-IDs
     */
    public TraceIdSupport(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * Öffnet einen neuen Trace-Kontext für eine Verbindung.
     *
     * @param client Client-Adresse (z. B. {@code 192.168.1.42:51234})
     * @return Scope, der den MDC beim Schließen wieder aufräumt
     */
    public Scope open(String client) {
        Scope scope = new Scope(idGenerator.get());
        MDC.put(TRACE_ID_KEY, scope.traceId);
        if (client != null && !client.isBlank()) {
            MDC.put(CLIENT_KEY, client);
        }
        return scope;
    }

    /**
     * @return {@code true} wenn {@code value} gefahrlos als Header-Wert zurückgesendet werden kann
     */
    public static boolean isValidTraceId(String value) {
        return value != null && TRACE_ID_PATTERN.matcher(value).matches();
    }

    /**
     * Aktiver Trace-Kontext. Nur im Thread verwenden, der ihn geöffnet hat.
     */
    public static final class Scope implements AutoCloseable {

        private String traceId;

        private Scope(String traceId) {
            this.traceId = traceId;
        }

        public String traceId() {
            return traceId;
        }

        /**
         * Übernimmt eine vom Client mitgesendete Trace-ID.
         * Leere oder reine Whitespace-Werte sind äquivalent zu "nicht gesetzt".
         * Werte mit Steuer- oder Sonderzeichen sowie zu lange Werte werden verworfen;
         * dann bleibt die erzeugte ID aktiv.
         *
         * @param incoming Wert des {@code X-Trace-Id}-Headers oder {@code null}
         * @return {@code true} wenn der Wert übernommen wurde
         */
        public boolean adopt(String incoming) {
            if (incoming == null || incoming.isBlank()) return false;
            String candidate = incoming.trim();
            if (!isValidTraceId(candidate)) return false;
            traceId = candidate;
            MDC.put(TRACE_ID_KEY, traceId);
            return true;
        }

        @Override
        public void close() {
            // Wichtig: Kontext nach der Verbindung wieder entfernen
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(CLIENT_KEY);
        }
    }
}
