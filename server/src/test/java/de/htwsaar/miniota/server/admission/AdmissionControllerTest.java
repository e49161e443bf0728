package de.htwsaar.miniota.server.admission;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class AdmissionControllerTest {

    @Test
    void tryAcquire_shouldRejectBeyondLimit() {
        AdmissionController admission = new AdmissionController(2);

        Optional<ConnectionSlot> a = admission.tryAcquire();
        Optional<ConnectionSlot> b = admission.tryAcquire();
        Optional<ConnectionSlot> c = admission.tryAcquire();

        assertTrue(a.isPresent());
        assertTrue(b.isPresent());
        assertTrue(c.isEmpty(), "dritter Slot muss abgelehnt werden");
        assertEquals(2, admission.activeConnections());
        assertEquals(1, admission.rejectedConnections());
    }

    @Test
    void close_shouldReleaseExactlyOnce() {
        AdmissionController admission = new AdmissionController(1);
        ConnectionSlot slot = admission.tryAcquire().orElseThrow();

        slot.close();
        slot.close();

        assertTrue(slot.isReleased());
        assertEquals(0, admission.activeConnections());
        assertEquals(1, admission.maxConnections(), "doppeltes close darf keinen Extra-Slot erzeugen");
        assertTrue(admission.tryAcquire().isPresent());
        assertTrue(admission.tryAcquire().isEmpty());
    }

    @Test
    void tryWithResources_shouldReleaseOnException() {
        AdmissionController admission = new AdmissionController(1);

        assertThrows(IllegalStateException.class, () -> {
            try (ConnectionSlot ignored = admission.tryAcquire().orElseThrow()) {
                throw new IllegalStateException("boom");
            }
        });
        assertEquals(0, admission.activeConnections());
    }

    @Test
    void constructor_shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionController(0));
    }
}
