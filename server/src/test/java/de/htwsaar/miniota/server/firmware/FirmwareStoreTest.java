package de.htwsaar.miniota.server.firmware;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FirmwareStoreTest {

    @TempDir
    Path dir;

    @Test
    void ensureDirectory_shouldCreateMissingDirectoryOnce() throws Exception {
        FirmwareStore store = new FirmwareStore(dir.resolve("a/b"), "firmware.bin");

        assertTrue(store.ensureDirectory());
        assertFalse(store.ensureDirectory());
        assertTrue(Files.isDirectory(dir.resolve("a/b")));
    }

    @Test
    void snapshot_shouldReflectCurrentFile() throws Exception {
        FirmwareStore store = new FirmwareStore(dir, "firmware.bin");
        assertFalse(store.isAvailable());
        assertThrows(FirmwareNotFoundException.class, store::snapshot);

        Files.write(store.artifactPath(), new byte[42]);

        assertTrue(store.isAvailable());
        FirmwareArtifact a = store.snapshot();
        assertEquals(42, a.size());
        assertEquals("firmware.bin", a.fileName());
        assertTrue(a.path().isAbsolute());
    }
}
