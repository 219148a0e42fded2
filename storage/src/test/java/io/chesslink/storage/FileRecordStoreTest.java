package io.chesslink.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Durability checks for FileRecordStore:
 *  - a record written by one instance is readable by a fresh instance,
 *  - later writes replace earlier ones,
 *  - no temp files are left behind,
 *  - unsafe ids never reach the filesystem.
 */
class FileRecordStoreTest {

    @TempDir
    Path dir;

    @Test
    void record_survives_reopen() {
        // --- arrange ---
        var first = new FileRecordStore(dir);
        first.put(new SaveRecord("a1b2c3d4", "{\"pieces\":[]}", 1234L));

        // --- act: simulate a restart ---
        var reopened = new FileRecordStore(dir);
        SaveRecord r = reopened.get("a1b2c3d4");

        // --- assert ---
        assertNotNull(r);
        assertEquals("a1b2c3d4", r.sessionId());
        assertEquals("{\"pieces\":[]}", r.payload());
        assertEquals(1234L, r.timestampMillis());
    }

    @Test
    void later_write_replaces_earlier_and_leaves_no_tmp_file() throws Exception {
        var store = new FileRecordStore(dir);
        store.put(new SaveRecord("game-1", "{\"pieces\":[]}", 1L));
        store.put(new SaveRecord("game-1", "{\"pieces\":[{\"pieceType\":\"King\",\"color\":\"White\",\"position\":\"e1\"}]}", 2L));

        assertEquals(2L, store.get("game-1").timestampMillis());
        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void unknown_id_returns_null() {
        assertNull(new FileRecordStore(dir).get("missing"));
    }

    @Test
    void path_like_ids_are_rejected() {
        var store = new FileRecordStore(dir);

        assertThrows(IllegalArgumentException.class, () -> store.get("../escape"));
        assertThrows(IllegalArgumentException.class, () -> new SaveRecord("a/b", "{}", 0L));
    }
}
