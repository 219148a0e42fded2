package io.chesslink.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HostConfigTest {

    @Test
    void defaults_when_no_args() {
        HostConfig cfg = HostConfig.fromArgs(new String[0]);

        assertEquals("host", cfg.peerId());
        assertNull(cfg.storeUrl());
        assertNull(cfg.peersConfigPath());
        assertTrue(cfg.autosave());
        assertEquals(60L, cfg.autosaveIntervalSec());
        assertEquals(5, cfg.autosaveEveryMoves());
    }

    @Test
    void parses_all_flags() {
        HostConfig cfg = HostConfig.fromArgs(new String[]{
                "-n", "table-1",
                "--store-url", "http://localhost:8090",
                "-c", "peers.json",
                "--autosave", "off",
                "--autosave-interval-seconds", "30",
                "--autosave-every-moves", "10"
        });

        assertEquals("table-1", cfg.peerId());
        assertEquals("http://localhost:8090", cfg.storeUrl());
        assertEquals("peers.json", cfg.peersConfigPath());
        assertFalse(cfg.autosave());
        assertEquals(30L, cfg.autosaveIntervalSec());
        assertEquals(10, cfg.autosaveEveryMoves());
    }

    @Test
    void rejects_non_positive_autosave_settings() {
        assertThrows(IllegalArgumentException.class,
                () -> new HostConfig("host", null, null, true, 0, 5));
        assertThrows(IllegalArgumentException.class,
                () -> new HostConfig("host", null, null, true, 60, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new HostConfig(" ", null, null, true, 60, 5));
    }
}
