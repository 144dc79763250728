package com.jobd.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonConfigTest {

    @Test
    void environmentNameIsDerivedFromKey() {
        assertEquals("JOBD_DAEMON_SOCKET_PATH", DaemonConfig.envName("daemon.socket.path"));
        assertEquals("JOBD_STORE_TYPE", DaemonConfig.envName("store.type"));
    }

    @Test
    void emptyConfigFallsBackToDefaults() {
        DaemonConfig config = DaemonConfig.of(new Properties());

        assertEquals(DaemonConfig.defaultSocketPath(), config.socketPath());
        assertEquals(Duration.ofSeconds(10), config.checkInterval());
        assertEquals(Duration.ofSeconds(10), config.requestTimeout());
        assertEquals(1024 * 1024, config.maxBufferBytes());
        assertEquals("memory", config.storeType());
        assertEquals(100, config.maxExecutionsPerJob());
        assertEquals("bash", config.shell());
        assertEquals(Duration.ofSeconds(1), config.retryBackoff());
        assertFalse(config.auditEnabled());
    }

    @Test
    void defaultSocketIsPerUser() {
        assertEquals("/tmp/jobd-" + System.getProperty("user.name") + ".sock", DaemonConfig.defaultSocketPath());
    }

    @Test
    void blankValueCountsAsUnset() {
        Properties p = new Properties();
        p.setProperty(DaemonConfig.SOCKET_PATH, "   ");

        DaemonConfig config = DaemonConfig.of(p);

        assertNull(config.get(DaemonConfig.SOCKET_PATH));
        assertEquals(DaemonConfig.defaultSocketPath(), config.socketPath());
    }

    @Test
    void overridesProduceACopy() {
        Properties p = new Properties();
        p.setProperty(DaemonConfig.STORE_TYPE, "JDBC");
        DaemonConfig base = DaemonConfig.of(p);

        DaemonConfig changed = base.with(Map.of(DaemonConfig.SOCKET_PATH, "/tmp/other.sock"));

        assertEquals("/tmp/other.sock", changed.socketPath());
        assertEquals("jdbc", changed.storeType());
        assertEquals(DaemonConfig.defaultSocketPath(), base.socketPath());
    }

    @Test
    void invalidNumberIsReported() {
        Properties p = new Properties();
        p.setProperty(DaemonConfig.LIST_LIMIT, "lots");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> DaemonConfig.of(p).listLimit());
        assertEquals("Invalid integer for daemon.list.limit: lots", ex.getMessage());
    }

    @Test
    void loadReadsBundledProperties() {
        DaemonConfig config = DaemonConfig.load();

        assertTrue(config.get(DaemonConfig.DB_URL).startsWith("jdbc:mysql:"));
        assertEquals(10, config.getInt(DaemonConfig.DB_POOL_SIZE, 0));
        assertTrue(config.getBoolean(DaemonConfig.DB_SCHEMA_INIT, false));
    }
}
