package com.agentrelay;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults() throws Exception {
        AppConfig config = new AppConfig.Builder().logPath(tempDir.resolve("relay.log")).build();

        assertEquals("localhost", config.getHost());
        assertEquals(8765, config.getPort());
        assertFalse(config.isRestartMode());
        assertFalse(config.isDevMode());
        assertEquals(Duration.ofSeconds(30000), config.getInterventionTimeout());
        assertEquals(5, config.getBindAttempts());
        assertEquals(Duration.ofMillis(500), config.getBindBackoff());
        assertTrue(config.isKillFallbackToAll());
        assertEquals(tempDir.resolve("relay.log"), config.getLogPath());
    }

    @Test
    void parsesCommandLine() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {
                "--host", "0.0.0.0", "--port=9001", "--restart", "--dev",
                "--intervention-timeout", "60", "--bind-attempts=2", "--bind-backoff-ms", "50",
                "--no-kill-fallback"
            })
            .logPath(tempDir.resolve("relay.log"))
            .build();

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(9001, config.getPort());
        assertTrue(config.isRestartMode());
        assertTrue(config.isDevMode());
        assertEquals(Duration.ofSeconds(60), config.getInterventionTimeout());
        assertEquals(2, config.getBindAttempts());
        assertEquals(Duration.ofMillis(50), config.getBindBackoff());
        assertFalse(config.isKillFallbackToAll());
    }

    @Test
    void invalidValuesKeepDefaults() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--port", "abc", "--intervention-timeout=-5", "--bind-attempts", "0", "--host="})
            .logPath(tempDir.resolve("relay.log"))
            .build();

        assertEquals(8765, config.getPort());
        assertEquals(Duration.ofSeconds(30000), config.getInterventionTimeout());
        assertEquals(5, config.getBindAttempts());
        assertEquals("localhost", config.getHost());
    }

    @Test
    void flagWithoutValueIsIgnored() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--port"})
            .logPath(tempDir.resolve("relay.log"))
            .build();

        assertEquals(8765, config.getPort());
    }
}
