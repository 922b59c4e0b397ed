package com.arcdispatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesBothArgumentForms() throws Exception {
        Path data = tempDir.resolve("data");
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[]{"--port=9090", "--data", data.toString(), "--retention-minutes", "12", "--dev"})
            .build();

        assertEquals(9090, config.getPort());
        assertEquals(data.toAbsolutePath().normalize(), config.getDataPath());
        assertEquals(config.getDataPath().resolve("puzzles"), config.getPuzzlesPath());
        assertEquals(12, config.getRetentionMinutes());
        assertTrue(config.isDevMode());
        assertNull(config.getProvidersFile());
        assertTrue(Files.isDirectory(data));
    }

    @Test
    void explicitPuzzleDirectoryWins() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[]{"--data", tempDir.toString(), "--puzzles", tempDir.resolve("eval").toString(), "stray"})
            .build();

        assertEquals(tempDir.resolve("eval").toAbsolutePath().normalize(), config.getPuzzlesPath());
        assertFalse(config.isDevMode());
    }

    @Test
    void rejectsBadValues() {
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--port", "http"}));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--port=70000"}));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--retention-minutes=0"}));
    }
}
