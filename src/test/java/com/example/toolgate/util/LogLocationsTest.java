package com.example.toolgate.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogLocationsTest {

    @Test
    void keepsAbsolutePaths(@TempDir Path tempDir) {
        Path logFile = tempDir.resolve("server.log");

        assertEquals(logFile, LogLocations.resolveLogFile(LogLocations.class, logFile.toString()));
    }

    @Test
    void resolvesRelativeNamesBesideTheCode() {
        Path codeDirectory = LogLocations.resolveCodeDirectory(LogLocations.class);
        assertNotNull(codeDirectory);
        assertTrue(Files.isDirectory(codeDirectory));

        assertEquals(codeDirectory.resolve("tool-gate.log"),
                LogLocations.resolveLogFile(LogLocations.class, "tool-gate.log"));
    }
}
