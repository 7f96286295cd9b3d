package tomo.ext.nxstack.utilities;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RunLoggerTest {

    private static final Logger logger = LoggerFactory.getLogger(RunLoggerTest.class);

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        RunLogger.disable();
    }

    @Test
    void testSessionWritesLogFile() throws IOException {
        try (RunLogger.Session session = RunLogger.start(tempDir)) {
            assertTrue(session.isActive());
            assertTrue(RunLogger.isEnabled());
            logger.warn("marker line for the run log");
        }
        assertFalse(RunLogger.isEnabled());
        String content = Files.readString(tempDir.resolve(RunLogger.LOG_FILE_NAME));
        assertTrue(content.contains("marker line for the run log"));
    }

    @Test
    void testClosedSessionStopsWriting() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("first"));
        Path second = Files.createDirectories(tempDir.resolve("second"));
        try (RunLogger.Session ignored = RunLogger.start(first)) {
            logger.warn("line for the first run");
        }
        try (RunLogger.Session ignored = RunLogger.start(second)) {
            logger.warn("line for the second run");
        }
        logger.warn("line after both runs");

        String firstLog = Files.readString(first.resolve(RunLogger.LOG_FILE_NAME));
        String secondLog = Files.readString(second.resolve(RunLogger.LOG_FILE_NAME));
        assertTrue(firstLog.contains("line for the first run"));
        assertFalse(firstLog.contains("line for the second run"));
        assertTrue(secondLog.contains("line for the second run"));
        assertFalse(secondLog.contains("line after both runs"));
    }

    @Test
    void testMissingDirectoryIsRefused() {
        assertFalse(RunLogger.enable(tempDir.resolve("absent")));
        assertFalse(RunLogger.isEnabled());
    }
}
