package tomo.ext.nxstack.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing a copy of the run log next to the outputs.
 *
 * <p>While enabled, everything logged is also appended to {@code <outputDir>/nxstack.log}.
 * Use it through try-with-resources:</p>
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(outputDir)) {
 *     logger.info("Stacking...");
 * }
 * }</pre>
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger(RunLogger.class);
    private static final String APPENDER_NAME = "RUN_LOG";
    public static final String LOG_FILE_NAME = "nxstack.log";

    private static FileAppender<ILoggingEvent> appender;

    private RunLogger() {
        // Utility class - no instantiation
    }

    /**
     * Enables the per-run log in the given directory.
     *
     * @param outputDir existing directory
     * @return true if enabled
     */
    public static synchronized boolean enable(Path outputDir) {
        if (outputDir == null || !Files.isDirectory(outputDir)) {
            logger.warn("Cannot enable run logging: invalid directory: {}", outputDir);
            return false;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.debug("Logback is not the active binding, run log disabled");
            return false;
        }
        disable();

        Path logFile = outputDir.resolve(LOG_FILE_NAME);
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n");
        encoder.start();

        FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setContext(context);
        fileAppender.setName(APPENDER_NAME);
        fileAppender.setFile(logFile.toString());
        fileAppender.setAppend(true);
        fileAppender.setEncoder(encoder);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
        appender = fileAppender;
        logger.info("Run logging enabled: {}", logFile);
        return true;
    }

    /**
     * Disables the per-run log, if enabled.
     */
    public static synchronized void disable() {
        if (appender == null) {
            return;
        }
        logger.info("Run logging disabled: {}", appender.getFile());
        LoggerContext context = (LoggerContext) appender.getContext();
        context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(appender);
        appender.stop();
        appender = null;
    }

    public static synchronized boolean isEnabled() {
        return appender != null;
    }

    public static Session start(Path outputDir) {
        return new Session(outputDir);
    }

    /**
     * Auto-closeable session for run logging.
     */
    public static class Session implements AutoCloseable {
        private final boolean wasEnabled;

        private Session(Path outputDir) {
            this.wasEnabled = enable(outputDir);
        }

        public boolean isActive() {
            return wasEnabled;
        }

        @Override
        public void close() {
            if (wasEnabled) {
                disable();
            }
        }
    }
}
