package de.mirkosertic.docmerge.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging to file output when requested.
 * <p>
 * By default logback.xml is used, which writes to the console (stderr). With file logging enabled,
 * logback-file.xml is loaded and logs are written to ~/.docmerge/log.
 */
public final class LoggingConfigurator {

    static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging. Must be called early in application startup, before logging is used.
     *
     * @param fileLogging true to write logs to files instead of the console
     */
    public static void configure(final boolean fileLogging) {
        if (fileLogging) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = getLogDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
