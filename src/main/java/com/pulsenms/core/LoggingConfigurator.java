package com.pulsenms.core;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import io.vertx.core.json.JsonObject;

import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * LoggingConfigurator - Applies the "logging" block of application.conf to Logback

 * Configuration in application.conf:
 * logging {
 *   enabled = true                    # Enable/disable all logging
 *   level = "INFO"                    # Log level
 *   file.path = "logs/pulsenms.log"   # Log file path
 *   file.enabled = true               # Enable file logging
 *   console.enabled = true            # Enable console logging
 * }

 * HOCON turns the dotted keys into nested objects (file -> path, file -> enabled).
 */
public class LoggingConfigurator
{

    public static final String APP_LOGGER = "com.pulsenms";

    /**
     * Configure logging based on application configuration.
     *
     * @param config Application configuration
     */
    public static void configure(JsonObject config)
    {
        var loggingConfig = config.getJsonObject("logging", new JsonObject());

        var fileConfig = loggingConfig.getJsonObject("file", new JsonObject());

        var consoleConfig = loggingConfig.getJsonObject("console", new JsonObject());

        var loggingEnabled = loggingConfig.getBoolean("enabled", true);

        var logLevel = loggingConfig.getString("level", "INFO");

        var fileEnabled = fileConfig.getBoolean("enabled", true);

        var consoleEnabled = consoleConfig.getBoolean("enabled", true);

        var filePath = fileConfig.getString("path", "logs/pulsenms.log");

        // Read by logback.xml on the next reconfiguration
        System.setProperty("pulsenms.log.level", loggingEnabled ? logLevel : "OFF");

        System.setProperty("pulsenms.log.file.path", filePath);

        System.setProperty("pulsenms.log.console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        System.setProperty("pulsenms.log.file.appender", fileEnabled ? "FILE" : "NULL");

        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        var level = loggingEnabled ? Level.toLevel(logLevel, Level.INFO) : Level.OFF;

        var rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(level);

        loggerContext.getLogger(APP_LOGGER).setLevel(level);

        // Logback was already initialised with the defaults, drop what was switched off
        if (!consoleEnabled)
        {
            rootLogger.detachAppender("CONSOLE");
        }

        if (!fileEnabled)
        {
            rootLogger.detachAppender("FILE");
        }

        if (fileEnabled && loggingEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists())
            {
                logDir.mkdirs();
            }
        }

        if (loggingEnabled)
        {
            var logger = LoggerFactory.getLogger(LoggingConfigurator.class);

            logger.info("Logging configured: level {}, console {}, file {}{}", logLevel, consoleEnabled, fileEnabled,
                fileEnabled ? " (" + filePath + ")" : "");
        }
    }
}
