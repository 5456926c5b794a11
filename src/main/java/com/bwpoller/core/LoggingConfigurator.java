package com.bwpoller.core;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import ch.qos.logback.classic.joran.JoranConfigurator;

import ch.qos.logback.core.joran.spi.JoranException;

import io.vertx.core.json.JsonObject;

import org.slf4j.LoggerFactory;

import java.io.File;

import java.util.ArrayList;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

/**
 * LoggingConfigurator - Applies the logging block of application.conf to logback

 * Configuration in application.conf:
 * logging {
 *   enabled = true
 *   level = "INFO"
 *   file.path = "logs/bandwidth-poller.log"
 *   file.enabled = true
 *   file.max.size = "50MB"
 *   file.max.history = 14
 *   console.enabled = true
 *   loggers {
 *     "com.bwpoller.core.DevicePool" = "DEBUG"
 *     "me.legrange.mikrotik" = "WARN"
 *   }
 * }

 * The appender choice and rolling limits are exported as bwpoller.log.* system
 * properties, logback.xml is re-read, then levels are set on the root, application
 * and per-logger overrides. Unknown level names fall back to INFO and are reported
 * once logging is up.
 */
public class LoggingConfigurator
{

    static final String APP_LOGGER = "com.bwpoller";

    static final String PROPERTY_PREFIX = "bwpoller.log.";

    private final boolean enabled;

    private final Level level;

    private final boolean consoleEnabled;

    private final boolean fileEnabled;

    private final String filePath;

    private final String maxFileSize;

    private final int maxHistory;

    // Key: logger name, Value: level (insertion order kept so later entries win for the same name)
    private final Map<String, Level> loggerLevels = new LinkedHashMap<>();

    private final List<String> warnings = new ArrayList<>();

    private LoggingConfigurator(JsonObject logging)
    {
        var file = logging.getJsonObject("file", new JsonObject());

        var fileMax = file.getJsonObject("max", new JsonObject());

        var console = logging.getJsonObject("console", new JsonObject());

        enabled = logging.getBoolean("enabled", true);

        level = parseLevel("logging.level", logging.getValue("level"));

        consoleEnabled = console.getBoolean("enabled", true);

        fileEnabled = file.getBoolean("enabled", true);

        filePath = file.getString("path", "logs/bandwidth-poller.log");

        maxFileSize = String.valueOf(fileMax.getValue("size", "50MB"));

        maxHistory = fileMax.getInteger("history", 14);

        for (var entry : logging.getJsonObject("loggers", new JsonObject()))
        {
            loggerLevels.put(entry.getKey(), parseLevel("logging.loggers." + entry.getKey(), entry.getValue()));
        }
    }

    /**
     * Configure logging based on application configuration
     *
     * @param config Application configuration JsonObject
     */
    public static void configure(JsonObject config)
    {
        fromJson(config).apply((LoggerContext) LoggerFactory.getILoggerFactory());
    }

    static LoggingConfigurator fromJson(JsonObject config)
    {
        var logging = config == null ? null : config.getJsonObject("logging");

        return new LoggingConfigurator(logging == null ? new JsonObject() : logging);
    }

    /**
     * @return bwpoller.log.* properties consumed by logback.xml
     */
    Map<String, String> toProperties()
    {
        var properties = new LinkedHashMap<String, String>();

        properties.put(PROPERTY_PREFIX + "level", enabled ? level.toString() : Level.OFF.toString());

        properties.put(PROPERTY_PREFIX + "file.path", filePath);

        properties.put(PROPERTY_PREFIX + "file.max.size", maxFileSize);

        properties.put(PROPERTY_PREFIX + "file.max.history", String.valueOf(maxHistory));

        properties.put(PROPERTY_PREFIX + "console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        properties.put(PROPERTY_PREFIX + "file.appender", fileEnabled ? "FILE" : "NULL");

        return properties;
    }

    void apply(LoggerContext loggerContext)
    {
        toProperties().forEach(System::setProperty);

        if (enabled && fileEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists() && !logDir.mkdirs())
            {
                warnings.add("Could not create log directory " + logDir);
            }
        }

        reload(loggerContext);

        var effective = enabled ? level : Level.OFF;

        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(effective);

        loggerContext.getLogger(APP_LOGGER).setLevel(effective);

        if (enabled)
        {
            loggerLevels.forEach((name, loggerLevel) -> loggerContext.getLogger(name).setLevel(loggerLevel));
        }

        var logger = loggerContext.getLogger(LoggingConfigurator.class);

        warnings.forEach(logger::warn);

        logger.debug("Logging configured: {}", toProperties());
    }

    private Level parseLevel(String key, Object value)
    {
        if (value == null)
        {
            return Level.INFO;
        }

        var parsed = Level.toLevel(value.toString().trim(), null);

        if (parsed == null)
        {
            warnings.add("Unknown log level '" + value + "' for " + key + ", using INFO");

            return Level.INFO;
        }

        return parsed;
    }

    /**
     * Re-read logback.xml so the appender properties set above take effect.
     */
    private void reload(LoggerContext loggerContext)
    {
        var configuration = LoggingConfigurator.class.getResource("/logback.xml");

        if (configuration == null)
        {
            warnings.add("logback.xml not found on the classpath, keeping the current appenders");

            return;
        }

        try
        {
            var configurator = new JoranConfigurator();

            configurator.setContext(loggerContext);

            loggerContext.reset();

            configurator.doConfigure(configuration);
        }
        catch (JoranException exception)
        {
            warnings.add("Failed to reload logback.xml: " + exception.getMessage());
        }
    }

    Level getLevel()
    {
        return level;
    }

    Map<String, Level> getLoggerLevels()
    {
        return loggerLevels;
    }
}
