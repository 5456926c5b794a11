package com.bwpoller.core;

import com.bwpoller.models.NasDevice;

import io.vertx.core.json.JsonObject;

import java.util.Locale;

import java.util.Set;

/**
 * PollerConfig - Typed configuration of the bandwidth poller

 * Built once from the merged application configuration (application.conf + environment)
 * and passed to DevicePool, BandwidthPoller and RedisStreamPublisher.

 * Configuration in application.conf (HOCON parses dotted keys as nested objects):
 * polling {
 *   enabled = true                        # Kill switch
 *   interval.ms = 1000                    # Target cycle interval
 *   stats.log.cycles = 60                 # Log counters every N cycles
 * }
 * devices {
 *   vendor = "mikrotik"                   # Directory vendor filter
 *   refresh.interval.seconds = 60         # Device/mapping refresh interval
 *   default.port = 8728                   # RouterOS API port when the directory has none
 *   connection.timeout.ms = 5000          # Per-device connect and command timeout
 *   worker.pool.size = 16                 # Concurrent device fetches
 *   worker.max.execute.seconds = 30       # Worker blocked-thread warning threshold
 * }
 * stream {
 *   redis.url = "redis://localhost:6379/0"
 *   name = "bandwidth:samples"
 *   max.length = 100000
 *   trim.approximate = false              # MAXLEN ~ instead of exact MAXLEN
 * }

 * Environment overrides (top-level keys of the merged configuration):
 * BANDWIDTH_POLLING_ENABLED, BANDWIDTH_POLL_INTERVAL_MS, REDIS_URL, BANDWIDTH_REDIS_STREAM
 */
public class PollerConfig
{

    public static final String ENV_POLLING_ENABLED = "BANDWIDTH_POLLING_ENABLED";

    public static final String ENV_POLL_INTERVAL_MS = "BANDWIDTH_POLL_INTERVAL_MS";

    public static final String ENV_REDIS_URL = "REDIS_URL";

    public static final String ENV_REDIS_STREAM = "BANDWIDTH_REDIS_STREAM";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    // Polling
    public final boolean enabled;

    public final long pollIntervalMillis;

    public final int statsLogCycles;

    // Devices
    public final String vendor;

    public final long refreshIntervalSeconds;

    public final int defaultPort;

    public final int connectionTimeoutMillis;

    public final int workerPoolSize;

    public final long workerMaxExecuteSeconds;

    // Stream
    public final String redisUrl;

    public final String streamName;

    public final long streamMaxLength;

    public final boolean approximateTrim;

    private PollerConfig(JsonObject config)
    {
        enabled = parseEnabled(firstPresent(config.getValue(ENV_POLLING_ENABLED), value(config, "polling.enabled")), true);

        pollIntervalMillis = toLong(firstPresent(config.getValue(ENV_POLL_INTERVAL_MS), value(config, "polling.interval.ms")), 1000);

        statsLogCycles = (int) toLong(value(config, "polling.stats.log.cycles"), 60);

        vendor = toString(value(config, "devices.vendor"), "mikrotik");

        refreshIntervalSeconds = toLong(value(config, "devices.refresh.interval.seconds"), 60);

        defaultPort = (int) toLong(value(config, "devices.default.port"), NasDevice.DEFAULT_API_PORT);

        connectionTimeoutMillis = (int) toLong(value(config, "devices.connection.timeout.ms"), 5000);

        workerPoolSize = (int) toLong(value(config, "devices.worker.pool.size"), 16);

        workerMaxExecuteSeconds = toLong(value(config, "devices.worker.max.execute.seconds"), 30);

        redisUrl = toString(firstPresent(config.getValue(ENV_REDIS_URL), value(config, "stream.redis.url")), "redis://localhost:6379/0");

        streamName = toString(firstPresent(config.getValue(ENV_REDIS_STREAM), value(config, "stream.name")), "bandwidth:samples");

        streamMaxLength = toLong(value(config, "stream.max.length"), 100000);

        approximateTrim = parseEnabled(value(config, "stream.trim.approximate"), false);
    }

    /**
     * Build and validate the configuration.
     *
     * @param config merged application configuration
     * @return validated PollerConfig
     * @throws IllegalArgumentException if a numeric option is out of range
     */
    public static PollerConfig fromJson(JsonObject config)
    {
        var pollerConfig = new PollerConfig(config == null ? new JsonObject() : config);

        pollerConfig.validate();

        return pollerConfig;
    }

    private void validate()
    {
        requirePositive("polling.interval.ms", pollIntervalMillis);

        requirePositive("polling.stats.log.cycles", statsLogCycles);

        requirePositive("devices.refresh.interval.seconds", refreshIntervalSeconds);

        requirePositive("devices.default.port", defaultPort);

        requirePositive("devices.connection.timeout.ms", connectionTimeoutMillis);

        requirePositive("devices.worker.pool.size", workerPoolSize);

        requirePositive("devices.worker.max.execute.seconds", workerMaxExecuteSeconds);

        requirePositive("stream.max.length", streamMaxLength);

        if (streamName.isBlank())
        {
            throw new IllegalArgumentException("stream.name must not be blank");
        }
    }

    private static void requirePositive(String key, long value)
    {
        if (value <= 0)
        {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }

    /**
     * Resolve a dotted path through nested objects.
     */
    private static Object value(JsonObject root, String path)
    {
        Object current = root;

        for (var key : path.split("\\."))
        {
            if (!(current instanceof JsonObject))
            {
                return null;
            }

            current = ((JsonObject) current).getValue(key);
        }

        return current;
    }

    private static Object firstPresent(Object override, Object configured)
    {
        return override != null ? override : configured;
    }

    private static long toLong(Object value, long defaultValue)
    {
        if (value == null)
        {
            return defaultValue;
        }

        if (value instanceof Number)
        {
            return ((Number) value).longValue();
        }

        try
        {
            return Long.parseLong(value.toString().trim());
        }
        catch (NumberFormatException exception)
        {
            throw new IllegalArgumentException("Not a number: " + value, exception);
        }
    }

    private static String toString(Object value, String defaultValue)
    {
        return value == null ? defaultValue : value.toString();
    }

    private static boolean parseEnabled(Object value, boolean defaultValue)
    {
        if (value == null)
        {
            return defaultValue;
        }

        if (value instanceof Boolean)
        {
            return (Boolean) value;
        }

        return TRUE_VALUES.contains(value.toString().trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString()
    {
        return "enabled=" + enabled +
               ", interval=" + pollIntervalMillis + "ms" +
               ", vendor=" + vendor +
               ", refresh=" + refreshIntervalSeconds + "s" +
               ", stream=" + streamName +
               ", maxLength=" + streamMaxLength;
    }
}
