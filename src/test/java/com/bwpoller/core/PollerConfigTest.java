package com.bwpoller.core;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PollerConfigTest
{

    @Test
    void defaultsApplyToEmptyConfiguration()
    {
        var config = PollerConfig.fromJson(null);

        assertTrue(config.enabled);

        assertEquals(1000, config.pollIntervalMillis);

        assertEquals(60, config.statsLogCycles);

        assertEquals("mikrotik", config.vendor);

        assertEquals(60, config.refreshIntervalSeconds);

        assertEquals(8728, config.defaultPort);

        assertEquals(5000, config.connectionTimeoutMillis);

        assertEquals(16, config.workerPoolSize);

        assertEquals("redis://localhost:6379/0", config.redisUrl);

        assertEquals("bandwidth:samples", config.streamName);

        assertEquals(100000, config.streamMaxLength);

        assertFalse(config.approximateTrim);
    }

    @Test
    void readsNestedHoconKeys()
    {
        var json = new JsonObject("""
            {
              "polling": { "interval": { "ms": 250 }, "stats": { "log": { "cycles": 10 } } },
              "devices": { "vendor": "mikrotik", "connection": { "timeout": { "ms": 2000 } } },
              "stream": { "name": "bw:test", "max": { "length": 500 }, "trim": { "approximate": true } }
            }
            """);

        var config = PollerConfig.fromJson(json);

        assertEquals(250, config.pollIntervalMillis);

        assertEquals(10, config.statsLogCycles);

        assertEquals(2000, config.connectionTimeoutMillis);

        assertEquals("bw:test", config.streamName);

        assertEquals(500, config.streamMaxLength);

        assertTrue(config.approximateTrim);
    }

    @Test
    void environmentOverridesConfiguredValues()
    {
        var json = new JsonObject()
            .put("polling", new JsonObject().put("interval", new JsonObject().put("ms", 1000)))
            .put("stream", new JsonObject().put("name", "from-file"))
            .put(PollerConfig.ENV_POLL_INTERVAL_MS, "2500")
            .put(PollerConfig.ENV_REDIS_URL, "redis://cache:6380/2")
            .put(PollerConfig.ENV_REDIS_STREAM, "from-env");

        var config = PollerConfig.fromJson(json);

        assertEquals(2500, config.pollIntervalMillis);

        assertEquals("redis://cache:6380/2", config.redisUrl);

        assertEquals("from-env", config.streamName);
    }

    @Test
    void killSwitchAcceptsCommonTruthyValues()
    {
        assertTrue(enabled("1"));

        assertTrue(enabled("true"));

        assertTrue(enabled("YES"));

        assertTrue(enabled(true));

        assertFalse(enabled("0"));

        assertFalse(enabled("false"));

        assertFalse(enabled("off"));

        assertFalse(enabled(false));
    }

    private static boolean enabled(Object value)
    {
        return PollerConfig.fromJson(new JsonObject().put(PollerConfig.ENV_POLLING_ENABLED, value)).enabled;
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(IllegalArgumentException.class, () -> PollerConfig.fromJson(
            new JsonObject().put(PollerConfig.ENV_POLL_INTERVAL_MS, "0")));

        assertThrows(IllegalArgumentException.class, () -> PollerConfig.fromJson(
            new JsonObject().put(PollerConfig.ENV_POLL_INTERVAL_MS, "fast")));

        assertThrows(IllegalArgumentException.class, () -> PollerConfig.fromJson(
            new JsonObject().put(PollerConfig.ENV_REDIS_STREAM, " ")));

        assertThrows(IllegalArgumentException.class, () -> PollerConfig.fromJson(
            new JsonObject().put("stream", new JsonObject().put("max", new JsonObject().put("length", -1)))));
    }
}
