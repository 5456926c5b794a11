package com.bwpoller.core;

import com.bwpoller.models.NasDevice;

import com.bwpoller.models.QueueCounters;

import com.bwpoller.utils.CounterParser;

import me.legrange.mikrotik.ApiConnection;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

/**
 * RouterOsConnection - Persistent RouterOS API session to one MikroTik device

 * Responsibilities:
 * - Connect and log in with the device's API credentials
 * - Read "/queue/simple/print" and parse rate/bytes/packets counters
 * - Track consecutive failures and apply exponential backoff
 * - Tear the session down after any failed fetch so the next attempt reconnects

 * Backoff:
 * - No failures: always eligible
 * - f failures: eligible once min(60s, 2^f s) has elapsed since the last failed attempt

 * WARNING: All methods are BLOCKING and must be called from a worker executor.
 * Methods are synchronized so a disconnect issued during shutdown waits for an in-flight fetch.
 */
public class RouterOsConnection implements DeviceConnection
{

    private static final Logger logger = LoggerFactory.getLogger(RouterOsConnection.class);

    static final String SIMPLE_QUEUE_PRINT = "/queue/simple/print";

    static final long MAX_BACKOFF_SECONDS = 60;

    private final NasDevice device;

    private final int timeoutMillis;

    private final RouterOsConnector connector;

    private final Clock clock;

    // Session (null when disconnected)
    private volatile ApiConnection session;

    // Health state
    private volatile int consecutiveFailures;

    private volatile Instant lastConnectedAt;

    private volatile Instant lastFailureAt;

    public RouterOsConnection(NasDevice device, int timeoutMillis)
    {
        this(device, timeoutMillis, RouterOsConnector.plain(), Clock.systemUTC());
    }

    public RouterOsConnection(NasDevice device, int timeoutMillis, RouterOsConnector connector, Clock clock)
    {
        this.device = device;

        this.timeoutMillis = timeoutMillis;

        this.connector = connector;

        this.clock = clock;
    }

    @Override
    public NasDevice getDevice()
    {
        return device;
    }

    /**
     * Open the API socket and log in. An already open session is closed first.
     *
     * @return true if the session is open
     */
    @Override
    public synchronized boolean connect()
    {
        disconnect();

        ApiConnection candidate = null;

        try
        {
            candidate = connector.open(device.host, device.port, timeoutMillis);

            candidate.setTimeout(timeoutMillis);

            candidate.login(device.username, device.password);

            session = candidate;

            lastConnectedAt = clock.instant();

            consecutiveFailures = 0;

            logger.info("Connected to MikroTik device {} at {}:{}", device.deviceId, device.host, device.port);

            return true;
        }
        catch (Exception exception)
        {
            recordFailure();

            logger.error("Failed to connect to {}:{} (device {}, {} consecutive failures): {}",
                device.host, device.port, device.deviceId, consecutiveFailures, exception.getMessage());

            closeSession(candidate);

            return false;
        }
    }

    @Override
    public synchronized void disconnect()
    {
        var current = session;

        session = null;

        closeSession(current);
    }

    /**
     * Fetch simple queue counters, connecting first when needed.
     *
     * @return parsed counters, or an empty list on failure
     */
    @Override
    public synchronized List<QueueCounters> fetchCounters()
    {
        if (session == null && !connect())
        {
            return List.of();
        }

        try
        {
            var rows = session.execute(SIMPLE_QUEUE_PRINT);

            var counters = new ArrayList<QueueCounters>(rows.size());

            for (var row : rows)
            {
                counters.add(CounterParser.toQueueCounters(row));
            }

            consecutiveFailures = 0;

            logger.debug("Fetched {} queues from device {}", counters.size(), device.deviceId);

            return counters;
        }
        catch (Exception exception)
        {
            recordFailure();

            logger.error("Failed to get queue stats from {} (device {}): {}",
                device.host, device.deviceId, exception.getMessage());

            // reconnect on the next eligible attempt
            disconnect();

            return List.of();
        }
    }

    @Override
    public boolean shouldRetry()
    {
        var failures = consecutiveFailures;

        if (failures == 0)
        {
            return true;
        }

        var failedAt = lastFailureAt;

        if (failedAt == null)
        {
            return true;
        }

        var elapsed = Duration.between(failedAt, clock.instant());

        return elapsed.compareTo(Duration.ofSeconds(backoffSeconds(failures))) >= 0;
    }

    /**
     * Backoff for a given failure count: min(60, 2^failures) seconds.
     *
     * @param failures consecutive failures, at least 1
     * @return backoff in seconds
     */
    static long backoffSeconds(int failures)
    {
        // 2^6 already exceeds the cap
        return Math.min(MAX_BACKOFF_SECONDS, 1L << Math.min(failures, 6));
    }

    @Override
    public boolean isConnected()
    {
        return session != null;
    }

    @Override
    public int getConsecutiveFailures()
    {
        return consecutiveFailures;
    }

    public Instant getLastConnectedAt()
    {
        return lastConnectedAt;
    }

    public Instant getLastFailureAt()
    {
        return lastFailureAt;
    }

    private void recordFailure()
    {
        consecutiveFailures++;

        lastFailureAt = clock.instant();
    }

    private void closeSession(ApiConnection connection)
    {
        if (connection == null)
        {
            return;
        }

        try
        {
            connection.close();
        }
        catch (Exception exception)
        {
            logger.warn("Error disconnecting from {} (device {}): {}", device.host, device.deviceId, exception.getMessage());
        }
    }
}
