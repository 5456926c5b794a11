package com.bwpoller.core;

import com.bwpoller.models.NasDevice;

import com.bwpoller.models.QueueCounters;

import java.util.List;

/**
 * DeviceConnection - Live session and retry policy of exactly one NAS device

 * One implementation exists per device vendor API (RouterOsConnection for MikroTik).
 * DevicePool and BandwidthPoller only depend on this interface.

 * Contract:
 * - Failures are state, not exceptions: no method throws
 * - All methods may block on network I/O and must be called from a worker thread
 * - Health state (consecutive failures, last success) is owned by the connection
 */
public interface DeviceConnection
{

    /**
     * @return the device this connection was built for
     */
    NasDevice getDevice();

    /**
     * Establish transport and authenticate.
     * Success resets the failure count; failure increments it.
     *
     * @return true if a session is now open
     */
    boolean connect();

    /**
     * Close the session if one is open. Idempotent.
     */
    void disconnect();

    /**
     * Read the counters of every traffic-shaping queue on the device.
     * Connects first when no session is open. On failure the session is torn down.
     *
     * @return queue counters, or an empty list on any failure
     */
    List<QueueCounters> fetchCounters();

    /**
     * Backoff decision for the next fetch attempt.
     *
     * @return true if the device may be polled now
     */
    boolean shouldRetry();

    /**
     * @return true if a session is currently open
     */
    boolean isConnected();

    /**
     * @return number of consecutive failed connect/fetch attempts
     */
    int getConsecutiveFailures();

}
