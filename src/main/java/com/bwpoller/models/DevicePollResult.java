package com.bwpoller.models;

import java.util.List;

/**
 * Counters returned by one device in one polling cycle.
 */
public class DevicePollResult
{

    public final String deviceId;

    public final List<QueueCounters> counters;

    public DevicePollResult(String deviceId, List<QueueCounters> counters)
    {
        this.deviceId = deviceId;

        this.counters = counters;
    }
}
