package com.bwpoller.models;

import java.time.Instant;

import java.util.LinkedHashMap;

import java.util.Map;

/**
 * One normalized bandwidth reading tying a subscription to a point-in-time rate.

 * All samples built in the same polling cycle share the same sampleAt instant.
 */
public class BandwidthSample
{

    public final String subscriptionId;

    public final String deviceId;

    public final String queueName;

    public final long rxBps;        // bits per second

    public final long txBps;        // bits per second

    public final Instant sampleAt;

    public BandwidthSample(String subscriptionId, String deviceId, String queueName,
                           long rxBps, long txBps, Instant sampleAt)
    {
        this.subscriptionId = subscriptionId;

        this.deviceId = deviceId;

        this.queueName = queueName;

        this.rxBps = rxBps;

        this.txBps = txBps;

        this.sampleAt = sampleAt;
    }

    /**
     * Builds a sample from queue counters, converting byte rates to bit rates.
     *
     * @param subscriptionId subscription resolved for the queue
     * @param deviceId device the queue was read from
     * @param counters queue counters (rates in bytes per second)
     * @param sampleAt capture time of the cycle
     * @return BandwidthSample with rx/tx in bits per second
     */
    public static BandwidthSample fromCounters(String subscriptionId, String deviceId, QueueCounters counters, Instant sampleAt)
    {
        return new BandwidthSample(subscriptionId, deviceId, counters.name,
            counters.rateRx * 8, counters.rateTx * 8, sampleAt);
    }

    /**
     * Flat field set written to the stream entry.

     * Stream entry layout:
     * subscription_id, device_id, queue_name, rx_bps, tx_bps, sample_at (ISO-8601 UTC)
     *
     * @return ordered field map, all values as strings
     */
    public Map<String, String> toStreamFields()
    {
        var fields = new LinkedHashMap<String, String>();

        fields.put("subscription_id", subscriptionId);

        fields.put("device_id", deviceId);

        fields.put("queue_name", queueName);

        fields.put("rx_bps", String.valueOf(rxBps));

        fields.put("tx_bps", String.valueOf(txBps));

        fields.put("sample_at", sampleAt.toString());

        return fields;
    }
}
