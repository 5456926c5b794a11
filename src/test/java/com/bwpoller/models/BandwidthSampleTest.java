package com.bwpoller.models;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import java.util.List;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BandwidthSampleTest
{

    @Test
    void convertsByteRatesToBitsAndFlattensForStream()
    {
        var counters = new QueueCounters("pppoe-s1", "10.10.0.15/32", 12500, 67000, 0, 0, 0, 0);

        var sample = BandwidthSample.fromCounters("S1", "d1", counters, Instant.parse("2026-03-01T12:00:00.250Z"));

        assertEquals(100000, sample.rxBps);

        assertEquals(536000, sample.txBps);

        var fields = sample.toStreamFields();

        assertEquals(List.of("subscription_id", "device_id", "queue_name", "rx_bps", "tx_bps", "sample_at"),
            List.copyOf(fields.keySet()));

        assertEquals(Map.of(
            "subscription_id", "S1",
            "device_id", "d1",
            "queue_name", "pppoe-s1",
            "rx_bps", "100000",
            "tx_bps", "536000",
            "sample_at", "2026-03-01T12:00:00.250Z"), fields);
    }
}
