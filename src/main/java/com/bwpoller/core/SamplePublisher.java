package com.bwpoller.core;

import com.bwpoller.models.BandwidthSample;

import com.bwpoller.models.PublishResult;

import io.vertx.core.Future;

import java.util.List;

/**
 * SamplePublisher - Sink for the bandwidth samples of each polling cycle

 * Contract:
 * - append() attempts every sample of the batch and never fails its future;
 *   per-sample failures are logged and counted in the PublishResult
 * - append() after close() attempts nothing and reports every sample as failed
 * - close() is idempotent
 */
public interface SamplePublisher
{

    /**
     * Append a batch of samples.
     *
     * @param samples samples of one cycle, possibly empty
     * @return Future with attempted/published/failed counts
     */
    Future<PublishResult> append(List<BandwidthSample> samples);

    /**
     * Release the underlying client.
     *
     * @return Future completed once the client is closed
     */
    Future<Void> close();

    /**
     * @return true once close() has been called
     */
    boolean isClosed();

}
