package com.bwpoller.models;

import io.vertx.core.json.JsonObject;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of the bandwidth poller, logged periodically.

 * Counters are updated from the poller's event loop and from publish callbacks,
 * and may be read from any thread.
 */
public class PollerStats
{

    private final AtomicLong cycles = new AtomicLong();

    private final AtomicLong samplesPublished = new AtomicLong();

    private final AtomicLong samplesDropped = new AtomicLong();

    private final AtomicLong publishFailures = new AtomicLong();

    private final AtomicLong cycleErrors = new AtomicLong();

    public long incrementCycles()
    {
        return cycles.incrementAndGet();
    }

    public void addPublished(long count)
    {
        samplesPublished.addAndGet(count);
    }

    public void addDropped(long count)
    {
        samplesDropped.addAndGet(count);
    }

    public void addPublishFailures(long count)
    {
        publishFailures.addAndGet(count);
    }

    public void incrementCycleErrors()
    {
        cycleErrors.incrementAndGet();
    }

    public long getCycles()
    {
        return cycles.get();
    }

    public long getSamplesPublished()
    {
        return samplesPublished.get();
    }

    public long getSamplesDropped()
    {
        return samplesDropped.get();
    }

    public long getPublishFailures()
    {
        return publishFailures.get();
    }

    public long getCycleErrors()
    {
        return cycleErrors.get();
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("cycles", getCycles())
            .put("samples_published", getSamplesPublished())
            .put("samples_dropped", getSamplesDropped())
            .put("publish_failures", getPublishFailures())
            .put("cycle_errors", getCycleErrors());
    }
}
