package com.bwpoller.core;

import com.bwpoller.models.BandwidthSample;

import com.bwpoller.models.DevicePollResult;

import com.bwpoller.models.PollerState;

import com.bwpoller.models.PollerStats;

import io.vertx.core.Context;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.Set;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.TimeUnit;

/**
 * BandwidthPoller - Fixed-cadence polling loop

 * State machine: IDLE -> RUNNING -> STOPPING -> STOPPED

 * Each cycle:
 * 1. Record cycle start (monotonic) and one capture instant shared by all samples
 * 2. DevicePool.pollAll() (refreshes devices/mappings when due)
 * 3. Resolve every queue to its subscription, drop unmapped queues
 * 4. Convert byte rates to bits per second and hand the batch to the publisher (not awaited)
 * 5. Schedule the next cycle after max(0, interval - elapsed); a late cycle starts
 *    the next one immediately and never tries to catch up

 * Cycles never overlap. The stop request is honoured at cycle boundaries:
 * a cycle in flight completes, a pending wait is cancelled, then in-flight publishes
 * are awaited, device connections and the publisher are closed.

 * All state transitions happen on the context captured by run().
 */
public class BandwidthPoller
{

    private static final Logger logger = LoggerFactory.getLogger(BandwidthPoller.class);

    private final Vertx vertx;

    private final DevicePool devicePool;

    private final SamplePublisher publisher;

    private final PollerConfig config;

    private final PollerStats stats = new PollerStats();

    private final Promise<Void> stoppedPromise = Promise.promise();

    // Publishes not yet completed (completion callbacks may run on another context)
    private final Set<Future<Void>> pendingPublishes = ConcurrentHashMap.newKeySet();

    private volatile PollerState state = PollerState.IDLE;

    private volatile Context context;

    private long timerId = -1;

    private boolean cycleInFlight;

    private boolean teardownStarted;

    public BandwidthPoller(Vertx vertx, DevicePool devicePool, SamplePublisher publisher, PollerConfig config)
    {
        this.vertx = vertx;

        this.devicePool = devicePool;

        this.publisher = publisher;

        this.config = config;
    }

    /**
     * Start the polling loop on the current context (or a new event loop context).
     *
     * @return Future completed once the poller reaches STOPPED
     */
    public Future<Void> run()
    {
        try
        {
            if (context == null)
            {
                context = vertx.getOrCreateContext();
            }

            context.runOnContext(v -> start());
        }
        catch (Exception exception)
        {
            logger.error("Error in run: {}", exception.getMessage());

            stoppedPromise.tryFail(exception);
        }

        return stoppedPromise.future();
    }

    private void start()
    {
        if (state != PollerState.IDLE)
        {
            return;
        }

        if (!config.enabled)
        {
            logger.warn("Bandwidth polling is disabled, poller will not run");

            state = PollerState.STOPPING;

            teardown();

            return;
        }

        state = PollerState.RUNNING;

        logger.info("Bandwidth poller started: {}", config);

        runCycle();
    }

    /**
     * Execute one polling cycle and schedule the next one.
     */
    private void runCycle()
    {
        timerId = -1;

        if (state != PollerState.RUNNING)
        {
            teardown();

            return;
        }

        cycleInFlight = true;

        var cycleStartNanos = System.nanoTime();

        var sampleAt = Instant.now();

        Future<Void> cycle;

        try
        {
            cycle = devicePool.pollAll()
                .map(results ->
                {
                    publish(buildSamples(results, sampleAt));

                    return null;
                });
        }
        catch (Exception exception)
        {
            cycle = Future.failedFuture(exception);
        }

        cycle.onComplete(result ->
        {
            cycleInFlight = false;

            if (result.failed())
            {
                stats.incrementCycleErrors();

                logger.error("Polling cycle failed: {}", result.cause().getMessage());
            }

            var cycles = stats.incrementCycles();

            if (cycles % config.statsLogCycles == 0)
            {
                logStats();
            }

            if (state != PollerState.RUNNING)
            {
                teardown();

                return;
            }

            scheduleNext(cycleStartNanos);
        });
    }

    private void scheduleNext(long cycleStartNanos)
    {
        var elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - cycleStartNanos);

        var delayMillis = config.pollIntervalMillis - elapsedMillis;

        if (delayMillis <= 0)
        {
            logger.debug("Polling cycle took {}ms, exceeding the {}ms interval", elapsedMillis, config.pollIntervalMillis);

            context.runOnContext(v -> runCycle());
        }
        else
        {
            timerId = vertx.setTimer(delayMillis, id -> runCycle());
        }
    }

    /**
     * Resolve counters to samples. Queues without a subscription are dropped and counted.
     */
    private List<BandwidthSample> buildSamples(List<DevicePollResult> results, Instant sampleAt)
    {
        var samples = new ArrayList<BandwidthSample>();

        var dropped = 0;

        for (var result : results)
        {
            for (var counters : result.counters)
            {
                var subscriptionId = devicePool.resolveSubscription(result.deviceId, counters.name);

                if (subscriptionId == null)
                {
                    dropped++;

                    continue;
                }

                samples.add(BandwidthSample.fromCounters(subscriptionId, result.deviceId, counters, sampleAt));
            }
        }

        if (dropped > 0)
        {
            stats.addDropped(dropped);

            logger.debug("Dropped {} unmapped queues", dropped);
        }

        return samples;
    }

    private void publish(List<BandwidthSample> samples)
    {
        if (samples.isEmpty())
        {
            return;
        }

        var publishing = publisher.append(samples)
            .onSuccess(result ->
            {
                stats.addPublished(result.published);

                stats.addPublishFailures(result.failed);
            })
            .<Void>mapEmpty()
            .recover(cause ->
            {
                stats.addPublishFailures(samples.size());

                logger.error("Failed to publish {} samples: {}", samples.size(), cause.getMessage());

                return Future.succeededFuture();
            });

        pendingPublishes.add(publishing);

        publishing.onComplete(result -> pendingPublishes.remove(publishing));
    }

    /**
     * Request a cooperative stop. Idempotent, callable from any thread.
     *
     * @return Future completed once the poller reaches STOPPED
     */
    public Future<Void> stop()
    {
        try
        {
            if (context == null)
            {
                context = vertx.getOrCreateContext();
            }

            context.runOnContext(v -> requestStop());
        }
        catch (Exception exception)
        {
            logger.error("Error in stop: {}", exception.getMessage());

            stoppedPromise.tryFail(exception);
        }

        return stoppedPromise.future();
    }

    private void requestStop()
    {
        if (state == PollerState.STOPPING || state == PollerState.STOPPED)
        {
            return;
        }

        var previous = state;

        state = PollerState.STOPPING;

        logger.info("Stopping bandwidth poller");

        if (previous == PollerState.IDLE)
        {
            teardown();

            return;
        }

        // A fired timer or an immediate cycle already queued will observe STOPPING in runCycle()
        if (!cycleInFlight && timerId != -1 && vertx.cancelTimer(timerId))
        {
            timerId = -1;

            teardown();
        }
    }

    /**
     * Await in-flight publishes, close connections and the publisher, then move to STOPPED.
     */
    private void teardown()
    {
        if (teardownStarted)
        {
            return;
        }

        teardownStarted = true;

        var publishes = new ArrayList<Future<Void>>(pendingPublishes);

        Future.all(publishes)
            .compose(v -> devicePool.close()
                .recover(cause ->
                {
                    logger.error("Failed to close device connections: {}", cause.getMessage());

                    return Future.succeededFuture();
                }))
            .compose(v -> publisher.close())
            .onComplete(result ->
            {
                if (result.failed())
                {
                    logger.error("Error during poller shutdown: {}", result.cause().getMessage());
                }

                state = PollerState.STOPPED;

                logStats();

                logger.info("Bandwidth poller stopped");

                stoppedPromise.tryComplete();
            });
    }

    private void logStats()
    {
        logger.info("Poller stats: {}", stats.toJson().put("devices", devicePool.getDeviceCount()).encode());
    }

    public PollerState getState()
    {
        return state;
    }

    public PollerStats getStats()
    {
        return stats;
    }
}
