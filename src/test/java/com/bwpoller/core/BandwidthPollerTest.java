package com.bwpoller.core;

import com.bwpoller.models.DevicePollResult;

import com.bwpoller.models.PollerState;

import com.bwpoller.models.QueueCounters;

import com.bwpoller.utils.CounterParser;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import java.util.List;

import java.util.Map;

import java.util.concurrent.TimeUnit;

import static com.bwpoller.core.VertxTestSupport.await;

import static com.bwpoller.core.VertxTestSupport.config;

import static com.bwpoller.core.VertxTestSupport.waitUntil;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

import static org.mockito.Mockito.mock;

import static org.mockito.Mockito.when;

class BandwidthPollerTest
{

    private Vertx vertx;

    private WorkerExecutor workerExecutor;

    private FakeDirectory directory;

    private FakeConnectionFactory factory;

    private RecordingPublisher publisher;

    private DevicePool pool;

    @BeforeEach
    void setUp()
    {
        vertx = Vertx.vertx();

        workerExecutor = vertx.createSharedWorkerExecutor("bandwidth-poller-test", 8);

        directory = new FakeDirectory();

        factory = new FakeConnectionFactory();

        publisher = new RecordingPublisher();
    }

    @AfterEach
    void tearDown() throws Exception
    {
        await(workerExecutor.close());

        await(vertx.close());
    }

    private BandwidthPoller newPoller(PollerConfig config)
    {
        pool = new DevicePool(workerExecutor, directory, directory, factory, config);

        return new BandwidthPoller(vertx, pool, publisher, config);
    }

    private static QueueCounters queue(String name, String rate)
    {
        return CounterParser.toQueueCounters(Map.of("name", name, "rate", rate));
    }

    @Test
    void publishesMappedQueueAsBitsPerSecond() throws Exception
    {
        factory.countersByDevice.put("d1", List.of(queue("pppoe-alice", "12500/67000")));

        directory.addDevice("d1", "10.0.0.1").map("d1", "pppoe-alice", "S1");

        var poller = newPoller(config(1000, 60));

        var finished = poller.run();

        assertTrue(waitUntil(() -> !publisher.batches.isEmpty(), 5000));

        await(poller.stop());

        var sample = publisher.batches.get(0).get(0);

        assertEquals("S1", sample.subscriptionId);

        assertEquals("d1", sample.deviceId);

        assertEquals("pppoe-alice", sample.queueName);

        assertEquals(100000, sample.rxBps);

        assertEquals(536000, sample.txBps);

        assertTrue(finished.isComplete());
    }

    @Test
    void dropsUnmappedQueues() throws Exception
    {
        factory.countersByDevice.put("d1", List.of(queue("mapped", "10/20"), queue("orphan", "30/40")));

        directory.addDevice("d1", "10.0.0.1").map("d1", "mapped", "S1");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> !publisher.batches.isEmpty(), 5000));

        await(poller.stop());

        var batch = publisher.batches.get(0);

        assertEquals(1, batch.size());

        assertEquals("mapped", batch.get(0).queueName);

        assertTrue(poller.getStats().getSamplesDropped() >= 1);

        assertTrue(publisher.allSamples().stream().allMatch(sample -> sample.subscriptionId != null));
    }

    @Test
    void samplesOfOneCycleShareCaptureTime() throws Exception
    {
        factory.countersByDevice.put("d1", List.of(queue("q1", "1/1")));

        factory.countersByDevice.put("d2", List.of(queue("q2", "2/2")));

        directory.addDevice("d1", "10.0.0.1").addDevice("d2", "10.0.0.2")
            .map("d1", "q1", "S1")
            .map("d2", "q2", "S2");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> !publisher.batches.isEmpty(), 5000));

        await(poller.stop());

        var batch = publisher.batches.get(0);

        assertEquals(2, batch.size());

        assertEquals(batch.get(0).sampleAt, batch.get(1).sampleAt);
    }

    @Test
    void holdsCadenceWhenCycleIsFasterThanInterval() throws Exception
    {
        factory.fetchDelayMillis = 300;

        directory.addDevice("d1", "10.0.0.1");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> fetchStarts("d1").size() >= 3, 5000));

        await(poller.stop());

        assertGapsBetween(fetchStarts("d1"), 900, 1200);
    }

    @Test
    void lateCycleStartsNextImmediatelyWithoutBurst() throws Exception
    {
        factory.fetchDelayMillis = 1500;

        directory.addDevice("d1", "10.0.0.1");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> fetchStarts("d1").size() >= 3, 8000));

        await(poller.stop());

        assertGapsBetween(fetchStarts("d1"), 1450, 1800);
    }

    private static void assertGapsBetween(List<Long> starts, long minMillis, long maxMillis)
    {
        for (var i = 1; i < 3; i++)
        {
            var gapMillis = TimeUnit.NANOSECONDS.toMillis(starts.get(i) - starts.get(i - 1));

            assertTrue(gapMillis >= minMillis && gapMillis <= maxMillis, "gap between cycles was " + gapMillis + "ms");
        }
    }

    @Test
    void stopLetsInFlightCycleFinishThenReleasesEverything() throws Exception
    {
        factory.fetchDelayMillis = 400;

        factory.countersByDevice.put("d1", List.of(queue("q1", "1/1")));

        directory.addDevice("d1", "10.0.0.1").addDevice("d2", "10.0.0.2").map("d1", "q1", "S1");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> fetchStarts("d1").size() == 1, 5000));

        await(poller.stop());

        assertEquals(PollerState.STOPPED, poller.getState());

        assertEquals(1, poller.getStats().getCycles());

        assertEquals(1, publisher.batches.size());

        assertTrue(publisher.isClosed());

        assertEquals(0, pool.getOpenConnectionCount());

        for (var connection : factory.created)
        {
            assertFalse(connection.isConnected());

            assertEquals(1, connection.fetchStartNanos.size());
        }
    }

    @Test
    void stopCancelsPendingWait() throws Exception
    {
        directory.addDevice("d1", "10.0.0.1");

        var poller = newPoller(config(5000, 60));

        poller.run();

        assertTrue(waitUntil(() -> poller.getStats().getCycles() == 1, 5000));

        var start = System.nanoTime();

        await(poller.stop());

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2000);

        assertEquals(PollerState.STOPPED, poller.getState());

        assertEquals(1, fetchStarts("d1").size());
    }

    @Test
    void stopIsIdempotent() throws Exception
    {
        var poller = newPoller(config(100, 60));

        poller.run();

        await(poller.stop());

        await(poller.stop());

        assertEquals(PollerState.STOPPED, poller.getState());
    }

    @Test
    void stopBeforeRunTearsDownWithoutPolling() throws Exception
    {
        directory.addDevice("d1", "10.0.0.1");

        var poller = newPoller(config(100, 60));

        await(poller.stop());

        await(poller.run());

        Thread.sleep(200);

        assertEquals(PollerState.STOPPED, poller.getState());

        assertEquals(0, directory.listCalls.get());

        assertTrue(publisher.isClosed());
    }

    @Test
    void disabledPollerStopsWithoutTouchingDevices() throws Exception
    {
        directory.addDevice("d1", "10.0.0.1");

        var disabled = PollerConfig.fromJson(new JsonObject()
            .put("polling", new JsonObject().put("enabled", false)));

        var poller = newPoller(disabled);

        await(poller.run());

        assertEquals(PollerState.STOPPED, poller.getState());

        assertEquals(0, directory.listCalls.get());

        assertTrue(factory.created.isEmpty());

        assertEquals(0, poller.getStats().getCycles());
    }

    @Test
    void cycleErrorIsCountedAndLoopContinues() throws Exception
    {
        var failingPool = mock(DevicePool.class);

        when(failingPool.pollAll())
            .thenThrow(new IllegalStateException("boom"))
            .thenReturn(Future.<List<DevicePollResult>>failedFuture(new IllegalStateException("boom again")))
            .thenReturn(Future.succeededFuture(List.of()));

        when(failingPool.close()).thenReturn(Future.succeededFuture());

        var config = config(50, 60);

        var poller = new BandwidthPoller(vertx, failingPool, publisher, config);

        poller.run();

        assertTrue(waitUntil(() -> poller.getStats().getCycles() >= 4, 5000));

        assertEquals(PollerState.RUNNING, poller.getState());

        await(poller.stop());

        assertEquals(2, poller.getStats().getCycleErrors());
    }

    @Test
    void publishFailuresAreCounted() throws Exception
    {
        publisher.failuresPerBatch = 1;

        factory.countersByDevice.put("d1", List.of(queue("q1", "1/1"), queue("q2", "2/2")));

        directory.addDevice("d1", "10.0.0.1").map("d1", "q1", "S1").map("d1", "q2", "S2");

        var poller = newPoller(config(1000, 60));

        poller.run();

        assertTrue(waitUntil(() -> poller.getStats().getPublishFailures() >= 1, 5000));

        await(poller.stop());

        assertTrue(poller.getStats().getSamplesPublished() >= 1);
    }

    private List<Long> fetchStarts(String deviceId)
    {
        var connection = factory.latest(deviceId);

        return connection == null ? List.of() : connection.fetchStartNanos;
    }
}
