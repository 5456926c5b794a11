package com.bwpoller.core;

import com.bwpoller.models.BandwidthSample;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.redis.client.Redis;

import io.vertx.redis.client.RedisConnection;

import io.vertx.redis.client.Request;

import io.vertx.redis.client.Response;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import static com.bwpoller.core.VertxTestSupport.await;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertTrue;

import static org.mockito.ArgumentMatchers.any;

import static org.mockito.Mockito.mock;

import static org.mockito.Mockito.never;

import static org.mockito.Mockito.times;

import static org.mockito.Mockito.verify;

import static org.mockito.Mockito.when;

class RedisStreamPublisherTest
{

    private static final Instant SAMPLE_AT = Instant.parse("2026-03-01T12:00:00Z");

    private Vertx vertx;

    private RespStubServer server;

    private RedisStreamPublisher publisher;

    @BeforeEach
    void setUp() throws Exception
    {
        vertx = Vertx.vertx();

        server = new RespStubServer(vertx);

        var port = await(server.start());

        var config = PollerConfig.fromJson(new JsonObject()
            .put("stream", new JsonObject()
                .put("redis", new JsonObject().put("url", "redis://127.0.0.1:" + port))
                .put("name", "bandwidth:samples")
                .put("max", new JsonObject().put("length", 1000))));

        publisher = new RedisStreamPublisher(vertx, config);
    }

    @AfterEach
    void tearDown() throws Exception
    {
        await(publisher.close());

        await(server.close());

        await(vertx.close());
    }

    private static BandwidthSample sample(String subscriptionId)
    {
        return new BandwidthSample(subscriptionId, "d1", "pppoe-" + subscriptionId, 100000, 536000, SAMPLE_AT);
    }

    private static List<BandwidthSample> samples(int count)
    {
        var samples = new ArrayList<BandwidthSample>(count);

        for (var i = 0; i < count; i++)
        {
            samples.add(sample("S" + i));
        }

        return samples;
    }

    @Test
    void appendsOneEntryPerSampleWithExactLengthCap() throws Exception
    {
        var result = await(publisher.append(List.of(sample("S1"))));

        assertEquals(1, result.attempted);

        assertEquals(1, result.published);

        assertEquals(0, result.failed);

        assertEquals(List.of(List.of("bandwidth:samples", "MAXLEN", "1000", "*",
            "subscription_id", "S1",
            "device_id", "d1",
            "queue_name", "pppoe-S1",
            "rx_bps", "100000",
            "tx_bps", "536000",
            "sample_at", "2026-03-01T12:00:00Z")), server.xadds);
    }

    @Test
    void largeBatchIsWrittenCompletelyOverOneConnection() throws Exception
    {
        var batch = samples(RedisStreamPublisher.PIPELINE_CHUNK * 2 + 100);

        var result = await(publisher.append(batch));

        assertEquals(batch.size(), result.attempted);

        assertEquals(batch.size(), result.published);

        assertEquals(0, result.failed);

        assertEquals(batch.size(), server.xadds.size());

        assertEquals(1, server.connections.get());

        // Entries keep batch order
        assertEquals("S0", server.xadds.get(0).get(5));

        assertEquals("S" + (batch.size() - 1), server.xadds.get(batch.size() - 1).get(5));
    }

    @Test
    void consecutiveLargeBatchesAreAllWritten() throws Exception
    {
        for (var i = 0; i < 3; i++)
        {
            var result = await(publisher.append(samples(200)));

            assertEquals(200, result.published);
        }

        assertEquals(600, server.xadds.size());
    }

    @Test
    void rejectedEntriesDoNotBlockTheRest() throws Exception
    {
        server.rejectWhen(args -> args.contains("S2") || args.contains("S7"));

        var result = await(publisher.append(samples(10)));

        assertEquals(10, result.attempted);

        assertEquals(8, result.published);

        assertEquals(2, result.failed);

        assertEquals(8, server.xadds.size());
    }

    @Test
    void approximateTrimUsesTilde()
    {
        var approximate = new RedisStreamPublisher(mock(Redis.class), "bw", 500, true);

        var args = approximate.buildXaddArgs(sample("S1"));

        assertEquals(List.of("bw", "MAXLEN", "~", "500", "*"), args.subList(0, 5));
    }

    @Test
    void commandThatThrowsCountsAsOneFailure() throws Exception
    {
        var redis = mock(Redis.class);

        var connection = mock(RedisConnection.class);

        when(redis.connect()).thenReturn(Future.succeededFuture(connection));

        when(connection.close()).thenReturn(Future.succeededFuture());

        when(connection.send(any(Request.class)))
            .thenReturn(Future.succeededFuture(mock(Response.class)))
            .thenThrow(new IllegalStateException("connection closed"))
            .thenReturn(Future.succeededFuture(mock(Response.class)));

        var mocked = new RedisStreamPublisher(redis, "bw", 1000, false);

        var result = await(mocked.append(List.of(sample("S1"), sample("S2"), sample("S3"))));

        assertEquals(3, result.attempted);

        assertEquals(2, result.published);

        assertEquals(1, result.failed);

        verify(connection, times(3)).send(any(Request.class));

        verify(connection).close();
    }

    @Test
    void unreachableRedisCountsEverySampleAsFailed() throws Exception
    {
        var redis = mock(Redis.class);

        when(redis.connect()).thenReturn(Future.failedFuture(new ConnectException("Connection refused")));

        var mocked = new RedisStreamPublisher(redis, "bw", 1000, false);

        var result = await(mocked.append(List.of(sample("S1"), sample("S2"))));

        assertEquals(2, result.attempted);

        assertEquals(0, result.published);

        assertEquals(2, result.failed);
    }

    @Test
    void emptyBatchWritesNothing() throws Exception
    {
        var result = await(publisher.append(List.of()));

        assertEquals(0, result.attempted);

        assertEquals(0, server.connections.get());
    }

    @Test
    void appendAfterCloseCountsEverySampleAsFailed() throws Exception
    {
        var redis = mock(Redis.class);

        var mocked = new RedisStreamPublisher(redis, "bw", 1000, false);

        await(mocked.close());

        await(mocked.close());

        assertTrue(mocked.isClosed());

        var result = await(mocked.append(List.of(sample("S1"), sample("S2"))));

        assertEquals(2, result.attempted);

        assertEquals(2, result.failed);

        verify(redis, never()).connect();

        verify(redis, never()).close();
    }
}
