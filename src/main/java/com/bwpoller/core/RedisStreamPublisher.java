package com.bwpoller.core;

import com.bwpoller.models.BandwidthSample;

import com.bwpoller.models.PublishResult;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.redis.client.Redis;

import io.vertx.redis.client.RedisAPI;

import io.vertx.redis.client.RedisConnection;

import io.vertx.redis.client.RedisOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RedisStreamPublisher - Appends bandwidth samples to a length-capped Redis stream

 * Every sample becomes one entry with a server-assigned ID:
 * XADD {stream} MAXLEN [~] {max} * subscription_id .. device_id .. queue_name .. rx_bps .. tx_bps .. sample_at ..

 * A batch borrows a single connection from the client pool and pipelines its XADDs
 * on it, PIPELINE_CHUNK commands at a time, so batch size is bounded by neither the
 * pool size nor the pool wait queue. A failed entry is counted and the rest still go out.

 * The stream is trimmed on every append, so its length never exceeds the cap
 * (exact trimming) or exceeds it only by one macro node (approximate trimming).
 */
public class RedisStreamPublisher implements SamplePublisher
{

    private static final Logger logger = LoggerFactory.getLogger(RedisStreamPublisher.class);

    // Commands written before waiting for their replies
    static final int PIPELINE_CHUNK = 256;

    private final Redis redis;

    private final boolean ownsClient;

    private final String streamName;

    private final long maxLength;

    private final boolean approximateTrim;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a publisher with its own Redis client.
     *
     * @param vertx Vert.x instance
     * @param config poller configuration (stream.redis.url, stream.name, stream.max.length)
     */
    public RedisStreamPublisher(Vertx vertx, PollerConfig config)
    {
        this.redis = Redis.createClient(vertx, new RedisOptions().setConnectionString(config.redisUrl));

        this.ownsClient = true;

        this.streamName = config.streamName;

        this.maxLength = config.streamMaxLength;

        this.approximateTrim = config.approximateTrim;

        logger.info("Redis stream publisher created: stream={}, maxLength={}, approximate={}",
            streamName, maxLength, approximateTrim);
    }

    /**
     * Create a publisher on an existing client. The caller owns and closes it.
     */
    public RedisStreamPublisher(Redis redis, String streamName, long maxLength, boolean approximateTrim)
    {
        this.redis = redis;

        this.ownsClient = false;

        this.streamName = streamName;

        this.maxLength = maxLength;

        this.approximateTrim = approximateTrim;
    }

    @Override
    public Future<PublishResult> append(List<BandwidthSample> samples)
    {
        if (samples == null || samples.isEmpty())
        {
            return Future.succeededFuture(PublishResult.empty());
        }

        if (closed.get())
        {
            logger.warn("Publisher closed, dropping {} samples", samples.size());

            return Future.succeededFuture(new PublishResult(samples.size(), 0, samples.size()));
        }

        Future<RedisConnection> connecting;

        try
        {
            connecting = redis.connect();
        }
        catch (Exception exception)
        {
            connecting = Future.failedFuture(exception);
        }

        return connecting
            .compose(connection ->
            {
                var redisApi = RedisAPI.api(connection);

                return appendChunk(redisApi, samples, 0, 0)
                    .onComplete(done -> connection.close()
                        .onFailure(cause -> logger.debug("Error releasing Redis connection: {}", cause.getMessage())));
            })
            .map(published ->
            {
                var failed = samples.size() - published;

                if (failed > 0)
                {
                    logger.warn("Published {}/{} samples to {} ({} failed)", published, samples.size(), streamName, failed);
                }
                else
                {
                    logger.debug("Published {} samples to {}", published, streamName);
                }

                return new PublishResult(samples.size(), published, failed);
            })
            .recover(cause ->
            {
                logger.error("Failed to connect to Redis, {} samples not published to {}: {}",
                    samples.size(), streamName, cause.getMessage());

                return Future.succeededFuture(new PublishResult(samples.size(), 0, samples.size()));
            });
    }

    /**
     * Pipeline samples[from, from + PIPELINE_CHUNK) on one connection, then continue with the next chunk.
     *
     * @return Future with the number of entries published so far
     */
    private Future<Integer> appendChunk(RedisAPI redisApi, List<BandwidthSample> samples, int from, int publishedSoFar)
    {
        if (from >= samples.size())
        {
            return Future.succeededFuture(publishedSoFar);
        }

        var to = Math.min(samples.size(), from + PIPELINE_CHUNK);

        var writes = new ArrayList<Future<Boolean>>(to - from);

        for (var sample : samples.subList(from, to))
        {
            writes.add(appendOne(redisApi, sample));
        }

        return Future.all(new ArrayList<>(writes))
            .compose(done ->
            {
                var published = publishedSoFar;

                for (var write : writes)
                {
                    if (Boolean.TRUE.equals(write.result()))
                    {
                        published++;
                    }
                }

                return appendChunk(redisApi, samples, to, published);
            });
    }

    private Future<Boolean> appendOne(RedisAPI redisApi, BandwidthSample sample)
    {
        try
        {
            return redisApi.xadd(buildXaddArgs(sample))
                .map(response -> true)
                .recover(cause ->
                {
                    logger.error("Failed to publish sample of subscription {} to {}: {}",
                        sample.subscriptionId, streamName, cause.getMessage());

                    return Future.succeededFuture(false);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error publishing sample of subscription {}: {}", sample.subscriptionId, exception.getMessage());

            return Future.succeededFuture(false);
        }
    }

    /**
     * Build XADD arguments: stream, MAXLEN, [~], max, *, then field/value pairs.
     */
    List<String> buildXaddArgs(BandwidthSample sample)
    {
        var args = new ArrayList<String>();

        args.add(streamName);

        args.add("MAXLEN");

        if (approximateTrim)
        {
            args.add("~");
        }

        args.add(String.valueOf(maxLength));

        args.add("*");

        sample.toStreamFields().forEach((field, value) ->
        {
            args.add(field);

            args.add(value);
        });

        return args;
    }

    @Override
    public Future<Void> close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return Future.succeededFuture();
        }

        try
        {
            if (ownsClient)
            {
                return redis.close()
                    .onSuccess(v -> logger.info("Redis stream publisher closed"))
                    .recover(cause ->
                    {
                        logger.warn("Error closing Redis client: {}", cause.getMessage());

                        return Future.succeededFuture();
                    });
            }

            return Future.succeededFuture();
        }
        catch (Exception exception)
        {
            logger.warn("Error closing Redis client: {}", exception.getMessage());

            return Future.succeededFuture();
        }
    }

    @Override
    public boolean isClosed()
    {
        return closed.get();
    }
}
