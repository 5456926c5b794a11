package com.bwpoller.services.impl;

import com.bwpoller.services.QueueMappingService;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * QueueMappingServiceImpl - Implementation of QueueMappingService

 * Reads the platform's queue_mappings table (nas_device_id, queue_name, subscription_id, is_active).
 */
public class QueueMappingServiceImpl implements QueueMappingService
{

    private static final Logger logger = LoggerFactory.getLogger(QueueMappingServiceImpl.class);

    private final Pool pgPool;

    /**
     * Constructor for QueueMappingServiceImpl
     *
     * @param pgPool PostgresSQL connection pool
     */
    public QueueMappingServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<JsonObject> queueMappingGetByDevice(String deviceId)
    {
        var promise = Promise.<JsonObject>promise();

        UUID deviceUuid;

        try
        {
            deviceUuid = UUID.fromString(deviceId);
        }
        catch (IllegalArgumentException exception)
        {
            return Future.failedFuture(new IllegalArgumentException("Invalid device ID: " + deviceId));
        }

        var sql = """
                SELECT queue_name, subscription_id
                FROM queue_mappings
                WHERE nas_device_id = $1 AND is_active = true
                """;

        pgPool.preparedQuery(sql)
                .execute(Tuple.of(deviceUuid))
                .onSuccess(rows ->
                {
                    var mappings = new JsonObject();

                    for (var row : rows)
                    {
                        var queueName = row.getString("queue_name");

                        var subscriptionId = row.getUUID("subscription_id");

                        if (queueName != null && subscriptionId != null)
                        {
                            mappings.put(queueName, subscriptionId.toString());
                        }
                    }

                    promise.complete(mappings);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to load queue mappings for device {}: {}", deviceId, cause.getMessage());

                    promise.fail(cause);
                });

        return promise.future();
    }

}
