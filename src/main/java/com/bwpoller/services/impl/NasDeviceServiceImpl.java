package com.bwpoller.services.impl;

import com.bwpoller.services.NasDeviceService;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * NasDeviceServiceImpl - Implementation of NasDeviceService

 * Reads the platform's nas_devices table. vendor and status are PostgreSQL enum
 * columns, compared as text.
 */
public class NasDeviceServiceImpl implements NasDeviceService
{

    private static final Logger logger = LoggerFactory.getLogger(NasDeviceServiceImpl.class);

    private final Pool pgPool;

    /**
     * Constructor for NasDeviceServiceImpl
     *
     * @param pgPool PostgresSQL connection pool
     */
    public NasDeviceServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<JsonArray> nasDeviceListActive(String vendor)
    {
        var promise = Promise.<JsonArray>promise();

        var sql = """
                SELECT id, name, vendor::text AS vendor, management_ip::text AS management_ip, management_port,
                       api_username, api_password
                FROM nas_devices
                WHERE vendor::text = $1 AND status::text = 'active' AND is_active = true
                ORDER BY name
                """;

        pgPool.preparedQuery(sql)
                .execute(Tuple.of(vendor))
                .onSuccess(rows ->
                {
                    var devices = new JsonArray();

                    for (var row : rows)
                    {
                        var device = new JsonObject()
                                .put("device_id", row.getUUID("id").toString())
                                .put("name", row.getString("name"))
                                .put("vendor", row.getString("vendor"))
                                .put("management_ip", row.getString("management_ip"))
                                .put("management_port", row.getInteger("management_port"))
                                .put("api_username", row.getString("api_username"))
                                .put("api_password", row.getString("api_password"));

                        devices.add(device);
                    }

                    logger.debug("Directory returned {} active {} devices", devices.size(), vendor);

                    promise.complete(devices);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to list active {} devices: {}", vendor, cause.getMessage());

                    promise.fail(cause);
                });

        return promise.future();
    }

}
