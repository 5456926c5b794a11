package com.bwpoller.core;

import com.bwpoller.services.NasDeviceService;

import com.bwpoller.services.QueueMappingService;

import com.bwpoller.services.impl.NasDeviceServiceImpl;

import com.bwpoller.services.impl.QueueMappingServiceImpl;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * DatabaseInitializer - One-time database setup at startup

 * Tasks performed:
 * - Creates the PostgreSQL connection pool and validates connectivity
 * - Instantiates the read-only directory services (NAS devices, queue mappings)

 * The services are handed directly to the polling verticle.
 */
public class DatabaseInitializer
{

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    private final Vertx vertx;

    private final JsonObject databaseConfig;

    private Pool pgPool;

    private NasDeviceService nasDeviceService;

    private QueueMappingService queueMappingService;

    /**
     * @param vertx Vert.x instance
     * @param databaseConfig database block of application.conf
     */
    public DatabaseInitializer(Vertx vertx, JsonObject databaseConfig)
    {
        this.vertx = vertx;

        this.databaseConfig = databaseConfig;
    }

    /**
     * Create the pool, test a connection and build the services.
     *
     * @return Future that completes when the services are ready
     */
    public Future<Void> initialize()
    {
        try
        {
            logger.info("Initializing database services");

            return setupDatabaseConnection()
                    .compose(pool ->
                    {
                        this.pgPool = pool;

                        this.nasDeviceService = new NasDeviceServiceImpl(pool);

                        this.queueMappingService = new QueueMappingServiceImpl(pool);

                        logger.info("Database initialization completed");

                        return Future.<Void>succeededFuture();
                    })
                    .onFailure(cause ->
                            logger.error("Failed to initialize database services: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in initialize: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private Future<Pool> setupDatabaseConnection()
    {
        var promise = Promise.<Pool>promise();

        try
        {
            var host = databaseConfig.getString("host", "localhost");

            var port = databaseConfig.getInteger("port", 5432);

            var database = databaseConfig.getString("database", "isp");

            var connectOptions = new PgConnectOptions()
                    .setHost(host)
                    .setPort(port)
                    .setDatabase(database)
                    .setUser(databaseConfig.getString("user", "isp"))
                    .setPassword(databaseConfig.getString("password", "isp"));

            var poolOptions = new PoolOptions()
                    .setMaxSize(databaseConfig.getInteger("maxSize", 4));

            var pool = PgBuilder.pool()
                    .with(poolOptions)
                    .connectingTo(connectOptions)
                    .using(vertx)
                    .build();

            pool.getConnection()
                    .onSuccess(connection ->
                    {
                        logger.info("Database connection established: {}:{}/{}", host, port, database);

                        connection.close();

                        promise.complete(pool);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Database connection failed: {}", cause.getMessage());

                        pool.close();

                        promise.fail(cause);
                    });
        }
        catch (Exception exception)
        {
            logger.error("Failed to setup database connection: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    public NasDeviceService getNasDeviceService()
    {
        return nasDeviceService;
    }

    public QueueMappingService getQueueMappingService()
    {
        return queueMappingService;
    }

    /**
     * Closes the database connection pool.
     *
     * @return Future that completes when cleanup is done
     */
    public Future<Void> cleanup()
    {
        if (pgPool == null)
        {
            return Future.succeededFuture();
        }

        logger.info("Cleaning up database resources");

        return pgPool.close()
                .onSuccess(v -> logger.debug("Database connection pool closed"))
                .onFailure(cause -> logger.error("Failed to close database pool: {}", cause.getMessage()));
    }
}
