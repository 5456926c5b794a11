package com.bwpoller;

import com.bwpoller.core.DatabaseInitializer;

import com.bwpoller.core.LoggingConfigurator;

import com.bwpoller.core.PollerConfig;

import com.bwpoller.verticles.BandwidthPollingVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Bandwidth Poller Application - Main Entry Point (Vert.x 5.0.4)

 * Startup:
 * 1. Load application.conf (HOCON) merged with the environment overrides
 * 2. Configure logging
 * 3. Validate the poller configuration; exit early when polling is disabled
 * 4. Initialize the PostgreSQL pool and directory services
 * 5. Deploy BandwidthPollingVerticle

 * Shutdown (SIGTERM/SIGINT): undeploy the verticle (poller stops cooperatively,
 * device connections and Redis client closed), close the database pool, close Vert.x.
 */
public class BandwidthPollerApplication
{

    private static final Logger logger = LoggerFactory.getLogger(BandwidthPollerApplication.class);

    private static final String CONFIG_PATH_PROPERTY = "bwpoller.config";

    private static Vertx vertx;

    private static DatabaseInitializer databaseInitializer;

    private static String deploymentId;

    /**
     * Main entry point for the bandwidth poller.
     *
     * @param args Command line arguments (not used)
     */
    public static void main(String[] args)
    {
        logger.info("Starting Bandwidth Poller");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(config ->
            {
                LoggingConfigurator.configure(config);

                var pollerConfig = PollerConfig.fromJson(config);

                logger.info("Configuration loaded: {}", pollerConfig);

                if (!pollerConfig.enabled)
                {
                    logger.warn("Bandwidth polling disabled via {}, exiting", PollerConfig.ENV_POLLING_ENABLED);

                    return Future.succeededFuture(false);
                }

                return initializeDatabase(config)
                    .compose(BandwidthPollerApplication::deployPollingVerticle)
                    .map(true);
            })
            .onSuccess(started ->
            {
                if (!started)
                {
                    vertx.close()
                        .onComplete(closeResult -> logger.info("Application stopped"));

                    return;
                }

                logger.info("Bandwidth Poller started successfully");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    try
                    {
                        cleanup()
                            .compose(cleanupResult -> vertx.close())
                            .onSuccess(closeResult -> logger.info("Application stopped gracefully"))
                            .onFailure(cause -> logger.error("Error during graceful shutdown", cause))
                            .toCompletionStage()
                            .toCompletableFuture()
                            .join();
                    }
                    catch (Exception exception)
                    {
                        logger.error("Shutdown did not complete: {}", exception.getMessage());
                    }
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start Bandwidth Poller", cause);

                cleanup()
                    .compose(cleanupResult -> vertx.close())
                    .onComplete(closeResult ->
                    {
                        if (closeResult.failed())
                        {
                            logger.error("Failed to close Vertx instance", closeResult.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Initializes the database pool and directory services before the verticle is deployed.
     *
     * @param config Application configuration
     * @return Future containing the config (for chaining)
     */
    private static Future<JsonObject> initializeDatabase(JsonObject config)
    {
        databaseInitializer = new DatabaseInitializer(vertx, config.getJsonObject("database", new JsonObject()));

        return databaseInitializer.initialize()
            .map(config);
    }

    /**
     * Deploys the polling verticle with the whole configuration.
     *
     * @param config Application configuration
     * @return Future that completes when the verticle is deployed
     */
    private static Future<Void> deployPollingVerticle(JsonObject config)
    {
        logger.info("Deploying BandwidthPollingVerticle");

        var verticle = new BandwidthPollingVerticle(
            databaseInitializer.getNasDeviceService(),
            databaseInitializer.getQueueMappingService());

        return vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config))
            .onSuccess(id ->
            {
                deploymentId = id;

                logger.debug("BandwidthPollingVerticle deployed: {}", id);
            })
            .onFailure(cause -> logger.error("Failed to deploy BandwidthPollingVerticle", cause))
            .mapEmpty();
    }

    /**
     * Undeploys the verticle, then closes database resources.
     *
     * @return Future that completes when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        logger.info("Starting cleanup");

        var undeploy = deploymentId == null
            ? Future.<Void>succeededFuture()
            : vertx.undeploy(deploymentId)
                .onSuccess(v -> logger.debug("Verticle undeployed: {}", deploymentId))
                .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", deploymentId, cause));

        // The poller must release its devices before the directory pool goes away
        return undeploy
            .transform(result ->
            {
                deploymentId = null;

                var cleanupFutures = new ArrayList<Future<Void>>();

                if (databaseInitializer != null)
                {
                    cleanupFutures.add(databaseInitializer.cleanup());
                }

                return Future.join(cleanupFutures).<Void>mapEmpty();
            })
            .onFailure(cause -> logger.error("Some cleanup operations failed", cause));
    }

    /**
     * Loads application.conf (HOCON) and overlays the supported environment variables.
     *
     * @return Future containing the loaded configuration as JsonObject
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var configPath = System.getProperty(CONFIG_PATH_PROPERTY, "application.conf");

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", configPath));

        var envStore = new ConfigStoreOptions()
            .setType("env")
            .setConfig(new JsonObject().put("keys", new JsonArray()
                .add(PollerConfig.ENV_POLLING_ENABLED)
                .add(PollerConfig.ENV_POLL_INTERVAL_MS)
                .add(PollerConfig.ENV_REDIS_URL)
                .add(PollerConfig.ENV_REDIS_STREAM)));

        var options = new ConfigRetrieverOptions()
            .addStore(fileStore)
            .addStore(envStore);

        var retriever = ConfigRetriever.create(vertx, options);

        retriever.getConfig()
            .onSuccess(config ->
            {
                var dbConfig = config.getJsonObject("database", new JsonObject());

                logger.info("Configuration loaded from {} - Database: {}:{}/{}",
                    configPath,
                    dbConfig.getString("host"),
                    dbConfig.getInteger("port"),
                    dbConfig.getString("database"));

                retriever.close();

                promise.complete(config);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from {}", configPath, cause);

                retriever.close();

                promise.fail(cause);
            });

        return promise.future();
    }

}
