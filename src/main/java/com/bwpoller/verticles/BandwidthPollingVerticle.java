package com.bwpoller.verticles;

import com.bwpoller.core.BandwidthPoller;

import com.bwpoller.core.DeviceConnectionFactory;

import com.bwpoller.core.DevicePool;

import com.bwpoller.core.PollerConfig;

import com.bwpoller.core.RedisStreamPublisher;

import com.bwpoller.services.NasDeviceService;

import com.bwpoller.services.QueueMappingService;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Promise;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * BandwidthPollingVerticle - Deployment unit of the bandwidth poller

 * Responsibilities:
 * - Build PollerConfig from the deployment configuration
 * - Create the shared worker executor used for blocking RouterOS I/O
 * - Wire DevicePool, RedisStreamPublisher and BandwidthPoller, and run the poller
 * - On undeploy: stop the poller cooperatively, then close the worker executor
 */
public class BandwidthPollingVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(BandwidthPollingVerticle.class);

    static final String WORKER_POOL_NAME = "bandwidth-poller-worker";

    private final NasDeviceService nasDeviceService;

    private final QueueMappingService queueMappingService;

    private WorkerExecutor workerExecutor;

    private BandwidthPoller poller;

    public BandwidthPollingVerticle(NasDeviceService nasDeviceService, QueueMappingService queueMappingService)
    {
        this.nasDeviceService = nasDeviceService;

        this.queueMappingService = queueMappingService;
    }

    /**
     * Start the verticle: build configuration, wire collaborators and start the polling loop.
     *
     * @param startPromise promise completed once the loop is scheduled
     */
    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting BandwidthPollingVerticle");

            var pollerConfig = PollerConfig.fromJson(config());

            workerExecutor = vertx.createSharedWorkerExecutor(WORKER_POOL_NAME,
                    pollerConfig.workerPoolSize, pollerConfig.workerMaxExecuteSeconds, TimeUnit.SECONDS);

            var devicePool = new DevicePool(workerExecutor, nasDeviceService, queueMappingService,
                    DeviceConnectionFactory.routerOs(pollerConfig.connectionTimeoutMillis), pollerConfig);

            var publisher = new RedisStreamPublisher(vertx, pollerConfig);

            poller = new BandwidthPoller(vertx, devicePool, publisher, pollerConfig);

            poller.run()
                    .onSuccess(v -> logger.info("Polling loop finished"))
                    .onFailure(cause -> logger.error("Polling loop failed: {}", cause.getMessage()));

            logger.info("BandwidthPollingVerticle started successfully");

            startPromise.complete();
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            if (workerExecutor != null)
            {
                workerExecutor.close();
            }

            startPromise.fail(exception);
        }
    }

    /**
     * Stop the verticle: stop the poller (connections and Redis client closed), then the worker executor.
     *
     * @param stopPromise promise completed once the verticle is stopped
     */
    @Override
    public void stop(Promise<Void> stopPromise)
    {
        try
        {
            logger.info("Stopping BandwidthPollingVerticle");

            if (poller == null)
            {
                stopPromise.complete();

                return;
            }

            poller.stop()
                    .onComplete(result ->
                    {
                        if (result.failed())
                        {
                            logger.error("Poller did not stop cleanly: {}", result.cause().getMessage());
                        }

                        workerExecutor.close()
                                .onComplete(closed -> stopPromise.complete());
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in stop: {}", exception.getMessage());

            stopPromise.fail(exception);
        }
    }
}
