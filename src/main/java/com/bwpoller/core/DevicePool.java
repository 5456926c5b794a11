package com.bwpoller.core;

import com.bwpoller.models.DevicePollResult;

import com.bwpoller.models.NasDevice;

import com.bwpoller.services.NasDeviceService;

import com.bwpoller.services.QueueMappingService;

import io.vertx.core.Future;

import io.vertx.core.WorkerExecutor;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collections;

import java.util.HashMap;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

/**
 * DevicePool - Owner of every DeviceConnection and of the queue mapping snapshot

 * Responsibilities:
 * - Refresh the device set from the directory on its own interval (lazily, at cycle start)
 * - Create, replace and discard connections as devices appear, change and disappear
 * - Rebuild the queue_name -> subscription_id snapshot wholesale on every refresh
 * - Fan out counter fetches to the worker executor and gather them with per-device isolation

 * Threading:
 * - refresh(), pollAll(), close() and the connection map are confined to the caller's event loop
 * - fetchCounters()/disconnect() run on the worker executor
 * - The mapping snapshot is an immutable map swapped through a volatile reference
 */
public class DevicePool
{

    private static final Logger logger = LoggerFactory.getLogger(DevicePool.class);

    private final WorkerExecutor workerExecutor;

    private final NasDeviceService nasDeviceService;

    private final QueueMappingService queueMappingService;

    private final DeviceConnectionFactory connectionFactory;

    private final PollerConfig config;

    private final Clock clock;

    // Key: device_id, Value: live connection (event loop confined)
    private final Map<String, DeviceConnection> connections = new LinkedHashMap<>();

    // Key: device_id, Value: queue_name -> subscription_id (immutable, replaced wholesale)
    private volatile Map<String, Map<String, String>> queueMappings = Map.of();

    // null until the first successful refresh
    private Instant lastRefreshAt;

    public DevicePool(WorkerExecutor workerExecutor,
                      NasDeviceService nasDeviceService,
                      QueueMappingService queueMappingService,
                      DeviceConnectionFactory connectionFactory,
                      PollerConfig config)
    {
        this(workerExecutor, nasDeviceService, queueMappingService, connectionFactory, config, Clock.systemUTC());
    }

    public DevicePool(WorkerExecutor workerExecutor,
                      NasDeviceService nasDeviceService,
                      QueueMappingService queueMappingService,
                      DeviceConnectionFactory connectionFactory,
                      PollerConfig config,
                      Clock clock)
    {
        this.workerExecutor = workerExecutor;

        this.nasDeviceService = nasDeviceService;

        this.queueMappingService = queueMappingService;

        this.connectionFactory = connectionFactory;

        this.config = config;

        this.clock = clock;
    }

    /**
     * Refresh devices and queue mappings from the directory.

     * - New devices with credentials: connection created
     * - Devices whose endpoint or credentials changed: old connection disconnected, new one created
     * - Devices no longer active: disconnected and forgotten
     * - Unchanged devices: untouched (no reconnect)

     * On directory failure the current device set is kept and the future fails.
     *
     * @return Future completed once devices, mappings and disconnects are settled
     */
    public Future<Void> refresh()
    {
        try
        {
            return nasDeviceService.nasDeviceListActive(config.vendor)
                .compose(rows ->
                {
                    var activeDevices = new LinkedHashMap<String, NasDevice>();

                    for (var obj : rows)
                    {
                        try
                        {
                            var device = NasDevice.fromJson((JsonObject) obj, config.defaultPort);

                            if (device != null)
                            {
                                activeDevices.put(device.deviceId, device);
                            }
                            else
                            {
                                logger.error("Skipping directory row without device_id");
                            }
                        }
                        catch (Exception exception)
                        {
                            logger.error("Skipping unreadable directory row: {}", exception.getMessage());
                        }
                    }

                    var staleConnections = applyInventory(activeDevices);

                    return loadQueueMappings()
                        .compose(v -> disconnectAll(staleConnections));
                })
                .onSuccess(v ->
                {
                    lastRefreshAt = clock.instant();

                    logger.info("Device pool refreshed: {} devices, {} with queue mappings",
                        connections.size(), queueMappings.size());
                })
                .onFailure(cause ->
                        logger.error("Device pool refresh failed, keeping {} devices: {}", connections.size(), cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in refresh: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    /**
     * Reconcile the connection map with the active device set.
     *
     * @param activeDevices devices currently active in the directory
     * @return connections that must be disconnected
     */
    private List<DeviceConnection> applyInventory(Map<String, NasDevice> activeDevices)
    {
        var stale = new ArrayList<DeviceConnection>();

        var added = 0;

        var replaced = 0;

        // Remove connections for devices that are no longer active
        var iterator = connections.entrySet().iterator();

        while (iterator.hasNext())
        {
            var entry = iterator.next();

            if (!activeDevices.containsKey(entry.getKey()))
            {
                stale.add(entry.getValue());

                iterator.remove();
            }
        }

        var removed = stale.size();

        for (var device : activeDevices.values())
        {
            var existing = connections.get(device.deviceId);

            if (existing != null && existing.getDevice().sameEndpoint(device))
            {
                continue;
            }

            if (!device.hasCredentials())
            {
                if (existing != null)
                {
                    stale.add(connections.remove(device.deviceId));

                    removed++;
                }

                logger.warn("Device {} has no API credentials or management IP, not polling it", device.deviceId);

                continue;
            }

            if (existing != null)
            {
                stale.add(existing);

                replaced++;

                logger.info("Device {} endpoint or credentials changed, reconnecting", device.deviceId);
            }
            else
            {
                added++;
            }

            connections.put(device.deviceId, connectionFactory.create(device));
        }

        if (added > 0 || replaced > 0 || removed > 0)
        {
            logger.info("Device set changed: {} added, {} replaced, {} removed", added, replaced, removed);
        }

        return stale;
    }

    /**
     * Load mappings for every tracked device and swap the snapshot in one assignment.
     * A device whose mapping cannot be loaded keeps its previous mapping.
     */
    private Future<Void> loadQueueMappings()
    {
        var previous = queueMappings;

        var loads = new LinkedHashMap<String, Future<Map<String, String>>>();

        for (var deviceId : connections.keySet())
        {
            loads.put(deviceId, queueMappingService.queueMappingGetByDevice(deviceId)
                .map(DevicePool::toMapping)
                .recover(cause ->
                {
                    logger.warn("Failed to load queue mappings for device {}, keeping previous: {}", deviceId, cause.getMessage());

                    return Future.succeededFuture(previous.getOrDefault(deviceId, Map.of()));
                }));
        }

        return Future.all(new ArrayList<>(loads.values()))
            .map(done ->
            {
                var snapshot = new HashMap<String, Map<String, String>>();

                loads.forEach((deviceId, load) -> snapshot.put(deviceId, load.result()));

                queueMappings = Collections.unmodifiableMap(snapshot);

                return null;
            });
    }

    private static Map<String, String> toMapping(JsonObject json)
    {
        var mapping = new HashMap<String, String>();

        for (var entry : json)
        {
            if (entry.getValue() != null)
            {
                mapping.put(entry.getKey(), entry.getValue().toString());
            }
        }

        return Collections.unmodifiableMap(mapping);
    }

    /**
     * @return true if the pool never refreshed or the refresh interval has elapsed
     */
    public boolean isRefreshDue()
    {
        var refreshedAt = lastRefreshAt;

        if (refreshedAt == null)
        {
            return true;
        }

        var elapsed = Duration.between(refreshedAt, clock.instant());

        return elapsed.compareTo(Duration.ofSeconds(config.refreshIntervalSeconds)) >= 0;
    }

    /**
     * Poll every eligible device concurrently.

     * - Refreshes first when the refresh interval has elapsed (a failed refresh does not fail the poll)
     * - Skips devices still in backoff
     * - A device that throws or whose worker fails yields an empty result, never failing the others
     *
     * @return Future with results of devices that returned at least one queue
     */
    public Future<List<DevicePollResult>> pollAll()
    {
        var refreshFuture = isRefreshDue()
            ? refresh().recover(cause -> Future.<Void>succeededFuture())
            : Future.<Void>succeededFuture();

        return refreshFuture.compose(v -> pollConnections());
    }

    private Future<List<DevicePollResult>> pollConnections()
    {
        var polls = new ArrayList<Future<DevicePollResult>>();

        for (var entry : connections.entrySet())
        {
            var deviceId = entry.getKey();

            var connection = entry.getValue();

            if (!connection.shouldRetry())
            {
                logger.debug("Device {} in backoff after {} failures", deviceId, connection.getConsecutiveFailures());

                continue;
            }

            polls.add(workerExecutor.executeBlocking(() -> new DevicePollResult(deviceId, connection.fetchCounters()), false)
                .recover(cause ->
                {
                    logger.error("Polling error for device {}: {}", deviceId, cause.getMessage());

                    return Future.succeededFuture(new DevicePollResult(deviceId, List.of()));
                }));
        }

        if (polls.isEmpty())
        {
            return Future.succeededFuture(List.of());
        }

        return Future.all(new ArrayList<>(polls))
            .map(done ->
            {
                var results = new ArrayList<DevicePollResult>();

                for (var poll : polls)
                {
                    var result = poll.result();

                    if (result.counters != null && !result.counters.isEmpty())
                    {
                        results.add(result);
                    }
                }

                return results;
            });
    }

    /**
     * Resolve a queue to its subscription against the current snapshot.
     *
     * @param deviceId device the queue was read from
     * @param queueName queue name on the device
     * @return subscription ID, or null when unmapped
     */
    public String resolveSubscription(String deviceId, String queueName)
    {
        if (deviceId == null || queueName == null)
        {
            return null;
        }

        var mapping = queueMappings.get(deviceId);

        return mapping == null ? null : mapping.get(queueName);
    }

    /**
     * Disconnect every connection and forget all devices and mappings.
     *
     * @return Future completed once every disconnect has run
     */
    public Future<Void> close()
    {
        var all = new ArrayList<>(connections.values());

        connections.clear();

        queueMappings = Map.of();

        lastRefreshAt = null;

        return disconnectAll(all)
            .onSuccess(v -> logger.info("Device pool closed: {} connections released", all.size()));
    }

    private Future<Void> disconnectAll(List<DeviceConnection> toDisconnect)
    {
        if (toDisconnect.isEmpty())
        {
            return Future.succeededFuture();
        }

        var disconnects = new ArrayList<Future<Void>>();

        for (var connection : toDisconnect)
        {
            disconnects.add(workerExecutor.<Void>executeBlocking(() ->
                {
                    connection.disconnect();

                    return null;
                }, false)
                .recover(cause ->
                {
                    logger.warn("Failed to disconnect device {}: {}", connection.getDevice().deviceId, cause.getMessage());

                    return Future.succeededFuture();
                }));
        }

        return Future.all(new ArrayList<>(disconnects)).mapEmpty();
    }

    public int getDeviceCount()
    {
        return connections.size();
    }

    public int getOpenConnectionCount()
    {
        return (int) connections.values().stream().filter(DeviceConnection::isConnected).count();
    }
}
