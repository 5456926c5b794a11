package com.bwpoller.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

/**
 * QueueMappingService - Read access to queue-to-subscription mappings

 * This interface provides:
 * - Bulk lookup of every active mapping of a device, used once per device per refresh
 */
public interface QueueMappingService
{

    // ========================================
    // QUEUE MAPPING OPERATIONS
    // ========================================

    /**
     * Get all active mappings of a NAS device as a dictionary
     * FILTER: nas_device_id = <param>, is_active = true
     *
     * @param deviceId NAS device ID
     * @return Future containing JsonObject of queue_name -> subscription_id
     */
    Future<JsonObject> queueMappingGetByDevice(String deviceId);

}
