package com.bwpoller.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

/**
 * NasDeviceService - Read access to the NAS device directory

 * This interface provides:
 * - Active device listing by vendor, with RouterOS API credentials
 */
public interface NasDeviceService
{

    // ========================================
    // DEVICE DIRECTORY OPERATIONS
    // ========================================

    /**
     * List active devices of one vendor
     * FILTER: vendor = <param>, status = 'active', is_active = true

     * Row layout:
     * {device_id, name, vendor, management_ip, management_port, api_username, api_password}
     *
     * @param vendor Vendor name, e.g. "mikrotik"
     * @return Future containing JsonArray of device rows
     */
    Future<JsonArray> nasDeviceListActive(String vendor);

}
