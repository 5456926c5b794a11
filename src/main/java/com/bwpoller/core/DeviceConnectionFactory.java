package com.bwpoller.core;

import com.bwpoller.models.NasDevice;

/**
 * Creates the DeviceConnection variant for a NAS device.
 */
@FunctionalInterface
public interface DeviceConnectionFactory
{

    DeviceConnection create(NasDevice device);

    /**
     * Factory for MikroTik devices speaking the RouterOS API.
     *
     * @param timeoutMillis connect and command timeout per device
     * @return factory building RouterOsConnection instances
     */
    static DeviceConnectionFactory routerOs(int timeoutMillis)
    {
        return device -> new RouterOsConnection(device, timeoutMillis);
    }

}
