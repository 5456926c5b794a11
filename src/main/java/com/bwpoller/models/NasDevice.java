package com.bwpoller.models;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * NAS device as read from the device directory.

 * Data Sources:
 * - nas_devices table (identity, management endpoint, API credentials)

 * Lifecycle:
 * - Built on every DevicePool refresh from the directory rows
 * - Compared against the tracked copy to decide whether a connection is kept or replaced
 */
public class NasDevice
{

    public static final int DEFAULT_API_PORT = 8728;

    // Identity
    public final String deviceId;        // nas_devices.id

    public final String name;            // nas_devices.name

    public final String vendor;          // nas_devices.vendor

    // RouterOS API endpoint
    public final String host;            // nas_devices.management_ip (CIDR suffix stripped)

    public final int port;               // nas_devices.management_port

    public final String username;        // nas_devices.api_username

    public final String password;        // nas_devices.api_password

    public NasDevice(String deviceId, String name, String vendor, String host, int port, String username, String password)
    {
        this.deviceId = deviceId;

        this.name = name;

        this.vendor = vendor;

        this.host = host;

        this.port = port;

        this.username = username;

        this.password = password;
    }

    /**
     * Builds a NasDevice from a directory row.

     * Missing management port falls back to the configured default.
     * Host values stored as "10.0.0.1/32" are reduced to the bare address.
     *
     * @param row JSON row from NasDeviceService
     * @param defaultPort port used when the row carries none
     * @return NasDevice, or null when the row has no device_id
     */
    public static NasDevice fromJson(JsonObject row, int defaultPort)
    {
        var deviceId = row.getString("device_id");

        if (deviceId == null || deviceId.isBlank())
        {
            return null;
        }

        var host = row.getString("management_ip");

        if (host != null && host.contains("/"))
        {
            host = host.split("/")[0];
        }

        var port = row.getInteger("management_port");

        return new NasDevice(
            deviceId,
            row.getString("name", deviceId),
            row.getString("vendor"),
            host,
            port != null && port > 0 ? port : defaultPort,
            row.getString("api_username"),
            row.getString("api_password"));
    }

    /**
     * A device can only be polled when host, username and password are all present.
     *
     * @return true if the device carries usable API credentials
     */
    public boolean hasCredentials()
    {
        return isPresent(host) && isPresent(username) && isPresent(password);
    }

    /**
     * Checks whether another copy of this device points at the same API endpoint with the same credentials.
     *
     * @param other device read on a later refresh
     * @return true if a connection built for this device is still valid for the other
     */
    public boolean sameEndpoint(NasDevice other)
    {
        return other != null &&

               port == other.port &&

               Objects.equals(host, other.host) &&

               Objects.equals(username, other.username) &&

               Objects.equals(password, other.password);
    }

    private static boolean isPresent(String value)
    {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString()
    {
        return name + " (" + deviceId + ") at " + host + ":" + port;
    }
}
