package com.bwpoller.core;

import me.legrange.mikrotik.ApiConnection;

import me.legrange.mikrotik.MikrotikApiException;

import javax.net.SocketFactory;

/**
 * Opens the raw RouterOS API socket for a RouterOsConnection.
 */
@FunctionalInterface
public interface RouterOsConnector
{

    ApiConnection open(String host, int port, int timeoutMillis) throws MikrotikApiException;

    /**
     * Plain TCP connector (RouterOS API service, default port 8728).
     *
     * @return connector using the default socket factory
     */
    static RouterOsConnector plain()
    {
        return (host, port, timeoutMillis) -> ApiConnection.connect(SocketFactory.getDefault(), host, port, timeoutMillis);
    }

}
