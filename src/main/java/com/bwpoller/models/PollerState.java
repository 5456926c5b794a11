package com.bwpoller.models;

/**
 * Lifecycle state of the bandwidth poller

 * State Machine:
 * IDLE → RUNNING (run() called, polling enabled)
 *      → STOPPING → STOPPED (polling disabled, or stop() before run(): nothing is polled)
 * RUNNING → STOPPING (stop() requested, in-flight cycle allowed to finish)
 * STOPPING → STOPPED (connections and stream client closed)
 */
public enum PollerState
{

    IDLE,            // Created, run() not called yet

    RUNNING,         // Cycle loop active

    STOPPING,        // Stop requested, waiting for the current cycle and teardown

    STOPPED          // Terminal

}
