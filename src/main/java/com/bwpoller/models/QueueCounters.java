package com.bwpoller.models;

/**
 * Counters of one RouterOS simple queue as read in a single fetch.

 * RouterOS reports every counter as an "rx/tx" pair:
 * - rate: current throughput in bytes per second
 * - bytes: total bytes since the queue counters were reset
 * - packets: total packets since the queue counters were reset
 */
public class QueueCounters
{

    public final String name;       // queue name, e.g. "pppoe-alice"

    public final String target;     // queue target, e.g. "10.10.0.15/32"

    public final long rateRx;       // bytes per second

    public final long rateTx;       // bytes per second

    public final long bytesRx;

    public final long bytesTx;

    public final long packetsRx;

    public final long packetsTx;

    public QueueCounters(String name, String target, long rateRx, long rateTx,
                         long bytesRx, long bytesTx, long packetsRx, long packetsTx)
    {
        this.name = name;

        this.target = target;

        this.rateRx = rateRx;

        this.rateTx = rateTx;

        this.bytesRx = bytesRx;

        this.bytesTx = bytesTx;

        this.packetsRx = packetsRx;

        this.packetsTx = packetsTx;
    }

    @Override
    public String toString()
    {
        return name + " rate=" + rateRx + "/" + rateTx;
    }
}
