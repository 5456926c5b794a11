package com.bwpoller.utils;

import com.bwpoller.models.QueueCounters;

import java.util.Map;

/**
 * CounterParser - Parsing of RouterOS "rx/tx" counter strings

 * RouterOS reports simple queue counters as slash-separated pairs:
 * - rate    = "12500/67000"     (bytes per second)
 * - bytes   = "1048576/5242880"
 * - packets = "1024/4096"

 * Parsing rules:
 * - Only plain ASCII digit runs are numbers; anything else ("", "-1", "1.5", " 7") is 0
 * - Values that overflow a long are 0
 * - A missing half is 0
 * - Never throws
 */
public class CounterParser
{

    private static final String EMPTY_PAIR = "0/0";

    /**
     * Parse an "rx/tx" counter string.
     *
     * @param raw counter string as returned by the device, may be null
     * @return two-element array {rx, tx}
     */
    public static long[] parsePair(String raw)
    {
        var pair = new long[2];

        if (raw == null || raw.isEmpty())
        {
            return pair;
        }

        var parts = raw.split("/", -1);

        pair[0] = parseCounter(parts[0]);

        if (parts.length > 1)
        {
            pair[1] = parseCounter(parts[1]);
        }

        return pair;
    }

    /**
     * Parse a single counter token.
     *
     * @param token counter token
     * @return counter value, or 0 when the token is not a plain non-negative integer
     */
    public static long parseCounter(String token)
    {
        if (token == null || token.isEmpty())
        {
            return 0;
        }

        for (var i = 0; i < token.length(); i++)
        {
            var c = token.charAt(i);

            if (c < '0' || c > '9')
            {
                return 0;
            }
        }

        try
        {
            return Long.parseLong(token);
        }
        catch (NumberFormatException exception)
        {
            // more than 19 digits
            return 0;
        }
    }

    /**
     * Build QueueCounters from one row of "/queue/simple/print".
     *
     * @param row attribute map of a simple queue
     * @return parsed QueueCounters
     */
    public static QueueCounters toQueueCounters(Map<String, String> row)
    {
        var rate = parsePair(row.getOrDefault("rate", EMPTY_PAIR));

        var bytes = parsePair(row.getOrDefault("bytes", EMPTY_PAIR));

        var packets = parsePair(row.getOrDefault("packets", EMPTY_PAIR));

        return new QueueCounters(
            row.getOrDefault("name", ""),
            row.getOrDefault("target", ""),
            rate[0], rate[1],
            bytes[0], bytes[1],
            packets[0], packets[1]);
    }

}
