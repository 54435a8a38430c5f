package com.hivestate.core.cache;

import java.time.Instant;
import java.util.Map;

/**
 * Result of an ephemeral store health check.
 *
 * @param timestamp when the check ran
 * @param connected whether PING answered
 * @param enabled   false when the store is switched off by configuration
 * @param pingMs    PING round trip
 * @param streams   per stream length and consumer group count
 * @param error     failure detail when not connected
 */
public record EphemeralStoreHealth(
    Instant timestamp,
    boolean connected,
    boolean enabled,
    double pingMs,
    Map<String, StreamInfo> streams,
    String error
) {

    public record StreamInfo(long length, int groups) {}

    public EphemeralStoreHealth {
        streams = streams == null ? Map.of() : Map.copyOf(streams);
    }

    public static EphemeralStoreHealth down(Instant timestamp, boolean enabled, String error) {
        return new EphemeralStoreHealth(timestamp, false, enabled, 0, Map.of(), error);
    }
}
