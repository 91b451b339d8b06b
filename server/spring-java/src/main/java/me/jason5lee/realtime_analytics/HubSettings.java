package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.Objects;

public record HubSettings(
        @NonNull Duration writeTimeout,
        @NonNull Duration readTimeout,
        @NonNull Duration pingInterval,
        @NonNull Duration refreshInterval,
        int broadcastQueueCapacity,
        int commandQueueCapacity,
        int outboundBufferSize,
        int initialWindowDays,
        int refreshWindowDays,
        @NonNull Duration queryTimeout
) {
    public HubSettings {
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(pingInterval, "pingInterval");
        Objects.requireNonNull(refreshInterval, "refreshInterval");
        Objects.requireNonNull(queryTimeout, "queryTimeout");
        if (broadcastQueueCapacity <= 0) {
            throw new IllegalArgumentException("broadcastQueueCapacity must be positive, got " + broadcastQueueCapacity);
        }
        if (commandQueueCapacity <= 0) {
            throw new IllegalArgumentException("commandQueueCapacity must be positive, got " + commandQueueCapacity);
        }
        if (outboundBufferSize < 2) {
            // A keepalive is two frames.
            throw new IllegalArgumentException("outboundBufferSize must be at least 2, got " + outboundBufferSize);
        }
        if (initialWindowDays <= 0 || refreshWindowDays <= 0) {
            throw new IllegalArgumentException("analytics windows must be at least one day");
        }
    }

    public static @NonNull HubSettings defaults() {
        return new HubSettings(
                Duration.ofSeconds(1),
                Duration.ofSeconds(60),
                Duration.ofSeconds(54),
                Duration.ofSeconds(30),
                1000,
                10000,
                64,
                30,
                1,
                Duration.ofSeconds(2)
        );
    }

    public @NonNull HubSettings withBroadcastQueueCapacity(int capacity) {
        return new HubSettings(writeTimeout, readTimeout, pingInterval, refreshInterval, capacity,
                commandQueueCapacity, outboundBufferSize, initialWindowDays, refreshWindowDays, queryTimeout);
    }

    public @NonNull HubSettings withCommandQueueCapacity(int capacity) {
        return new HubSettings(writeTimeout, readTimeout, pingInterval, refreshInterval, broadcastQueueCapacity,
                capacity, outboundBufferSize, initialWindowDays, refreshWindowDays, queryTimeout);
    }

    public @NonNull HubSettings withOutboundBufferSize(int size) {
        return new HubSettings(writeTimeout, readTimeout, pingInterval, refreshInterval, broadcastQueueCapacity,
                commandQueueCapacity, size, initialWindowDays, refreshWindowDays, queryTimeout);
    }

    public @NonNull HubSettings withTimeouts(@NonNull Duration write, @NonNull Duration read) {
        return new HubSettings(write, read, pingInterval, refreshInterval, broadcastQueueCapacity,
                commandQueueCapacity, outboundBufferSize, initialWindowDays, refreshWindowDays, queryTimeout);
    }

    public @NonNull HubSettings withQueryTimeout(@NonNull Duration timeout) {
        return new HubSettings(writeTimeout, readTimeout, pingInterval, refreshInterval, broadcastQueueCapacity,
                commandQueueCapacity, outboundBufferSize, initialWindowDays, refreshWindowDays, timeout);
    }
}
