package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

// Every field is always written; keepalive messages carry an empty short code and null data.
@JsonPropertyOrder({"type", "short_code", "data", "timestamp"})
public record Update(
        @JsonProperty("type") @NonNull UpdateKind kind,
        @JsonProperty("short_code") @NonNull String shortCode,
        @JsonProperty("data") @Nullable Object data,
        @JsonProperty("timestamp") @NonNull Instant timestamp
) {
    public Update {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(shortCode, "shortCode");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static @NonNull Update of(@NonNull UpdateKind kind, @NonNull String shortCode, @Nullable Object data) {
        return new Update(kind, shortCode, data, Instant.now());
    }

    public static @NonNull Update ping() {
        return new Update(UpdateKind.PING, "", null, Instant.now());
    }

    public static @NonNull Update pong(@Nullable String shortCode) {
        return new Update(UpdateKind.PONG, shortCode == null ? "" : shortCode, null, Instant.now());
    }
}
