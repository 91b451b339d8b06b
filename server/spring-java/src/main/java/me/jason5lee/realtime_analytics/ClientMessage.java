package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public record ClientMessage(@NonNull Kind kind, @Nullable String shortCode) {
    public enum Kind {
        SUBSCRIBE,
        UNSUBSCRIBE,
        PING
    }

    public static @NonNull ClientMessage subscribe(@NonNull String shortCode) {
        return new ClientMessage(Kind.SUBSCRIBE, shortCode);
    }

    public static @NonNull ClientMessage unsubscribe(@NonNull String shortCode) {
        return new ClientMessage(Kind.UNSUBSCRIBE, shortCode);
    }

    public static @NonNull ClientMessage ping(@Nullable String shortCode) {
        return new ClientMessage(Kind.PING, shortCode);
    }
}
