package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;

import java.util.Map;

public interface AnalyticsHub {
    void register(@NonNull ConnectionHandle handle);

    void unregister(@NonNull ConnectionHandle handle);

    void subscribe(@NonNull ConnectionHandle handle, @NonNull String shortCode);

    void unsubscribe(@NonNull ConnectionHandle handle, @NonNull String shortCode);

    /**
     * @return false if the broadcast queue is full or the hub is shut down
     */
    boolean broadcast(@NonNull Update update);

    int activeConnectionCount();

    @NonNull
    Map<String, Integer> activeSubscriptionCounts();
}
