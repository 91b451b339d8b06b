package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public class RealtimeEventPublisher {
    private final AnalyticsHub hub;
    private final ClickDetailsResolver clickDetailsResolver;

    public RealtimeEventPublisher(@NonNull AnalyticsHub hub, @NonNull ClickDetailsResolver clickDetailsResolver) {
        this.hub = hub;
        this.clickDetailsResolver = clickDetailsResolver;
    }

    public boolean broadcastClick(@NonNull String shortCode, @Nullable String ipAddress, @Nullable String userAgent,
                                  @Nullable String referrer) {
        ClickDetails details = clickDetailsResolver.resolve(shortCode, ipAddress, userAgent, referrer);
        return hub.broadcast(Update.of(UpdateKind.CLICK, shortCode, details));
    }

    public boolean broadcastConversion(@NonNull String shortCode, @NonNull ConversionEvent conversion) {
        return hub.broadcast(Update.of(UpdateKind.CONVERSION, shortCode, conversion));
    }
}
