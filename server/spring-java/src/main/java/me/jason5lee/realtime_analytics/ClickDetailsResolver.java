package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public interface ClickDetailsResolver {
    @NonNull
    ClickDetails resolve(@NonNull String shortCode, @Nullable String ipAddress, @Nullable String userAgent,
                         @Nullable String referrer);
}
