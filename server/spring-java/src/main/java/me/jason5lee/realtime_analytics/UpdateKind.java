package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.NonNull;

public enum UpdateKind {
    CLICK("click"),
    CONVERSION("conversion"),
    ANALYTICS_UPDATE("analytics_update"),
    INITIAL_ANALYTICS("initial_analytics"),
    PING("ping"),
    PONG("pong");

    private final String wireName;

    UpdateKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public @NonNull String wireName() {
        return wireName;
    }
}
