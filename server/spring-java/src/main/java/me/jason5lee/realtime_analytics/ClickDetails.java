package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ClickDetails(
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("client_ip") String clientIp,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("referrer") String referrer,
        @JsonProperty("country") String country,
        @JsonProperty("city") String city,
        @JsonProperty("device") String device,
        @JsonProperty("browser") String browser,
        @JsonProperty("os") String os,
        @JsonProperty("timestamp") Instant timestamp
) {
}
