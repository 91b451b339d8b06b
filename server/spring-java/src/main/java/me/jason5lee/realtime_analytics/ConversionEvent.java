package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversionEvent(
        @JsonProperty("conversion_id") String conversionId,
        @JsonProperty("short_code") String shortCode,
        @JsonProperty("goal_id") Long goalId,
        @JsonProperty("conversion_type") String conversionType,
        @JsonProperty("conversion_value") BigDecimal conversionValue,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("conversion_time") Instant conversionTime,
        @JsonProperty("attribution_model") String attributionModel
) {
}
