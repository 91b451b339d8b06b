package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateAnalytics(
        @JsonProperty("short_code") @NonNull String shortCode,
        @JsonProperty("original_url") @Nullable String originalUrl,
        @JsonProperty("total_clicks") long totalClicks,
        @JsonProperty("created_at") @Nullable Instant createdAt,
        @JsonProperty("last_click_at") @Nullable Instant lastClickAt,
        @JsonProperty("daily_clicks") @NonNull List<DailyClicks> dailyClicks,
        @JsonProperty("country_stats") @NonNull List<CountryClicks> countryStats
) {
    public AggregateAnalytics {
        dailyClicks = dailyClicks == null ? List.of() : List.copyOf(dailyClicks);
        countryStats = countryStats == null ? List.of() : List.copyOf(countryStats);
    }

    // Sent when the store has nothing recorded for the code yet.
    public static @NonNull AggregateAnalytics empty(@NonNull String shortCode) {
        return new AggregateAnalytics(shortCode, null, 0, null, null, List.of(), List.of());
    }

    public record DailyClicks(@JsonProperty("date") String date, @JsonProperty("clicks") long clicks) {
    }

    public record CountryClicks(@JsonProperty("country_code") String countryCode, @JsonProperty("clicks") long clicks) {
    }
}
