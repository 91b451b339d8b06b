package me.jason5lee.realtime_analytics;

import org.springframework.lang.NonNull;

import java.util.Optional;

public interface AnalyticsSnapshotProvider {
    /**
     * @return the aggregate for the last {@code windowDays} days, or empty when nothing is recorded
     * @throws AnalyticsUnavailableException when the store cannot be queried
     */
    @NonNull
    Optional<AggregateAnalytics> getAnalyticsSnapshot(@NonNull String shortCode, int windowDays)
            throws AnalyticsUnavailableException;
}
