package me.jason5lee.realtime_analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.NonNull;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class PeriodicRefresher {
    private static final Logger logger = LoggerFactory.getLogger(PeriodicRefresher.class);

    private final AnalyticsHub hub;
    private final AnalyticsSnapshotProvider snapshotProvider;
    private final TaskExecutor snapshotExecutor;
    private final HubSettings settings;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "analytics-refresher");
        thread.setDaemon(true);
        return thread;
    });

    public PeriodicRefresher(@NonNull AnalyticsHub hub, @NonNull AnalyticsSnapshotProvider snapshotProvider,
                             @NonNull TaskExecutor snapshotExecutor, @NonNull HubSettings settings) {
        this.hub = hub;
        this.snapshotProvider = snapshotProvider;
        this.snapshotExecutor = snapshotExecutor;
        this.settings = settings;
    }

    public void start() {
        long periodMs = settings.refreshInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::refreshQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    // Returns the number of topics a fetch was started for.
    public int refresh() {
        Set<String> topics = hub.activeSubscriptionCounts().keySet();
        int started = 0;
        for (String shortCode : topics) {
            try {
                snapshotExecutor.execute(() -> refreshTopic(shortCode));
                started++;
            } catch (TaskRejectedException e) {
                logger.warn("Skipping analytics refresh for {}: snapshot executor is saturated", shortCode);
            }
        }
        if (started > 0) {
            logger.debug("Started analytics refresh for {} topics", started);
        }
        return started;
    }

    // An exception escaping a scheduled task would cancel every later run.
    private void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) {
            logger.warn("Analytics refresh cycle skipped: {}", e.getMessage());
        }
    }

    private void refreshTopic(String shortCode) {
        Optional<AggregateAnalytics> snapshot;
        try {
            snapshot = snapshotProvider.getAnalyticsSnapshot(shortCode, settings.refreshWindowDays());
        } catch (AnalyticsUnavailableException | RuntimeException e) {
            logger.warn("Skipping analytics refresh for {}: {}", shortCode, e.getMessage());
            return;
        }
        hub.broadcast(Update.of(UpdateKind.ANALYTICS_UPDATE, shortCode,
                snapshot.orElseGet(() -> AggregateAnalytics.empty(shortCode))));
    }
}
