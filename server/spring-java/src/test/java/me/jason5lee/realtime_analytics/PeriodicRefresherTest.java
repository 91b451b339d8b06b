package me.jason5lee.realtime_analytics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PeriodicRefresherTest {
    @Mock
    private AnalyticsHub hub;
    @Mock
    private AnalyticsSnapshotProvider snapshotProvider;

    @Test
    void refreshesEverySubscribedTopicWithOneDayWindow() throws Exception {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("abc123", 2);
        counts.put("xyz999", 1);
        when(hub.activeSubscriptionCounts()).thenReturn(counts);
        AggregateAnalytics abc = AggregateAnalytics.empty("abc123");
        when(snapshotProvider.getAnalyticsSnapshot("abc123", 1)).thenReturn(Optional.of(abc));
        when(snapshotProvider.getAnalyticsSnapshot("xyz999", 1)).thenReturn(Optional.empty());
        PeriodicRefresher refresher = new PeriodicRefresher(hub, snapshotProvider, new SyncTaskExecutor(),
                HubSettings.defaults());

        assertEquals(2, refresher.refresh());

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(hub, times(2)).broadcast(captor.capture());
        assertEquals(UpdateKind.ANALYTICS_UPDATE, captor.getAllValues().get(0).kind());
        assertSame(abc, captor.getAllValues().get(0).data());
        assertEquals("xyz999", captor.getAllValues().get(1).shortCode());
        assertEquals(0, ((AggregateAnalytics) captor.getAllValues().get(1).data()).totalClicks());
    }

    @Test
    void failedFetchSkipsOnlyThatTopic() throws Exception {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("down", 1);
        counts.put("up", 1);
        when(hub.activeSubscriptionCounts()).thenReturn(counts);
        when(snapshotProvider.getAnalyticsSnapshot("down", 1))
                .thenThrow(new AnalyticsUnavailableException("timeout"));
        when(snapshotProvider.getAnalyticsSnapshot("up", 1)).thenReturn(Optional.empty());
        PeriodicRefresher refresher = new PeriodicRefresher(hub, snapshotProvider, new SyncTaskExecutor(),
                HubSettings.defaults());

        refresher.refresh();

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(hub).broadcast(captor.capture());
        assertEquals("up", captor.getValue().shortCode());
    }

    @Test
    void saturatedExecutorSkipsTheCycle() {
        when(hub.activeSubscriptionCounts()).thenReturn(Map.of("abc123", 1));
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("queue full");
        };
        PeriodicRefresher refresher = new PeriodicRefresher(hub, snapshotProvider, rejecting, HubSettings.defaults());

        assertEquals(0, refresher.refresh());
        verify(hub, never()).broadcast(any());
    }

    @Test
    void nothingToDoWithoutSubscribers() {
        when(hub.activeSubscriptionCounts()).thenReturn(Map.of());
        PeriodicRefresher refresher = new PeriodicRefresher(hub, snapshotProvider, new SyncTaskExecutor(),
                HubSettings.defaults());

        assertEquals(0, refresher.refresh());
        verify(hub, never()).broadcast(any());
    }
}
