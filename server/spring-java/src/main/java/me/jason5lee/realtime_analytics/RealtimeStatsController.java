package me.jason5lee.realtime_analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/realtime")
public class RealtimeStatsController {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeStatsController.class);

    private final AnalyticsHub hub;

    public RealtimeStatsController(AnalyticsHub hub) {
        this.hub = hub;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("active_clients", hub.activeConnectionCount());
        stats.put("active_subscriptions", hub.activeSubscriptionCounts());
        return stats;
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> hubUnavailable(IllegalStateException e) {
        logger.warn("Real-time stats unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "realtime_unavailable", "message", e.getMessage()));
    }
}
