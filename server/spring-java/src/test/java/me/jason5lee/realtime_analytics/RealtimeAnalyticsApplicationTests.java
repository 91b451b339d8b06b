package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static me.jason5lee.realtime_analytics.RecordingSession.awaitTrue;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RealtimeAnalyticsApplicationTests {
    private static final String IPHONE_SAFARI = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_4 like Mac OS X) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Mobile/15E148 Safari/604.1";

    private final ObjectMapper mapper = new ObjectMapper();

    @LocalServerPort
    private int port;
    @Autowired
    private RealtimeEventPublisher publisher;
    @Autowired
    private AnalyticsHub hub;
    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void subscriberReceivesSnapshotThenLiveClicks() throws Exception {
        BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        WebSocketSession client = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
                        inbox.add(mapper.readTree(message.getPayload()));
                    }
                }, "ws://localhost:" + port + "/api/v1/realtime/ws")
                .get(5, TimeUnit.SECONDS);
        try {
            client.sendMessage(new TextMessage("{\"type\":\"subscribe\",\"short_code\":\"abc123\"}"));

            JsonNode initial = inbox.poll(5, TimeUnit.SECONDS);
            assertNotNull(initial);
            assertEquals("initial_analytics", initial.path("type").asText());
            assertEquals(0, initial.path("data").path("total_clicks").asLong());

            assertTrue(publisher.broadcastClick("abc123", "203.0.113.7", IPHONE_SAFARI, "https://news.example"));

            JsonNode click = inbox.poll(5, TimeUnit.SECONDS);
            assertNotNull(click);
            assertEquals("click", click.path("type").asText());
            assertEquals("abc123", click.path("short_code").asText());
            assertEquals("mobile", click.path("data").path("device").asText());
            assertEquals("iOS", click.path("data").path("os").asText());

            JsonNode stats = mapper.readTree(restTemplate.getForObject("/api/v1/realtime/stats", String.class));
            assertEquals(1, stats.path("active_clients").asInt());
            assertEquals(1, stats.path("active_subscriptions").path("abc123").asInt());
        } finally {
            client.close();
        }

        awaitTrue("hub dropped the closed client", () -> hub.activeConnectionCount() == 0);
        assertTrue(hub.activeSubscriptionCounts().isEmpty());
    }
}
