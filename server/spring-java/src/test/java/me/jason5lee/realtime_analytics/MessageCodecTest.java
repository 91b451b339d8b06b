package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {
    private final MessageCodec codec = new MessageCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decodesSubscribeAndUnsubscribe() {
        assertEquals(Optional.of(ClientMessage.subscribe("abc123")),
                codec.decode("{\"type\":\"subscribe\",\"short_code\":\"abc123\"}"));
        assertEquals(Optional.of(ClientMessage.unsubscribe("abc123")),
                codec.decode("{\"type\":\"unsubscribe\",\"short_code\":\"abc123\"}"));
    }

    @Test
    void pingNeedsNoShortCode() {
        assertEquals(Optional.of(ClientMessage.ping(null)), codec.decode("{\"type\":\"ping\"}"));
    }

    @Test
    void ignoresUnknownTypes() {
        assertTrue(codec.decode("{\"type\":\"shout\",\"short_code\":\"abc123\"}").isEmpty());
        assertTrue(codec.decode("{\"short_code\":\"abc123\"}").isEmpty());
    }

    @Test
    void ignoresMalformedFrames() {
        assertTrue(codec.decode("not json at all").isEmpty());
        assertTrue(codec.decode("[\"subscribe\"]").isEmpty());
        assertTrue(codec.decode("").isEmpty());
    }

    @Test
    void subscribeWithoutShortCodeIsIgnored() {
        assertTrue(codec.decode("{\"type\":\"subscribe\"}").isEmpty());
        assertTrue(codec.decode("{\"type\":\"subscribe\",\"short_code\":\"  \"}").isEmpty());
        assertTrue(codec.decode("{\"type\":\"unsubscribe\",\"short_code\":42}").isEmpty());
    }

    @Test
    void encodesWireFieldNamesAndRfc3339Timestamp() throws Exception {
        Update update = new Update(UpdateKind.ANALYTICS_UPDATE, "abc123", AggregateAnalytics.empty("abc123"),
                Instant.parse("2024-05-01T10:15:30Z"));

        JsonNode json = mapper.readTree(codec.encode(update).getPayload());

        assertEquals("analytics_update", json.path("type").asText());
        assertEquals("abc123", json.path("short_code").asText());
        assertEquals("2024-05-01T10:15:30Z", json.path("timestamp").asText());
        assertEquals(0, json.path("data").path("total_clicks").asLong());
        assertFalse(json.path("data").has("original_url"));
    }

    @Test
    void keepaliveMessagesCarryEveryField() throws Exception {
        JsonNode pong = mapper.readTree(codec.encode(Update.pong(null)).getPayload());
        JsonNode ping = mapper.readTree(codec.encode(Update.ping()).getPayload());

        assertEquals("pong", pong.path("type").asText());
        assertEquals("", pong.path("short_code").asText());
        assertTrue(pong.has("data"));
        assertTrue(pong.path("data").isNull());
        assertEquals("", ping.path("short_code").asText());
        assertFalse(ping.path("timestamp").asText().isEmpty());
    }

    @Test
    void unserializableDataIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> codec.encode(Update.of(UpdateKind.CLICK, "abc123", new Object())));
    }
}
