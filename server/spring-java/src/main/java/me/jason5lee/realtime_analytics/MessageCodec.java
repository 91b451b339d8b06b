package me.jason5lee.realtime_analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.TextMessage;

import java.util.Optional;

public class MessageCodec {
    private static final Logger logger = LoggerFactory.getLogger(MessageCodec.class);

    private final ObjectMapper mapper;

    public MessageCodec() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public @NonNull TextMessage encode(@NonNull Update update) {
        try {
            return new TextMessage(mapper.writeValueAsString(update));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + update.kind().wireName() + " update", e);
        }
    }

    public @NonNull Optional<ClientMessage> decode(@NonNull String payload) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring malformed client message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        String type = root.path("type").asText("");
        JsonNode codeNode = root.get("short_code");
        String shortCode = codeNode != null && codeNode.isTextual() && !codeNode.asText().isBlank()
                ? codeNode.asText()
                : null;

        switch (type) {
            case "subscribe":
                return shortCode == null ? Optional.empty() : Optional.of(ClientMessage.subscribe(shortCode));
            case "unsubscribe":
                return shortCode == null ? Optional.empty() : Optional.of(ClientMessage.unsubscribe(shortCode));
            case "ping":
                return Optional.of(ClientMessage.ping(shortCode));
            default:
                logger.debug("Ignoring client message of unknown type '{}'", type);
                return Optional.empty();
        }
    }
}
