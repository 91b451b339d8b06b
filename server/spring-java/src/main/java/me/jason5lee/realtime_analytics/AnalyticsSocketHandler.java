package me.jason5lee.realtime_analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;

public class AnalyticsSocketHandler implements WebSocketHandler {
    private static final String CONNECTION_HANDLE = "connectionHandle";
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsSocketHandler.class);

    private final AnalyticsHub hub;
    private final MessageCodec codec;
    private final TaskExecutor writeExecutor;
    private final Clock clock;
    private final HubSettings settings;

    public AnalyticsSocketHandler(AnalyticsHub hub, MessageCodec codec, TaskExecutor writeExecutor,
                                  Clock clock, HubSettings settings) {
        this.hub = hub;
        this.codec = codec;
        this.writeExecutor = writeExecutor;
        this.clock = clock;
        this.settings = settings;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        ConnectionHandle handle = new ConnectionHandle(session, codec, writeExecutor, clock, settings, hub::unregister);
        putHandle(session, handle);
        hub.register(handle);
    }

    @Override
    public void handleMessage(@NonNull WebSocketSession session, @NonNull WebSocketMessage<?> message) throws Exception {
        ConnectionHandle handle = getHandle(session);
        if (handle == null) {
            return;
        }
        handle.touch();
        if (message instanceof TextMessage) {
            codec.decode(((TextMessage) message).getPayload()).ifPresent(m -> dispatch(handle, m));
        } else if (!(message instanceof PongMessage)) {
            logger.debug("Ignoring {} from {}", message.getClass().getSimpleName(), handle);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) throws Exception {
        logger.error("transport error on connection {}", session.getId(), exception);
        ConnectionHandle handle = getHandle(session);
        if (handle != null) {
            hub.unregister(handle);
            handle.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) throws Exception {
        ConnectionHandle handle = getHandle(session);
        if (handle != null) {
            hub.unregister(handle);
            handle.close(status);
        }
        logger.info("connection {} closed, status: {}", session.getId(), status);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private void dispatch(ConnectionHandle handle, ClientMessage message) {
        switch (message.kind()) {
            case SUBSCRIBE:
                hub.subscribe(handle, message.shortCode());
                break;
            case UNSUBSCRIBE:
                hub.unsubscribe(handle, message.shortCode());
                break;
            case PING:
                try {
                    handle.send(Update.pong(message.shortCode()));
                } catch (SendException e) {
                    logger.info("Failed to answer ping: {}", e.getMessage());
                    hub.unregister(handle);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled client message " + message.kind());
        }
    }

    private static void putHandle(@NonNull WebSocketSession session, @NonNull ConnectionHandle handle) {
        session.getAttributes().put(CONNECTION_HANDLE, handle);
    }

    private static ConnectionHandle getHandle(@NonNull WebSocketSession session) {
        return (ConnectionHandle) session.getAttributes().get(CONNECTION_HANDLE);
    }
}
