package me.jason5lee.realtime_analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

public class ConnectionHandle {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandle.class);

    private final WebSocketSession session;
    private final MessageCodec codec;
    private final TaskExecutor writeExecutor;
    private final Clock clock;
    private final Duration writeTimeout;
    private final Duration readTimeout;
    private final Consumer<ConnectionHandle> onWriteFailure;
    private final BlockingQueue<WebSocketMessage<?>> outbound;
    // At most one write-executor task drains the buffer.
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Instant lastSeen;
    private volatile Instant writeStartedAt;

    public ConnectionHandle(@NonNull WebSocketSession session, @NonNull MessageCodec codec,
                            @NonNull TaskExecutor writeExecutor, @NonNull Clock clock,
                            @NonNull HubSettings settings, @NonNull Consumer<ConnectionHandle> onWriteFailure) {
        this.session = session;
        this.codec = codec;
        this.writeExecutor = writeExecutor;
        this.clock = clock;
        this.writeTimeout = settings.writeTimeout();
        this.readTimeout = settings.readTimeout();
        this.onWriteFailure = onWriteFailure;
        this.outbound = new ArrayBlockingQueue<>(settings.outboundBufferSize());
        this.lastSeen = clock.instant();
    }

    public @NonNull String id() {
        return session.getId();
    }

    public void send(@NonNull Update update) throws SendException {
        send(codec.encode(update));
    }

    public void send(@NonNull TextMessage message) throws SendException {
        checkWritable();
        offer(message);
        scheduleDrain();
    }

    // JSON ping for clients that only look at text frames, protocol ping so browsers answer with a pong.
    public void ping() throws SendException {
        checkWritable();
        offer(codec.encode(Update.ping()));
        offer(new PingMessage());
        scheduleDrain();
    }

    public void touch() {
        lastSeen = clock.instant();
    }

    public boolean isExpired(@NonNull Instant now) {
        return now.isAfter(lastSeen.plus(readTimeout));
    }

    public boolean isWriteStalled(@NonNull Instant now) {
        Instant started = writeStartedAt;
        return started != null && now.isAfter(started.plus(writeTimeout));
    }

    public boolean isClosed() {
        return closed.get() || !session.isOpen();
    }

    public void close(@NonNull CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeSession(status);
    }

    // Closing writes a close frame, which can block as long as any other write.
    public void closeAsync(@NonNull CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            writeExecutor.execute(() -> closeSession(status));
        } catch (TaskRejectedException e) {
            // Only during shutdown, once the write executor is gone.
            closeSession(status);
        }
    }

    private void checkWritable() throws SendException {
        if (isClosed()) {
            throw new SendException(id(), "connection is closed");
        }
        if (isWriteStalled(clock.instant())) {
            throw new SendException(id(), "write stalled for more than " + writeTimeout.toMillis() + " ms");
        }
    }

    private void offer(WebSocketMessage<?> message) throws SendException {
        if (!outbound.offer(message)) {
            throw new SendException(id(), "outbound buffer is full");
        }
    }

    private void scheduleDrain() throws SendException {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            writeExecutor.execute(this::drain);
        } catch (TaskRejectedException e) {
            draining.set(false);
            throw new SendException(id(), "write executor rejected the message", e);
        }
    }

    private void drain() {
        try {
            while (true) {
                WebSocketMessage<?> message = outbound.poll();
                if (message == null) {
                    draining.set(false);
                    // A sender may have queued after the poll but before the flag was cleared.
                    if (outbound.isEmpty() || !draining.compareAndSet(false, true)) {
                        return;
                    }
                    continue;
                }
                writeStartedAt = clock.instant();
                try {
                    session.sendMessage(message);
                } finally {
                    writeStartedAt = null;
                }
            }
        } catch (IOException | RuntimeException e) {
            // draining stays set: nothing is written to this connection again.
            outbound.clear();
            logger.info("Write to connection {} failed: {}", id(), e.getMessage());
            onWriteFailure.accept(this);
            close(CloseStatus.SESSION_NOT_RELIABLE);
        }
    }

    private void closeSession(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to close connection {}", id(), e);
        }
    }

    @Override
    public String toString() {
        return "ConnectionHandle{" + id() + "}";
    }
}
