package me.jason5lee.realtime_analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Supplier;

/**
 * A connection unsubscribing while a broadcast for the same topic is being dispatched may or may
 * not receive that update: the unsubscribe is applied either before or after the whole dispatch.
 */
public class AnalyticsHubImpl implements AnalyticsHub {
    private static final Logger logger = LoggerFactory.getLogger(AnalyticsHubImpl.class);
    private static final long IDLE_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final AnalyticsSnapshotProvider snapshotProvider;
    private final TaskExecutor snapshotExecutor;
    private final MessageCodec codec;
    private final Clock clock;
    private final HubSettings settings;

    private final BlockingQueue<Runnable> commands;
    private final BlockingQueue<Update> broadcasts;
    private final AtomicLong droppedBroadcasts = new AtomicLong();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final ScheduledExecutorService keepaliveScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "analytics-hub-keepalive");
        thread.setDaemon(true);
        return thread;
    });
    private volatile Thread loopThread;

    // Loop thread only.
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final SubscriptionIndex index = new SubscriptionIndex();

    public AnalyticsHubImpl(@NonNull AnalyticsSnapshotProvider snapshotProvider, @NonNull TaskExecutor snapshotExecutor,
                            @NonNull MessageCodec codec, @NonNull Clock clock, @NonNull HubSettings settings) {
        this.snapshotProvider = snapshotProvider;
        this.snapshotExecutor = snapshotExecutor;
        this.codec = codec;
        this.clock = clock;
        this.settings = settings;
        this.commands = new ArrayBlockingQueue<>(settings.commandQueueCapacity());
        this.broadcasts = new ArrayBlockingQueue<>(settings.broadcastQueueCapacity());
    }

    public synchronized void start() {
        if (loopThread != null) {
            return;
        }
        Thread thread = new Thread(this::runLoop, "analytics-hub");
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();

        long pingMs = settings.pingInterval().toMillis();
        if (pingMs > 0) {
            keepaliveScheduler.scheduleAtFixedRate(this::requestKeepaliveSweep, pingMs, pingMs, TimeUnit.MILLISECONDS);
        }
    }

    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        keepaliveScheduler.shutdownNow();

        Thread thread = loopThread;
        if (thread == null) {
            commands.clear();
            broadcasts.clear();
            stopped.countDown();
            return;
        }
        LockSupport.unpark(thread);
        try {
            if (!stopped.await(settings.queryTimeout().toMillis() * 5, TimeUnit.MILLISECONDS)) {
                logger.warn("Analytics hub did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void register(@NonNull ConnectionHandle handle) {
        if (!enqueue(() -> doRegister(handle))) {
            logger.warn("Refusing connection {}: analytics hub is not accepting commands", handle.id());
            handle.closeAsync(accepting.get() ? CloseStatus.SERVICE_OVERLOAD : CloseStatus.GOING_AWAY);
        }
    }

    @Override
    public void unregister(@NonNull ConnectionHandle handle) {
        if (!enqueue(() -> doUnregister(handle)) && accepting.get()) {
            logger.error("Could not unregister {}: analytics hub command queue is full", handle);
        }
    }

    @Override
    public void subscribe(@NonNull ConnectionHandle handle, @NonNull String shortCode) {
        offerClientCommand(handle, () -> doSubscribe(handle, shortCode));
    }

    @Override
    public void unsubscribe(@NonNull ConnectionHandle handle, @NonNull String shortCode) {
        offerClientCommand(handle, () -> index.unsubscribe(handle, shortCode));
    }

    @Override
    public boolean broadcast(@NonNull Update update) {
        if (!accepting.get()) {
            return false;
        }
        if (!broadcasts.offer(update)) {
            droppedBroadcasts.incrementAndGet();
            logger.warn("Dropped real-time {} update for {} (broadcast queue full)",
                    update.kind().wireName(), update.shortCode());
            return false;
        }
        LockSupport.unpark(loopThread);
        return true;
    }

    @Override
    public int activeConnectionCount() {
        return query(registry::size);
    }

    @Override
    public @NonNull Map<String, Integer> activeSubscriptionCounts() {
        return Collections.unmodifiableMap(query(index::counts));
    }

    public long droppedBroadcastCount() {
        return droppedBroadcasts.get();
    }

    void requestKeepaliveSweep() {
        if (!accepting.get()) {
            return;
        }
        if (!commands.offer(this::sweepConnections)) {
            logger.warn("Skipping keepalive tick: analytics hub command queue is full");
            return;
        }
        LockSupport.unpark(loopThread);
    }

    // A client that outruns the loop loses its connection rather than growing the queue.
    private void offerClientCommand(ConnectionHandle handle, Runnable command) {
        if (!accepting.get()) {
            return;
        }
        if (!commands.offer(command)) {
            logger.warn("Dropping client {}: analytics hub command queue is full", handle.id());
            handle.closeAsync(CloseStatus.SERVICE_OVERLOAD);
            return;
        }
        LockSupport.unpark(loopThread);
    }

    // Waits up to the query timeout for room; the loop itself never waits on its own queue.
    private boolean enqueue(Runnable command) {
        if (!accepting.get()) {
            return false;
        }
        boolean queued;
        if (Thread.currentThread() == loopThread) {
            queued = commands.offer(command);
        } else {
            try {
                queued = commands.offer(command, settings.queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        if (queued) {
            LockSupport.unpark(loopThread);
        }
        return queued;
    }

    private <T> T query(Supplier<T> read) {
        CompletableFuture<T> result = new CompletableFuture<>();
        boolean queued = enqueue(() -> {
            try {
                result.complete(read.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        if (!queued) {
            throw new IllegalStateException(accepting.get()
                    ? "Analytics hub command queue is full"
                    : "Analytics hub is shut down");
        }
        try {
            return result.get(settings.queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Analytics hub did not answer within " + settings.queryTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analytics hub query failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while querying the analytics hub", e);
        }
    }

    private void runLoop() {
        logger.info("Analytics hub started");
        try {
            while (accepting.get()) {
                boolean idle = true;

                Runnable command = commands.poll();
                if (command != null) {
                    idle = false;
                    guarded("command", command);
                }

                Update update = broadcasts.poll();
                if (update != null) {
                    idle = false;
                    guarded(update.kind().wireName() + " broadcast", () -> dispatch(update));
                }

                if (idle && accepting.get()) {
                    LockSupport.parkNanos(this, IDLE_PARK_NANOS);
                }
                if (Thread.interrupted()) {
                    logger.warn("Analytics hub loop interrupted, shutting down");
                    accepting.set(false);
                }
            }
            closeAll();
        } finally {
            stopped.countDown();
            logger.info("Analytics hub stopped");
        }
    }

    private void guarded(String what, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            logger.error("Analytics hub {} failed", what, e);
        }
    }

    private void doRegister(ConnectionHandle handle) {
        if (handle.isClosed()) {
            logger.debug("Not registering {}: already closed", handle);
            return;
        }
        if (registry.register(handle)) {
            logger.info("Client {} connected to real-time analytics ({} active)", handle.id(), registry.size());
        }
    }

    private void doUnregister(ConnectionHandle handle) {
        if (!registry.unregister(handle)) {
            return;
        }
        int topics = index.unregisterAll(handle);
        handle.closeAsync(CloseStatus.SESSION_NOT_RELIABLE);
        logger.info("Client {} disconnected from real-time analytics (left {} topics, {} active)",
                handle.id(), topics, registry.size());
    }

    private void doSubscribe(ConnectionHandle handle, String shortCode) {
        if (!registry.contains(handle)) {
            logger.debug("Ignoring subscribe to {} from unregistered {}", shortCode, handle);
            return;
        }
        if (index.subscribe(handle, shortCode)) {
            logger.debug("{} subscribed to {}", handle, shortCode);
            fetchInitialSnapshot(handle, shortCode);
        }
    }

    private void fetchInitialSnapshot(ConnectionHandle handle, String shortCode) {
        try {
            snapshotExecutor.execute(() -> {
                Optional<AggregateAnalytics> snapshot;
                try {
                    snapshot = snapshotProvider.getAnalyticsSnapshot(shortCode, settings.initialWindowDays());
                } catch (AnalyticsUnavailableException | RuntimeException e) {
                    logger.warn("Skipping initial analytics for {}: {}", shortCode, e.getMessage());
                    return;
                }
                Update update = Update.of(UpdateKind.INITIAL_ANALYTICS, shortCode,
                        snapshot.orElseGet(() -> AggregateAnalytics.empty(shortCode)));
                if (!enqueue(() -> deliver(handle, update))) {
                    logger.warn("Skipping initial analytics for {}: analytics hub is not accepting commands", shortCode);
                }
            });
        } catch (TaskRejectedException e) {
            logger.warn("Skipping initial analytics for {}: snapshot executor is saturated", shortCode);
        }
    }

    // Targeted send; skipped if the connection unsubscribed or left while the snapshot was fetched.
    private void deliver(ConnectionHandle handle, Update update) {
        if (!index.isSubscribed(handle, update.shortCode())) {
            return;
        }
        try {
            handle.send(update);
        } catch (SendException e) {
            evict(handle, e);
        }
    }

    private void dispatch(Update update) {
        TextMessage message;
        try {
            message = codec.encode(update);
        } catch (IllegalArgumentException e) {
            logger.error("Dropping {} update for {}", update.kind().wireName(), update.shortCode(), e);
            return;
        }

        List<ConnectionHandle> failed = new ArrayList<>();
        for (ConnectionHandle handle : index.subscribers(update.shortCode())) {
            try {
                handle.send(message);
            } catch (SendException e) {
                logger.info("Dropping client {}: {}", handle.id(), e.getMessage());
                failed.add(handle);
            }
        }
        failed.forEach(this::doUnregister);
    }

    private void sweepConnections() {
        Instant now = clock.instant();
        List<ConnectionHandle> evicted = new ArrayList<>();
        for (ConnectionHandle handle : registry.snapshot()) {
            if (handle.isExpired(now)) {
                logger.info("Client {} missed its read deadline, dropping it", handle.id());
                evicted.add(handle);
                continue;
            }
            try {
                handle.ping();
            } catch (SendException e) {
                logger.info("Dropping client {}: {}", handle.id(), e.getMessage());
                evicted.add(handle);
            }
        }
        evicted.forEach(this::doUnregister);
    }

    private void evict(ConnectionHandle handle, SendException cause) {
        logger.info("Dropping client {}: {}", handle.id(), cause.getMessage());
        doUnregister(handle);
    }

    private void closeAll() {
        List<ConnectionHandle> handles = registry.snapshot();
        for (ConnectionHandle handle : handles) {
            handle.closeAsync(CloseStatus.GOING_AWAY);
        }
        registry.clear();
        index.clear();
        broadcasts.clear();
        commands.clear();
        logger.info("Closed {} real-time analytics connections", handles.size());
    }
}
