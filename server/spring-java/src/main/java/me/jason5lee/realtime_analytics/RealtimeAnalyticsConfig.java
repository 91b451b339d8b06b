package me.jason5lee.realtime_analytics;

import nl.basjes.parse.useragent.UserAgentAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

@Configuration
public class RealtimeAnalyticsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeAnalyticsConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HubSettings hubSettings(
            @Value("${realtime.write-timeout-ms:1000}") long writeTimeoutMs,
            @Value("${realtime.read-timeout-ms:60000}") long readTimeoutMs,
            @Value("${realtime.ping-interval-ms:54000}") long pingIntervalMs,
            @Value("${realtime.refresh-interval-ms:30000}") long refreshIntervalMs,
            @Value("${realtime.broadcast-queue-capacity:1000}") int broadcastQueueCapacity,
            @Value("${realtime.command-queue-capacity:10000}") int commandQueueCapacity,
            @Value("${realtime.outbound-buffer-size:64}") int outboundBufferSize,
            @Value("${realtime.initial-window-days:30}") int initialWindowDays,
            @Value("${realtime.refresh-window-days:1}") int refreshWindowDays,
            @Value("${realtime.query-timeout-ms:2000}") long queryTimeoutMs
    ) {
        return new HubSettings(
                Duration.ofMillis(writeTimeoutMs),
                Duration.ofMillis(readTimeoutMs),
                Duration.ofMillis(pingIntervalMs),
                Duration.ofMillis(refreshIntervalMs),
                broadcastQueueCapacity,
                commandQueueCapacity,
                outboundBufferSize,
                initialWindowDays,
                refreshWindowDays,
                Duration.ofMillis(queryTimeoutMs)
        );
    }

    @Bean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    // No queue: a connection stuck in a blocking write holds one thread, and the others get a new one.
    @Bean
    @Qualifier("connection-write-executor")
    public ThreadPoolTaskExecutor connectionWriteExecutor(
            @Value("${realtime.write-thread-pool.core:8}") int corePoolSize,
            @Value("${realtime.write-thread-pool.max:512}") int maxPoolSize
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("connection-write-");
        executor.initialize();
        return executor;
    }

    @Bean
    @Qualifier("snapshot-executor")
    public ThreadPoolTaskExecutor snapshotExecutor(
            @Value("${realtime.snapshot-thread-pool.core:4}") int corePoolSize,
            @Value("${realtime.snapshot-thread-pool.max:8}") int maxPoolSize,
            @Value("${realtime.snapshot-thread-pool.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analytics-snapshot-");
        executor.initialize();
        return executor;
    }

    // The analytics store lives in another service; until it is wired in every code reads as empty.
    @Bean
    public AnalyticsSnapshotProvider analyticsSnapshotProvider() {
        logger.info("No analytics store configured, snapshots will be empty");
        return (shortCode, windowDays) -> Optional.empty();
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public AnalyticsHubImpl analyticsHub(
            AnalyticsSnapshotProvider snapshotProvider,
            @Qualifier("snapshot-executor") TaskExecutor snapshotExecutor,
            MessageCodec codec,
            Clock clock,
            HubSettings settings
    ) {
        return new AnalyticsHubImpl(snapshotProvider, snapshotExecutor, codec, clock, settings);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public PeriodicRefresher periodicRefresher(
            AnalyticsHub hub,
            AnalyticsSnapshotProvider snapshotProvider,
            @Qualifier("snapshot-executor") TaskExecutor snapshotExecutor,
            HubSettings settings
    ) {
        return new PeriodicRefresher(hub, snapshotProvider, snapshotExecutor, settings);
    }

    @Bean
    public UserAgentAnalyzer userAgentAnalyzer(@Value("${realtime.user-agent-cache-size:10000}") int cacheSize) {
        return UserAgentClickDetailsResolver.newAnalyzer(cacheSize);
    }

    @Bean
    public ClickDetailsResolver clickDetailsResolver(UserAgentAnalyzer userAgentAnalyzer, Clock clock) {
        return new UserAgentClickDetailsResolver(userAgentAnalyzer, clock);
    }

    @Bean
    public RealtimeEventPublisher realtimeEventPublisher(AnalyticsHub hub, ClickDetailsResolver clickDetailsResolver) {
        return new RealtimeEventPublisher(hub, clickDetailsResolver);
    }

    @Bean
    public AnalyticsSocketHandler analyticsSocketHandler(
            AnalyticsHub hub,
            MessageCodec codec,
            @Qualifier("connection-write-executor") TaskExecutor writeExecutor,
            Clock clock,
            HubSettings settings
    ) {
        return new AnalyticsSocketHandler(hub, codec, writeExecutor, clock, settings);
    }
}
