package me.jason5lee.realtime_analytics;

import nl.basjes.parse.useragent.UserAgent;
import nl.basjes.parse.useragent.UserAgentAnalyzer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Locale;

// No GeoIP database is wired in, so country and city are always Unknown.
public class UserAgentClickDetailsResolver implements ClickDetailsResolver {
    static final String UNKNOWN = "Unknown";

    private final UserAgentAnalyzer analyzer;
    private final Clock clock;

    public UserAgentClickDetailsResolver(@NonNull UserAgentAnalyzer analyzer, @NonNull Clock clock) {
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public static @NonNull UserAgentAnalyzer newAnalyzer(int cacheSize) {
        return UserAgentAnalyzer.newBuilder()
                .hideMatcherLoadStats()
                .withCache(cacheSize)
                .withField(UserAgent.DEVICE_CLASS)
                .withField(UserAgent.AGENT_NAME)
                .withField(UserAgent.OPERATING_SYSTEM_NAME)
                .build();
    }

    @Override
    public @NonNull ClickDetails resolve(@NonNull String shortCode, @Nullable String ipAddress,
                                         @Nullable String userAgent, @Nullable String referrer) {
        String device = UNKNOWN;
        String browser = UNKNOWN;
        String os = UNKNOWN;
        if (userAgent != null && !userAgent.isBlank()) {
            UserAgent agent = analyzer.parse(userAgent);
            device = deviceType(agent.getValue(UserAgent.DEVICE_CLASS));
            browser = known(agent.getValue(UserAgent.AGENT_NAME));
            os = osName(agent.getValue(UserAgent.OPERATING_SYSTEM_NAME));
        }
        return new ClickDetails(shortCode, ipAddress, userAgent, referrer, UNKNOWN, UNKNOWN,
                device, browser, os, clock.instant());
    }

    static String deviceType(@Nullable String deviceClass) {
        switch (known(deviceClass)) {
            case "Desktop":
                return "desktop";
            case "Phone":
            case "Mobile":
            case "Watch":
            case "Handheld Game Console":
                return "mobile";
            case "Tablet":
            case "eReader":
                return "tablet";
            case "Robot":
            case "Robot Mobile":
            case "Robot Imitator":
                return "bot";
            case UNKNOWN:
                return UNKNOWN;
            default:
                return "other";
        }
    }

    // Collapses vendor spellings such as "Windows NT" and "Mac OS" to the names the dashboards group by.
    static String osName(@Nullable String name) {
        String lower = known(name).toLowerCase(Locale.ROOT);
        if (lower.contains("windows")) {
            return "Windows";
        }
        if (lower.contains("mac") || lower.contains("darwin")) {
            return "macOS";
        }
        return known(name);
    }

    private static String known(@Nullable String value) {
        return value == null || value.isEmpty() || "??".equals(value) || UNKNOWN.equals(value) ? UNKNOWN : value;
    }
}
