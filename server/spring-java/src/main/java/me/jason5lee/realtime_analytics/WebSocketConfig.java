package me.jason5lee.realtime_analytics;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private final AnalyticsSocketHandler analyticsSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(AnalyticsSocketHandler analyticsSocketHandler,
                           @Value("${realtime.allowed-origins:*}") String[] allowedOrigins) {
        this.analyticsSocketHandler = analyticsSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(analyticsSocketHandler, "/api/v1/realtime/ws")
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
