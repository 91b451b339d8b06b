package me.jason5lee.realtime_analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealtimeAnalyticsApplication {
    public static void main(String[] args) {
        SpringApplication.run(RealtimeAnalyticsApplication.class, args);
    }
}
