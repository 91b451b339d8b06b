package me.jason5lee.realtime_analytics;

public class AnalyticsUnavailableException extends Exception {
    public AnalyticsUnavailableException(String message) {
        super(message);
    }

    public AnalyticsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
