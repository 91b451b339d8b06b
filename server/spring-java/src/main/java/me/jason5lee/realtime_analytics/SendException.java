package me.jason5lee.realtime_analytics;

public class SendException extends Exception {
    public SendException(String connectionId, String reason) {
        super("connection " + connectionId + ": " + reason);
    }

    public SendException(String connectionId, String reason, Throwable cause) {
        super("connection " + connectionId + ": " + reason, cause);
    }
}
