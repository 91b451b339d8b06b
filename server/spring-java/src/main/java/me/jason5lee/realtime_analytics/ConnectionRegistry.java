package me.jason5lee.realtime_analytics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

class ConnectionRegistry {
    private final Set<ConnectionHandle> connections = new LinkedHashSet<>();

    boolean register(ConnectionHandle handle) {
        return connections.add(handle);
    }

    boolean unregister(ConnectionHandle handle) {
        return connections.remove(handle);
    }

    boolean contains(ConnectionHandle handle) {
        return connections.contains(handle);
    }

    int size() {
        return connections.size();
    }

    List<ConnectionHandle> snapshot() {
        return new ArrayList<>(connections);
    }

    void clear() {
        connections.clear();
    }
}
