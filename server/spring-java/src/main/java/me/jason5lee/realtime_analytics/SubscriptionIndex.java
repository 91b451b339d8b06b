package me.jason5lee.realtime_analytics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Owned by the hub loop.
class SubscriptionIndex {
    private final Map<String, Set<ConnectionHandle>> subscribersByTopic = new HashMap<>();
    private final Map<ConnectionHandle, Set<String>> topicsByConnection = new HashMap<>();

    /**
     * @return true if the pair was not present before
     */
    boolean subscribe(ConnectionHandle handle, String topic) {
        boolean added = subscribersByTopic.computeIfAbsent(topic, t -> new LinkedHashSet<>()).add(handle);
        if (added) {
            topicsByConnection.computeIfAbsent(handle, h -> new LinkedHashSet<>()).add(topic);
        }
        return added;
    }

    boolean unsubscribe(ConnectionHandle handle, String topic) {
        Set<String> topics = topicsByConnection.get(handle);
        if (topics == null || !topics.remove(topic)) {
            return false;
        }
        if (topics.isEmpty()) {
            topicsByConnection.remove(handle);
        }
        removeFromTopic(handle, topic);
        return true;
    }

    /**
     * @return the number of topics the connection was removed from
     */
    int unregisterAll(ConnectionHandle handle) {
        Set<String> topics = topicsByConnection.remove(handle);
        if (topics == null) {
            return 0;
        }
        for (String topic : topics) {
            removeFromTopic(handle, topic);
        }
        return topics.size();
    }

    boolean isSubscribed(ConnectionHandle handle, String topic) {
        Set<ConnectionHandle> subscribers = subscribersByTopic.get(topic);
        return subscribers != null && subscribers.contains(handle);
    }

    // Copy, so callers may trigger unsubscribes while iterating.
    List<ConnectionHandle> subscribers(String topic) {
        Set<ConnectionHandle> subscribers = subscribersByTopic.get(topic);
        return subscribers == null ? List.of() : new ArrayList<>(subscribers);
    }

    Map<String, Integer> counts() {
        Map<String, Integer> counts = new HashMap<>();
        subscribersByTopic.forEach((topic, subscribers) -> counts.put(topic, subscribers.size()));
        return counts;
    }

    void clear() {
        subscribersByTopic.clear();
        topicsByConnection.clear();
    }

    private void removeFromTopic(ConnectionHandle handle, String topic) {
        Set<ConnectionHandle> subscribers = subscribersByTopic.get(topic);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(handle);
        if (subscribers.isEmpty()) {
            subscribersByTopic.remove(topic);
        }
    }
}
